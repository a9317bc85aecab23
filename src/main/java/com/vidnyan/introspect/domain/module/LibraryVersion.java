package com.vidnyan.introspect.domain.module;

import java.util.Objects;

/**
 * Dotted library version such as {@code 2.0} or {@code 17}.
 * Numeric segments compare numerically, other segments lexically; missing segments count as zero.
 */
public record LibraryVersion(String value) implements Comparable<LibraryVersion> {

    public LibraryVersion {
        Objects.requireNonNull(value, "value");
    }

    public static LibraryVersion of(String value) {
        return new LibraryVersion(value);
    }

    /**
     * Whether this version equals the prefix or extends it by further dotted segments.
     * {@code 3.24} matches {@code 3} and {@code 3.24}, but not {@code 3.2}.
     */
    public boolean matchesPrefix(String prefix) {
        return value.equals(prefix) || value.startsWith(prefix + ".");
    }

    @Override
    public int compareTo(LibraryVersion other) {
        String[] left = value.split("\\.");
        String[] right = other.value.split("\\.");
        int length = Math.max(left.length, right.length);
        for (int i = 0; i < length; i++) {
            String a = i < left.length ? left[i] : "0";
            String b = i < right.length ? right[i] : "0";
            int result = compareSegment(a, b);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static int compareSegment(String a, String b) {
        boolean aNumeric = isNumeric(a);
        boolean bNumeric = isNumeric(b);
        if (aNumeric && bNumeric) {
            return Long.compare(Long.parseLong(a), Long.parseLong(b));
        }
        if (aNumeric != bNumeric) {
            // numeric releases sort above pre-release tags
            return aNumeric ? 1 : -1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String segment) {
        if (segment.isEmpty() || segment.length() > 18) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return value;
    }
}
