package com.vidnyan.introspect.domain.module;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A requested module: {@code *}, {@code Family-*}, {@code Name-1.*}, {@code Name} or {@code Name-Version}.
 * A version without glob matches as a dotted prefix, so {@code Gtk-3} selects {@code Gtk-3.0}.
 */
public final class ModulePattern {

    private final String raw;
    private final Pattern namePattern;
    private final Pattern versionPattern;
    private final String explicitVersion;

    private ModulePattern(String raw, Pattern namePattern, Pattern versionPattern, String explicitVersion) {
        this.raw = raw;
        this.namePattern = namePattern;
        this.versionPattern = versionPattern;
        this.explicitVersion = explicitVersion;
    }

    public static ModulePattern parse(String raw) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty module pattern");
        }
        if ("*".equals(trimmed)) {
            return new ModulePattern(trimmed, null, null, null);
        }
        int dash = trimmed.lastIndexOf('-');
        if (dash <= 0 || dash == trimmed.length() - 1) {
            return new ModulePattern(trimmed, glob(trimmed), null, null);
        }
        String name = trimmed.substring(0, dash);
        String version = trimmed.substring(dash + 1);
        if (version.contains("*")) {
            return new ModulePattern(trimmed, glob(name), glob(version), null);
        }
        return new ModulePattern(trimmed, glob(name), null, version);
    }

    private static Pattern glob(String text) {
        StringBuilder regex = new StringBuilder();
        for (String part : text.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        return Pattern.compile(regex.toString());
    }

    public boolean matches(ModuleFile module) {
        if (namePattern == null) {
            return true;
        }
        if (!namePattern.matcher(module.namespace()).matches()) {
            return false;
        }
        if (versionPattern != null) {
            return versionPattern.matcher(module.version()).matches();
        }
        return explicitVersion == null || module.libraryVersion().matchesPrefix(explicitVersion);
    }

    /**
     * The version requested without glob for the given namespace, if this pattern names one.
     */
    public Optional<String> explicitVersionFor(String namespace) {
        if (explicitVersion == null || !namePattern.matcher(namespace).matches()) {
            return Optional.empty();
        }
        return Optional.of(explicitVersion);
    }

    @Override
    public String toString() {
        return raw;
    }
}
