package com.vidnyan.introspect.domain.resolve;

import com.vidnyan.introspect.domain.diagnostic.Diagnostic;
import com.vidnyan.introspect.domain.type.TypeExpression;

import java.util.Optional;

/**
 * Outcome of resolving one raw reference. Resolution never fails: an unmatched
 * reference is a {@link Fallback} carrying the diagnostic that explains it.
 */
public sealed interface Resolution {

    TypeExpression type();

    /**
     * Diagnostic to surface, if any.
     */
    Optional<Diagnostic> diagnostic();

    /**
     * Which ordered lookup step matched.
     */
    enum Step {
        PRIMITIVE,
        QUALIFIED,
        SCOPED,
        EXACT,
        NATIVE_TYPE_NAME,
        GLOBAL
    }

    /**
     * Matched a declaration. {@code note} reports a scoped-over-global decision and may be null.
     */
    record Resolved(TypeExpression type, Step step, Diagnostic note) implements Resolution {

        public static Resolved of(TypeExpression type, Step step) {
            return new Resolved(type, step, null);
        }

        @Override
        public Optional<Diagnostic> diagnostic() {
            return Optional.ofNullable(note);
        }
    }

    record Fallback(TypeExpression type, Diagnostic reason) implements Resolution {

        @Override
        public Optional<Diagnostic> diagnostic() {
            return Optional.of(reason);
        }
    }
}
