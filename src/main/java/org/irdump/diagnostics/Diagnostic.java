package org.irdump.diagnostics;

import org.irdump.api.SourceSpan;

import java.util.Objects;

/**
 * Represents a single diagnostic (error, warning, info) that the compiler
 * attached to an IR node.
 *
 * @param id The stable diagnostic code, e.g. {@code RZ1034}.
 * @param severity The severity of the diagnostic.
 * @param message The human readable message.
 * @param span The location the diagnostic refers to, may be {@code null}.
 */
public record Diagnostic(
        String id,
        Severity severity,
        String message,
        SourceSpan span
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Severity {
        /** An error that prevents code generation. */
        ERROR,
        /** A warning that does not prevent code generation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    public Diagnostic {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Creates an error diagnostic.
     */
    public static Diagnostic error(String id, String message, SourceSpan span) {
        return new Diagnostic(id, Severity.ERROR, message, span);
    }

    /**
     * Creates a warning diagnostic.
     */
    public static Diagnostic warning(String id, String message, SourceSpan span) {
        return new Diagnostic(id, Severity.WARNING, message, span);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", severity, id, message);
    }
}
