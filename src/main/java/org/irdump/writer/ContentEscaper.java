package org.irdump.writer;

/**
 * Escapes node content so that every node occupies exactly one line of the dump
 * and {@link #SEPARATOR} only ever appears as a field delimiter.
 */
public final class ContentEscaper {

    /** Delimiter between the name, source range and content fields of a line. */
    public static final String SEPARATOR = " - ";

    private ContentEscaper() {
        // Private constructor to prevent instantiation
    }

    /**
     * Drops carriage returns, then replaces newlines with {@code \n} and the separator with {@code \-}.
     * The escaped newline must not depend on the platform, hence the {@code \r} removal.
     *
     * @param content The raw content, may be {@code null}.
     * @return The escaped content, or {@code null} if {@code content} was {@code null}.
     */
    public static String escape(String content) {
        if (content == null) {
            return null;
        }
        return content
                .replace("\r", "")
                .replace("\n", "\\n")
                .replace(SEPARATOR, "\\-");
    }
}
