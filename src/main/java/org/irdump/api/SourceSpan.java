package org.irdump.api;

/**
 * A located range in the original source text.
 * It is part of the public API and free of implementation details.
 *
 * @param filePath The path of the source document, may be {@code null}.
 * @param absoluteIndex The zero-based character offset from the start of the document.
 * @param lineIndex The zero-based line of the first character.
 * @param characterIndex The zero-based column of the first character.
 * @param length The number of characters covered.
 */
public record SourceSpan(String filePath, int absoluteIndex, int lineIndex, int characterIndex, int length) {

    /**
     * Creates a span that is not associated with a file.
     */
    public SourceSpan(int absoluteIndex, int lineIndex, int characterIndex, int length) {
        this(null, absoluteIndex, lineIndex, characterIndex, length);
    }

    /**
     * @return The part of {@link #filePath()} after the last {@code '/'}, or an empty string if there is no path.
     */
    public String fileName() {
        if (filePath == null) {
            return "";
        }
        return filePath.substring(filePath.lastIndexOf('/') + 1);
    }
}
