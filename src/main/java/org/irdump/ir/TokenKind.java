package org.irdump.ir;

/**
 * The language of an {@link IntermediateToken}. Constant names are used verbatim in IR dumps.
 */
public enum TokenKind {
    Html,
    CSharp
}
