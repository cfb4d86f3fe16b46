package org.irdump.ir;

/**
 * Quoting style of an attribute value in the source.
 */
public enum AttributeStructure {
    DoubleQuotes,
    SingleQuotes,
    NoQuotes,
    Minimized
}
