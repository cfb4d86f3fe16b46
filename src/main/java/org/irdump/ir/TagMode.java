package org.irdump.ir;

/**
 * How a tag helper element was written in the source.
 */
public enum TagMode {
    /** {@code <p></p>} */
    StartTagAndEndTag,
    /** {@code <p />} */
    SelfClosing,
    /** {@code <p>} */
    StartTagOnly
}
