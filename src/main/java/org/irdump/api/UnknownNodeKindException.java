package org.irdump.api;

/**
 * Thrown when an extension node reaches the writer without a registered renderer
 * and its origin is not trusted. The dump written so far is truncated and must
 * not be used as a complete result.
 */
public class UnknownNodeKindException extends IllegalStateException {

    private final Class<?> nodeType;

    /**
     * Constructs a new exception for the given node class.
     * @param nodeType The concrete class of the offending node.
     */
    public UnknownNodeKindException(Class<?> nodeType) {
        super("Unknown node type: " + nodeType.getName());
        this.nodeType = nodeType;
    }

    /**
     * @return The concrete class of the node that could not be rendered.
     */
    public Class<?> nodeType() {
        return nodeType;
    }
}
