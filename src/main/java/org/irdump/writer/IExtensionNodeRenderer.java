package org.irdump.writer;

import org.irdump.ir.ExtensionIntermediateNode;

import java.util.List;

/**
 * Supplies the content fields for one extension node shape.
 * <p>
 * Implementations should be stateless. The returned list must have the same
 * length and order for every node of the shape; {@code null} elements render
 * as empty fields.
 *
 * @param <T> The concrete extension node type handled by this renderer.
 */
@FunctionalInterface
public interface IExtensionNodeRenderer<T extends ExtensionIntermediateNode> {

    /**
     * @param node The node to render.
     * @return The ordered content fields, without escaping.
     */
    List<String> contentOf(T node);
}
