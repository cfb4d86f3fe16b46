package org.irdump.components;

import org.irdump.writer.ExtensionRendererRegistry;

import java.util.Arrays;
import java.util.List;

/**
 * Registers the IR dump renderers of all component node shapes.
 */
public final class ComponentExtensionRenderers {

    /** Rendered for a ref capture whose target is a plain element. */
    static final String ELEMENT_CAPTURE = "Element";

    private ComponentExtensionRenderers() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param registry The registry to populate.
     * @return The same registry, for chaining.
     */
    public static ExtensionRendererRegistry registerAll(ExtensionRendererRegistry registry) {
        registry.register(HtmlElementIntermediateNode.class, node -> fields(node.tagName()));
        registry.register(HtmlBlockIntermediateNode.class, node -> fields(node.content()));
        registry.register(ComponentExtensionNode.class, node -> fields(node.tagName(), node.typeName()));
        registry.register(ComponentAttributeExtensionNode.class, node -> fields(node.attributeName(), node.propertyName()));
        registry.register(RouteAttributeExtensionNode.class, node -> fields(node.template()));
        registry.register(RefExtensionNode.class, node -> fields(
                node.identifierToken().content(),
                node.isComponentCapture() ? node.componentCaptureTypeName() : ELEMENT_CAPTURE));
        return registry;
    }

    // Fields may be null, which List.of rejects.
    private static List<String> fields(String... values) {
        return Arrays.asList(values);
    }
}
