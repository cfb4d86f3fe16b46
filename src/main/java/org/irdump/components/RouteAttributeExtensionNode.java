package org.irdump.components;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.ExtensionIntermediateNode;

import java.util.List;

/**
 * Route attribute generated from a {@code @page} directive.
 */
public final class RouteAttributeExtensionNode extends ExtensionIntermediateNode {

    private final String template;

    /**
     * @param template The route template including quotes, e.g. {@code "/counter"}.
     */
    public RouteAttributeExtensionNode(String template, SourceSpan source, List<Diagnostic> diagnostics) {
        super(source, diagnostics, List.of());
        this.template = template;
    }

    public RouteAttributeExtensionNode(String template, SourceSpan source) {
        this(template, source, List.of());
    }

    public String template() {
        return template;
    }
}
