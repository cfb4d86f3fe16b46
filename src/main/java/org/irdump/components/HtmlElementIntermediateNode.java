package org.irdump.components;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.ExtensionIntermediateNode;
import org.irdump.ir.IrNode;

import java.util.List;

/**
 * A plain markup element in a component, e.g. {@code <div>}. Attributes and content are children.
 */
public final class HtmlElementIntermediateNode extends ExtensionIntermediateNode {

    private final String tagName;

    public HtmlElementIntermediateNode(String tagName, SourceSpan source, List<Diagnostic> diagnostics, List<IrNode> children) {
        super(source, diagnostics, children);
        this.tagName = tagName;
    }

    public HtmlElementIntermediateNode(String tagName, SourceSpan source, List<IrNode> children) {
        this(tagName, source, List.of(), children);
    }

    public String tagName() {
        return tagName;
    }
}
