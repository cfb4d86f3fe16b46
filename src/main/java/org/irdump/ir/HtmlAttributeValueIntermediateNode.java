package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Literal part of an attribute value.
 */
public record HtmlAttributeValueIntermediateNode(
        String prefix,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public HtmlAttributeValueIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public HtmlAttributeValueIntermediateNode(String prefix, SourceSpan source, List<IrNode> children) {
        this(prefix, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitHtmlAttributeValue(this);
    }
}
