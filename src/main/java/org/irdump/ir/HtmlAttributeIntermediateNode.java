package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * An HTML attribute whose value contains code.
 *
 * @param prefix The text up to and including the opening quote, e.g. {@code  class="}.
 * @param suffix The closing quote.
 */
public record HtmlAttributeIntermediateNode(
        String prefix,
        String suffix,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public HtmlAttributeIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public HtmlAttributeIntermediateNode(String prefix, String suffix, SourceSpan source, List<IrNode> children) {
        this(prefix, suffix, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitHtmlAttribute(this);
    }
}
