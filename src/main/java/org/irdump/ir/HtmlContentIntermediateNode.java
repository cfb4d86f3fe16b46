package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A run of literal HTML; the text is held by child tokens.
 */
public record HtmlContentIntermediateNode(
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public HtmlContentIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public HtmlContentIntermediateNode(SourceSpan source, List<IrNode> children) {
        this(source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitHtmlContent(this);
    }
}
