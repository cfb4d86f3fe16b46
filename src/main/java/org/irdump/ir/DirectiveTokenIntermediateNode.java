package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * One token argument of a directive.
 */
public record DirectiveTokenIntermediateNode(
        String content,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public DirectiveTokenIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public DirectiveTokenIntermediateNode(String content, SourceSpan source) {
        this(content, source, List.of(), List.of());
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitDirectiveToken(this);
    }
}
