package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A recognized directive such as {@code @page} or {@code @inject}.
 */
public record DirectiveIntermediateNode(
        String directiveName,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public DirectiveIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public DirectiveIntermediateNode(String directiveName, SourceSpan source, List<IrNode> children) {
        this(directiveName, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitDirective(this);
    }
}
