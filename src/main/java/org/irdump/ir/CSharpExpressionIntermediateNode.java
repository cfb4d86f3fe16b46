package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A C# expression rendered into the output.
 */
public record CSharpExpressionIntermediateNode(
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public CSharpExpressionIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public CSharpExpressionIntermediateNode(SourceSpan source, List<IrNode> children) {
        this(source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitCSharpExpression(this);
    }
}
