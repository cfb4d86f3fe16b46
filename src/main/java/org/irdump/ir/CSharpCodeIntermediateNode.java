package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A block of C# statements.
 */
public record CSharpCodeIntermediateNode(
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public CSharpCodeIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public CSharpCodeIntermediateNode(SourceSpan source, List<IrNode> children) {
        this(source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitCSharpCode(this);
    }
}
