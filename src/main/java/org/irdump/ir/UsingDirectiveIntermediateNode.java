package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A using directive in the generated code.
 *
 * @param content The imported namespace, e.g. {@code System.Linq}.
 */
public record UsingDirectiveIntermediateNode(
        String content,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public UsingDirectiveIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public UsingDirectiveIntermediateNode(String content, SourceSpan source) {
        this(content, source, List.of(), List.of());
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitUsingDirective(this);
    }
}
