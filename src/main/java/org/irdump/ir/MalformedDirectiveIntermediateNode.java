package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A directive the parser recognized by name but could not fully parse.
 * The compiler reports the problem through {@link #diagnostics()}.
 */
public record MalformedDirectiveIntermediateNode(
        String directiveName,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public MalformedDirectiveIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public MalformedDirectiveIntermediateNode(String directiveName, SourceSpan source, List<IrNode> children) {
        this(directiveName, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitMalformedDirective(this);
    }
}
