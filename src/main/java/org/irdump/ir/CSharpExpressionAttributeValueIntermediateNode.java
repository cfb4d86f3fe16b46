package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Expression part of an attribute value.
 */
public record CSharpExpressionAttributeValueIntermediateNode(
        String prefix,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public CSharpExpressionAttributeValueIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public CSharpExpressionAttributeValueIntermediateNode(String prefix, SourceSpan source, List<IrNode> children) {
        this(prefix, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitCSharpExpressionAttributeValue(this);
    }
}
