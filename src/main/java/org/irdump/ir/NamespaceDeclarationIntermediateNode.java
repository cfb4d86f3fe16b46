package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Namespace that wraps the generated class.
 */
public record NamespaceDeclarationIntermediateNode(
        String content,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public NamespaceDeclarationIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public NamespaceDeclarationIntermediateNode(String content, SourceSpan source, List<IrNode> children) {
        this(content, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitNamespaceDeclaration(this);
    }
}
