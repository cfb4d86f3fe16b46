package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A method of the generated class, usually the render method.
 */
public record MethodDeclarationIntermediateNode(
        List<String> modifiers,
        String returnType,
        String methodName,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public MethodDeclarationIntermediateNode {
        modifiers = NodeLists.copyOf(modifiers);
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public MethodDeclarationIntermediateNode(List<String> modifiers, String returnType, String methodName, SourceSpan source, List<IrNode> children) {
        this(modifiers, returnType, methodName, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitMethodDeclaration(this);
    }
}
