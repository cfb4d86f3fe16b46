package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * The generated class.
 *
 * @param modifiers Modifiers in declaration order, e.g. {@code public}.
 * @param className The simple class name.
 * @param baseType The base type, may be {@code null}.
 * @param interfaces Implemented interfaces, may be {@code null}.
 */
public record ClassDeclarationIntermediateNode(
        List<String> modifiers,
        String className,
        String baseType,
        List<String> interfaces,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public ClassDeclarationIntermediateNode {
        modifiers = NodeLists.copyOf(modifiers);
        interfaces = NodeLists.copyOf(interfaces);
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public ClassDeclarationIntermediateNode(List<String> modifiers, String className, String baseType, List<String> interfaces, SourceSpan source, List<IrNode> children) {
        this(modifiers, className, baseType, interfaces, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitClassDeclaration(this);
    }
}
