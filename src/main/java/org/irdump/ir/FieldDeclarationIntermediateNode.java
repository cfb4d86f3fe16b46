package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * A field of the generated class.
 */
public record FieldDeclarationIntermediateNode(
        List<String> modifiers,
        String fieldType,
        String fieldName,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public FieldDeclarationIntermediateNode {
        modifiers = NodeLists.copyOf(modifiers);
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public FieldDeclarationIntermediateNode(List<String> modifiers, String fieldType, String fieldName, SourceSpan source) {
        this(modifiers, fieldType, fieldName, source, List.of(), List.of());
    }

    /**
     * Fields are dumped as {@code Field}.
     */
    @Override
    public String kindName() {
        return "Field";
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitFieldDeclaration(this);
    }
}
