package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * An attribute bound to a tag helper property.
 */
public record TagHelperPropertyIntermediateNode(
        String attributeName,
        BoundAttributeDescriptor boundAttribute,
        AttributeStructure attributeStructure,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public TagHelperPropertyIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public TagHelperPropertyIntermediateNode(String attributeName, BoundAttributeDescriptor boundAttribute, AttributeStructure attributeStructure, SourceSpan source, List<IrNode> children) {
        this(attributeName, boundAttribute, attributeStructure, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitTagHelperProperty(this);
    }
}
