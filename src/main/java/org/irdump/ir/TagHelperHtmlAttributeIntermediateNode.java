package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * An attribute on a tag helper element that is not bound to a property.
 */
public record TagHelperHtmlAttributeIntermediateNode(
        String attributeName,
        AttributeStructure attributeStructure,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public TagHelperHtmlAttributeIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public TagHelperHtmlAttributeIntermediateNode(String attributeName, AttributeStructure attributeStructure, SourceSpan source, List<IrNode> children) {
        this(attributeName, attributeStructure, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitTagHelperHtmlAttribute(this);
    }
}
