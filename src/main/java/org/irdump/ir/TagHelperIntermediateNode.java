package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * An element that was matched by one or more tag helpers.
 */
public record TagHelperIntermediateNode(
        String tagName,
        TagMode tagMode,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public TagHelperIntermediateNode {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public TagHelperIntermediateNode(String tagName, TagMode tagMode, SourceSpan source, List<IrNode> children) {
        this(tagName, tagMode, source, List.of(), children);
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitTagHelper(this);
    }
}
