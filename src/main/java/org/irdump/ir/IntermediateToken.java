package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Leaf carrying raw HTML or C# text.
 *
 * @param kind The language of the content.
 * @param content The literal text.
 */
public record IntermediateToken(
        TokenKind kind,
        String content,
        SourceSpan source,
        List<Diagnostic> diagnostics,
        List<IrNode> children) implements IrNode {

    public IntermediateToken {
        diagnostics = NodeLists.copyOf(diagnostics);
        children = NodeLists.copyOf(children);
    }

    public IntermediateToken(TokenKind kind, String content, SourceSpan source) {
        this(kind, content, source, List.of(), List.of());
    }

    @Override
    public void accept(IrNodeVisitor visitor) {
        visitor.visitToken(this);
    }
}
