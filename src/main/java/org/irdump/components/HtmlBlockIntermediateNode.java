package org.irdump.components;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.ExtensionIntermediateNode;

import java.util.List;

/**
 * Static markup that was folded into a single block of text.
 */
public final class HtmlBlockIntermediateNode extends ExtensionIntermediateNode {

    private final String content;

    public HtmlBlockIntermediateNode(String content, SourceSpan source, List<Diagnostic> diagnostics) {
        super(source, diagnostics, List.of());
        this.content = content;
    }

    public HtmlBlockIntermediateNode(String content, SourceSpan source) {
        this(content, source, List.of());
    }

    public String content() {
        return content;
    }
}
