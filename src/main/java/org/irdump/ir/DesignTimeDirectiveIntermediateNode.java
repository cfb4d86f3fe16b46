package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Compiler-internal node that groups directive tokens for design-time code generation.
 * It has no payload of its own.
 */
public final class DesignTimeDirectiveIntermediateNode extends ExtensionIntermediateNode {

    public DesignTimeDirectiveIntermediateNode(SourceSpan source, List<Diagnostic> diagnostics, List<IrNode> children) {
        super(source, diagnostics, children);
    }

    public DesignTimeDirectiveIntermediateNode(SourceSpan source, List<IrNode> children) {
        super(source, children);
    }
}
