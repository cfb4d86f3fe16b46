package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Base class for node kinds defined outside the closed set of well-known kinds,
 * for example by the component feature or by compiler internals. Subclasses add
 * their own payload and are rendered through renderers registered with the
 * IR writer.
 */
public non-sealed abstract class ExtensionIntermediateNode implements IrNode {

    private final SourceSpan source;
    private final List<Diagnostic> diagnostics;
    private final List<IrNode> children;

    protected ExtensionIntermediateNode(SourceSpan source, List<Diagnostic> diagnostics, List<IrNode> children) {
        this.source = source;
        this.diagnostics = NodeLists.copyOf(diagnostics);
        this.children = NodeLists.copyOf(children);
    }

    protected ExtensionIntermediateNode(SourceSpan source, List<IrNode> children) {
        this(source, List.of(), children);
    }

    @Override
    public SourceSpan source() {
        return source;
    }

    @Override
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    @Override
    public List<IrNode> children() {
        return children;
    }

    @Override
    public final void accept(IrNodeVisitor visitor) {
        visitor.visitExtension(this);
    }

    @Override
    public String toString() {
        return kindName() + "{source=" + source + ", children=" + children.size() + '}';
    }
}
