package org.irdump.components;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.ExtensionIntermediateNode;
import org.irdump.ir.IrNode;

import java.util.List;

/**
 * An element that was resolved to a component type.
 */
public final class ComponentExtensionNode extends ExtensionIntermediateNode {

    private final String tagName;
    private final String typeName;

    /**
     * @param tagName  The tag as written in the markup.
     * @param typeName The fully qualified component type.
     */
    public ComponentExtensionNode(String tagName, String typeName, SourceSpan source, List<Diagnostic> diagnostics, List<IrNode> children) {
        super(source, diagnostics, children);
        this.tagName = tagName;
        this.typeName = typeName;
    }

    public ComponentExtensionNode(String tagName, String typeName, SourceSpan source, List<IrNode> children) {
        this(tagName, typeName, source, List.of(), children);
    }

    public String tagName() {
        return tagName;
    }

    public String typeName() {
        return typeName;
    }
}
