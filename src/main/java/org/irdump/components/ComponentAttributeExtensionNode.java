package org.irdump.components;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.ExtensionIntermediateNode;
import org.irdump.ir.IrNode;

import java.util.List;

/**
 * An attribute of a component element that sets a component property.
 */
public final class ComponentAttributeExtensionNode extends ExtensionIntermediateNode {

    private final String attributeName;
    private final String propertyName;

    public ComponentAttributeExtensionNode(String attributeName, String propertyName, SourceSpan source, List<Diagnostic> diagnostics, List<IrNode> children) {
        super(source, diagnostics, children);
        this.attributeName = attributeName;
        this.propertyName = propertyName;
    }

    public ComponentAttributeExtensionNode(String attributeName, String propertyName, SourceSpan source, List<IrNode> children) {
        this(attributeName, propertyName, source, List.of(), children);
    }

    public String attributeName() {
        return attributeName;
    }

    public String propertyName() {
        return propertyName;
    }
}
