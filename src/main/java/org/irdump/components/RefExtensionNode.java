package org.irdump.components;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.ExtensionIntermediateNode;
import org.irdump.ir.IntermediateToken;

import java.util.List;
import java.util.Objects;

/**
 * A {@code ref="..."} capture of an element or component into a field.
 */
public final class RefExtensionNode extends ExtensionIntermediateNode {

    private final IntermediateToken identifierToken;
    private final String componentCaptureTypeName;

    /**
     * Captures a plain element.
     *
     * @param identifierToken The token holding the capture target, e.g. {@code myDiv}.
     */
    public RefExtensionNode(IntermediateToken identifierToken, SourceSpan source) {
        this(identifierToken, null, source, List.of());
    }

    /**
     * Captures a component instance.
     *
     * @param identifierToken          The token holding the capture target.
     * @param componentCaptureTypeName The type of the captured component.
     */
    public RefExtensionNode(IntermediateToken identifierToken, String componentCaptureTypeName, SourceSpan source) {
        this(identifierToken, Objects.requireNonNull(componentCaptureTypeName, "componentCaptureTypeName"), source, List.of());
    }

    public RefExtensionNode(IntermediateToken identifierToken, String componentCaptureTypeName, SourceSpan source, List<Diagnostic> diagnostics) {
        super(source, diagnostics, List.of());
        this.identifierToken = Objects.requireNonNull(identifierToken, "identifierToken");
        this.componentCaptureTypeName = componentCaptureTypeName;
    }

    public IntermediateToken identifierToken() {
        return identifierToken;
    }

    public boolean isComponentCapture() {
        return componentCaptureTypeName != null;
    }

    public String componentCaptureTypeName() {
        return componentCaptureTypeName;
    }
}
