package org.irdump.ir;

import org.irdump.api.SourceSpan;
import org.irdump.diagnostics.Diagnostic;

import java.util.List;

/**
 * Base type of all nodes in the intermediate representation produced by the
 * template compiler front-end. The set of well-known kinds is closed; nodes
 * contributed by pluggable front-end features derive from
 * {@link ExtensionIntermediateNode}.
 * <p>
 * Nodes are immutable. Children are kept in source order.
 */
public sealed interface IrNode permits
        DocumentIntermediateNode,
        NamespaceDeclarationIntermediateNode,
        UsingDirectiveIntermediateNode,
        ClassDeclarationIntermediateNode,
        FieldDeclarationIntermediateNode,
        MethodDeclarationIntermediateNode,
        DirectiveIntermediateNode,
        MalformedDirectiveIntermediateNode,
        DirectiveTokenIntermediateNode,
        IntermediateToken,
        HtmlContentIntermediateNode,
        HtmlAttributeIntermediateNode,
        HtmlAttributeValueIntermediateNode,
        CSharpCodeIntermediateNode,
        CSharpExpressionIntermediateNode,
        CSharpExpressionAttributeValueIntermediateNode,
        CSharpCodeAttributeValueIntermediateNode,
        TagHelperIntermediateNode,
        TagHelperBodyIntermediateNode,
        TagHelperPropertyIntermediateNode,
        TagHelperHtmlAttributeIntermediateNode,
        ExtensionIntermediateNode {

    /**
     * @return The source location of the node, or {@code null} if the node was synthesized.
     */
    SourceSpan source();

    /**
     * @return The diagnostics attached to this node, never {@code null}.
     */
    List<Diagnostic> diagnostics();

    /**
     * @return The ordered child nodes, never {@code null}.
     */
    List<IrNode> children();

    /**
     * Dispatches to the visitor method matching the concrete kind of this node.
     * @param visitor The visitor to call.
     */
    void accept(IrNodeVisitor visitor);

    default boolean hasDiagnostics() {
        return !diagnostics().isEmpty();
    }

    /**
     * The label of the node kind, used for display. Defaults to the simple class name.
     * @return The kind label.
     */
    default String kindName() {
        return getClass().getSimpleName();
    }
}
