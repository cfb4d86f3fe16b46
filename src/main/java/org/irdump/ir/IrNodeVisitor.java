package org.irdump.ir;

/**
 * Visitor over the closed set of IR node kinds. Every well-known kind has its own
 * method, so a new kind cannot be added without every visitor handling it.
 * All nodes deriving from {@link ExtensionIntermediateNode} arrive at
 * {@link #visitExtension(ExtensionIntermediateNode)}.
 */
public interface IrNodeVisitor {

    // Document structure
    void visitDocument(DocumentIntermediateNode node);
    void visitNamespaceDeclaration(NamespaceDeclarationIntermediateNode node);
    void visitUsingDirective(UsingDirectiveIntermediateNode node);
    void visitClassDeclaration(ClassDeclarationIntermediateNode node);
    void visitFieldDeclaration(FieldDeclarationIntermediateNode node);
    void visitMethodDeclaration(MethodDeclarationIntermediateNode node);

    // Directives
    void visitDirective(DirectiveIntermediateNode node);
    void visitMalformedDirective(MalformedDirectiveIntermediateNode node);
    void visitDirectiveToken(DirectiveTokenIntermediateNode node);

    // Content
    void visitToken(IntermediateToken node);
    void visitHtmlContent(HtmlContentIntermediateNode node);
    void visitHtmlAttribute(HtmlAttributeIntermediateNode node);
    void visitHtmlAttributeValue(HtmlAttributeValueIntermediateNode node);
    void visitCSharpCode(CSharpCodeIntermediateNode node);
    void visitCSharpExpression(CSharpExpressionIntermediateNode node);
    void visitCSharpExpressionAttributeValue(CSharpExpressionAttributeValueIntermediateNode node);
    void visitCSharpCodeAttributeValue(CSharpCodeAttributeValueIntermediateNode node);

    // Tag helpers
    void visitTagHelper(TagHelperIntermediateNode node);
    void visitTagHelperBody(TagHelperBodyIntermediateNode node);
    void visitTagHelperProperty(TagHelperPropertyIntermediateNode node);
    void visitTagHelperHtmlAttribute(TagHelperHtmlAttributeIntermediateNode node);

    // Everything defined outside the closed set
    void visitExtension(ExtensionIntermediateNode node);
}
