package org.irdump.writer;

import org.irdump.api.SourceSpan;
import org.irdump.api.UnknownNodeKindException;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.CSharpCodeAttributeValueIntermediateNode;
import org.irdump.ir.CSharpCodeIntermediateNode;
import org.irdump.ir.CSharpExpressionAttributeValueIntermediateNode;
import org.irdump.ir.CSharpExpressionIntermediateNode;
import org.irdump.ir.ClassDeclarationIntermediateNode;
import org.irdump.ir.DirectiveIntermediateNode;
import org.irdump.ir.DirectiveTokenIntermediateNode;
import org.irdump.ir.DocumentIntermediateNode;
import org.irdump.ir.ExtensionIntermediateNode;
import org.irdump.ir.FieldDeclarationIntermediateNode;
import org.irdump.ir.HtmlAttributeIntermediateNode;
import org.irdump.ir.HtmlAttributeValueIntermediateNode;
import org.irdump.ir.HtmlContentIntermediateNode;
import org.irdump.ir.IntermediateToken;
import org.irdump.ir.IrNode;
import org.irdump.ir.IrNodeVisitor;
import org.irdump.ir.MalformedDirectiveIntermediateNode;
import org.irdump.ir.MethodDeclarationIntermediateNode;
import org.irdump.ir.NamespaceDeclarationIntermediateNode;
import org.irdump.ir.TagHelperBodyIntermediateNode;
import org.irdump.ir.TagHelperHtmlAttributeIntermediateNode;
import org.irdump.ir.TagHelperIntermediateNode;
import org.irdump.ir.TagHelperPropertyIntermediateNode;
import org.irdump.ir.UsingDirectiveIntermediateNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Writes single IR nodes (shallow) as one line of text: indentation, name, source range
 * and the content fields of the node kind, followed by a fingerprint of its diagnostics.
 * <p>
 * The writer appends to the sink and never writes a line terminator; traversal and line
 * breaks are owned by {@link IrNodeSerializer}. Instances are not thread-safe.
 */
public class IrNodeWriter implements IrNodeVisitor {

    private static final String NAME_SUFFIX = "IntermediateNode";
    private static final int INDENT_WIDTH = 4;

    private final Appendable sink;
    private final ExtensionRendererRegistry registry;
    private final MessageFingerprint fingerprint;
    private int depth;

    /**
     * @param sink        The destination of the rendered text.
     * @param registry    Renderers for extension nodes.
     * @param fingerprint The digest used for diagnostic messages.
     */
    public IrNodeWriter(Appendable sink, ExtensionRendererRegistry registry, MessageFingerprint fingerprint) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        this.depth = depth;
    }

    /**
     * Writes the line of the given node including its diagnostics.
     *
     * @param node The node to write; its children are not visited.
     * @throws UnknownNodeKindException if the node is an extension node that cannot be rendered.
     * @throws UncheckedIOException if the sink fails.
     */
    public void write(IrNode node) {
        node.accept(this);
        writeDiagnostics(node);
    }

    @Override
    public void visitDocument(DocumentIntermediateNode node) {
        writeBasicNode(node);
    }

    @Override
    public void visitNamespaceDeclaration(NamespaceDeclarationIntermediateNode node) {
        writeContentNode(node, node.content());
    }

    @Override
    public void visitUsingDirective(UsingDirectiveIntermediateNode node) {
        writeContentNode(node, node.content());
    }

    @Override
    public void visitClassDeclaration(ClassDeclarationIntermediateNode node) {
        writeContentNode(node, join(" ", node.modifiers()), node.className(), node.baseType(), join(", ", node.interfaces()));
    }

    @Override
    public void visitFieldDeclaration(FieldDeclarationIntermediateNode node) {
        writeContentNode(node, join(" ", node.modifiers()), node.fieldType(), node.fieldName());
    }

    @Override
    public void visitMethodDeclaration(MethodDeclarationIntermediateNode node) {
        writeContentNode(node, join(" ", node.modifiers()), node.returnType(), node.methodName());
    }

    @Override
    public void visitDirective(DirectiveIntermediateNode node) {
        writeContentNode(node, node.directiveName());
    }

    @Override
    public void visitMalformedDirective(MalformedDirectiveIntermediateNode node) {
        writeContentNode(node, node.directiveName());
    }

    @Override
    public void visitDirectiveToken(DirectiveTokenIntermediateNode node) {
        writeContentNode(node, node.content());
    }

    @Override
    public void visitToken(IntermediateToken node) {
        writeContentNode(node, label(null, node.kind()), node.content());
    }

    @Override
    public void visitHtmlContent(HtmlContentIntermediateNode node) {
        writeBasicNode(node);
    }

    @Override
    public void visitHtmlAttribute(HtmlAttributeIntermediateNode node) {
        writeContentNode(node, node.prefix(), node.suffix());
    }

    @Override
    public void visitHtmlAttributeValue(HtmlAttributeValueIntermediateNode node) {
        writeContentNode(node, node.prefix());
    }

    @Override
    public void visitCSharpCode(CSharpCodeIntermediateNode node) {
        writeBasicNode(node);
    }

    @Override
    public void visitCSharpExpression(CSharpExpressionIntermediateNode node) {
        writeBasicNode(node);
    }

    @Override
    public void visitCSharpExpressionAttributeValue(CSharpExpressionAttributeValueIntermediateNode node) {
        writeContentNode(node, node.prefix());
    }

    @Override
    public void visitCSharpCodeAttributeValue(CSharpCodeAttributeValueIntermediateNode node) {
        writeContentNode(node, node.prefix());
    }

    @Override
    public void visitTagHelper(TagHelperIntermediateNode node) {
        writeContentNode(node, node.tagName(), label("TagMode.", node.tagMode()));
    }

    @Override
    public void visitTagHelperBody(TagHelperBodyIntermediateNode node) {
        writeBasicNode(node);
    }

    @Override
    public void visitTagHelperProperty(TagHelperPropertyIntermediateNode node) {
        String displayName = node.boundAttribute() == null ? null : node.boundAttribute().displayName();
        writeContentNode(node, node.attributeName(), displayName, label("HtmlAttributeValueStyle.", node.attributeStructure()));
    }

    @Override
    public void visitTagHelperHtmlAttribute(TagHelperHtmlAttributeIntermediateNode node) {
        writeContentNode(node, node.attributeName(), label("HtmlAttributeValueStyle.", node.attributeStructure()));
    }

    @Override
    public void visitExtension(ExtensionIntermediateNode node) {
        List<String> content = registry.resolve(node).contentOf(node);
        writeContentNode(node, content.toArray(new String[0]));
    }

    protected void writeBasicNode(IrNode node) {
        writeIndent();
        writeName(node);
        writeSourceRange(node);
    }

    protected void writeContentNode(IrNode node, String... content) {
        writeBasicNode(node);
        for (String field : content) {
            writeSeparator();
            writeContent(field);
        }
    }

    protected void writeIndent() {
        append(" ".repeat(depth * INDENT_WIDTH));
    }

    protected void writeSeparator() {
        append(ContentEscaper.SEPARATOR);
    }

    protected void writeName(IrNode node) {
        append(displayName(node.kindName()));
    }

    protected void writeSourceRange(IrNode node) {
        if (node.source() != null) {
            writeSeparator();
            writeSourceRange(node.source());
        }
    }

    protected void writeSourceRange(SourceSpan span) {
        append("(" + span.absoluteIndex() + ":" + span.lineIndex() + "," + span.characterIndex()
                + " [" + span.length() + "] " + span.fileName() + ")");
    }

    /**
     * Writes {@code | {range: SEVERITY id: fingerprint}} entries for every diagnostic of the node.
     * The message itself is never written: it may span lines and its wording is not part of the IR.
     */
    protected void writeDiagnostics(IrNode node) {
        if (!node.hasDiagnostics()) {
            return;
        }
        append(" |");
        for (Diagnostic diagnostic : node.diagnostics()) {
            append(" {");
            if (diagnostic.span() != null) {
                writeSourceRange(diagnostic.span());
            }
            append(": " + diagnostic.severity() + " " + diagnostic.id() + ": ");
            append(fingerprint.of(diagnostic.message()));
            append("}");
        }
    }

    protected void writeContent(String content) {
        if (content == null) {
            return;
        }
        append(ContentEscaper.escape(content));
    }

    /**
     * Strips a trailing {@value #NAME_SUFFIX} from a node kind label.
     *
     * @param kindName The label of the node kind.
     * @return The name written to the dump.
     */
    static String displayName(String kindName) {
        if (kindName.endsWith(NAME_SUFFIX)) {
            return kindName.substring(0, kindName.length() - NAME_SUFFIX.length());
        }
        return kindName;
    }

    /**
     * Renders an enum constant with an optional qualifier; an absent constant is an empty field.
     */
    private static String label(String qualifier, Enum<?> value) {
        if (value == null) {
            return null;
        }
        return qualifier == null ? value.name() : qualifier + value.name();
    }

    private static String join(String delimiter, List<String> values) {
        return values == null ? "" : String.join(delimiter, values);
    }

    private void append(String text) {
        try {
            sink.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write IR dump", e);
        }
    }
}
