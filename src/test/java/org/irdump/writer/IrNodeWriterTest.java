package org.irdump.writer;

import org.irdump.api.SourceSpan;
import org.irdump.api.UnknownNodeKindException;
import org.irdump.diagnostics.Diagnostic;
import org.irdump.ir.AttributeStructure;
import org.irdump.ir.BoundAttributeDescriptor;
import org.irdump.ir.CSharpCodeAttributeValueIntermediateNode;
import org.irdump.ir.CSharpExpressionAttributeValueIntermediateNode;
import org.irdump.ir.CSharpExpressionIntermediateNode;
import org.irdump.ir.ClassDeclarationIntermediateNode;
import org.irdump.ir.DesignTimeDirectiveIntermediateNode;
import org.irdump.ir.DirectiveIntermediateNode;
import org.irdump.ir.DirectiveTokenIntermediateNode;
import org.irdump.ir.DocumentIntermediateNode;
import org.irdump.ir.ExtensionIntermediateNode;
import org.irdump.ir.FieldDeclarationIntermediateNode;
import org.irdump.ir.HtmlAttributeIntermediateNode;
import org.irdump.ir.HtmlAttributeValueIntermediateNode;
import org.irdump.ir.IntermediateToken;
import org.irdump.ir.IrNode;
import org.irdump.ir.MalformedDirectiveIntermediateNode;
import org.irdump.ir.MethodDeclarationIntermediateNode;
import org.irdump.ir.NamespaceDeclarationIntermediateNode;
import org.irdump.ir.TagHelperBodyIntermediateNode;
import org.irdump.ir.TagHelperHtmlAttributeIntermediateNode;
import org.irdump.ir.TagHelperIntermediateNode;
import org.irdump.ir.TagHelperPropertyIntermediateNode;
import org.irdump.ir.TagMode;
import org.irdump.ir.TokenKind;
import org.irdump.ir.UsingDirectiveIntermediateNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link IrNodeWriter}.
 * These tests verify the single-line rendering of every node kind: name, source range,
 * content fields, escaping, indentation and diagnostics.
 */
public class IrNodeWriterTest {

    private static final SourceSpan SPAN = new SourceSpan("/app/Pages/Counter.cshtml", 10, 1, 4, 7);
    private static final String RANGE = "(10:1,4 [7] Counter.cshtml)";

    private ExtensionRendererRegistry registry;

    @BeforeEach
    void setUp() {
        registry = ExtensionRendererRegistry.initialize(new PackageTrustPolicy(List.of("org.irdump.ir")));
    }

    private String write(IrNode node) {
        return write(node, 0);
    }

    private String write(IrNode node, int depth) {
        StringBuilder sb = new StringBuilder();
        IrNodeWriter writer = new IrNodeWriter(sb, registry, new MessageFingerprint("MD5"));
        writer.setDepth(depth);
        writer.write(node);
        return sb.toString();
    }

    /**
     * A field declaration without source span or diagnostics renders as {@code Field},
     * followed by modifiers, type and name.
     */
    @Test
    @Tag("unit")
    void writesFieldDeclarationWithoutSourceRange() {
        FieldDeclarationIntermediateNode field = new FieldDeclarationIntermediateNode(List.of("public", "static"), "int", "Count", null);

        assertThat(write(field)).isEqualTo("Field - public static - int - Count");
    }

    @Test
    @Tag("unit")
    void indentsFourSpacesPerDepthLevel() {
        FieldDeclarationIntermediateNode field = new FieldDeclarationIntermediateNode(List.of("public", "static"), "int", "Count", null);

        assertThat(write(field, 2)).isEqualTo("        Field - public static - int - Count");
        assertThat(write(field, 1)).startsWith("    Field");
        assertThat(write(field, 0)).startsWith("Field");
    }

    @Test
    @Tag("unit")
    void writesSourceRangeAfterName() {
        DirectiveIntermediateNode directive = new DirectiveIntermediateNode("page", SPAN, List.of());

        assertThat(write(directive)).isEqualTo("Directive - " + RANGE + " - page");
    }

    @Test
    @Tag("unit")
    void sourceRangeWithoutFilePathHasEmptyFileName() {
        UsingDirectiveIntermediateNode using = new UsingDirectiveIntermediateNode("System", new SourceSpan(1, 0, 1, 12));

        assertThat(write(using)).isEqualTo("UsingDirective - (1:0,1 [12] ) - System");
    }

    @Test
    @Tag("unit")
    void sourceRangeUsesFileNameOfPathWithoutSlash() {
        UsingDirectiveIntermediateNode using = new UsingDirectiveIntermediateNode("System", new SourceSpan("Index.cshtml", 0, 0, 0, 6));

        assertThat(write(using)).isEqualTo("UsingDirective - (0:0,0 [6] Index.cshtml) - System");
    }

    @Test
    @Tag("unit")
    void writesClassDeclarationWithJoinedInterfaces() {
        ClassDeclarationIntermediateNode clazz = new ClassDeclarationIntermediateNode(
                List.of("public"), "Counter", "ComponentBase", List.of("IDisposable", "IHandleEvent"), null, List.of());

        assertThat(write(clazz)).isEqualTo("ClassDeclaration - public - Counter - ComponentBase - IDisposable, IHandleEvent");
    }

    /**
     * Absent lists and absent values keep their field slot, so the number of
     * separators only depends on the node kind.
     */
    @Test
    @Tag("unit")
    void absentValuesRenderAsEmptyFields() {
        ClassDeclarationIntermediateNode clazz = new ClassDeclarationIntermediateNode(
                null, "Counter", null, null, null, List.of());

        assertThat(write(clazz)).isEqualTo("ClassDeclaration -  - Counter -  - ");
        assertThat(write(new DirectiveTokenIntermediateNode(null, null)))
                .isEqualTo(write(new DirectiveTokenIntermediateNode("", null)))
                .isEqualTo("DirectiveToken - ");
    }

    @Test
    @Tag("unit")
    void absentEnumValuesRenderAsEmptyFields() {
        assertThat(write(new IntermediateToken(null, "x", null))).isEqualTo("IntermediateToken -  - x");
        assertThat(write(new TagHelperIntermediateNode("input", null, null, List.of())))
                .isEqualTo("TagHelper - input - ");
        assertThat(write(new TagHelperHtmlAttributeIntermediateNode("type", null, null, List.of())))
                .isEqualTo("TagHelperHtmlAttribute - type - ");
        assertThat(write(new TagHelperPropertyIntermediateNode("value", null, null, null, List.of())))
                .isEqualTo("TagHelperProperty - value -  - ");
    }

    @Test
    @Tag("unit")
    void writesMethodDeclaration() {
        MethodDeclarationIntermediateNode method = new MethodDeclarationIntermediateNode(
                List.of("protected", "override"), "void", "BuildRenderTree", null, List.of());

        assertThat(write(method)).isEqualTo("MethodDeclaration - protected override - void - BuildRenderTree");
    }

    @Test
    @Tag("unit")
    void writesSingleContentKinds() {
        assertThat(write(new NamespaceDeclarationIntermediateNode("Test.Pages", null, List.of())))
                .isEqualTo("NamespaceDeclaration - Test.Pages");
        assertThat(write(new DirectiveTokenIntermediateNode("\"/counter\"", SPAN)))
                .isEqualTo("DirectiveToken - " + RANGE + " - \"/counter\"");
        assertThat(write(new HtmlAttributeValueIntermediateNode(" ", null, List.of())))
                .isEqualTo("HtmlAttributeValue -  ");
        assertThat(write(new CSharpExpressionAttributeValueIntermediateNode(" ", null, List.of())))
                .isEqualTo("CSharpExpressionAttributeValue -  ");
        assertThat(write(new CSharpCodeAttributeValueIntermediateNode("", null, List.of())))
                .isEqualTo("CSharpCodeAttributeValue - ");
    }

    @Test
    @Tag("unit")
    void writesTokenKindBeforeContent() {
        IntermediateToken token = new IntermediateToken(TokenKind.Html, "<h1>", new SourceSpan("/app/Counter.cshtml", 0, 0, 0, 4));

        assertThat(write(token)).isEqualTo("IntermediateToken - (0:0,0 [4] Counter.cshtml) - Html - <h1>");
        assertThat(write(new IntermediateToken(TokenKind.CSharp, "count++;", null)))
                .isEqualTo("IntermediateToken - CSharp - count++;");
    }

    @Test
    @Tag("unit")
    void writesHtmlAttributePrefixAndSuffix() {
        HtmlAttributeIntermediateNode attribute = new HtmlAttributeIntermediateNode(" class=\"", "\"", null, List.of());

        assertThat(write(attribute)).isEqualTo("HtmlAttribute -  class=\" - \"");
    }

    @Test
    @Tag("unit")
    void writesTagHelperKinds() {
        BoundAttributeDescriptor bound = new BoundAttributeDescriptor("Value", "System.String", "string InputTagHelper.Value");

        assertThat(write(new TagHelperIntermediateNode("input", TagMode.SelfClosing, null, List.of())))
                .isEqualTo("TagHelper - input - TagMode.SelfClosing");
        assertThat(write(new TagHelperPropertyIntermediateNode("value", bound, AttributeStructure.DoubleQuotes, null, List.of())))
                .isEqualTo("TagHelperProperty - value - string InputTagHelper.Value - HtmlAttributeValueStyle.DoubleQuotes");
        assertThat(write(new TagHelperHtmlAttributeIntermediateNode("type", AttributeStructure.SingleQuotes, null, List.of())))
                .isEqualTo("TagHelperHtmlAttribute - type - HtmlAttributeValueStyle.SingleQuotes");
        assertThat(write(new TagHelperBodyIntermediateNode(SPAN, List.of())))
                .isEqualTo("TagHelperBody - " + RANGE);
    }

    @Test
    @Tag("unit")
    void kindsWithoutPayloadWriteNameAndRangeOnly() {
        assertThat(write(new DocumentIntermediateNode(null, List.of()))).isEqualTo("Document");
        assertThat(write(new CSharpExpressionIntermediateNode(SPAN, List.of()))).isEqualTo("CSharpExpression - " + RANGE);
    }

    /**
     * Malformed directives are a classification by the compiler, not a writer error.
     */
    @Test
    @Tag("unit")
    void writesMalformedDirectiveLikeAnyOtherNode() {
        assertThat(write(new MalformedDirectiveIntermediateNode("inject", SPAN, List.of())))
                .isEqualTo("MalformedDirective - " + RANGE + " - inject");
    }

    @Test
    @Tag("unit")
    void escapesContentFields() {
        assertThat(write(new UsingDirectiveIntermediateNode("a - b\r\nc", null)))
                .isEqualTo("UsingDirective - a\\-b\\nc");
    }

    @Test
    @Tag("unit")
    void appendsDiagnosticFingerprintsToTheLine() {
        SourceSpan span = new SourceSpan("/app/Pages/Counter.cshtml", 40, 2, 0, 6);
        MalformedDirectiveIntermediateNode node = new MalformedDirectiveIntermediateNode(
                "inject",
                span,
                List.of(
                        Diagnostic.error("RZ1016", "The 'inject' directive expects a type name.", span),
                        Diagnostic.warning("RZ2001", "Unused attribute.", null)),
                List.of());

        assertThat(write(node)).isEqualTo("MalformedDirective - (40:2,0 [6] Counter.cshtml) - inject"
                + " | {(40:2,0 [6] Counter.cshtml): ERROR RZ1016: 5d549ee78ffe9c9e5136c4b4d89d1fe4}"
                + " {: WARNING RZ2001: 158a863e00d181158574a00647c8e074}");
    }

    @Test
    @Tag("unit")
    void diagnosticMessageTextIsNeverWritten() {
        String message = "first line\nsecond - line";
        DirectiveIntermediateNode node = new DirectiveIntermediateNode(
                "page", null, List.of(Diagnostic.error("RZ9999", message, null)), List.of());

        assertThat(write(node)).doesNotContain("first line", "second", "\n");
    }

    @Test
    @Tag("unit")
    void trustedInternalExtensionNodeWritesNameAndRangeOnly() {
        DesignTimeDirectiveIntermediateNode node = new DesignTimeDirectiveIntermediateNode(SPAN, List.of());

        assertThat(write(node)).isEqualTo("DesignTimeDirective - " + RANGE);
    }

    @Test
    @Tag("unit")
    void registeredExtensionNodeWritesItsFields() {
        registry.register(NoteNode.class, node -> List.of(node.text, "fixed"));

        assertThat(write(new NoteNode("remember\nme"))).isEqualTo("NoteNode - remember\\nme - fixed");
    }

    @Test
    @Tag("unit")
    void unknownExtensionNodeIsFatal() {
        assertThatThrownBy(() -> write(new NoteNode("orphan")))
                .isInstanceOf(UnknownNodeKindException.class)
                .hasMessage("Unknown node type: " + NoteNode.class.getName());
    }

    @Test
    @Tag("unit")
    void usesKindNameOfTheNode() {
        registry.register(RenamedNode.class, node -> List.of());

        assertThat(write(new RenamedNode())).isEqualTo("Renamed");
    }

    @Test
    @Tag("unit")
    void stripsOnlyATrailingSuffix() {
        assertThat(IrNodeWriter.displayName("HtmlContentIntermediateNode")).isEqualTo("HtmlContent");
        assertThat(IrNodeWriter.displayName("IntermediateToken")).isEqualTo("IntermediateToken");
        assertThat(IrNodeWriter.displayName("IntermediateNodeWrapper")).isEqualTo("IntermediateNodeWrapper");
        assertThat(IrNodeWriter.displayName("ComponentExtensionNode")).isEqualTo("ComponentExtensionNode");
    }

    @Test
    @Tag("unit")
    void wrapsSinkFailures() throws IOException {
        Appendable sink = mock(Appendable.class);
        when(sink.append(any(CharSequence.class))).thenThrow(new IOException("disk full"));
        IrNodeWriter writer = new IrNodeWriter(sink, registry, new MessageFingerprint("MD5"));

        assertThatThrownBy(() -> writer.write(new DocumentIntermediateNode(null, List.of())))
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("disk full");
    }

    static final class NoteNode extends ExtensionIntermediateNode {
        final String text;

        NoteNode(String text) {
            super(null, List.of());
            this.text = text;
        }
    }

    static final class RenamedNode extends ExtensionIntermediateNode {
        RenamedNode() {
            super(null, List.of());
        }

        @Override
        public String kindName() {
            return "RenamedIntermediateNode";
        }
    }
}
