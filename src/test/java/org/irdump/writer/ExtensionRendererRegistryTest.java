package org.irdump.writer;

import org.irdump.api.UnknownNodeKindException;
import org.irdump.ir.DesignTimeDirectiveIntermediateNode;
import org.irdump.ir.ExtensionIntermediateNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests resolution of extension node renderers and the trust fallback of the {@link ExtensionRendererRegistry}.
 * These are unit tests and do not require external resources.
 */
@ExtendWith(MockitoExtension.class)
public class ExtensionRendererRegistryTest {

    @Mock
    private ITrustPolicy trustPolicy;

    @Test
    @Tag("unit")
    void resolvesExactRegistration() {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(trustPolicy);
        registry.register(ShapeNode.class, node -> List.of("shape"));

        assertThat(registry.resolve(new ShapeNode()).contentOf(new ShapeNode())).containsExactly("shape");
        assertThat(registry.get(ShapeNode.class)).isPresent();
        verify(trustPolicy, never()).isTrusted(any());
    }

    /**
     * A subclass without own registration uses the renderer of its nearest registered superclass.
     */
    @Test
    @Tag("unit")
    void walksUpTheClassHierarchy() {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(trustPolicy);
        registry.register(ShapeNode.class, node -> List.of("shape"));
        registry.register(SquareNode.class, node -> List.of("square"));

        assertThat(registry.resolve(new SquareNode()).contentOf(new SquareNode())).containsExactly("square");
        assertThat(registry.resolve(new BigSquareNode()).contentOf(new BigSquareNode())).containsExactly("square");
        assertThat(registry.get(BigSquareNode.class)).isEmpty();
    }

    @Test
    @Tag("unit")
    void laterRegistrationReplacesEarlierOne() {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(trustPolicy);
        registry.register(ShapeNode.class, node -> List.of("old"));
        registry.register(ShapeNode.class, node -> List.of("new"));

        assertThat(registry.resolve(new ShapeNode()).contentOf(new ShapeNode())).containsExactly("new");
    }

    @Test
    @Tag("unit")
    void unregisteredTrustedNodeFallsBackToNoContent() {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(trustPolicy);
        ShapeNode node = new ShapeNode();
        when(trustPolicy.isTrusted(node)).thenReturn(true);

        assertThat(registry.resolve(node).contentOf(node)).isEmpty();
    }

    @Test
    @Tag("unit")
    void unregisteredUntrustedNodeIsRejected() {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(trustPolicy);
        ShapeNode node = new ShapeNode();
        when(trustPolicy.isTrusted(node)).thenReturn(false);

        assertThatThrownBy(() -> registry.resolve(node))
                .isInstanceOfSatisfying(UnknownNodeKindException.class,
                        e -> assertThat(e.nodeType()).isEqualTo(ShapeNode.class))
                .hasMessageContaining(ShapeNode.class.getName());
    }

    /**
     * An internal registration is a trust tag on the shape itself, independent of the policy.
     */
    @Test
    @Tag("unit")
    void internalRegistrationBypassesTheTrustPolicy() {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(ITrustPolicy.none());
        registry.registerInternal(ShapeNode.class);

        assertThat(registry.resolve(new ShapeNode()).contentOf(new ShapeNode())).isEmpty();
        assertThat(registry.resolve(new SquareNode()).contentOf(new SquareNode())).isEmpty();
    }

    @Test
    @Tag("unit")
    void packagePolicyTrustsPackagesAndSubPackagesOnly() {
        PackageTrustPolicy policy = new PackageTrustPolicy(List.of("org.irdump.ir", "org.irdump.writer.internal"));

        assertThat(policy.isTrusted(new DesignTimeDirectiveIntermediateNode(null, List.of()))).isTrue();
        assertThat(policy.isTrusted(new ShapeNode())).isFalse();
        assertThat(new PackageTrustPolicy(List.of("org.irdump")).isTrusted(new ShapeNode())).isTrue();
        assertThat(new PackageTrustPolicy(List.of("org.irdump.writ")).isTrusted(new ShapeNode())).isFalse();
        assertThat(new PackageTrustPolicy(List.of()).isTrusted(new ShapeNode())).isFalse();
    }

    static class ShapeNode extends ExtensionIntermediateNode {
        ShapeNode() {
            super(null, List.of());
        }
    }

    static class SquareNode extends ShapeNode {
    }

    static class BigSquareNode extends SquareNode {
    }
}
