package org.irdump.writer;

import org.irdump.api.UnknownNodeKindException;
import org.irdump.ir.ExtensionIntermediateNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry mapping extension node classes to renderers.
 * <p>
 * Feature packages register their node shapes here so the writer never depends on them.
 * The {@link #resolve(ExtensionIntermediateNode)} method walks the class hierarchy to find
 * the nearest registered renderer and consults the {@link ITrustPolicy} for everything else.
 */
public final class ExtensionRendererRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ExtensionRendererRegistry.class);

    /** Renders name and source range only. */
    static final IExtensionNodeRenderer<ExtensionIntermediateNode> BASIC = node -> List.of();

    private final Map<Class<?>, IExtensionNodeRenderer<?>> byClass = new HashMap<>();
    private final ITrustPolicy trustPolicy;

    private ExtensionRendererRegistry(ITrustPolicy trustPolicy) {
        this.trustPolicy = Objects.requireNonNull(trustPolicy, "trustPolicy");
    }

    /**
     * Registers a renderer for the given extension node class.
     *
     * @param nodeType The concrete extension node class.
     * @param renderer The renderer producing the content fields of that class.
     * @param <T>      Concrete node type parameter.
     */
    public <T extends ExtensionIntermediateNode> void register(Class<T> nodeType, IExtensionNodeRenderer<T> renderer) {
        Objects.requireNonNull(renderer, "renderer");
        IExtensionNodeRenderer<?> previous = byClass.put(nodeType, renderer);
        if (previous != null) {
            LOG.debug("Replaced renderer for extension node {}", nodeType.getName());
        } else {
            LOG.debug("Registered renderer for extension node {}", nodeType.getName());
        }
    }

    /**
     * Marks an extension node class as an internal implementation detail. Nodes of the class are
     * written with name and source range only, regardless of the trust policy.
     *
     * @param nodeType The concrete extension node class.
     */
    public void registerInternal(Class<? extends ExtensionIntermediateNode> nodeType) {
        byClass.put(nodeType, BASIC);
        LOG.debug("Registered internal extension node {}", nodeType.getName());
    }

    /**
     * Retrieves the renderer strictly registered for the given class (no hierarchy search).
     *
     * @param nodeType The extension node class to look up.
     * @return Optional renderer if present.
     */
    public Optional<IExtensionNodeRenderer<?>> get(Class<? extends ExtensionIntermediateNode> nodeType) {
        return Optional.ofNullable(byClass.get(nodeType));
    }

    /**
     * Resolves a renderer for the given node by searching the node's concrete class,
     * then walking up its superclasses. Unregistered nodes fall back to name and source
     * range if the trust policy accepts them.
     *
     * @param node The extension node to resolve a renderer for.
     * @return A non-null renderer for the node.
     * @throws UnknownNodeKindException if nothing is registered and the node is not trusted.
     */
    @SuppressWarnings("unchecked")
    public IExtensionNodeRenderer<ExtensionIntermediateNode> resolve(ExtensionIntermediateNode node) {
        Class<?> c = node.getClass();
        while (c != null && ExtensionIntermediateNode.class.isAssignableFrom(c)) {
            IExtensionNodeRenderer<?> found = byClass.get(c);
            if (found != null) return (IExtensionNodeRenderer<ExtensionIntermediateNode>) found;
            c = c.getSuperclass();
        }
        if (trustPolicy.isTrusted(node)) {
            return BASIC;
        }
        throw new UnknownNodeKindException(node.getClass());
    }

    /**
     * @return The policy consulted for unregistered extension nodes.
     */
    public ITrustPolicy trustPolicy() {
        return trustPolicy;
    }

    /**
     * Creates an empty registry. Feature packages register their renderers after construction.
     *
     * @param trustPolicy The policy for extension nodes without a registered renderer.
     * @return A new registry instance.
     */
    public static ExtensionRendererRegistry initialize(ITrustPolicy trustPolicy) {
        return new ExtensionRendererRegistry(trustPolicy);
    }
}
