package org.irdump.writer;

import org.irdump.api.UnknownNodeKindException;
import org.irdump.ir.IrNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Serializes a whole IR tree: visits every node pre-order, depth first and in child order,
 * and writes one {@code '\n'} terminated line per node with four spaces of indentation per level.
 * <p>
 * The serializer is stateless apart from its registry and may serve any number of trees,
 * one at a time per sink.
 */
public final class IrNodeSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(IrNodeSerializer.class);
    private static final char NEW_LINE = '\n';

    private final ExtensionRendererRegistry registry;
    private final MessageFingerprint fingerprint;

    /**
     * @param registry    Renderers for extension nodes.
     * @param fingerprint The digest used for diagnostic messages.
     */
    public IrNodeSerializer(ExtensionRendererRegistry registry, MessageFingerprint fingerprint) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    }

    /**
     * Creates a serializer with an empty registry that trusts the configured packages.
     * Feature packages register their renderers on {@link #registry()} afterwards.
     *
     * @param options The writer options.
     * @return A new serializer.
     */
    public static IrNodeSerializer fromOptions(IrWriterOptions options) {
        ExtensionRendererRegistry registry = ExtensionRendererRegistry.initialize(new PackageTrustPolicy(options.trustedPackages()));
        return new IrNodeSerializer(registry, new MessageFingerprint(options.fingerprintAlgorithm()));
    }

    public ExtensionRendererRegistry registry() {
        return registry;
    }

    /**
     * @param root The root of the tree.
     * @return The complete dump.
     * @throws UnknownNodeKindException if the tree contains an extension node that cannot be rendered.
     */
    public String serialize(IrNode root) {
        StringBuilder sb = new StringBuilder();
        serialize(root, sb);
        return sb.toString();
    }

    /**
     * Writes the dump of the tree to the sink. If an exception is thrown, the sink holds a
     * truncated dump that must be discarded.
     *
     * @param root The root of the tree.
     * @param sink The destination; only appended to.
     * @throws UnknownNodeKindException if the tree contains an extension node that cannot be rendered.
     * @throws UncheckedIOException if the sink fails.
     */
    public void serialize(IrNode root, Appendable sink) {
        IrNodeWriter writer = new IrNodeWriter(sink, registry, fingerprint);
        try {
            int count = visit(root, 0, writer, sink);
            LOG.debug("Serialized IR tree rooted at {} ({} nodes)", root.kindName(), count);
        } catch (UnknownNodeKindException e) {
            LOG.debug("Aborted IR dump: no renderer for extension node {}", e.nodeType().getName());
            throw e;
        }
    }

    private int visit(IrNode node, int depth, IrNodeWriter writer, Appendable sink) {
        writer.setDepth(depth);
        writer.write(node);
        newLine(sink);
        int count = 1;
        for (IrNode child : node.children()) {
            count += visit(child, depth + 1, writer, sink);
        }
        return count;
    }

    private static void newLine(Appendable sink) {
        try {
            sink.append(NEW_LINE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write IR dump", e);
        }
    }
}
