package org.irdump.writer;

import org.irdump.ir.ExtensionIntermediateNode;

/**
 * Decides whether an extension node without a registered renderer is an internal
 * implementation detail of the compiler. Trusted nodes are written with name and
 * source range only; untrusted ones abort the dump.
 */
@FunctionalInterface
public interface ITrustPolicy {

    /**
     * @param node An extension node that has no registered renderer.
     * @return {@code true} if the node may be rendered without content fields.
     */
    boolean isTrusted(ExtensionIntermediateNode node);

    /**
     * @return A policy that trusts nothing.
     */
    static ITrustPolicy none() {
        return node -> false;
    }
}
