package org.irdump.writer;

import org.irdump.ir.ExtensionIntermediateNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Trusts extension nodes declared in one of a fixed set of packages or their sub-packages.
 */
public final class PackageTrustPolicy implements ITrustPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(PackageTrustPolicy.class);

    private final List<String> trustedPackages;

    /**
     * @param trustedPackages Package names, e.g. {@code org.irdump.ir}.
     */
    public PackageTrustPolicy(List<String> trustedPackages) {
        this.trustedPackages = List.copyOf(trustedPackages);
        LOG.debug("Trusting extension nodes from packages {}", this.trustedPackages);
    }

    public List<String> trustedPackages() {
        return trustedPackages;
    }

    @Override
    public boolean isTrusted(ExtensionIntermediateNode node) {
        String packageName = node.getClass().getPackageName();
        for (String trusted : trustedPackages) {
            if (packageName.equals(trusted) || packageName.startsWith(trusted + ".")) {
                return true;
            }
        }
        return false;
    }
}
