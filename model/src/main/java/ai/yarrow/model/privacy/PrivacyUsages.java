package ai.yarrow.model.privacy;

import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class PrivacyUsages {
    private static final Logger LOG = LogManager.getLogger(PrivacyUsages.class);

    private PrivacyUsages() {
    }

    public static Optional<List<PrivacyUsage>> of(@Nullable Double epsilon, @Nullable Double delta) {
        return ofLists(epsilon == null ? null : List.of(epsilon), delta == null ? null : List.of(delta));
    }

    /**
     * Builds one usage per epsilon. With deltas present the usages are approximate and epsilons are paired
     * with deltas by position; the pairing stops at the end of the shorter list.
     *
     * @return usages, or empty when no epsilon is given
     */
    public static Optional<List<PrivacyUsage>> ofLists(@Nullable List<Double> epsilon,
                                                       @Nullable List<Double> delta)
    {
        if (epsilon == null) {
            return Optional.empty();
        }

        var usages = new ArrayList<PrivacyUsage>();
        if (delta == null) {
            for (double e : epsilon) {
                usages.add(new PrivacyUsage.Pure(e));
            }
            return Optional.of(List.copyOf(usages));
        }

        if (epsilon.size() != delta.size()) {
            LOG.warn("Got {} epsilon and {} delta values, only the first {} pairs are used",
                epsilon.size(), delta.size(), Math.min(epsilon.size(), delta.size()));
        }
        for (int i = 0; i < Math.min(epsilon.size(), delta.size()); i++) {
            usages.add(new PrivacyUsage.Approximate(epsilon.get(i), delta.get(i)));
        }
        return Optional.of(List.copyOf(usages));
    }
}
