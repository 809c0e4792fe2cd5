package ai.yarrow.model.privacy;

/**
 * Privacy cost of a release: pure (epsilon) or approximate (epsilon, delta) differential privacy.
 */
public sealed interface PrivacyUsage {

    double epsilon();

    record Pure(double epsilon) implements PrivacyUsage {}

    record Approximate(double epsilon, double delta) implements PrivacyUsage {}
}
