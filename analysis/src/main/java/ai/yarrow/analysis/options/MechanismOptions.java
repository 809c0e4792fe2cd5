package ai.yarrow.analysis.options;

import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.privacy.PrivacyUsage;

import java.util.List;

public record MechanismOptions(String mechanism, List<PrivacyUsage> privacyUsage) implements ComponentOptions {

    public MechanismOptions {
        if (mechanism == null || mechanism.isBlank()) {
            throw new ConfigurationException("mechanism name is required");
        }
        privacyUsage = List.copyOf(privacyUsage);
    }
}
