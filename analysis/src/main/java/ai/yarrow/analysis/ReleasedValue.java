package ai.yarrow.analysis;

import ai.yarrow.model.privacy.PrivacyUsage;
import ai.yarrow.model.value.Value;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Value known for a component, either its literal or a result computed by the runtime engine.
 */
public record ReleasedValue(@Nullable Value value, List<PrivacyUsage> privacyUsage) {

    public ReleasedValue {
        privacyUsage = List.copyOf(privacyUsage);
    }

    public static ReleasedValue literal(Value value) {
        return new ReleasedValue(value, List.of());
    }
}
