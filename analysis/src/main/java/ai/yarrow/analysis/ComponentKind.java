package ai.yarrow.analysis;

import ai.yarrow.analysis.options.ComponentOptions;
import ai.yarrow.analysis.options.MaterializeOptions;
import ai.yarrow.analysis.options.MechanismOptions;
import ai.yarrow.analysis.options.NoOptions;
import ai.yarrow.model.exceptions.ConfigurationException;
import jakarta.annotation.Nullable;

import java.util.Arrays;
import java.util.Locale;

/**
 * Operations a component may perform, with the options shape each one takes.
 */
public enum ComponentKind {
    MATERIALIZE("Materialize", MaterializeOptions.class),
    INDEX("Index"),
    CONSTANT("Constant"),
    CLAMP("Clamp"),
    IMPUTE("Impute"),
    RESIZE("Resize"),
    ROW_MIN("RowMin"),
    ROW_MAX("RowMax"),

    NEGATIVE("Negative"),
    ADD("Add"),
    SUBTRACT("Subtract"),
    MULTIPLY("Multiply"),
    DIVIDE("Divide"),
    POWER("Power"),
    OR("Or"),
    AND("And"),
    GREATER_THAN("GreaterThan"),
    LESS_THAN("LessThan"),
    EQUAL("Equal"),

    COUNT("Count"),
    SUM("Sum"),
    MEAN("Mean"),
    VARIANCE("Variance"),

    DP_COUNT("DPCount", MechanismOptions.class),
    DP_SUM("DPSum", MechanismOptions.class),
    DP_MEAN("DPMean", MechanismOptions.class),
    DP_VARIANCE("DPVariance", MechanismOptions.class);

    private final String operationName;
    private final Class<? extends ComponentOptions> optionsType;

    ComponentKind(String operationName) {
        this(operationName, NoOptions.class);
    }

    ComponentKind(String operationName, Class<? extends ComponentOptions> optionsType) {
        this.operationName = operationName;
        this.optionsType = optionsType;
    }

    public String operationName() {
        return operationName;
    }

    /** Name of the oneof field carrying this operation on the wire. */
    public String variant() {
        return operationName.toLowerCase(Locale.ROOT);
    }

    public Class<? extends ComponentOptions> optionsType() {
        return optionsType;
    }

    public static ComponentKind fromName(String operationName) {
        return Arrays.stream(values())
            .filter(kind -> kind.operationName.equals(operationName))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("unknown operation " + operationName));
    }

    ComponentOptions checkOptions(@Nullable ComponentOptions options) {
        if (options == null) {
            if (optionsType == NoOptions.class) {
                return NoOptions.INSTANCE;
            }
            throw new ConfigurationException(operationName + " requires " + optionsType.getSimpleName());
        }
        if (!optionsType.isInstance(options)) {
            throw new ConfigurationException("%s expects %s, got %s".formatted(
                operationName, optionsType.getSimpleName(), options.getClass().getSimpleName()));
        }
        return options;
    }
}
