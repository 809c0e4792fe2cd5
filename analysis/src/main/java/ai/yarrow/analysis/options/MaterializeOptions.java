package ai.yarrow.analysis.options;

import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.value.Value;
import jakarta.annotation.Nullable;

/**
 * Source of a dataset: either a file the engine reads or an inline literal, never both.
 */
public record MaterializeOptions(
    @Nullable String filePath,
    @Nullable Value literal,
    boolean isPrivate
) implements ComponentOptions {

    public MaterializeOptions {
        if ((filePath == null) == (literal == null)) {
            throw new ConfigurationException("dataset needs exactly one of file path or literal value");
        }
    }

    public static MaterializeOptions fromPath(String filePath, boolean isPrivate) {
        return new MaterializeOptions(filePath, null, isPrivate);
    }

    public static MaterializeOptions fromLiteral(Value literal, boolean isPrivate) {
        return new MaterializeOptions(null, literal, isPrivate);
    }
}
