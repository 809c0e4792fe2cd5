package ai.yarrow.analysis;

import ai.yarrow.analysis.options.MaterializeOptions;
import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.value.ValueFormat;
import ai.yarrow.model.value.Values;
import jakarta.annotation.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Data source of an analysis, backed by a {@code Materialize} component.
 */
public class Dataset {
    private final Component component;

    public Dataset(@Nullable String path, @Nullable Object value, @Nullable ValueFormat format, boolean isPrivate) {
        var analysis = AnalysisContext.require();
        if ((path == null) == (value == null)) {
            throw new ConfigurationException("dataset needs exactly one of path or value");
        }
        var literal = value == null ? null : Values.encode(value, format);
        this.component = new Component(ComponentKind.MATERIALIZE, Map.of(),
            new MaterializeOptions(path, literal, isPrivate));
        analysis.addDataset(this);
    }

    public static Dataset fromPath(String path) {
        return new Dataset(path, null, null, true);
    }

    public static Dataset fromValue(Object value, boolean isPrivate) {
        return new Dataset(null, value, null, isPrivate);
    }

    public Component component() {
        return component;
    }

    /**
     * Selects columns by name or position.
     */
    public Component index(Object identifier) {
        Objects.requireNonNull(identifier, "identifier");
        Component.requireOwnedBy(AnalysisContext.require(), "data", component);
        var columns = Component.of(identifier);
        return new Component(ComponentKind.INDEX, Map.of("columns", columns, "data", component));
    }
}
