package ai.yarrow.analysis;

import ai.yarrow.model.value.Values;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps component arguments into preprocessing components according to constraints keyed
 * {@code <argument>_min}, {@code <argument>_max}, {@code <argument>_categories} and {@code <argument>_n}.
 *
 * <p>For every argument the wrappers are applied in a fixed order: {@code Clamp} then {@code Impute} when
 * both bounds are given, otherwise {@code RowMax} for an upper and {@code RowMin} for a lower bound; then
 * {@code Clamp} on categories; then {@code Resize} to the row count.
 */
public final class ConstraintExpander {
    private static final Logger LOG = LogManager.getLogger(ConstraintExpander.class);

    private static final String MIN = "min";
    private static final String MAX = "max";
    private static final String CATEGORIES = "categories";
    private static final String N = "n";

    private ConstraintExpander() {
    }

    public static Map<String, Component> expand(Map<String, Component> arguments, Map<String, ?> constraints) {
        var result = new LinkedHashMap<>(arguments);
        if (constraints.isEmpty()) {
            return result;
        }

        // all values are encoded before the first wrapper is registered
        var lowered = new HashMap<String, Object>();
        for (var argument : arguments.keySet()) {
            for (var suffix : new String[] {MIN, MAX, CATEGORIES, N}) {
                var key = argument + "_" + suffix;
                var raw = constraints.get(key);
                if (raw != null) {
                    lowered.put(key, raw instanceof Component ? raw : Values.encode(raw));
                }
            }
        }

        for (var entry : arguments.entrySet()) {
            var argument = entry.getKey();
            var current = entry.getValue();
            var min = lowered.get(argument + "_" + MIN);
            var max = lowered.get(argument + "_" + MAX);
            var categories = lowered.get(argument + "_" + CATEGORIES);
            var n = lowered.get(argument + "_" + N);

            if (min != null && max != null) {
                var lower = Component.of(min);
                var upper = Component.of(max);
                current = new Component(ComponentKind.CLAMP, Map.of("data", current, "min", lower, "max", upper));
                current = new Component(ComponentKind.IMPUTE, Map.of("data", current));
            } else {
                if (max != null) {
                    var upper = Component.of(max);
                    current = new Component(ComponentKind.ROW_MAX, Map.of("left", current, "right", upper));
                }
                if (min != null) {
                    var lower = Component.of(min);
                    current = new Component(ComponentKind.ROW_MIN, Map.of("left", current, "right", lower));
                }
            }
            if (categories != null) {
                var clamp = Component.of(categories);
                current = new Component(ComponentKind.CLAMP, Map.of("data", current, "categories", clamp));
            }
            if (n != null) {
                var size = Component.of(n);
                current = new Component(ComponentKind.RESIZE, Map.of("data", current, "n", size));
            }

            if (current != entry.getValue()) {
                LOG.debug("Argument '{}' expanded to {}", argument, current);
            }
            result.put(argument, current);
        }
        return result;
    }
}
