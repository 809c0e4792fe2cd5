package ai.yarrow.analysis;

import ai.yarrow.analysis.options.ComponentOptions;
import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.privacy.PrivacyUsage;
import ai.yarrow.model.value.Value;
import ai.yarrow.model.value.ValueFormat;
import ai.yarrow.model.value.Values;
import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node of an analysis graph. A component joins the analysis active on the current thread when it is created,
 * and belongs to it for the rest of its life.
 *
 * <p>Operator methods build new components that take this one as an argument; plain java values passed to
 * them are wrapped into {@code Constant} components first.
 */
public class Component {
    private final ComponentKind kind;
    private final Map<String, Component> arguments;
    private final ComponentOptions options;

    // set once on registration
    private Analysis analysis;
    private int id = -1;

    public Component(ComponentKind kind, Map<String, Component> arguments) {
        this(kind, arguments, null, Map.of(), null, null);
    }

    public Component(ComponentKind kind, Map<String, Component> arguments, @Nullable ComponentOptions options) {
        this(kind, arguments, options, Map.of(), null, null);
    }

    public Component(ComponentKind kind, Map<String, Component> arguments, @Nullable ComponentOptions options,
                     Map<String, ?> constraints)
    {
        this(kind, arguments, options, constraints, null, null);
    }

    public Component(ComponentKind kind, Map<String, Component> arguments, @Nullable ComponentOptions options,
                     Map<String, ?> constraints, @Nullable Object value, @Nullable ValueFormat format)
    {
        var target = AnalysisContext.require();
        this.kind = kind;
        this.options = kind.checkOptions(options);
        var present = present(arguments);
        present.forEach((name, argument) -> requireOwnedBy(target, name, argument));
        constraints.forEach((name, constraint) -> {
            if (constraint instanceof Component component) {
                requireOwnedBy(target, name, component);
            }
        });
        Value literal = value == null ? null : Values.encode(value, format);
        this.arguments = Collections.unmodifiableMap(ConstraintExpander.expand(present, constraints));
        target.register(this, literal);
    }

    /**
     * Lifts {@code value} into the graph: components are returned as is, {@code null} stays {@code null},
     * anything else becomes a new {@code Constant}.
     */
    @Nullable
    public static Component of(@Nullable Object value) {
        return of(value, null);
    }

    @Nullable
    public static Component of(@Nullable Object value, @Nullable ValueFormat format) {
        if (value == null) {
            return null;
        }
        if (value instanceof Component component) {
            return component;
        }
        return new Component(ComponentKind.CONSTANT, Map.of(), null, Map.of(), value, format);
    }

    public Component negative() {
        return new Component(ComponentKind.NEGATIVE, Map.of("data", this));
    }

    public Component add(Object other) {
        return binary(ComponentKind.ADD, this, operand(other));
    }

    public Component subtract(Object other) {
        return binary(ComponentKind.SUBTRACT, this, operand(other));
    }

    public Component multiply(Object other) {
        return binary(ComponentKind.MULTIPLY, this, operand(other));
    }

    public Component divide(Object other) {
        return binary(ComponentKind.DIVIDE, this, operand(other));
    }

    public Component power(Object other) {
        return binary(ComponentKind.POWER, this, operand(other));
    }

    public Component or(Object other) {
        return binary(ComponentKind.OR, this, operand(other));
    }

    public Component and(Object other) {
        return binary(ComponentKind.AND, this, operand(other));
    }

    public Component greaterThan(Object other) {
        return binary(ComponentKind.GREATER_THAN, this, operand(other));
    }

    public Component lessThan(Object other) {
        return binary(ComponentKind.LESS_THAN, this, operand(other));
    }

    /** Element-wise equality node. {@link #equals(Object)} keeps identity semantics. */
    public Component equalsNode(Object other) {
        return binary(ComponentKind.EQUAL, this, operand(other));
    }

    public Component greaterThanOrEqual(Object other) {
        var right = operand(other);
        var greater = binary(ComponentKind.GREATER_THAN, this, right);
        var equal = binary(ComponentKind.EQUAL, this, right);
        return binary(ComponentKind.OR, greater, equal);
    }

    public Component lessThanOrEqual(Object other) {
        var right = operand(other);
        var less = binary(ComponentKind.LESS_THAN, this, right);
        var equal = binary(ComponentKind.EQUAL, this, right);
        return binary(ComponentKind.OR, less, equal);
    }

    public int id() {
        return id;
    }

    @Nullable
    public Analysis analysis() {
        return analysis;
    }

    public ComponentKind kind() {
        return kind;
    }

    public Map<String, Component> arguments() {
        return arguments;
    }

    public ComponentOptions options() {
        return options;
    }

    /** Released value of this component, if the analysis knows one. */
    public Optional<Value> value() {
        if (analysis == null) {
            return Optional.empty();
        }
        return analysis.releasedValue(id).map(ReleasedValue::value);
    }

    /** Released value decoded into plain java objects, see {@link Values#decode(Value)}. */
    public Optional<Object> javaValue() {
        return value().map(Values::decode);
    }

    public List<PrivacyUsage> actualPrivacyUsage() {
        if (analysis == null) {
            return List.of();
        }
        return analysis.releasedValue(id).map(ReleasedValue::privacyUsage).orElse(List.of());
    }

    boolean isOwned() {
        return analysis != null;
    }

    void bind(Analysis owner, int assignedId) {
        this.analysis = owner;
        this.id = assignedId;
    }

    @Override
    public String toString() {
        return "Component{id=" + id + ", kind=" + kind.operationName() + "}";
    }

    /**
     * Lifts the right operand, failing first if this component is not part of the active analysis.
     */
    @Nullable
    private Component operand(@Nullable Object other) {
        requireOwnedBy(AnalysisContext.require(), "left", this);
        return of(other);
    }

    static void requireOwnedBy(Analysis target, String name, Component argument) {
        if (argument.analysis != target) {
            throw new ConfigurationException("argument '%s' refers to %s of another analysis".formatted(name,
                argument));
        }
    }

    private static Component binary(ComponentKind kind, Component left, @Nullable Component right) {
        var args = new LinkedHashMap<String, Component>();
        args.put("left", left);
        args.put("right", right);
        return new Component(kind, args);
    }

    private static Map<String, Component> present(Map<String, Component> arguments) {
        var result = new LinkedHashMap<String, Component>();
        arguments.forEach((name, argument) -> {
            if (argument != null) {
                result.put(name, argument);
            }
        });
        return result;
    }
}
