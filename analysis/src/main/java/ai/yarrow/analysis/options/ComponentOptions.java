package ai.yarrow.analysis.options;

/**
 * Operation-specific payload of a component. Every {@link ai.yarrow.analysis.ComponentKind} accepts exactly
 * one of these shapes.
 */
public sealed interface ComponentOptions permits NoOptions, MaterializeOptions, MechanismOptions {
}
