package ai.yarrow.model.value;

/**
 * Typed data exchanged with the runtime: an n-dimensional array, a jagged array or a string-keyed map.
 * Values are immutable.
 */
public sealed interface Value permits ArrayValue, JaggedValue, HashmapValue {

    ValueFormat format();
}
