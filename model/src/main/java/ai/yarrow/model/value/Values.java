package ai.yarrow.model.value;

import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.exceptions.UnsupportedDtypeException;
import jakarta.annotation.Nullable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversion between plain java objects and {@link Value}s.
 *
 * <p>Arrays are built from scalars ({@code Boolean}, integral and floating point numbers, {@code String},
 * {@code Character}), {@code List}s and java arrays; nesting depth gives the shape. Decoding returns
 * {@code Boolean}, {@code Long}, {@code Double} and {@code String} scalars, nested {@code List}s for arrays,
 * {@code Map<String, Object>} for maps and {@code List<Optional<List<Object>>>} for jagged arrays.
 *
 * <p>Jagged columns are encoded from sequences; an absent column is either {@code null} or an empty
 * {@code Optional}, so decoded jagged values encode back to the same value.
 */
public final class Values {

    private Values() {
    }

    public static Value encode(Object raw) {
        return encode(raw, null);
    }

    public static Value encode(@Nullable Object raw, @Nullable ValueFormat format) {
        if (raw == null) {
            throw new UnsupportedDtypeException("null can not be encoded as a value");
        }
        if (raw instanceof Value value) {
            if (format != null && value.format() != format) {
                throw new ConfigurationException("value is already encoded as " + value.format().tag()
                    + ", requested " + format.tag());
            }
            return value;
        }
        if (format == ValueFormat.HASHMAP || raw instanceof Map<?, ?>) {
            return encodeHashmap(raw);
        }
        if (format == ValueFormat.JAGGED) {
            return encodeJagged(raw);
        }
        return encodeArray(raw);
    }

    public static Object decode(Value value) {
        if (value instanceof ArrayValue array) {
            return decodeArray(array);
        }
        if (value instanceof JaggedValue jagged) {
            return jagged.columns().stream()
                .map(column -> column.map(Array1d::data))
                .toList();
        }
        var hashmap = (HashmapValue) value;
        var result = new LinkedHashMap<String, Object>();
        hashmap.data().forEach((key, entry) -> result.put(key, decode(entry)));
        return result;
    }

    private static HashmapValue encodeHashmap(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ConfigurationException("hashmap format requires a map, got " + raw.getClass().getName());
        }
        var data = new HashMap<String, Value>();
        for (var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ConfigurationException("hashmap keys must be strings, got " + entry.getKey());
            }
            data.put(key, encode(entry.getValue(), null));
        }
        return new HashmapValue(data);
    }

    private static JaggedValue encodeJagged(Object raw) {
        if (!isSequence(raw)) {
            throw new ConfigurationException("jagged format requires a sequence of columns, got "
                + raw.getClass().getName());
        }
        var columns = new ArrayList<Optional<Array1d>>();
        for (var item : asList(raw)) {
            var column = item instanceof Optional<?> present ? present.orElse(null) : item;
            if (column == null) {
                columns.add(Optional.empty());
                continue;
            }
            var array = encodeArray(column);
            if (array.rank() != 1) {
                throw new ConfigurationException("jagged columns must be one-dimensional, got shape "
                    + array.shape());
            }
            columns.add(Optional.of(array.flattened()));
        }
        return new JaggedValue(columns);
    }

    private static ArrayValue encodeArray(Object raw) {
        var shape = new ArrayList<Long>();
        Object current = raw;
        while (isSequence(current)) {
            var items = asList(current);
            shape.add((long) items.size());
            if (items.isEmpty()) {
                break;
            }
            current = items.get(0);
        }

        var leaves = new ArrayList<>();
        flatten(raw, shape, 0, leaves);

        var type = ElementType.F64;
        if (!leaves.isEmpty()) {
            type = ElementType.of(leaves.get(0));
            for (var leaf : leaves) {
                type = ElementType.promote(type, ElementType.of(leaf));
            }
        }

        var data = new ArrayList<>(leaves.size());
        for (var leaf : leaves) {
            data.add(type.coerce(leaf));
        }
        return ArrayValue.of(new Array1d(type, data), shape);
    }

    private static void flatten(Object node, List<Long> shape, int depth, List<Object> out) {
        if (depth == shape.size()) {
            if (isSequence(node)) {
                throw ragged(shape);
            }
            out.add(node);
            return;
        }
        if (!isSequence(node)) {
            throw ragged(shape);
        }
        var items = asList(node);
        if (items.size() != shape.get(depth)) {
            throw ragged(shape);
        }
        for (var item : items) {
            flatten(item, shape, depth + 1, out);
        }
    }

    private static Object decodeArray(ArrayValue array) {
        var data = array.flattened().data();
        if (array.isScalar()) {
            return data.get(0);
        }
        return unflatten(data, array.shape(), array.strides(), 0, 0);
    }

    private static List<Object> unflatten(List<Object> data, List<Long> shape, long[] strides, int axis,
                                          long offset)
    {
        var size = shape.get(axis).intValue();
        var result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            long position = offset + i * strides[axis];
            if (axis == shape.size() - 1) {
                result.add(data.get(Math.toIntExact(position)));
            } else {
                result.add(unflatten(data, shape, strides, axis + 1, position));
            }
        }
        return result;
    }

    private static UnsupportedDtypeException ragged(List<Long> shape) {
        return new UnsupportedDtypeException("nested sequence does not match shape " + shape
            + ", use the jagged format for columns of different length");
    }

    private static boolean isSequence(@Nullable Object o) {
        return o instanceof List<?> || (o != null && o.getClass().isArray());
    }

    private static List<?> asList(Object sequence) {
        if (sequence instanceof List<?> list) {
            return list;
        }
        int length = Array.getLength(sequence);
        var list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(sequence, i));
        }
        return list;
    }
}
