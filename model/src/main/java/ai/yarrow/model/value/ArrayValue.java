package ai.yarrow.model.value;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * N-dimensional array stored as a flat buffer. {@code order} lists the axes from the slowest to the fastest
 * varying one, so the identity permutation means row-major layout. An empty shape denotes a scalar.
 */
public record ArrayValue(Array1d flattened, List<Long> shape, List<Integer> order) implements Value {

    public ArrayValue {
        Objects.requireNonNull(flattened, "flattened");
        shape = List.copyOf(shape);
        order = order.isEmpty() ? identity(shape.size()) : List.copyOf(order);

        long expected = 1;
        for (long dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("negative dimension in shape " + shape);
            }
            expected *= dim;
        }
        if (flattened.size() != expected) {
            throw new IllegalArgumentException("buffer of %d elements does not fit shape %s".formatted(
                flattened.size(), shape));
        }
        if (order.size() != shape.size() || !new HashSet<>(order).equals(new HashSet<>(identity(shape.size())))) {
            throw new IllegalArgumentException("order " + order + " is not a permutation of the axes of " + shape);
        }
    }

    public static ArrayValue scalar(Object element) {
        var type = ElementType.of(element);
        return new ArrayValue(new Array1d(type, List.of(type.coerce(element))), List.of(), List.of());
    }

    public static ArrayValue vector(Array1d data) {
        return new ArrayValue(data, List.of((long) data.size()), List.of(0));
    }

    public static ArrayValue of(Array1d data, List<Long> shape) {
        return new ArrayValue(data, shape, identity(shape.size()));
    }

    public boolean isScalar() {
        return shape.isEmpty();
    }

    public int rank() {
        return shape.size();
    }

    public ElementType type() {
        return flattened.type();
    }

    @Override
    public ValueFormat format() {
        return ValueFormat.ARRAY;
    }

    /**
     * Buffer offset step of every axis.
     */
    public long[] strides() {
        var strides = new long[rank()];
        long step = 1;
        for (int k = rank() - 1; k >= 0; k--) {
            int axis = order.get(k);
            strides[axis] = step;
            step *= shape.get(axis);
        }
        return strides;
    }

    static List<Integer> identity(int rank) {
        return IntStream.range(0, rank).boxed().toList();
    }
}
