package ai.yarrow.model.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Homogeneous one-dimensional buffer.
 */
public record Array1d(ElementType type, List<Object> data) {

    public Array1d {
        Objects.requireNonNull(type, "type");
        for (int i = 0; i < data.size(); i++) {
            var element = data.get(i);
            if (!type.javaType().isInstance(element)) {
                throw new IllegalArgumentException("element %d of %s array is %s".formatted(
                    i, type, element == null ? "null" : element.getClass().getSimpleName()));
            }
        }
        data = List.copyOf(data);
    }

    public int size() {
        return data.size();
    }

    public static Array1d ofBools(List<Boolean> data) {
        return new Array1d(ElementType.BOOL, List.copyOf(data));
    }

    public static Array1d ofLongs(List<Long> data) {
        return new Array1d(ElementType.I64, List.copyOf(data));
    }

    public static Array1d ofDoubles(List<Double> data) {
        return new Array1d(ElementType.F64, List.copyOf(data));
    }

    public static Array1d ofStrings(List<String> data) {
        return new Array1d(ElementType.STRING, List.copyOf(data));
    }

    public static Array1d bools(boolean... data) {
        var list = new ArrayList<Boolean>(data.length);
        for (boolean b : data) {
            list.add(b);
        }
        return ofBools(list);
    }

    public static Array1d longs(long... data) {
        return ofLongs(Arrays.stream(data).boxed().toList());
    }

    public static Array1d doubles(double... data) {
        return ofDoubles(Arrays.stream(data).boxed().toList());
    }

    public static Array1d strings(String... data) {
        return ofStrings(Arrays.asList(data));
    }
}
