package ai.yarrow.model.value;

import java.util.Map;

public record HashmapValue(Map<String, Value> data) implements Value {

    public HashmapValue {
        data = Map.copyOf(data);
    }

    @Override
    public ValueFormat format() {
        return ValueFormat.HASHMAP;
    }
}
