package ai.yarrow.model.value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sequence of independent columns; an absent column is kept as {@link Optional#empty()}.
 */
public record JaggedValue(List<Optional<Array1d>> columns) implements Value {

    public JaggedValue {
        if (columns.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("absent columns must be Optional.empty()");
        }
        columns = List.copyOf(columns);
    }

    @Override
    public ValueFormat format() {
        return ValueFormat.JAGGED;
    }
}
