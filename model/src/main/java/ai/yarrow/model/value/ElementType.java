package ai.yarrow.model.value;

import ai.yarrow.model.exceptions.UnsupportedDtypeException;
import jakarta.annotation.Nullable;

/**
 * Element kinds an array may hold. Numeric kinds are declared in promotion order.
 */
public enum ElementType {
    BOOL(Boolean.class),
    I64(Long.class),
    F64(Double.class),
    STRING(String.class);

    private final Class<?> javaType;

    ElementType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public static ElementType of(@Nullable Object element) {
        if (element instanceof Boolean) {
            return BOOL;
        }
        if (element instanceof Long || element instanceof Integer || element instanceof Short
            || element instanceof Byte)
        {
            return I64;
        }
        if (element instanceof Double || element instanceof Float) {
            return F64;
        }
        if (element instanceof String || element instanceof Character) {
            return STRING;
        }
        throw new UnsupportedDtypeException("unsupported element type: "
            + (element == null ? "null" : element.getClass().getName()));
    }

    public static ElementType promote(ElementType left, ElementType right) {
        if (left == right) {
            return left;
        }
        if (left == STRING || right == STRING) {
            throw new UnsupportedDtypeException("can not mix string and non-string elements in one array");
        }
        return left.ordinal() > right.ordinal() ? left : right;
    }

    /**
     * Converts an element accepted by {@link #of(Object)} to the java type of this kind.
     */
    public Object coerce(Object element) {
        return switch (this) {
            case BOOL -> (Boolean) element;
            case I64 -> element instanceof Boolean b ? (b ? 1L : 0L) : ((Number) element).longValue();
            case F64 -> element instanceof Boolean b ? (b ? 1.0 : 0.0) : ((Number) element).doubleValue();
            case STRING -> element instanceof Character c ? String.valueOf(c) : (String) element;
        };
    }
}
