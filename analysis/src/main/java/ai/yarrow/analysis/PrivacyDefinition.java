package ai.yarrow.analysis;

import ai.yarrow.model.exceptions.ConfigurationException;

import java.util.Locale;

public record PrivacyDefinition(Distance distance, Neighboring neighboring) {
    public static final PrivacyDefinition DEFAULT = new PrivacyDefinition(Distance.APPROXIMATE, Neighboring.SUBSTITUTE);

    public enum Distance {
        PURE,
        APPROXIMATE
    }

    public enum Neighboring {
        SUBSTITUTE,
        ADD_REMOVE
    }

    /**
     * Parses names such as {@code "approximate"} and {@code "add_remove"}, ignoring case.
     */
    public static PrivacyDefinition of(String distance, String neighboring) {
        return new PrivacyDefinition(parse(Distance.class, distance), parse(Neighboring.class, neighboring));
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown %s '%s'".formatted(type.getSimpleName().toLowerCase(Locale.ROOT),
                name));
        }
    }
}
