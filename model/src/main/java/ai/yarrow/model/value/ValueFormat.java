package ai.yarrow.model.value;

import ai.yarrow.model.exceptions.ConfigurationException;
import jakarta.annotation.Nullable;

public enum ValueFormat {
    ARRAY("array"),
    JAGGED("jagged"),
    HASHMAP("hashmap");

    private final String tag;

    ValueFormat(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * @return parsed format, or null for a missing tag
     */
    @Nullable
    public static ValueFormat fromTag(@Nullable String tag) {
        if (tag == null) {
            return null;
        }
        for (var format : values()) {
            if (format.tag.equals(tag)) {
                return format;
            }
        }
        throw new ConfigurationException(
            "format must be either \"array\", \"jagged\", \"hashmap\" or unset, got \"" + tag + "\"");
    }
}
