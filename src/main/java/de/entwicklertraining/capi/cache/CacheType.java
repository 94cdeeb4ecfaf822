package de.entwicklertraining.capi.cache;

import de.entwicklertraining.capi.ErrorKind;

/**
 * Backends {@link CacheFactory} can build.
 */
public enum CacheType {
    MEMORY("memory"),
    NONE("none");

    private final String value;

    CacheType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses a configuration value such as {@code "memory"}.
     *
     * @throws CacheException with {@link ErrorKind#UNSUPPORTED_CACHE_TYPE} for unknown values
     */
    public static CacheType fromValue(String value) {
        for (CacheType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new CacheException(ErrorKind.UNSUPPORTED_CACHE_TYPE, value);
    }
}
