package de.entwicklertraining.capi.batch;

import java.util.Optional;

/**
 * Verbs a {@link BatchOperation} can carry.
 */
public enum OperationType {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    GET("get");

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<OperationType> fromValue(String value) {
        for (OperationType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
