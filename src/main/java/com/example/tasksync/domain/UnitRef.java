package com.example.tasksync.domain;

import com.example.tasksync.domain.enums.UnitType;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Reference to a local schedulable unit: a non-recurring task or a single instance.
 */
@Value
public class UnitRef {

    @NonNull
    UnitType type;

    @NonNull
    UUID id;

    public static UnitRef task(UUID taskId) {
        return new UnitRef(UnitType.TASK, taskId);
    }

    public static UnitRef instance(UUID instanceId) {
        return new UnitRef(UnitType.INSTANCE, instanceId);
    }

    /**
     * Inverse of {@link #key()}; empty for anything that is not a well-formed key
     */
    public static Optional<UnitRef> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        var separator = key.indexOf(':');
        if (separator < 0) {
            return Optional.empty();
        }
        try {
            var type = UnitType.valueOf(key.substring(0, separator).toUpperCase());
            return Optional.of(new UnitRef(type, UUID.fromString(key.substring(separator + 1))));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Stable key used for lock striping and set membership
     */
    public String key() {
        return type.name().toLowerCase() + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
