package io.pipewright.core.stage.spi;

import io.pipewright.core.stage.StageRole;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Declarative description of one stage, as read from a pipeline definition.
///
/// Handed to the {@link StageProvider} registered for {@link #type()}, which
/// turns it into a runnable {@link io.pipewright.core.stage.Stage}.
///
/// @param id stage identifier within the pipeline, not null
/// @param type provider type key, not null
/// @param role structural role of the stage, not null
/// @param params provider-specific settings, never null (empty if absent)
public record StageSpec(String id, String type, StageRole role, Map<String, Object> params) {

    public StageSpec {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(role, "role must not be null");
        params =
                params == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /// Returns a parameter converted to the requested type.
    ///
    /// Numbers are widened or narrowed to the requested numeric type, since
    /// definition formats do not distinguish `int` from `long`.
    ///
    /// @param name parameter name, not null
    /// @param type expected type, not null
    /// @return the value, empty if absent
    /// @throws IllegalArgumentException if the value has an incompatible type
    public <T> Optional<T> param(String name, Class<T> type) {
        Object value = params.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        if (value instanceof Number number) {
            Object converted = convertNumber(number, type);
            if (converted != null) {
                return Optional.of(type.cast(converted));
            }
        }
        if (type == String.class) {
            return Optional.of(type.cast(String.valueOf(value)));
        }
        throw new IllegalArgumentException(
                "Parameter '"
                        + name
                        + "' of stage '"
                        + id
                        + "' must be "
                        + type.getSimpleName()
                        + " but is "
                        + value.getClass().getSimpleName());
    }

    /// Returns a mandatory parameter.
    ///
    /// @param name parameter name, not null
    /// @param type expected type, not null
    /// @return the value, never null
    /// @throws IllegalArgumentException if the parameter is absent or has an
    ///         incompatible type
    public <T> T requireParam(String name, Class<T> type) {
        return param(name, type)
                .orElseThrow(
                        () ->
                                new IllegalArgumentException(
                                        "Stage '" + id + "' requires parameter '" + name + "'"));
    }

    private static Object convertNumber(Number number, Class<?> type) {
        if (type == Integer.class) {
            return number.intValue();
        }
        if (type == Long.class) {
            return number.longValue();
        }
        if (type == Double.class) {
            return number.doubleValue();
        }
        return null;
    }
}
