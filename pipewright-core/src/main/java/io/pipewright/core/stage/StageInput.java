package io.pipewright.core.stage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/// Values delivered to a stage for one invocation, keyed by input port.
///
/// For a source stage the single port holds the external run input; for
/// other stages each port holds the output of the predecessor wired to it.
///
/// @implNote Immutable. A port may map to `null` when the producer returned no value.
public final class StageInput {

    private static final StageInput EMPTY = new StageInput(Map.of());

    private final Map<String, Object> values;

    private StageInput(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /// Creates an input from a port-to-value map.
    ///
    /// @param values port values, not null (values may be null)
    /// @return new input, never null
    public static StageInput of(Map<String, Object> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new StageInput(new LinkedHashMap<>(values));
    }

    /// Creates an input with a single value on the default port.
    ///
    /// @param value value, may be null
    /// @return new input, never null
    public static StageInput single(Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(StageSignature.DEFAULT_PORT, value);
        return new StageInput(values);
    }

    public static StageInput empty() {
        return EMPTY;
    }

    /// Returns the value of a port cast to the expected type.
    ///
    /// @param port port name, not null
    /// @param type expected type, not null
    /// @param <T> expected type
    /// @return port value, may be null
    /// @throws NoSuchElementException if the port carries no entry
    /// @throws ClassCastException if the value is not an instance of `type`
    public <T> T get(String port, Class<T> type) {
        if (!values.containsKey(port)) {
            throw new NoSuchElementException("No value for port '" + port + "'");
        }
        return type.cast(values.get(port));
    }

    /// Returns the only value of a single-port input.
    ///
    /// @param type expected type, not null
    /// @param <T> expected type
    /// @return the value, may be null
    /// @throws IllegalStateException if the input does not have exactly one port
    public <T> T single(Class<T> type) {
        if (values.size() != 1) {
            throw new IllegalStateException(
                    "Expected exactly one input port but found " + values.keySet());
        }
        return type.cast(values.values().iterator().next());
    }

    /// Returns all port values.
    ///
    /// @return unmodifiable map of port to value, never null
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "StageInput" + values.keySet();
    }
}
