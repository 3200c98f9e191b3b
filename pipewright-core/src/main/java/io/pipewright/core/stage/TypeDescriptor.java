package io.pipewright.core.stage;

import java.util.Objects;

/// Explicit type descriptor declared by a stage for one of its inputs or its output.
///
/// Compatibility is structural: a consumer descriptor accepts a producer
/// descriptor when both describe the same Java type or when the producer's type
/// is a declared subtype of the consumer's.
///
/// @param type the described Java type, not null
public record TypeDescriptor(Class<?> type) {

    /// Descriptor for stages that take no input or produce no output.
    public static final TypeDescriptor NONE = new TypeDescriptor(Void.class);

    /// Descriptor accepting any output.
    public static final TypeDescriptor ANY = new TypeDescriptor(Object.class);

    public TypeDescriptor {
        Objects.requireNonNull(type, "type must not be null");
    }

    /// Creates a descriptor for the given type.
    ///
    /// @param type described type, not null
    /// @return new descriptor, never null
    public static TypeDescriptor of(Class<?> type) {
        return new TypeDescriptor(type);
    }

    /// Checks whether values described by `producer` may flow into a slot described by this
    /// descriptor.
    ///
    /// @param producer descriptor of the producing side, not null
    /// @return true on exact or declared-subtype match
    public boolean accepts(TypeDescriptor producer) {
        return type.isAssignableFrom(producer.type);
    }

    /// Checks whether a runtime value may be passed into a slot described by this descriptor.
    ///
    /// `null` is accepted everywhere; {@link #NONE} accepts only `null`.
    ///
    /// @param value candidate value, may be null
    /// @return true if the value is null or an instance of the described type
    public boolean acceptsValue(Object value) {
        if (value == null) {
            return true;
        }
        return !Void.class.equals(type) && type.isInstance(value);
    }

    /// Returns the simple name of the described type.
    ///
    /// @return type name, never null
    public String name() {
        return type.getSimpleName();
    }

    @Override
    public String toString() {
        return type.getName();
    }
}
