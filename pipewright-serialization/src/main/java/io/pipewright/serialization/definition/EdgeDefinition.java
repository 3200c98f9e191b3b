package io.pipewright.serialization.definition;

/// Edge entry of a pipeline definition.
///
/// @param from producing stage ID
/// @param to consuming stage ID
/// @param port consumer port, may be null for single-input consumers
public record EdgeDefinition(String from, String to, String port) {}
