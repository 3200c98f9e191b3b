package io.pipewright.core.stage.spi;

import io.pipewright.core.stage.Stage;

/// Provider interface for stage implementations referenced by type name.
///
/// Pipeline definitions name stages by a `type` key; the provider registered
/// for that key builds the stage from its {@link StageSpec}.
///
/// ### Registration
/// Register instances explicitly, or list them in
/// `META-INF/services/io.pipewright.core.stage.spi.StageProvider` and use
/// {@link StageRegistry#loadProviders()}:
/// {@snippet :
/// var registry = new StageRegistry()
///     .register(new FrostHarvesterProvider())
///     .register(new CkanRegistrationProvider());
/// }
///
/// @implNote Implementations should be stateless and thread-safe. Stateful
/// resources belong to the created stage, not the provider.
///
/// @see StageRegistry for lookup by type
public interface StageProvider {

    /// Returns the type key this provider handles.
    ///
    /// @return type key (e.g., "frost-harvester"), never null
    String getType();

    /// Creates a stage for the given specification.
    ///
    /// @param spec stage specification whose type equals {@link #getType()}, not null
    /// @return the stage, never null
    /// @throws IllegalArgumentException if the parameters are invalid for this provider
    Stage create(StageSpec spec);
}
