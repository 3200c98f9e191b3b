package io.pipewright.core.stage.spi;

import io.pipewright.core.stage.Stage;
import java.util.Collections;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/// Maps stage type keys to {@link StageProvider}s.
///
/// ### Provider Discovery
/// {@link #loadProviders()} discovers providers listed in
/// `META-INF/services/io.pipewright.core.stage.spi.StageProvider`. Explicit
/// {@link #register(StageProvider)} calls work on any registry.
///
/// @implNote **Not thread-safe** during registration. Register all providers
/// before sharing the registry; lookups afterwards are safe.
public class StageRegistry {

    private static final Logger logger = Logger.getLogger(StageRegistry.class.getName());

    private final Map<String, StageProvider> providers = new TreeMap<>();

    /// Creates an empty registry.
    public StageRegistry() {}

    /// Creates a registry holding every provider found by {@link ServiceLoader}.
    ///
    /// @return registry with discovered providers, never null
    /// @throws IllegalArgumentException if two discovered providers share a type
    public static StageRegistry loadProviders() {
        StageRegistry registry = new StageRegistry();
        for (StageProvider provider : ServiceLoader.load(StageProvider.class)) {
            registry.register(provider);
            logger.fine("Discovered stage provider: " + provider.getType());
        }
        logger.info(
                "Loaded "
                        + registry.providers.size()
                        + " stage providers: "
                        + registry.providers.keySet());
        return registry;
    }

    /// Registers a provider.
    ///
    /// @param provider provider, not null
    /// @return this registry for chaining
    /// @throws IllegalArgumentException if a provider for the same type exists
    public StageRegistry register(StageProvider provider) {
        String type = provider.getType();
        if (providers.putIfAbsent(type, provider) != null) {
            throw new IllegalArgumentException(
                    "Stage type '" + type + "' is already registered");
        }
        return this;
    }

    /// Creates the stage described by a specification.
    ///
    /// @param spec stage specification, not null
    /// @return the created stage, never null
    /// @throws IllegalStateException if no provider handles the spec's type
    /// @throws IllegalArgumentException if the provider rejects the parameters
    public Stage create(StageSpec spec) {
        StageProvider provider = providers.get(spec.type());
        if (provider == null) {
            throw new IllegalStateException(
                    "No provider found for stage type: "
                            + spec.type()
                            + ". Available types: "
                            + providers.keySet());
        }
        return provider.create(spec);
    }

    public boolean isRegistered(String type) {
        return providers.containsKey(type);
    }

    /// Returns the registered type keys in sorted order.
    ///
    /// @return unmodifiable set of type keys, never null
    public Set<String> getTypes() {
        return Collections.unmodifiableSet(providers.keySet());
    }
}
