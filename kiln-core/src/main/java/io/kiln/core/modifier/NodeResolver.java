package io.kiln.core.modifier;

import io.kiln.core.function.FunctionDefinition;
import java.util.Map;
import java.util.Optional;

/// Decides whether a definition takes part in the graph for a configuration.
public interface NodeResolver extends FunctionModifier {

    /// Resolves the definition against a configuration snapshot.
    ///
    /// @param fn the definition, not null
    /// @param config read-only configuration mapping, not null
    /// @return the definition to build (possibly renamed), or empty to drop it
    Optional<FunctionDefinition> resolve(FunctionDefinition fn, Map<String, Object> config);
}
