package io.kiln.core.creator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Convenience base for models parameterized from the configuration mapping.
///
/// Subclasses receive the parameters stored under the key named in
/// {@link io.kiln.core.modifier.Modifiers#model} and typically derive their
/// dependents from them.
public abstract class BaseModel implements Model {

    private final Map<String, Object> configParameters;

    protected BaseModel(Map<String, Object> configParameters) {
        Objects.requireNonNull(configParameters, "configParameters must not be null");
        this.configParameters = Collections.unmodifiableMap(new LinkedHashMap<>(configParameters));
    }

    /// @return unmodifiable model parameters in configuration order, never null
    public Map<String, Object> getConfigParameters() {
        return configParameters;
    }
}
