package io.kiln.core.creator;

import java.util.List;
import java.util.Map;

/// Capability contract of an object that can be wrapped as a single node.
///
/// @see ModelNodeCreator
public interface Model {

    /// Returns the names of the upstream nodes the model consumes.
    ///
    /// @return dependency names in a stable order, never null
    List<String> getDependents();

    /// Computes the model's output.
    ///
    /// @param inputs upstream values keyed by dependency name, not null
    /// @return the prediction, may be null
    Object predict(Map<String, Object> inputs);
}
