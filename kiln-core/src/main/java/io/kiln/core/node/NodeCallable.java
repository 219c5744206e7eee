package io.kiln.core.node;

import java.util.Map;

/// Computation carried by a {@link Node}.
///
/// The execution engine always invokes a node by keyword: every argument is
/// passed in a map keyed by parameter name. Graph assembly never calls it.
@FunctionalInterface
public interface NodeCallable {

    /// Invokes the computation.
    ///
    /// @param kwargs argument values keyed by input name, not null
    /// @return the computed value, may be null
    Object call(Map<String, Object> kwargs);

    /// Invokes the computation with no arguments.
    ///
    /// @return the computed value, may be null
    default Object call() {
        return call(Map.of());
    }
}
