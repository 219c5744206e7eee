package io.kiln.core.modifier;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.node.Node;
import java.util.Map;

/// Builds the base node of a definition in place of {@link Node#fromFunction}.
///
/// At most one creator may be attached to a definition.
public interface NodeCreator extends FunctionModifier {

    /// @param fn the resolved definition, not null
    /// @param config read-only configuration mapping, not null
    /// @return the base node, never null
    /// @throws InvalidModifierException if the node cannot be built for this configuration
    Node generateNode(FunctionDefinition fn, Map<String, Object> config);
}
