package io.kiln.core.modifier;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.node.Node;
import java.util.List;
import java.util.Map;

/// Multiplies one node into an ordered sequence of nodes.
///
/// Unbound inputs of the incoming node are kept, with their name, type and
/// dependency type, on every node that still calls it.
public interface NodeExpander extends FunctionModifier {

    /// @param node the node to expand, not null
    /// @param config read-only configuration mapping, not null
    /// @param fn the resolved definition the node came from, not null
    /// @return the produced nodes in emission order, never null
    List<Node> expandNode(Node node, Map<String, Object> config, FunctionDefinition fn);

    /// Returns whether this expander derives outputs from the incoming node
    /// rather than replacing it.
    ///
    /// When true, the first node returned by {@link #expandNode} stands for the
    /// incoming node and every following node reads that node's output. Later
    /// expanders on the same definition leave such derived nodes untouched.
    ///
    /// @return false by default
    default boolean derivesOutputs() {
        return false;
    }
}
