package io.kiln.core.modifier;

import io.kiln.core.node.Node;

/// Adds metadata to a finished node. Applied last, to every sibling.
public interface NodeDecorator extends FunctionModifier {

    /// @param node the node to decorate, not null
    /// @return the decorated copy, never null
    Node decorateNode(Node node);
}
