package io.kiln.core.node;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// The flat, name-unique collection of nodes emitted by one assembly run.
///
/// Dependency names are not checked against producers here; missing or
/// cyclic producers are detected by the execution engine.
///
/// @implNote Immutable. Iteration follows emission order.
public final class NodeSet {

    private final Map<String, Node> nodes;

    /// Creates a node set from already-deduplicated nodes.
    ///
    /// @param nodes nodes in emission order, not null
    /// @throws IllegalArgumentException if two nodes share a name
    public NodeSet(Collection<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Map<String, Node> byName = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (byName.putIfAbsent(node.getName(), node) != null) {
                throw new IllegalArgumentException("Duplicate node name: " + node.getName());
            }
        }
        this.nodes = Collections.unmodifiableMap(byName);
    }

    public Optional<Node> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(nodes.get(name));
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    public Set<String> names() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }
}
