package io.kiln.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.kiln.core.node.NodeSet;
import java.util.List;
import java.util.Map;

/// Exports an emitted {@link NodeSet} as JSON for an execution engine running
/// in another process, and reads such exports back as descriptors.
///
/// ### Usage
/// {@snippet :
/// String json = NodeSetSerializer.toJson(nodeSet);
/// List<NodeDescriptor> nodes = NodeSetSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see KilnJacksonModule for the registered type handlers
public final class NodeSetSerializer {

    private NodeSetSerializer() {}

    /// Serializes a node set to pretty-printed JSON of the form `{"nodes": [...]}`.
    ///
    /// @param nodeSet the node set, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(NodeSet nodeSet) {
        try {
            return createMapper().writeValueAsString(Map.of("nodes", nodeSet.nodes()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize node set: " + e.getMessage(), e);
        }
    }

    /// Reads node descriptors from JSON written by {@link #toJson}.
    ///
    /// @param json JSON string, not null
    /// @return descriptors in emission order, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static List<NodeDescriptor> fromJson(String json) {
        try {
            NodeSetDocument document = createMapper().readValue(json, NodeSetDocument.class);
            return document.nodes() != null ? List.copyOf(document.nodes()) : List.of();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize node set: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for node set serialization.
    ///
    /// Registers:
    /// - `KilnJacksonModule` for {@link io.kiln.core.node.Node}
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new KilnJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    record NodeSetDocument(List<NodeDescriptor> nodes) {}
}
