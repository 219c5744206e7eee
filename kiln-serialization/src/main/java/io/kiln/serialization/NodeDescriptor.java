package io.kiln.serialization;

import io.kiln.core.node.DependencyType;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Serializable view of a {@link Node}: everything except its callable.
///
/// @param name node name, not null
/// @param type binary class name of the output type, not null
/// @param documentation node documentation, not null
/// @param inputTypes inputs keyed by producer name, not null
/// @param tags node tags, not null
public record NodeDescriptor(
        String name,
        String type,
        String documentation,
        Map<String, InputDescriptor> inputTypes,
        Map<String, Object> tags) {

    public NodeDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        documentation = documentation != null ? documentation : "";
        inputTypes =
                inputTypes != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputTypes))
                        : Map.of();
        tags = tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tags)) : Map.of();
    }

    /// Describes a node without its callable.
    ///
    /// @param node the node to describe, not null
    /// @return new descriptor, never null
    public static NodeDescriptor of(Node node) {
        Map<String, InputDescriptor> inputs = new LinkedHashMap<>();
        node.getInputTypes().forEach((name, input) -> inputs.put(name, InputDescriptor.of(input)));
        return new NodeDescriptor(
                node.getName(), node.getType().getName(), node.getDocumentation(), inputs, node.getTags());
    }

    /// Serializable view of an {@link InputType}.
    ///
    /// @param type binary class name of the input type, not null
    /// @param dependency dependency classification, not null
    public record InputDescriptor(String type, DependencyType dependency) {

        public InputDescriptor {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(dependency, "dependency must not be null");
        }

        public static InputDescriptor of(InputType inputType) {
            return new InputDescriptor(inputType.type().getName(), inputType.dependencyType());
        }
    }
}
