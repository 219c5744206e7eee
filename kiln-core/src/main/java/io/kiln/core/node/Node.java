package io.kiln.core.node;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.function.Parameter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A vertex of the dataflow graph handed to the execution engine.
///
/// A node names one computation, declares its output type, and lists the
/// inputs it needs by name. The engine matches each input name to the node
/// of the same name and invokes {@link #getCallable()} with their values.
///
/// ### Lifecycle
/// 1. Built once from a {@link FunctionDefinition}, either directly through
///    {@link #fromFunction} or by a creator modifier
/// 2. Cloned and rewired by expanders into sibling nodes via {@link #toBuilder()}
/// 3. Extended with tags by decorators
///
/// @implNote Immutable and thread-safe after construction. Input types and
/// tags keep their insertion order.
///
/// @see io.kiln.core.assembly.NodeAssembler for the pipeline producing nodes
public final class Node {

    /// Tag key carrying the logical module a node was declared in.
    public static final String MODULE_TAG = "module";

    private final String name;
    private final Class<?> type;
    private final String documentation;
    private final NodeCallable callable;
    private final Map<String, InputType> inputTypes;
    private final Map<String, Object> tags;

    private Node(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.documentation = builder.documentation != null ? builder.documentation : "";
        this.callable = builder.callable;
        this.inputTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputTypes));
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    }

    /// Derives a node straight from a function definition.
    ///
    /// Inputs are the definition's non-variadic parameters; a parameter with a
    /// default becomes an `OPTIONAL` input. The definition's module, when set,
    /// is recorded under the {@value #MODULE_TAG} tag.
    ///
    /// @param fn the function definition, not null
    /// @return new node named after the function, never null
    public static Node fromFunction(FunctionDefinition fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        Builder builder =
                builder()
                        .name(fn.getName())
                        .type(fn.getReturnType())
                        .documentation(fn.getDocumentation())
                        .callable(fn.getImplementation());
        for (Parameter parameter : fn.getInputParameters()) {
            builder.input(
                    parameter.name(),
                    new InputType(
                            parameter.type(), DependencyType.fromRequired(parameter.required())));
        }
        if (!fn.getModule().isEmpty()) {
            builder.tag(MODULE_TAG, fn.getModule());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this node's state.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .type(type)
                .documentation(documentation)
                .callable(callable)
                .inputTypes(inputTypes)
                .tags(tags);
    }

    public String getName() {
        return name;
    }

    public Class<?> getType() {
        return type;
    }

    /// @return documentation text, never null (may be empty)
    public String getDocumentation() {
        return documentation;
    }

    public NodeCallable getCallable() {
        return callable;
    }

    /// Returns the inputs this node depends on, keyed by producer name.
    ///
    /// @return unmodifiable ordered map, never null (may be empty)
    public Map<String, InputType> getInputTypes() {
        return inputTypes;
    }

    /// @return unmodifiable ordered tag map, never null (may be empty)
    public Map<String, Object> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return name.equals(other.name)
                && type.equals(other.type)
                && documentation.equals(other.documentation)
                && callable.equals(other.callable)
                && inputTypes.equals(other.inputTypes)
                && tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, documentation, inputTypes, tags);
    }

    @Override
    public String toString() {
        return "Node{name='" + name + "', type=" + type.getSimpleName() + ", inputs="
                + inputTypes.keySet() + ", tags=" + tags + "}";
    }

    /// Builder for constructing immutable Node instances.
    ///
    /// Required fields: `name`, `type`, `callable`
    public static final class Builder {
        private String name;
        private Class<?> type;
        private String documentation;
        private NodeCallable callable;
        private Map<String, InputType> inputTypes = new LinkedHashMap<>();
        private Map<String, Object> tags = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder documentation(String documentation) {
            this.documentation = documentation;
            return this;
        }

        public Builder callable(NodeCallable callable) {
            this.callable = callable;
            return this;
        }

        /// Replaces all inputs.
        ///
        /// @param inputTypes inputs keyed by producer name, may be null for none
        /// @return this builder for chaining
        public Builder inputTypes(Map<String, InputType> inputTypes) {
            this.inputTypes = inputTypes != null ? new LinkedHashMap<>(inputTypes) : new LinkedHashMap<>();
            return this;
        }

        public Builder input(String inputName, InputType inputType) {
            this.inputTypes.put(inputName, inputType);
            return this;
        }

        public Builder removeInput(String inputName) {
            this.inputTypes.remove(inputName);
            return this;
        }

        /// Replaces all tags.
        ///
        /// @param tags tag map, may be null for none
        /// @return this builder for chaining
        public Builder tags(Map<String, Object> tags) {
            this.tags = tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>();
            return this;
        }

        public Builder tag(String key, Object value) {
            this.tags.put(key, value);
            return this;
        }

        public Node build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Node name is required");
            }
            if (type == null) {
                throw new IllegalStateException("Node type is required for '" + name + "'");
            }
            if (callable == null) {
                throw new IllegalStateException("Node callable is required for '" + name + "'");
            }
            return new Node(this);
        }
    }
}
