package io.kiln.core.function;

import io.kiln.core.node.NodeCallable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Signature description of one authored function.
///
/// Every modifier validates and expands against this description instead of
/// inspecting code: the ordered parameter list, the declared return type, the
/// raw documentation string, whether the body is empty, and the implementation
/// to call.
///
/// ### Contracts
/// - **Precondition**: `name` not blank; parameter names unique
/// - **Postcondition**: an empty-bodied definition without an explicit
///   implementation evaluates to `null`, like a body consisting only of a
///   docstring
///
/// ### Usage
/// {@snippet :
/// FunctionDefinition revenue = FunctionDefinition.builder()
///         .name("revenue")
///         .module("finance.metrics")
///         .documentation("Revenue in {currency}")
///         .parameter("sales", Table.class)
///         .optionalParameter("rate", Double.class)
///         .returnType(Series.class)
///         .implementation(kwargs -> compute(kwargs))
///         .build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class FunctionDefinition {

    private final String name;
    private final String module;
    private final String documentation;
    private final Class<?> returnType;
    private final List<Parameter> parameters;
    private final boolean emptyBody;
    private final NodeCallable implementation;

    private FunctionDefinition(Builder builder) {
        this.name = builder.name;
        this.module = builder.module != null ? builder.module : "";
        this.documentation = builder.documentation != null ? builder.documentation : "";
        this.returnType = builder.returnType != null ? builder.returnType : Object.class;
        this.parameters = List.copyOf(builder.parameters);
        this.emptyBody = builder.emptyBody;
        this.implementation =
                builder.implementation != null ? builder.implementation : kwargs -> null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    /// @return logical module name, never null (empty when unknown)
    public String getModule() {
        return module;
    }

    /// @return raw documentation, never null (empty when absent)
    public String getDocumentation() {
        return documentation;
    }

    public Class<?> getReturnType() {
        return returnType;
    }

    /// @return all declared parameters in declaration order, never null
    public List<Parameter> getParameters() {
        return parameters;
    }

    /// Returns the parameters that become named node inputs.
    ///
    /// @return non-variadic parameters in declaration order, never null
    public List<Parameter> getInputParameters() {
        return parameters.stream().filter(p -> !p.kind().isVariadic()).toList();
    }

    public Optional<Parameter> getParameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    public boolean hasParameter(String parameterName) {
        return getParameter(parameterName).isPresent();
    }

    public boolean hasParameterOfKind(ParameterKind kind) {
        return parameters.stream().anyMatch(p -> p.kind() == kind);
    }

    /// Returns whether the body holds nothing beyond a docstring and a bare return.
    public boolean isEmptyBody() {
        return emptyBody;
    }

    public NodeCallable getImplementation() {
        return implementation;
    }

    /// Returns a copy of this definition under another name.
    ///
    /// @param newName the new name, not blank
    /// @return renamed copy, or this instance when the name is unchanged
    public FunctionDefinition withName(String newName) {
        if (name.equals(newName)) {
            return this;
        }
        return toBuilder().name(newName).build();
    }

    public Builder toBuilder() {
        Builder builder =
                new Builder()
                        .name(name)
                        .module(module)
                        .documentation(documentation)
                        .returnType(returnType)
                        .emptyBody(emptyBody)
                        .implementation(implementation);
        builder.parameters.addAll(parameters);
        return builder;
    }

    @Override
    public String toString() {
        return name + parameters.stream().map(Parameter::name).toList() + " -> "
                + returnType.getSimpleName();
    }

    /// Builder for {@link FunctionDefinition}.
    ///
    /// Required fields: `name`. A definition without an implementation must be
    /// declared empty-bodied.
    public static final class Builder {
        private String name;
        private String module;
        private String documentation;
        private Class<?> returnType;
        private final List<Parameter> parameters = new ArrayList<>();
        private boolean emptyBody;
        private NodeCallable implementation;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder documentation(String documentation) {
            this.documentation = documentation;
            return this;
        }

        public Builder returnType(Class<?> returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            this.parameters.add(Objects.requireNonNull(parameter, "parameter must not be null"));
            return this;
        }

        /// Adds a required positional-or-keyword parameter.
        public Builder parameter(String parameterName, Class<?> type) {
            return parameter(Parameter.of(parameterName, type));
        }

        /// Adds a positional-or-keyword parameter that declares a default.
        public Builder optionalParameter(String parameterName, Class<?> type) {
            return parameter(Parameter.optional(parameterName, type));
        }

        /// Adds a `**kwargs`-style parameter collecting arbitrary keyword arguments.
        public Builder varKeyword(String parameterName, Class<?> type) {
            return parameter(new Parameter(parameterName, type, ParameterKind.VAR_KEYWORD, false));
        }

        /// Adds a `*args`-style parameter collecting arbitrary positional arguments.
        public Builder varPositional(String parameterName, Class<?> type) {
            return parameter(
                    new Parameter(parameterName, type, ParameterKind.VAR_POSITIONAL, false));
        }

        /// Marks the body as empty: docstring and bare return at most.
        public Builder emptyBody(boolean emptyBody) {
            this.emptyBody = emptyBody;
            return this;
        }

        public Builder implementation(NodeCallable implementation) {
            this.implementation = implementation;
            return this;
        }

        public FunctionDefinition build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("FunctionDefinition name is required");
            }
            if (implementation == null && !emptyBody) {
                throw new IllegalStateException(
                        "FunctionDefinition '" + name + "' needs an implementation or an empty body");
            }
            long distinct = parameters.stream().map(Parameter::name).distinct().count();
            if (distinct != parameters.size()) {
                throw new IllegalStateException(
                        "FunctionDefinition '" + name + "' declares duplicate parameter names");
            }
            return new FunctionDefinition(this);
        }
    }
}
