package io.kiln.core.creator;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.function.Parameter;
import io.kiln.core.modifier.NodeCreator;
import io.kiln.core.node.Node;
import io.kiln.core.validation.FunctionValidators;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Replaces a declaration's implementation with a separately written one.
///
/// The declaration is an empty-bodied definition whose parameters and
/// return type define the node. At call time its declared parameters are
/// passed by keyword into the implementation, which must collect arbitrary
/// keyword arguments.
///
/// ### Usage
/// {@snippet :
/// FunctionDefinition sum = FunctionDefinition.builder()
///         .name("sum")
///         .varKeyword("values", Integer.class)
///         .returnType(Integer.class)
///         .implementation(kwargs -> kwargs.values().stream().mapToInt(v -> (Integer) v).sum())
///         .build();
/// DecoratedFunction total = DecoratedFunction.of(totalDeclaration, Modifiers.does(sum));
/// }
///
/// The node keeps the declaration's name, documentation, return type and
/// inputs; nothing is taken from the implementation's signature.
public final class DelegatingNodeCreator implements NodeCreator {

    private final FunctionDefinition implementation;

    public DelegatingNodeCreator(FunctionDefinition implementation) {
        this.implementation = Objects.requireNonNull(implementation, "implementation must not be null");
    }

    public FunctionDefinition getImplementation() {
        return implementation;
    }

    @Override
    public void validate(FunctionDefinition fn) {
        FunctionValidators.ensureFunctionEmpty(fn);
        FunctionValidators.ensureKeywordOnly(implementation);
        FunctionValidators.ensureOutputTypesMatch(fn, implementation);
    }

    @Override
    public Node generateNode(FunctionDefinition fn, Map<String, Object> config) {
        List<String> declared = fn.getInputParameters().stream().map(Parameter::name).toList();
        return Node.fromFunction(fn).toBuilder()
                .callable(
                        kwargs -> {
                            Map<String, Object> bound = new LinkedHashMap<>();
                            for (String name : declared) {
                                if (kwargs.containsKey(name)) {
                                    bound.put(name, kwargs.get(name));
                                }
                            }
                            return implementation.getImplementation().call(bound);
                        })
                .build();
    }
}
