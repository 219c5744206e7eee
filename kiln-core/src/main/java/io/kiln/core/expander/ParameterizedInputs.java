package io.kiln.core.expander;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeExpander;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import io.kiln.core.template.SimpleTemplateResolver;
import io.kiln.core.template.TemplateResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Produces one differently wired node per output by remapping parameters to
/// other upstream nodes.
///
/// `parameterization` maps each output name to `{parameter -> upstream}`.
/// Parameters not mentioned stay shared across all outputs. The definition's
/// documentation may reference remapped parameters as `{parameter}` placeholders,
/// filled per output with the upstream name, and `{output_name}`, filled with
/// the emitted node's name.
///
/// {@snippet :
/// Modifiers.parameterizedInputs(Map.of(
///         "growth_eu", Map.of("current", "sales_eu", "previous", "sales_eu_ly"),
///         "growth_us", Map.of("current", "sales_us", "previous", "sales_us_ly")));
/// }
///
/// ### Contracts
/// - **Precondition**: every remapped parameter exists on the definition
/// - **Precondition**: `output_name` is neither a parameter nor a remap target
/// - **Precondition**: every documentation placeholder is satisfiable per output
public final class ParameterizedInputs implements NodeExpander {

    /// Placeholder carrying the emitted node's own name.
    public static final String OUTPUT_NAME = "output_name";

    private static final TemplateResolver TEMPLATES = new SimpleTemplateResolver();

    private final Map<String, Map<String, String>> parameterization;

    /// @param parameterization upstream remap per output name, not empty
    /// @throws InvalidModifierException if empty or if an output has no remap
    public ParameterizedInputs(Map<String, Map<String, String>> parameterization) {
        if (parameterization == null || parameterization.isEmpty()) {
            throw new InvalidModifierException(
                    "parameterized_inputs needs at least one output parameterization");
        }
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> entry : parameterization.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new InvalidModifierException(
                        "parameterized_inputs output '" + entry.getKey() + "' remaps no parameter");
            }
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.parameterization = Collections.unmodifiableMap(copy);
    }

    @Override
    public void validate(FunctionDefinition fn) {
        if (fn.hasParameter(OUTPUT_NAME)) {
            throw new InvalidModifierException(
                    "parameterized_inputs: '" + fn.getName() + "' declares the reserved parameter '"
                            + OUTPUT_NAME + "'");
        }
        Set<String> placeholders = TEMPLATES.placeholders(fn.getDocumentation());
        for (Map.Entry<String, Map<String, String>> output : parameterization.entrySet()) {
            Map<String, String> remap = output.getValue();
            for (Map.Entry<String, String> mapping : remap.entrySet()) {
                if (!fn.hasParameter(mapping.getKey())) {
                    throw new InvalidModifierException(
                            "parameterized_inputs: '" + fn.getName() + "' has no parameter '"
                                    + mapping.getKey() + "' (output '" + output.getKey() + "')");
                }
                if (OUTPUT_NAME.equals(mapping.getValue())) {
                    throw new InvalidModifierException(
                            "parameterized_inputs: '" + OUTPUT_NAME
                                    + "' is reserved and cannot be a remap target (output '"
                                    + output.getKey() + "')");
                }
            }
            Set<String> satisfiable = new HashSet<>(remap.keySet());
            satisfiable.add(OUTPUT_NAME);
            for (String placeholder : placeholders) {
                if (!satisfiable.contains(placeholder)) {
                    throw new InvalidModifierException(
                            "parameterized_inputs: documentation of '" + fn.getName()
                                    + "' references {" + placeholder
                                    + "} which output '" + output.getKey() + "' does not remap");
                }
            }
        }
    }

    @Override
    public List<Node> expandNode(Node node, Map<String, Object> config, FunctionDefinition fn) {
        List<Node> nodes = new ArrayList<>(parameterization.size());
        for (Map.Entry<String, Map<String, String>> output : parameterization.entrySet()) {
            String outputName = output.getKey();
            Map<String, String> remap = output.getValue();

            Node.Builder builder = node.toBuilder().name(outputName);
            for (Map.Entry<String, String> mapping : remap.entrySet()) {
                InputType inputType = node.getInputTypes().get(mapping.getKey());
                if (inputType == null) {
                    throw new InvalidModifierException(
                            "parameterized_inputs: node '" + node.getName() + "' has no input '"
                                    + mapping.getKey() + "'");
                }
                builder.removeInput(mapping.getKey());
            }
            for (Map.Entry<String, String> mapping : remap.entrySet()) {
                builder.input(mapping.getValue(), node.getInputTypes().get(mapping.getKey()));
            }

            Map<String, Object> docContext = new HashMap<>(remap);
            docContext.put(OUTPUT_NAME, outputName);
            builder.documentation(TEMPLATES.resolve(node.getDocumentation(), docContext));

            Set<String> shared = new HashSet<>(node.getInputTypes().keySet());
            shared.removeAll(remap.keySet());
            builder.callable(
                    kwargs -> {
                        Map<String, Object> args = new HashMap<>();
                        for (String name : shared) {
                            if (kwargs.containsKey(name)) {
                                args.put(name, kwargs.get(name));
                            }
                        }
                        for (Map.Entry<String, String> mapping : remap.entrySet()) {
                            if (kwargs.containsKey(mapping.getValue())) {
                                args.put(mapping.getKey(), kwargs.get(mapping.getValue()));
                            }
                        }
                        return node.getCallable().call(args);
                    });
            nodes.add(builder.build());
        }
        return nodes;
    }
}
