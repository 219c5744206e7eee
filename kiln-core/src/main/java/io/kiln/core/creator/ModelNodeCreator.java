package io.kiln.core.creator;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeCreator;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import io.kiln.core.validation.FunctionValidators;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Wraps a {@link Model} as the single node of a placeholder definition.
///
/// The model is built from the configuration entry under `configKey`; its
/// dependents become the node's inputs, each typed with the placeholder's
/// return type. The placeholder declares no parameters of its own: its
/// dependencies come from the model only.
///
/// ### Contracts
/// - **Precondition**: the placeholder is empty-bodied and parameterless
/// - **Precondition**: `config[configKey]` exists and is a mapping
/// - **Postcondition**: `predict` is only called when the engine runs the node
public final class ModelNodeCreator implements NodeCreator {

    private static final Logger logger = Logger.getLogger(ModelNodeCreator.class.getName());

    private final ModelFactory modelFactory;
    private final String configKey;

    public ModelNodeCreator(ModelFactory modelFactory, String configKey) {
        this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory must not be null");
        this.configKey = Objects.requireNonNull(configKey, "configKey must not be null");
    }

    public String getConfigKey() {
        return configKey;
    }

    @Override
    public void validate(FunctionDefinition fn) {
        FunctionValidators.ensureFunctionEmpty(fn);
        if (!fn.getParameters().isEmpty()) {
            throw new InvalidModifierException(
                    "Model-backed function '" + fn.getName() + "' must not declare parameters;"
                            + " its dependencies come from the model");
        }
    }

    @Override
    public Node generateNode(FunctionDefinition fn, Map<String, Object> config) {
        if (!config.containsKey(configKey)) {
            throw new InvalidModifierException(
                    "Configuration has no model parameters under '" + configKey + "' for '"
                            + fn.getName() + "'");
        }
        Model model = modelFactory.create(toParameters(config.get(configKey)));
        List<String> dependents = model.getDependents();
        if (dependents == null) {
            throw new InvalidModifierException(
                    "Model for '" + fn.getName() + "' returned no dependents");
        }

        Node.Builder builder = Node.fromFunction(fn).toBuilder().callable(model::predict);
        for (String dependent : dependents) {
            builder.input(dependent, InputType.required(fn.getReturnType()));
        }
        logger.fine("Wrapped model for '" + fn.getName() + "' with dependents " + dependents);
        return builder.build();
    }

    private Map<String, Object> toParameters(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidModifierException(
                    "Model parameters under '" + configKey + "' must be a mapping, found "
                            + (raw == null ? "null" : raw.getClass().getSimpleName()));
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new InvalidModifierException(
                        "Model parameter names under '" + configKey + "' must be strings");
            }
            parameters.put((String) entry.getKey(), entry.getValue());
        }
        return parameters;
    }
}
