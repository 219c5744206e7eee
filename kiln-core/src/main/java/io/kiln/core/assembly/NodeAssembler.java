package io.kiln.core.assembly;

import io.kiln.core.KilnConfig;
import io.kiln.core.VariantConflictPolicy;
import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.DecoratedFunction;
import io.kiln.core.modifier.FunctionModifier;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeCreator;
import io.kiln.core.modifier.NodeDecorator;
import io.kiln.core.modifier.NodeExpander;
import io.kiln.core.modifier.NodeResolver;
import io.kiln.core.node.Node;
import io.kiln.core.node.NodeSet;
import io.kiln.core.tag.TagDecorator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Turns decorated function definitions into the node set handed to the
/// execution engine.
///
/// ### Pipeline (per definition)
/// 1. Validate every attached modifier against the raw definition
/// 2. Resolve: every {@link NodeResolver} must keep the definition, otherwise
///    it contributes nothing
/// 3. Create the base node with the single {@link NodeCreator}, or
///    {@link Node#fromFunction} when none is attached
/// 4. Expand with each {@link NodeExpander} in attachment order, applied to
///    every node produced so far except nodes derived by an earlier
///    expander (see {@link NodeExpander#derivesOutputs()}), which pass through
/// 5. Decorate every resulting node with each {@link NodeDecorator}
///
/// Any {@link InvalidModifierException} aborts the whole contribution of
/// the failing definition, and with it the assembly.
///
/// ### Across definitions
/// Definitions sharing a resolved logical name are configuration variants.
/// At most one may match (see {@link VariantConflictPolicy}). Node names must
/// be unique across the emitted set.
///
/// @implNote Stateless apart from its configuration. Safe to share between
/// threads; each call works on its own data.
public class NodeAssembler {

    private static final Logger logger = Logger.getLogger(NodeAssembler.class.getName());

    private final KilnConfig config;

    public NodeAssembler(KilnConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Assembles the node set for one configuration snapshot.
    ///
    /// @param functions decorated definitions in declaration order, not null
    /// @param configuration read-only configuration mapping, not null
    /// @return emitted nodes in declaration order, never null
    /// @throws InvalidModifierException if any definition violates a modifier contract,
    ///         if variants conflict, or if node names collide
    public NodeSet assemble(List<DecoratedFunction> functions, Map<String, Object> configuration) {
        Objects.requireNonNull(functions, "functions must not be null");
        Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(configuration));

        Map<String, Contribution> byLogicalName = new LinkedHashMap<>();
        for (DecoratedFunction function : functions) {
            Optional<Contribution> contribution = contribute(function, snapshot);
            if (contribution.isEmpty()) {
                continue;
            }
            Contribution current = contribution.get();
            Contribution previous = byLogicalName.remove(current.logicalName());
            if (previous != null) {
                handleConflict(previous, current);
            }
            byLogicalName.put(current.logicalName(), current);
        }

        Map<String, Node> emitted = new LinkedHashMap<>();
        Map<String, String> producers = new HashMap<>();
        for (Contribution contribution : byLogicalName.values()) {
            for (Node node : contribution.nodes()) {
                String producer = producers.putIfAbsent(node.getName(), contribution.source());
                if (producer != null) {
                    throw new InvalidModifierException(
                            "Node '" + node.getName() + "' is produced more than once ("
                                    + (producer.equals(contribution.source())
                                            ? "twice by '" + producer + "'"
                                            : "by '" + producer + "' and '" + contribution.source() + "'")
                                    + ")");
                }
                emitted.put(node.getName(), node);
            }
        }

        logger.info(
                "Assembled " + emitted.size() + " node(s) from " + functions.size()
                        + " function definition(s)");
        return new NodeSet(emitted.values());
    }

    /// Runs the pipeline for a single definition.
    ///
    /// @param function the decorated definition, not null
    /// @param configuration read-only configuration mapping, not null
    /// @return emitted nodes, empty when a resolver drops the definition
    /// @throws InvalidModifierException if a modifier contract is violated
    public List<Node> resolveNodes(DecoratedFunction function, Map<String, Object> configuration) {
        return contribute(function, configuration).map(Contribution::nodes).orElse(List.of());
    }

    private Optional<Contribution> contribute(
            DecoratedFunction function, Map<String, Object> configuration) {
        FunctionDefinition fn = function.definition();
        List<FunctionModifier> modifiers = effectiveModifiers(function);

        for (FunctionModifier modifier : modifiers) {
            modifier.validate(fn);
        }

        FunctionDefinition resolved = fn;
        for (FunctionModifier modifier : modifiers) {
            if (modifier instanceof NodeResolver resolver) {
                Optional<FunctionDefinition> kept = resolver.resolve(resolved, configuration);
                if (kept.isEmpty()) {
                    logger.fine(() -> "Definition '" + fn.getName() + "' does not match configuration");
                    return Optional.empty();
                }
                resolved = kept.get();
            }
        }

        List<NodeCreator> creators =
                modifiers.stream()
                        .filter(NodeCreator.class::isInstance)
                        .map(NodeCreator.class::cast)
                        .toList();
        if (creators.size() > 1) {
            throw new InvalidModifierException(
                    "Function '" + fn.getName() + "' has " + creators.size()
                            + " node creators; at most one is allowed");
        }
        Node base =
                creators.isEmpty()
                        ? Node.fromFunction(resolved)
                        : creators.get(0).generateNode(resolved, configuration);

        List<Produced> produced = List.of(new Produced(base, false));
        for (FunctionModifier modifier : modifiers) {
            if (modifier instanceof NodeExpander expander) {
                List<Produced> expanded = new ArrayList<>();
                for (Produced entry : produced) {
                    if (entry.derived()) {
                        expanded.add(entry);
                        continue;
                    }
                    List<Node> outputs = expander.expandNode(entry.node(), configuration, resolved);
                    for (int i = 0; i < outputs.size(); i++) {
                        expanded.add(new Produced(outputs.get(i), expander.derivesOutputs() && i > 0));
                    }
                }
                produced = expanded;
            }
        }
        List<Node> nodes = produced.stream().map(Produced::node).toList();

        for (FunctionModifier modifier : modifiers) {
            if (modifier instanceof NodeDecorator decorator) {
                nodes = nodes.stream().map(decorator::decorateNode).toList();
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(
                    "Definition '" + fn.getName() + "' produced "
                            + nodes.stream().map(Node::getName).toList());
        }
        boolean variant = modifiers.stream().anyMatch(NodeResolver.class::isInstance);
        String logicalName = variant ? resolved.getName() : fn.getName();
        return Optional.of(new Contribution(logicalName, fn.getName(), variant, List.copyOf(nodes)));
    }

    private List<FunctionModifier> effectiveModifiers(DecoratedFunction function) {
        if (config.isStrictTags()) {
            return function.modifiers();
        }
        List<FunctionModifier> modifiers = new ArrayList<>(function.modifiers().size());
        for (FunctionModifier modifier : function.modifiers()) {
            modifiers.add(
                    modifier instanceof TagDecorator tags ? tags.retainAllowed() : modifier);
        }
        return modifiers;
    }

    private void handleConflict(Contribution previous, Contribution current) {
        if (!previous.variant() || !current.variant()) {
            throw new InvalidModifierException(
                    "Definitions '" + previous.source() + "' and '" + current.source()
                            + "' both produce '" + current.logicalName() + "'");
        }
        if (config.getVariantConflictPolicy() == VariantConflictPolicy.FAIL) {
            throw new InvalidModifierException(
                    "Variants '" + previous.source() + "' and '" + current.source()
                            + "' of '" + current.logicalName() + "' both match the configuration");
        }
        logger.warning(
                "Variant '" + current.source() + "' overrides '" + previous.source() + "' for '"
                        + current.logicalName() + "'");
    }

    private record Produced(Node node, boolean derived) {}

    private record Contribution(String logicalName, String source, boolean variant, List<Node> nodes) {}
}
