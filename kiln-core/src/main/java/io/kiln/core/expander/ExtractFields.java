package io.kiln.core.expander;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeExpander;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import io.kiln.core.node.NodeCallable;
import io.kiln.core.validation.FunctionValidators;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Exposes fields of a map-producing node as nodes of their own.
///
/// The map counterpart of {@link ExtractColumns}: emits the incoming node,
/// followed by one node per field typed with the declared field type. Missing
/// fields follow the same fill-or-fail rule at run time, and with a fill value
/// the map node's output is replaced by a copy carrying every missing field.
public final class ExtractFields implements NodeExpander {

    private final Map<String, Class<?>> fields;
    private final Object fillWith;

    private ExtractFields(Map<String, Class<?>> fields, Object fillWith) {
        this.fields = fields;
        this.fillWith = fillWith;
    }

    /// @param fields field name to concrete field type, not empty
    /// @return new extractor without a fill value, never null
    /// @throws InvalidModifierException if `fields` is null or empty, or holds a
    ///         non-string name or a value that is not a type
    public static ExtractFields of(Map<?, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new InvalidModifierException("extract_fields needs a non-empty field mapping");
        }
        Map<String, Class<?>> checked = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : fields.entrySet()) {
            if (!(entry.getKey() instanceof String name) || name.isBlank()) {
                throw new InvalidModifierException(
                        "extract_fields field names must be non-blank strings: " + entry.getKey());
            }
            if (!(entry.getValue() instanceof Class<?> type)) {
                throw new InvalidModifierException(
                        "extract_fields field '" + name + "' must map to a type, found "
                                + entry.getValue());
            }
            checked.put(name, type);
        }
        return new ExtractFields(Collections.unmodifiableMap(checked), null);
    }

    /// Returns a copy that synthesizes missing fields from `value`.
    ///
    /// @param value the fill value; null means no fill
    /// @return new extractor, never null
    public ExtractFields fillWith(Object value) {
        return new ExtractFields(fields, value);
    }

    public Optional<Object> getFillWith() {
        return Optional.ofNullable(fillWith);
    }

    public Map<String, Class<?>> getFields() {
        return fields;
    }

    @Override
    public void validate(FunctionDefinition fn) {
        FunctionValidators.ensureReturnType(fn, Map.class, "extract_fields");
    }

    @Override
    public List<Node> expandNode(Node node, Map<String, Object> config, FunctionDefinition fn) {
        List<Node> nodes = new ArrayList<>(fields.size() + 1);
        nodes.add(fillWith == null ? node : node.toBuilder().callable(backfilling(node)).build());
        String source = node.getName();
        for (Map.Entry<String, Class<?>> field : fields.entrySet()) {
            String name = field.getKey();
            nodes.add(
                    Node.builder()
                            .name(name)
                            .type(field.getValue())
                            .documentation(node.getDocumentation())
                            .input(source, InputType.required(node.getType()))
                            .tags(node.getTags())
                            .callable(kwargs -> extract(sourceMap(kwargs, source), name).value())
                            .build());
        }
        return nodes;
    }

    @Override
    public boolean derivesOutputs() {
        return true;
    }

    /// Returns the map with every missing requested field set to the fill value.
    ///
    /// @param source the upstream map, not null
    /// @return `source` itself if nothing is missing, an updated copy otherwise
    /// @throws MissingOutputException if a field is absent and there is no fill value
    public Map<String, Object> backfill(Map<String, Object> source) {
        Map<String, Object> current = source;
        for (String field : fields.keySet()) {
            current = extract(current, field).source();
        }
        return current;
    }

    /// Extracts one field, synthesizing it from the fill value when absent.
    ///
    /// The input map is never modified: a synthesized field is carried by an
    /// updated copy in {@link Extraction#source()}.
    ///
    /// @param source the upstream map, not null
    /// @param field the field to extract, not null
    /// @return the field value and the map as seen after extraction, never null
    /// @throws MissingOutputException if the field is absent and there is no fill value
    public Extraction<Object, Map<String, Object>> extract(Map<String, Object> source, String field) {
        if (source.containsKey(field)) {
            return new Extraction<>(source.get(field), source, false);
        }
        if (fillWith == null) {
            throw new MissingOutputException(
                    "No such field: " + field + " (available: " + source.keySet() + ")");
        }
        Map<String, Object> updated = new LinkedHashMap<>(source);
        updated.put(field, fillWith);
        return new Extraction<>(fillWith, Collections.unmodifiableMap(updated), true);
    }

    private NodeCallable backfilling(Node node) {
        NodeCallable callable = node.getCallable();
        return kwargs -> {
            Object output = callable.call(kwargs);
            return output instanceof Map<?, ?> map ? backfill(toFieldMap(map, node.getName())) : output;
        };
    }

    private static Map<String, Object> sourceMap(Map<String, Object> kwargs, String source) {
        Object value = kwargs.get(source);
        if (value instanceof Map<?, ?> map) {
            return toFieldMap(map, source);
        }
        throw new IllegalArgumentException(
                "Expected a Map for input '" + source + "', found "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private static Map<String, Object> toFieldMap(Map<?, ?> map, String source) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new IllegalArgumentException(
                        "Expected string keys in the output of '" + source + "', found "
                                + entry.getKey());
            }
            fields.put((String) entry.getKey(), entry.getValue());
        }
        return fields;
    }
}
