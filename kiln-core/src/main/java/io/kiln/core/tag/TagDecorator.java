package io.kiln.core.tag;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeDecorator;
import io.kiln.core.node.Node;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Attaches key/value metadata to every node a definition emits.
///
/// ### Key Grammar
/// One or more dot-separated segments of letters, digits and underscores, each
/// not starting with a digit. The first segment must not be the reserved
/// {@value #RESERVED_NAMESPACE} namespace.
///
/// ### Value Grammar
/// A non-empty scalar: null, `false`, empty strings, and any collection,
/// array or map are rejected, whatever their contents.
///
/// The grammar checks are exposed as predicates ({@link #isKeyAllowed},
/// {@link #isValueAllowed}); {@link #validate} escalates them to an exception
/// and {@link #retainAllowed} drops offending entries instead.
public final class TagDecorator implements NodeDecorator {

    /// Namespace reserved for tags written by the framework itself.
    public static final String RESERVED_NAMESPACE = "kiln";

    private static final Logger logger = Logger.getLogger(TagDecorator.class.getName());
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, Object> tags;

    /// @param tags tags to attach, not null; checked by {@link #validate}
    public TagDecorator(Map<String, ?> tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public Map<String, Object> getTags() {
        return tags;
    }

    /// Returns whether a tag key follows the key grammar.
    ///
    /// @param key candidate key, may be null
    /// @return true if every segment is an identifier and the first is not reserved
    public static boolean isKeyAllowed(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        String[] segments = key.split("\\.", -1);
        if (segments[0].equals(RESERVED_NAMESPACE)) {
            return false;
        }
        for (String segment : segments) {
            if (!SEGMENT.matcher(segment).matches()) {
                return false;
            }
        }
        return true;
    }

    /// Returns whether a tag value follows the value grammar.
    ///
    /// @param value candidate value, may be null
    /// @return true for non-empty scalars other than `false`
    public static boolean isValueAllowed(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof Collection<?> || value instanceof Map<?, ?> || value.getClass().isArray()) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        return value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof Enum<?>;
    }

    @Override
    public void validate(FunctionDefinition fn) {
        for (Map.Entry<String, Object> entry : tags.entrySet()) {
            if (!isKeyAllowed(entry.getKey())) {
                throw new InvalidModifierException(
                        "tag: key '" + entry.getKey() + "' on '" + fn.getName() + "' is not allowed");
            }
            if (!isValueAllowed(entry.getValue())) {
                throw new InvalidModifierException(
                        "tag: value " + entry.getValue() + " for key '" + entry.getKey() + "' on '"
                                + fn.getName() + "' is not allowed");
            }
        }
    }

    /// Returns a decorator holding only the entries that pass both predicates.
    ///
    /// Dropped entries are logged at WARNING level.
    ///
    /// @return this instance if nothing was dropped, a filtered copy otherwise
    public TagDecorator retainAllowed() {
        Map<String, Object> allowed = new LinkedHashMap<>();
        tags.forEach(
                (key, value) -> {
                    if (isKeyAllowed(key) && isValueAllowed(value)) {
                        allowed.put(key, value);
                    } else {
                        logger.warning("Dropping invalid tag " + key + "=" + value);
                    }
                });
        return allowed.size() == tags.size() ? this : new TagDecorator(allowed);
    }

    @Override
    public Node decorateNode(Node node) {
        Map<String, Object> merged = new LinkedHashMap<>(node.getTags());
        merged.putAll(tags);
        return node.toBuilder().tags(merged).build();
    }
}
