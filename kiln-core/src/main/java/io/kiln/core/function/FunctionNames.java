package io.kiln.core.function;

import java.util.Objects;

/// Name desugaring for configuration variants.
///
/// Several definitions may implement the same logical output by appending a
/// variant suffix introduced by {@value #VARIANT_MARKER}: `revenue__eu` and
/// `revenue__us` both sanitize to `revenue`.
public final class FunctionNames {

    public static final String VARIANT_MARKER = "__";

    private FunctionNames() {}

    /// Strips everything from the first variant marker onward.
    ///
    /// A marker at position zero is part of the name itself and is kept.
    /// Sanitizing an already sanitized name returns it unchanged.
    ///
    /// @param name raw definition name, not null
    /// @return logical node name, never null
    public static String sanitize(String name) {
        Objects.requireNonNull(name, "name must not be null");
        int index = name.indexOf(VARIANT_MARKER);
        return index > 0 ? name.substring(0, index) : name;
    }

    /// Returns whether the name carries a variant suffix.
    public static boolean hasVariant(String name) {
        return !sanitize(name).equals(name);
    }
}
