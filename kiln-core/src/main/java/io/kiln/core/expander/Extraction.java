package io.kiln.core.expander;

/// Result of extracting one column or field from an upstream value.
///
/// When the value had to be synthesized from a fill value, `source` is an
/// updated copy of the upstream value that also carries it; otherwise it is
/// the upstream value itself. Sharing the updated copy with other consumers
/// is up to the execution engine.
///
/// @param value the extracted value, may be null
/// @param source the upstream value as seen after extraction, not null
/// @param filled whether the value was synthesized from the fill value
/// @param <V> extracted value type
/// @param <S> upstream structure type
public record Extraction<V, S>(V value, S source, boolean filled) {}
