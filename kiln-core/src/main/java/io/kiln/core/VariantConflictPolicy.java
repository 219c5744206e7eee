package io.kiln.core;

/// What to do when more than one configuration variant of the same logical
/// name matches the configuration.
public enum VariantConflictPolicy {
    /// Reject the configuration with {@link io.kiln.core.modifier.InvalidModifierException}.
    FAIL,
    /// Keep the variant declared last and log a warning.
    LAST_WINS
}
