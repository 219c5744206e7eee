package io.kiln.core;

import java.util.Objects;

/// Options of the node assembly pipeline.
///
/// ### Default Values
/// - `variantConflictPolicy`: `FAIL` (two matching variants abort assembly)
/// - `strictTags`: `true` (an invalid tag aborts the definition)
///
/// @implNote Immutable. Use {@link #builder()} to change defaults.
///
/// @see KilnFactory#createAssembler(KilnConfig)
public final class KilnConfig {

    private final VariantConflictPolicy variantConflictPolicy;
    private final boolean strictTags;

    private KilnConfig(Builder builder) {
        this.variantConflictPolicy = builder.variantConflictPolicy;
        this.strictTags = builder.strictTags;
    }

    /// Returns the default configuration.
    public static KilnConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public VariantConflictPolicy getVariantConflictPolicy() {
        return variantConflictPolicy;
    }

    /// Returns whether invalid tags raise instead of being dropped with a warning.
    public boolean isStrictTags() {
        return strictTags;
    }

    /// Fluent builder for {@link KilnConfig}.
    public static final class Builder {
        private VariantConflictPolicy variantConflictPolicy = VariantConflictPolicy.FAIL;
        private boolean strictTags = true;

        private Builder() {}

        /// @param variantConflictPolicy policy for multiple matching variants, not null
        /// @return this builder for chaining
        public Builder variantConflictPolicy(VariantConflictPolicy variantConflictPolicy) {
            this.variantConflictPolicy =
                    Objects.requireNonNull(variantConflictPolicy, "variantConflictPolicy must not be null");
            return this;
        }

        /// @param strictTags `true` to raise on invalid tags, `false` to drop them
        /// @return this builder for chaining
        public Builder strictTags(boolean strictTags) {
            this.strictTags = strictTags;
            return this;
        }

        public KilnConfig build() {
            return new KilnConfig(this);
        }
    }
}
