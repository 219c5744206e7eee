package io.kiln.core.expander;

import java.util.Objects;

/// Name and documentation of one node produced by an expander.
///
/// @param name emitted node name, not blank
/// @param documentation node documentation, not null
public record OutputSpec(String name, String documentation) {

    public OutputSpec {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(documentation, "documentation must not be null");
    }

    public static OutputSpec of(String name, String documentation) {
        return new OutputSpec(name, documentation);
    }
}
