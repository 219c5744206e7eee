package io.kiln.core.creator;

import java.util.Map;

/// Instantiates a {@link Model} from its configuration parameters.
@FunctionalInterface
public interface ModelFactory {

    Model create(Map<String, Object> parameters);
}
