package io.kiln.core;

import io.kiln.core.assembly.NodeAssembler;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point wiring a {@link NodeAssembler} from a {@link KilnConfig}.
///
/// {@snippet :
/// NodeAssembler assembler = KilnFactory.createAssembler(
///         KilnConfig.builder().variantConflictPolicy(VariantConflictPolicy.LAST_WINS).build());
/// NodeSet nodes = assembler.assemble(functions, Map.of("region", "eu"));
/// }
public final class KilnFactory {

    private static final Logger logger = Logger.getLogger(KilnFactory.class.getName());

    private KilnFactory() {}

    public static NodeAssembler createAssembler() {
        return createAssembler(KilnConfig.defaults());
    }

    /// @param config assembly options, not null
    /// @return new assembler, never null
    public static NodeAssembler createAssembler(KilnConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        logger.fine(
                () -> "Creating assembler: variantConflictPolicy=" + config.getVariantConflictPolicy()
                        + ", strictTags=" + config.isStrictTags());
        return new NodeAssembler(config);
    }
}
