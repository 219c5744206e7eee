package io.kiln.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.kiln.core.node.Node;
import java.io.Serial;

/// Jackson `SimpleModule` registering the Kiln node serializer.
///
/// Only the write side is custom: a {@link Node} carries a callable that cannot
/// travel, so the read side targets the plain {@link NodeDescriptor} records,
/// which Jackson binds without extra configuration.
///
/// @see NodeSetSerializer for the convenience factory API
public class KilnJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2291874410533260817L;

    public KilnJacksonModule() {
        super("KilnJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
    }
}
