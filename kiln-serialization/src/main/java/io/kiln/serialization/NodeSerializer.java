package io.kiln.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a {@link Node} as a JSON descriptor.
///
/// ```
/// {
///   "name": "col_1",
///   "type": "io.kiln.core.table.Series",
///   "documentation": "...",
///   "inputTypes": { "prices": { "type": "io.kiln.core.table.Table", "dependency": "REQUIRED" } },
///   "tags": { "module": "finance" }
/// }
/// ```
///
/// Types are written as binary class names. The callable is not written.
///
/// @implNote Package-private. Registered by {@link KilnJacksonModule}.
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = -7346081239112653904L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", node.getName());
        gen.writeStringField("type", node.getType().getName());
        gen.writeStringField("documentation", node.getDocumentation());

        gen.writeObjectFieldStart("inputTypes");
        for (Map.Entry<String, InputType> input : node.getInputTypes().entrySet()) {
            gen.writeObjectFieldStart(input.getKey());
            gen.writeStringField("type", input.getValue().type().getName());
            gen.writeStringField("dependency", input.getValue().dependencyType().name());
            gen.writeEndObject();
        }
        gen.writeEndObject();

        provider.defaultSerializeField("tags", node.getTags(), gen);
        gen.writeEndObject();
    }
}
