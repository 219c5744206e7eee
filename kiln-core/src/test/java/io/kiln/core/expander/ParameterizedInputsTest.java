package io.kiln.core.expander;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.Modifiers;
import io.kiln.core.node.Node;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParameterizedInputsTest {

    private static FunctionDefinition concat(String first, String doc) {
        return FunctionDefinition.builder()
                .name("identity")
                .documentation(doc)
                .parameter(first, String.class)
                .parameter("parameter2", String.class)
                .parameter("static", String.class)
                .returnType(String.class)
                .implementation(
                        kwargs -> "" + kwargs.get(first) + kwargs.get("parameter2") + kwargs.get("static"))
                .build();
    }

    @Nested
    class Validation {

        @Test
        void shouldRejectUnknownParameter() {
            ParameterizedInputs annotation =
                    Modifiers.parameterizedInputs(Map.of("test_1", Map.of("parameterfoo", "input_1")));

            assertThatThrownBy(() -> annotation.validate(concat("parameter1", "Function with {parameter1} as first input")))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("parameterfoo");
        }

        @Test
        void shouldRejectReservedParameter() {
            ParameterizedInputs annotation =
                    Modifiers.parameterizedInputs(Map.of("test_1", Map.of("parameter2", "input_1")));

            assertThatThrownBy(() -> annotation.validate(concat("output_name", "Function with {parameter2} as second input")))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("output_name");
        }

        @Test
        void shouldRejectReservedRemapTarget() {
            ParameterizedInputs annotation =
                    Modifiers.parameterizedInputs(Map.of("test_1", Map.of("parameter2", "output_name")));

            assertThatThrownBy(() -> annotation.validate(concat("parameter1", "No placeholders")))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("reserved");
        }

        @Test
        void shouldRejectUnsatisfiablePlaceholder() {
            ParameterizedInputs annotation =
                    Modifiers.parameterizedInputs(Map.of("test_1", Map.of("parameter2", "input_1")));

            assertThatThrownBy(() -> annotation.validate(concat("parameter1", "Function with {foo} as second input")))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("{foo}");
        }

        @Test
        void shouldAcceptOutputNamePlaceholder() {
            ParameterizedInputs annotation =
                    Modifiers.parameterizedInputs(Map.of("test_1", Map.of("parameter2", "input_1")));

            assertThatCode(() -> annotation.validate(concat("parameter1", "{output_name} reads {parameter2}")))
                    .doesNotThrowAnyException();
        }

        @Test
        void shouldRejectEmptyParameterization() {
            assertThatThrownBy(() -> Modifiers.parameterizedInputs(Map.of()))
                    .isInstanceOf(InvalidModifierException.class);
            assertThatThrownBy(() -> Modifiers.parameterizedInputs(Map.of("test_1", Map.of())))
                    .isInstanceOf(InvalidModifierException.class);
        }
    }

    @Test
    void shouldRewireAndDocumentEachOutput() {
        // Given
        FunctionDefinition fn = concat("parameter1", "Function with {parameter1} as first input");
        ParameterizedInputs annotation =
                Modifiers.parameterizedInputs(
                        Map.of(
                                "test_1", Map.of("parameter1", "input_1", "parameter2", "input_2"),
                                "test_2", Map.of("parameter1", "input_2", "parameter2", "input_1")));
        annotation.validate(fn);

        // When
        List<Node> nodes =
                annotation.expandNode(Node.fromFunction(fn), Map.of(), fn).stream()
                        .sorted(Comparator.comparing(Node::getName))
                        .toList();

        // Then
        assertThat(nodes).extracting(Node::getName).containsExactly("test_1", "test_2");
        assertThat(nodes.get(0).getInputTypes()).containsOnlyKeys("static", "input_1", "input_2");
        assertThat(nodes.get(0).getDocumentation()).isEqualTo("Function with input_1 as first input");
        assertThat(nodes.get(1).getInputTypes()).containsOnlyKeys("static", "input_1", "input_2");
        assertThat(nodes.get(1).getDocumentation()).isEqualTo("Function with input_2 as first input");

        Map<String, Object> kwargs = Map.of("input_1", "1", "input_2", "2", "static", "3");
        assertThat(nodes.get(0).getCallable().call(kwargs)).isEqualTo("123");
        assertThat(nodes.get(1).getCallable().call(kwargs)).isEqualTo("213");
    }

    @Test
    void shouldFillOutputNamePlaceholder() {
        FunctionDefinition fn = concat("parameter1", "{output_name} compares {parameter2}");

        List<Node> nodes =
                Modifiers.parameterizedInputs(Map.of("eu_vs_us", Map.of("parameter2", "sales_us")))
                        .expandNode(Node.fromFunction(fn), Map.of(), fn);

        assertThat(nodes.get(0).getDocumentation()).isEqualTo("eu_vs_us compares sales_us");
        assertThat(nodes.get(0).getInputTypes()).containsOnlyKeys("parameter1", "sales_us", "static");
    }
}
