package io.kiln.core.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kiln.core.KilnConfig;
import io.kiln.core.KilnFactory;
import io.kiln.core.VariantConflictPolicy;
import io.kiln.core.expander.MissingOutputException;
import io.kiln.core.expander.OutputSpec;
import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.DecoratedFunction;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.Modifiers;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import io.kiln.core.node.NodeSet;
import io.kiln.core.table.Series;
import io.kiln.core.table.Table;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NodeAssemblerTest {

    private NodeAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = KilnFactory.createAssembler();
    }

    private static Table quotes() {
        Map<String, Series> columns = new LinkedHashMap<>();
        columns.put("bid", Series.of(10, 11));
        columns.put("venue", Series.of("x", "y"));
        return Table.of(columns);
    }

    private static FunctionDefinition tableFunction(String name) {
        return FunctionDefinition.builder()
                .name(name)
                .module("pricing.quotes")
                .documentation("Quotes per venue")
                .returnType(Table.class)
                .implementation(kwargs -> quotes())
                .build();
    }

    private static FunctionDefinition constant(String name, int value) {
        return FunctionDefinition.builder()
                .name(name)
                .documentation(name + " constant")
                .returnType(Integer.class)
                .implementation(kwargs -> value)
                .build();
    }

    private static Object evaluate(NodeSet nodes, String name, Map<String, Object> upstream) {
        return nodes.get(name).orElseThrow().getCallable().call(upstream);
    }

    @Nested
    class ColumnExtraction {

        @Test
        void shouldEmitResolvedTableAndFilledColumns() {
            // Given
            DecoratedFunction prices =
                    DecoratedFunction.of(
                            tableFunction("quotes__eu"),
                            Modifiers.configWhen("region", "eu"),
                            Modifiers.extractColumns("bid", OutputSpec.of("ask", "Best ask")).fillWith(0),
                            Modifiers.tag(Map.of("owner", "pricing")));

            // When
            NodeSet nodes = assembler.assemble(List.of(prices), Map.of("region", "eu"));

            // Then
            assertThat(nodes.names()).containsExactly("quotes", "bid", "ask");
            assertThat(nodes.nodes())
                    .allSatisfy(
                            node -> assertThat(node.getTags())
                                    .containsEntry("owner", "pricing")
                                    .containsEntry("module", "pricing.quotes"));
            assertThat(nodes.get("ask").orElseThrow().getInputTypes())
                    .containsExactly(Map.entry("quotes", InputType.required(Table.class)));

            Table table = (Table) evaluate(nodes, "quotes", Map.of());
            assertThat(evaluate(nodes, "bid", Map.of("quotes", table))).isEqualTo(Series.of(10, 11));
            assertThat(evaluate(nodes, "ask", Map.of("quotes", table))).isEqualTo(Series.of(0, 0));
            assertThat(table.column("ask")).hasValue(Series.of(0, 0));
        }

        @Test
        void shouldCombineFilledAndUnfilledExtractors() {
            // Given
            DecoratedFunction prices =
                    DecoratedFunction.of(
                            tableFunction("quotes"),
                            Modifiers.extractColumns("ask").fillWith(0),
                            Modifiers.extractColumns("mid"));

            // When
            NodeSet nodes = assembler.assemble(List.of(prices), Map.of());

            // Then
            assertThat(nodes.names()).containsExactlyInAnyOrder("quotes", "ask", "mid");
            assertThat(nodes.get("mid").orElseThrow().getInputTypes()).containsOnlyKeys("quotes");

            Table table = (Table) evaluate(nodes, "quotes", Map.of());
            assertThat(table.columnNames()).containsExactly("bid", "venue", "ask");
            assertThat(evaluate(nodes, "ask", Map.of("quotes", table))).isEqualTo(Series.of(0, 0));
            assertThatThrownBy(() -> evaluate(nodes, "mid", Map.of("quotes", table)))
                    .isInstanceOf(MissingOutputException.class)
                    .hasMessageContaining("mid");
        }

        @Test
        void shouldNameDefinitionExtractingSameColumnTwice() {
            DecoratedFunction prices =
                    DecoratedFunction.of(
                            tableFunction("quotes"), Modifiers.extractColumns("bid"), Modifiers.extractColumns("bid"));

            assertThatThrownBy(() -> assembler.assemble(List.of(prices), Map.of()))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("twice by 'quotes'");
        }

        @Test
        void shouldFailOnlyWhenMissingColumnIsEvaluated() {
            DecoratedFunction prices =
                    DecoratedFunction.of(tableFunction("quotes"), Modifiers.extractColumns("bid", "ask"));

            NodeSet nodes = assembler.assemble(List.of(prices), Map.of());

            assertThat(nodes.names()).containsExactly("quotes", "bid", "ask");
            assertThatThrownBy(() -> evaluate(nodes, "ask", Map.of("quotes", quotes())))
                    .isInstanceOf(MissingOutputException.class)
                    .hasMessageContaining("ask");
        }
    }

    @Nested
    class Variants {

        private List<DecoratedFunction> overlappingVariants() {
            return List.of(
                    DecoratedFunction.of(constant("rate__flat", 1), Modifiers.configWhen("plan", "basic")),
                    DecoratedFunction.of(
                            constant("rate__tiered", 2), Modifiers.configWhenIn("plan", List.of("basic", "pro"))));
        }

        @Test
        void shouldEmitMatchingVariantUnderLogicalName() {
            NodeSet nodes = assembler.assemble(overlappingVariants(), Map.of("plan", "pro"));

            assertThat(nodes.names()).containsExactly("rate");
            assertThat(evaluate(nodes, "rate", Map.of())).isEqualTo(2);
        }

        @Test
        void shouldEmitNothingWhenNoVariantMatches() {
            NodeSet nodes = assembler.assemble(overlappingVariants(), Map.of("plan", "enterprise"));

            assertThat(nodes.size()).isZero();
        }

        @Test
        void shouldRejectTwoMatchingVariantsByDefault() {
            assertThatThrownBy(() -> assembler.assemble(overlappingVariants(), Map.of("plan", "basic")))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("both match the configuration");
        }

        @Test
        void shouldKeepLastMatchingVariantWhenConfigured() {
            NodeAssembler lenient =
                    KilnFactory.createAssembler(
                            KilnConfig.builder().variantConflictPolicy(VariantConflictPolicy.LAST_WINS).build());

            NodeSet nodes = lenient.assemble(overlappingVariants(), Map.of("plan", "basic"));

            assertThat(nodes.names()).containsExactly("rate");
            assertThat(evaluate(nodes, "rate", Map.of())).isEqualTo(2);
        }

        @Test
        void shouldValidateEvenWhenConfigurationDoesNotMatch() {
            DecoratedFunction invalid =
                    DecoratedFunction.of(constant("invalid_function__", 1), Modifiers.configWhen("plan", "basic"));

            assertThatThrownBy(() -> assembler.assemble(List.of(invalid), Map.of("plan", "pro")))
                    .isInstanceOf(InvalidModifierException.class);
        }
    }

    @Test
    void shouldRejectDuplicateDefinitionsWithoutResolvers() {
        List<DecoratedFunction> functions =
                List.of(DecoratedFunction.of(constant("a", 1)), DecoratedFunction.of(constant("a", 2)));

        assertThatThrownBy(() -> assembler.assemble(functions, Map.of()))
                .isInstanceOf(InvalidModifierException.class)
                .hasMessageContaining("both produce 'a'");
    }

    @Test
    void shouldRejectNodeNameProducedTwice() {
        List<DecoratedFunction> functions =
                List.of(
                        DecoratedFunction.of(constant("bid", 1)),
                        DecoratedFunction.of(tableFunction("quotes"), Modifiers.extractColumns("bid")));

        assertThatThrownBy(() -> assembler.assemble(functions, Map.of()))
                .isInstanceOf(InvalidModifierException.class)
                .hasMessageContaining("produced more than once")
                .hasMessageContaining("by 'bid' and 'quotes'");
    }

    @Nested
    class Tags {

        private DecoratedFunction badlyTagged() {
            Map<String, Object> tags = new LinkedHashMap<>();
            tags.put("owner", "pricing");
            tags.put("kiln.internal", "yes");
            return DecoratedFunction.of(constant("a", 1), Modifiers.tag(tags));
        }

        @Test
        void shouldRejectInvalidTagsByDefault() {
            assertThatThrownBy(() -> assembler.assemble(List.of(badlyTagged()), Map.of()))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("kiln.internal");
        }

        @Test
        void shouldDropInvalidTagsWhenNotStrict() {
            NodeAssembler lenient = KilnFactory.createAssembler(KilnConfig.builder().strictTags(false).build());

            NodeSet nodes = lenient.assemble(List.of(badlyTagged()), Map.of());

            assertThat(nodes.get("a").orElseThrow().getTags()).containsExactly(Map.entry("owner", "pricing"));
        }
    }

    @Nested
    class Pipeline {

        private final FunctionDefinition sum =
                FunctionDefinition.builder()
                        .name("sum")
                        .varKeyword("values", Integer.class)
                        .returnType(Integer.class)
                        .implementation(
                                kwargs -> kwargs.values().stream().mapToInt(v -> (Integer) v).sum())
                        .build();

        private final FunctionDefinition total =
                FunctionDefinition.builder()
                        .name("total")
                        .parameter("a", Integer.class)
                        .parameter("b", Integer.class)
                        .returnType(Integer.class)
                        .emptyBody(true)
                        .build();

        @Test
        void shouldCreateThenExpandThenDecorate() {
            // Given
            DecoratedFunction function =
                    DecoratedFunction.of(
                            total,
                            Modifiers.tag(Map.of("stage", "final")),
                            Modifiers.parametrized(
                                    "b",
                                    Map.of(OutputSpec.of("total_plus_one", "a + 1"), 1,
                                            OutputSpec.of("total_plus_ten", "a + 10"), 10)),
                            Modifiers.does(sum));

            // When
            List<Node> nodes = assembler.resolveNodes(function, Map.of());

            // Then
            assertThat(nodes).extracting(Node::getName).containsExactlyInAnyOrder("total_plus_one", "total_plus_ten");
            assertThat(nodes).allSatisfy(node -> {
                assertThat(node.getTags()).containsEntry("stage", "final");
                assertThat(node.getInputTypes()).containsOnlyKeys("a");
            });
            Node plusTen = nodes.stream().filter(n -> n.getName().equals("total_plus_ten")).findFirst().orElseThrow();
            assertThat(plusTen.getCallable().call(Map.of("a", 5))).isEqualTo(15);
        }

        @Test
        void shouldRejectMoreThanOneCreator() {
            DecoratedFunction function =
                    DecoratedFunction.of(total, Modifiers.does(sum), Modifiers.does(sum));

            assertThatThrownBy(() -> assembler.resolveNodes(function, Map.of()))
                    .isInstanceOf(InvalidModifierException.class)
                    .hasMessageContaining("at most one");
        }

        @Test
        void shouldReturnNothingForUnmatchedDefinition() {
            DecoratedFunction function =
                    DecoratedFunction.of(total, Modifiers.does(sum), Modifiers.configWhen("mode", "on"));

            assertThat(assembler.resolveNodes(function, Map.of("mode", "off"))).isEmpty();
        }
    }
}
