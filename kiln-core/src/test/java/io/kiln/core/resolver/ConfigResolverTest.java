package io.kiln.core.resolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.Modifiers;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConfigResolverTest {

    private static FunctionDefinition configFunction(String name) {
        return FunctionDefinition.builder()
                .name(name)
                .returnType(Integer.class)
                .implementation(kwargs -> 1)
                .build();
    }

    @Nested
    class When {

        @Test
        void shouldKeepDefinitionWhenValueMatches() {
            Optional<FunctionDefinition> resolved =
                    Modifiers.configWhen("key", "value").resolve(configFunction("fn"), Map.of("key", "value"));

            assertThat(resolved).map(FunctionDefinition::getName).hasValue("fn");
        }

        @Test
        void shouldDropDefinitionWhenValueDiffers() {
            Optional<FunctionDefinition> resolved =
                    Modifiers.configWhen("key", "value").resolve(configFunction("fn"), Map.of("key", "wrong_value"));

            assertThat(resolved).isEmpty();
        }

        @Test
        void shouldRequireEveryKey() {
            ConfigResolver resolver = Modifiers.configWhen(Map.of("key", "value", "other", 2));

            assertThat(resolver.matches(Map.of("key", "value", "other", 2))).isTrue();
            assertThat(resolver.matches(Map.of("key", "value", "other", 3))).isFalse();
            assertThat(resolver.matches(Map.of("key", "value"))).isFalse();
        }
    }

    @Test
    void shouldMatchWhenNot() {
        ConfigResolver resolver = Modifiers.configWhenNot("key", "value");

        assertThat(resolver.resolve(configFunction("fn"), Map.of("key", "value"))).isEmpty();
        assertThat(resolver.resolve(configFunction("fn"), Map.of("key", "other"))).isPresent();
    }

    @Test
    void shouldMatchWhenIn() {
        ConfigResolver resolver = Modifiers.configWhenIn("key", List.of("valid_value", "another_valid_value"));

        assertThat(resolver.matches(Map.of("key", "valid_value"))).isTrue();
        assertThat(resolver.matches(Map.of("key", "another_valid_value"))).isTrue();
        assertThat(resolver.matches(Map.of("key", "invalid_value"))).isFalse();
    }

    @Test
    void shouldMatchWhenNotIn() {
        ConfigResolver resolver = Modifiers.configWhenNotIn("key", List.of("invalid_value", "another_invalid_value"));

        assertThat(resolver.matches(Map.of("key", "valid_value"))).isTrue();
        assertThat(resolver.matches(Map.of("key", "invalid_value"))).isFalse();
        assertThat(resolver.matches(Map.of("key", "another_invalid_value"))).isFalse();
    }

    @Test
    void shouldTreatNullConfigValueAsOrdinaryValue() {
        Map<String, Object> config = new HashMap<>();
        config.put("key", null);

        assertThat(Modifiers.configWhenIn("key", List.of("a", "b")).resolve(configFunction("fn"), config)).isEmpty();
        assertThat(Modifiers.configWhenNotIn("key", List.of("a", "b")).resolve(configFunction("fn"), config))
                .isPresent();
        assertThat(Modifiers.configWhen("key", "a").matches(config)).isFalse();
    }

    @Test
    void shouldAcceptNullCandidate() {
        Map<String, Object> config = new HashMap<>();
        config.put("key", null);

        ConfigResolver resolver = Modifiers.configWhenIn("key", Arrays.asList("a", null));

        assertThat(resolver.matches(config)).isTrue();
        assertThat(resolver.matches(Map.of("key", "b"))).isFalse();
    }

    @Test
    void shouldNeverMatchMissingKey() {
        Map<String, Object> config = Map.of("unrelated", "value");

        assertThat(Modifiers.configWhen("key", "value").matches(config)).isFalse();
        assertThat(Modifiers.configWhenNot("key", "value").matches(config)).isFalse();
        assertThat(Modifiers.configWhenNotIn("key", List.of("value")).matches(config)).isFalse();
    }

    @Test
    void shouldStripVariantSuffixFromName() {
        Optional<FunctionDefinition> resolved =
                Modifiers.configWhen("key", "value").resolve(configFunction("config_when_function__v2"), Map.of("key", "value"));

        assertThat(resolved).map(FunctionDefinition::getName).hasValue("config_when_function");
    }

    @Test
    void shouldUseNameOverride() {
        ConfigResolver resolver = Modifiers.configWhen("key", "value").named("new_function_name");

        Optional<FunctionDefinition> resolved = resolver.resolve(configFunction("fn__v2"), Map.of("key", "value"));

        assertThat(resolver.getNameOverride()).hasValue("new_function_name");
        assertThat(resolved).map(FunctionDefinition::getName).hasValue("new_function_name");
    }

    @Test
    void shouldRejectNameEndingWithMarker() {
        ConfigResolver resolver = Modifiers.configWhen("key", "value");

        assertThatThrownBy(() -> resolver.validate(configFunction("invalid_function__")))
                .isInstanceOf(InvalidModifierException.class);
        assertThatCode(() -> resolver.validate(configFunction("valid_function__v2"))).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectMalformedConditions() {
        assertThatThrownBy(() -> Modifiers.configWhen(Map.of())).isInstanceOf(InvalidModifierException.class);
        assertThatThrownBy(() -> new ConfigResolver(ConfigCondition.ONE_OF, Map.of("key", "value"), null))
                .isInstanceOf(InvalidModifierException.class)
                .hasMessageContaining("config.when_in expects a collection");
        assertThatThrownBy(() -> new ConfigResolver(ConfigCondition.NOT_ONE_OF, Map.of("key", "value"), null))
                .isInstanceOf(InvalidModifierException.class)
                .hasMessageContaining("config.when_not_in expects a collection");
        assertThatThrownBy(() -> Modifiers.configWhen("key", "value").named(" "))
                .isInstanceOf(InvalidModifierException.class)
                .hasMessageContaining("config.when name override");
        assertThatThrownBy(() -> new ConfigResolver(ConfigCondition.NOT_EQUALS, Map.of(), null))
                .isInstanceOf(InvalidModifierException.class)
                .hasMessageContaining("config.when_not needs");
    }
}
