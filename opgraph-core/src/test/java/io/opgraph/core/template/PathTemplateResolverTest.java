package io.opgraph.core.template;

import static org.assertj.core.api.Assertions.assertThat;

import io.opgraph.core.state.VariableStore;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PathTemplateResolver")
class PathTemplateResolverTest {

    private final PathTemplateResolver resolver = new PathTemplateResolver();
    private VariableStore variables;

    @BeforeEach
    void setUp() {
        variables = new VariableStore();
        variables.set("a", Map.of("b", 5));
        variables.set("user", Map.of("name", "Ada", "tags", List.of("x", "y")));
    }

    @Test
    void shouldReplaceNestedPath() {
        assertThat(resolver.resolve("value={{a.b}}", variables)).isEqualTo("value=5");
    }

    @Test
    void shouldAcceptStatePrefixAndWhitespace() {
        assertThat(resolver.resolve("{{ state.user.name }}", variables)).isEqualTo("Ada");
    }

    @Test
    void shouldLeaveUnresolvedPlaceholderVerbatim() {
        assertThat(resolver.resolve("{{user.email}} and {{a.b}}", variables))
                .isEqualTo("{{user.email}} and 5");
    }

    @Test
    void shouldReturnTemplateWithoutPlaceholdersUnchanged() {
        assertThat(resolver.resolve("plain text", variables)).isEqualTo("plain text");
        assertThat(resolver.resolve(null, variables)).isNull();
    }

    @Test
    void shouldQuoteReplacementCharacters() {
        variables.set("price", "$5\\each");

        assertThat(resolver.resolve("cost: {{price}}", variables)).isEqualTo("cost: $5\\each");
    }

    @Test
    void shouldResolveNestedStructures() {
        Object resolved =
                resolver.resolveAll(
                        Map.of("greeting", "Hi {{user.name}}", "items", List.of("{{a.b}}", 7)), variables);

        assertThat(resolved).isEqualTo(Map.of("greeting", "Hi Ada", "items", List.of("5", 7)));
    }

    @Test
    void shouldUseAnyLookup() {
        VariableLookup lookup = path -> "who".equals(path) ? Optional.of("world") : Optional.empty();

        assertThat(resolver.resolve("hello {{who}}", lookup)).isEqualTo("hello world");
    }
}
