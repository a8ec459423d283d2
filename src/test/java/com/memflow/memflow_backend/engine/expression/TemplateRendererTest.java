package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.InvalidExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    @DisplayName("renders conversation variables through var.*")
    void rendersVariables() {
        assertEquals("Hello World!", renderer.render("Hello {{var.name}}!", Map.of("name", "World"), null, null, false));
    }

    @Test
    @DisplayName("strict mode raises on an undefined variable")
    void strictRaisesOnMissing() {
        assertThrows(EvaluationException.class,
                () -> renderer.render("Hello {{var.name}}!", Map.of(), null, null, true));
    }

    @Test
    @DisplayName("lenient mode renders an undefined variable as empty text")
    void lenientRendersEmpty() {
        assertEquals("Hello !", renderer.render("Hello {{var.name}}!", Map.of(), null, null, false));
        assertEquals("[]", "[" + renderer.render("{{ghost.output.text}}", Map.of(), null, null, false) + "]");
    }

    @Test
    void rendersNodeOutputsAndSystemVariables() {
        String out = renderer.render("{{ llm.output }} for {{sys.user_id}}",
                Map.of(), Map.of("llm", Map.of("output", "Answer")), Map.of("user_id", "u-1"), true);

        assertEquals("Answer for u-1", out);
    }

    @Test
    @DisplayName("non-string values are rendered as text or JSON")
    void stringifiesValues() {
        Map<String, Object> conv = Map.of("n", 3L, "f", 2.0d, "flag", true, "list", List.of(1, 2));

        assertEquals("3 2 true [1,2]", renderer.render("{{n}} {{f}} {{flag}} {{list}}", conv, null, null, true));
    }

    @Test
    void nestedConvAndSysMapsAreUnpacked() {
        Map<String, Object> variables = Map.of("conv", Map.of("topic", "billing"), "sys", Map.of("message", "hi"));

        assertEquals("billing/hi", renderer.render("{{conv.topic}}/{{sys.message}}", variables, null, null, true));
    }

    @Test
    void emptyTemplateRendersEmpty() {
        assertEquals("", renderer.render("", Map.of(), null, null, true));
        assertEquals("", renderer.render(null, Map.of(), null, null, true));
    }

    @Test
    @DisplayName("unclosed blocks, unknown statements and filters, unclosed and empty placeholders are syntax errors")
    void rejectsBadSyntax() {
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{% if x %}y"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{% endfor %}"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{% set x = 1 %}"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{% for in items %}{% endfor %}"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{% for sys in items %}{% endfor %}"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{{ name | system }}"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{# note"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("Hello {{ name"));
        assertThrows(InvalidExpressionException.class, () -> renderer.parse("{{ }}"));
        assertFalse(renderer.validate("{{ a( }}").isEmpty());
        assertTrue(renderer.validate("plain {{a}} text").isEmpty());
    }

    @Test
    void parseKeepsTextAndPlaceholdersInOrder() {
        List<TemplatePart> parts = renderer.parse("a{{x}}b");

        assertEquals(3, parts.size());
        assertInstanceOf(TemplatePart.Text.class, parts.get(0));
        assertInstanceOf(TemplatePart.Placeholder.class, parts.get(1));
        assertEquals("x", ((TemplatePart.Placeholder) parts.get(1)).source());
    }

    @Nested
    @DisplayName("blocks")
    class Blocks {

        private final Map<String, Object> conv = Map.of(
                "tier", "gold",
                "items", List.of("tea", "cake"),
                "prices", Map.of("tea", 2L, "cake", 4L));

        @Test
        void ifElifElse() {
            String template = "{% if tier == 'silver' %}S{% elif tier == 'gold' %}G{% else %}-{% endif %}";

            assertEquals("G", renderer.render(template, conv, null, null, true));
            assertEquals("-", renderer.render(template, Map.of("tier", "none"), null, null, true));
        }

        @Test
        @DisplayName("for loops expose loop.* and fall back to their else part when empty")
        void forLoop() {
            String template = "{% for item in items %}{{ item }}{% if not loop.last %}, {% endif %}{% endfor %}";

            assertEquals("tea, cake", renderer.render(template, conv, null, null, true));
            assertEquals("none", renderer.render("{% for x in [] %}{{x}}{% else %}none{% endfor %}",
                    conv, null, null, true));
        }

        @Test
        @DisplayName("two loop variables unpack the pairs produced by dictsort")
        void forLoopOverPairs() {
            String template = "{% for name, price in prices | dictsort %}{{ name }}={{ price }};{% endfor %}";

            assertEquals("cake=4;tea=2;", renderer.render(template, conv, null, null, true));
        }

        @Test
        @DisplayName("loop variables do not leak out of the loop")
        void loopVariableIsScoped() {
            assertThrows(EvaluationException.class,
                    () -> renderer.render("{% for item in items %}{% endfor %}{{ item }}", conv, null, null, true));
        }

        @Test
        @DisplayName("comments are dropped and '-' strips whitespace next to a tag")
        void commentsAndWhitespaceControl() {
            String template = "{# header #}Items:\n  {%- for item in items %} {{ item }}{% endfor -%}\n  .";

            assertEquals("Items: tea cake.", renderer.render(template, conv, null, null, true));
        }
    }

    @Nested
    @DisplayName("filters")
    class FiltersInTemplates {

        @Test
        void stringFilters() {
            Map<String, Object> conv = Map.of("name", "  ada lovelace ");

            assertEquals("ADA LOVELACE", renderer.render("{{ name | trim | upper }}", conv, null, null, true));
            assertEquals("Ada Lovelace", renderer.render("{{ name | trim | title }}", conv, null, null, true));
            assertEquals("ada-lovelace", renderer.render("{{ name | trim | replace(' ', '-') }}", conv, null, null, true));
        }

        @Test
        void sequenceFilters() {
            Map<String, Object> conv = Map.of("scores", List.of(3L, 1L, 2L));

            assertEquals("1, 2, 3", renderer.render("{{ scores | sort | join(', ') }}", conv, null, null, true));
            assertEquals("3 6 3", renderer.render("{{ scores | length }} {{ scores | sum }} {{ scores | first }}",
                    conv, null, null, true));
            assertEquals("[\"a\",1]", renderer.render("{{ ['a', 1] | tojson }}", conv, null, null, true));
        }

        @Test
        @DisplayName("default replaces undefined names, even in strict mode")
        void defaultFilter() {
            assertEquals("guest", renderer.render("{{ user | default('guest') }}", Map.of(), null, null, true));
            assertEquals("guest", renderer.render("{{ user | d('guest', true) }}", Map.of("user", ""), null, null, true));
            assertEquals("", renderer.render("{{ user | default }}", Map.of("user", ""), null, null, true));
        }

        @Test
        void numberFilters() {
            Map<String, Object> conv = Map.of("ratio", 2.346d, "raw", "42");

            assertEquals("2.35 43 2", renderer.render("{{ ratio | round(2) }} {{ raw | int + 1 }} {{ ratio | int }}",
                    conv, null, null, true));
        }
    }
}
