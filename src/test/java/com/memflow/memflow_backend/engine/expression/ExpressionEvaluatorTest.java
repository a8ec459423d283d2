package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.InvalidExpressionException;
import com.memflow.memflow_backend.exception.UndefinedVariableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private Object eval(String expression) {
        return evaluator.evaluate(expression,
                Map.of("score", 80L, "name", "Ada", "tags", List.of("a", "b")),
                Map.of("llm", Map.of("output", "yes")),
                Map.of("user_id", "u-1"));
    }

    @Nested
    @DisplayName("arithmetic and comparison")
    class Arithmetic {

        @Test
        void integerArithmeticStaysIntegral() {
            assertEquals(7L, eval("1 + 2 * 3"));
            assertEquals(2L, eval("7 // 3"));
            assertEquals(1L, eval("7 % 3"));
            assertEquals(1024L, eval("2 ** 10"));
        }

        @Test
        void trueDivisionIsFloating() {
            assertEquals(3.5, eval("7 / 2"));
        }

        @Test
        void divisionByZeroRaises() {
            assertThrows(EvaluationException.class, () -> eval("1 / 0"));
        }

        @Test
        void integerOverflowRaises() {
            assertThrows(EvaluationException.class, () -> eval("9223372036854775807 + 1"));
        }

        @Test
        @DisplayName("repetition counts large enough to overflow are rejected, not truncated")
        void hugeRepetitionRaises() {
            assertEquals("abab", eval("'ab' * 2"));
            assertThrows(EvaluationException.class, () -> eval("'ab' * 4611686018427387904"));
            assertThrows(EvaluationException.class, () -> eval("tags * 4611686018427387904"));
        }

        @Test
        void chainedComparison() {
            assertEquals(true, eval("0 < score <= 100"));
            assertEquals(false, eval("score > 90"));
        }

        @Test
        void membershipAndLogic() {
            assertEquals(true, eval("'a' in tags and not ('z' in tags)"));
            assertEquals(true, eval("'d' in name or score == 80"));
        }

        @Test
        void conditionalExpression() {
            assertEquals("pass", eval("'pass' if score >= 60 else 'fail'"));
        }

        @Test
        void mixingStringAndNumberRaises() {
            assertThrows(EvaluationException.class, () -> eval("name + 1"));
        }
    }

    @Nested
    @DisplayName("names")
    class Names {

        @Test
        void namespacesResolve() {
            assertEquals(80L, eval("var.score"));
            assertEquals("yes", eval("node.llm.output"));
            assertEquals("yes", eval("nodes['llm']['output']"));
            assertEquals("u-1", eval("sys.user_id"));
        }

        @Test
        @DisplayName("node outputs and conversation variables are visible unqualified")
        void unqualifiedNames() {
            assertEquals(80L, eval("score"));
            assertEquals("yes", eval("llm.output"));
        }

        @Test
        void delimitersAreStripped() {
            assertEquals(true, evaluator.evaluateBool("{{ score }} > {{ 10 }}", Map.of("score", 80L), Map.of(), Map.of()));
        }

        @Test
        void undefinedNameRaises() {
            assertThrows(UndefinedVariableException.class, () -> eval("missing + 1"));
        }
    }

    @Nested
    @DisplayName("sandboxing")
    class Sandboxing {

        @ParameterizedTest
        @ValueSource(strings = {
                "os.system('x')",
                "__import__('os')",
                "import os",
                "lambda: 1",
                "name.upper()",
                "[x for x in tags]",
                "score = 1",
                "llm.__class__",
                "name | __class__",
                "tags | join(os.system('x'))"
        })
        @DisplayName("calls, imports and private access never evaluate")
        void rejectsUnsafeConstructs(String expression) {
            assertThrows(EvaluationException.class, () -> eval(expression));
        }

        @Test
        void parseErrorsAreInvalidExpressions() {
            assertThrows(InvalidExpressionException.class, () -> evaluator.parse("1 +"));
            assertThrows(InvalidExpressionException.class, () -> evaluator.parse("   "));
        }
    }

    @Test
    @DisplayName("variable names: reserved words and non-identifiers are reported")
    void validatesVariableNames() {
        List<String> errors = ExpressionEvaluator.validateVariableNames(List.of("ok_name", "var", "1abc", ""));

        assertEquals(3, errors.size());
        assertTrue(errors.get(0).contains("reserved"));
        assertTrue(ExpressionEvaluator.validateVariableNames(List.of("score", "user_name")).isEmpty());
    }
}
