package com.memflow.memflow_backend.executor.branch;

import com.memflow.memflow_backend.engine.expression.Expression;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.model.config.ComparisonOperator;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig.ConditionBranch;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig.ConditionDetail;
import com.memflow.memflow_backend.model.config.LogicalOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class BranchCompilerTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final BranchCompiler compiler = new BranchCompiler(evaluator);

    private static ConditionDetail condition(String left, ComparisonOperator op, Object right) {
        return new ConditionDetail(left, op, right);
    }

    private static IfElseNodeConfig config(ConditionBranch... cases) {
        IfElseNodeConfig config = new IfElseNodeConfig();
        config.setCases(new ArrayList<>(List.of(cases)));
        return config;
    }

    private static ConditionBranch branch(LogicalOperator op, ConditionDetail... conditions) {
        return new ConditionBranch(op, new ArrayList<>(List.of(conditions)));
    }

    private Predicate<Expression> holdsWith(Map<String, Object> conv) {
        return expression -> evaluator.evaluateBool(expression, conv, Map.of(), Map.of());
    }

    @Nested
    @DisplayName("fallback")
    class Fallback {

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 5})
        @DisplayName("N cases compile to N + 1 branches ending in an unconditional else")
        void appendsFallback(int n) {
            ConditionBranch[] cases = new ConditionBranch[n];
            for (int i = 0; i < n; i++) {
                cases[i] = branch(LogicalOperator.AND, condition("conv.x", ComparisonOperator.EQ, (long) i));
            }

            List<CompiledBranch> branches = compiler.compile(config(cases));

            assertEquals(n + 1, branches.size());
            CompiledBranch last = branches.get(n);
            assertTrue(last.fallback());
            assertEquals("CASE" + (n + 1), last.label());
            assertTrue(evaluator.evaluateBool(last.condition(), Map.of(), Map.of(), Map.of()));
        }

        @Test
        @DisplayName("a matching single case routes to CASE1, otherwise to CASE2")
        void singleCaseRouting() {
            List<CompiledBranch> matching = compiler.compile(config(
                    branch(LogicalOperator.AND, condition("5", ComparisonOperator.GT, "3"))));
            assertEquals("CASE1", BranchCompiler.select(matching, holdsWith(Map.of())).label());

            List<CompiledBranch> failing = compiler.compile(config(
                    branch(LogicalOperator.AND, condition("1", ComparisonOperator.GT, "3"))));
            assertEquals("CASE2", BranchCompiler.select(failing, holdsWith(Map.of())).label());
        }
    }

    @Nested
    @DisplayName("conditions")
    class Conditions {

        @ParameterizedTest
        @CsvSource({
                "80, CASE1",
                "65, CASE2",
                "10, CASE3"
        })
        void firstMatchingCaseWins(long score, String expected) {
            List<CompiledBranch> branches = compiler.compile(config(
                    branch(LogicalOperator.AND, condition("{{conv.score}}", ComparisonOperator.GE, 80L)),
                    branch(LogicalOperator.AND, condition("{{conv.score}}", ComparisonOperator.GE, 60L))));

            assertEquals(expected, BranchCompiler.select(branches, holdsWith(Map.of("score", score))).label());
        }

        @Test
        void logicalOperatorCombinesConditions() {
            ConditionDetail isAdmin = condition("conv.role", ComparisonOperator.EQ, "'admin'");
            ConditionDetail isActive = condition("conv.active", ComparisonOperator.EQ, true);
            Map<String, Object> conv = Map.of("role", "admin", "active", false);

            List<CompiledBranch> and = compiler.compile(config(branch(LogicalOperator.AND, isAdmin, isActive)));
            List<CompiledBranch> or = compiler.compile(config(branch(LogicalOperator.OR, isAdmin, isActive)));

            assertEquals("CASE2", BranchCompiler.select(and, holdsWith(conv)).label());
            assertEquals("CASE1", BranchCompiler.select(or, holdsWith(conv)).label());
        }

        @Test
        void stringOperators() {
            Map<String, Object> conv = Map.of("text", "hello world", "list", List.of("a", "b"), "blank", "");

            assertEquals("CASE1", selectOne(condition("conv.text", ComparisonOperator.CONTAINS, "'world'"), conv));
            assertEquals("CASE1", selectOne(condition("conv.list", ComparisonOperator.NOT_CONTAINS, "'z'"), conv));
            assertEquals("CASE1", selectOne(condition("conv.text", ComparisonOperator.START_WITH, "'hello'"), conv));
            assertEquals("CASE2", selectOne(condition("conv.text", ComparisonOperator.END_WITH, "'hello'"), conv));
            assertEquals("CASE1", selectOne(condition("conv.blank", ComparisonOperator.EMPTY, null), conv));
            assertEquals("CASE1", selectOne(condition("conv.text", ComparisonOperator.NOT_EMPTY, null), conv));
        }

        @Test
        @DisplayName("a condition that fails to evaluate propagates instead of reading as false")
        void evaluationErrorsPropagate() {
            List<CompiledBranch> branches = compiler.compile(config(
                    branch(LogicalOperator.AND, condition("conv.name", ComparisonOperator.GT, 3L))));

            assertThrows(EvaluationException.class,
                    () -> BranchCompiler.select(branches, holdsWith(Map.of("name", "text"))));
        }

        private String selectOne(ConditionDetail detail, Map<String, Object> conv) {
            List<CompiledBranch> branches = compiler.compile(config(branch(LogicalOperator.AND, detail)));
            return BranchCompiler.select(branches, holdsWith(conv)).label();
        }
    }
}
