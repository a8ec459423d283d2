package com.memflow.memflow_backend.executor.branch;

import com.memflow.memflow_backend.engine.expression.Expression;
import com.memflow.memflow_backend.engine.expression.ExpressionEvaluator;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig;
import com.memflow.memflow_backend.model.config.IfElseNodeConfig.ConditionBranch;
import com.memflow.memflow_backend.model.config.LogicalOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Compiles if-else cases into an ordered branch list. The list always ends with an
 * unconditional fallback, so N declared cases give N + 1 branches and exactly one
 * of them is selected for any input.
 */
public class BranchCompiler {

    public static final String LABEL_PREFIX = "CASE";

    private final ConditionExpressionBuilder builder;

    public BranchCompiler(ExpressionEvaluator evaluator) {
        this.builder = new ConditionExpressionBuilder(evaluator);
    }

    public static String label(int index) {
        return LABEL_PREFIX + (index + 1);
    }

    public List<CompiledBranch> compile(IfElseNodeConfig config) {
        List<CompiledBranch> branches = new ArrayList<>();
        List<ConditionBranch> cases = config.getCases();
        for (int i = 0; i < cases.size(); i++) {
            branches.add(new CompiledBranch(label(i), compileCase(cases.get(i)), false));
        }
        branches.add(new CompiledBranch(label(cases.size()), Expression.Literal.TRUE, true));
        return branches;
    }

    private Expression compileCase(ConditionBranch branch) {
        List<Expression> conditions = branch.getConditions().stream()
                .map(builder::build)
                .toList();
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        boolean conjunction = branch.getLogicalOperator() != LogicalOperator.OR;
        return new Expression.Logical(conjunction, conditions);
    }

    /**
     * First branch, in declared order, whose condition holds. Exceptions thrown by
     * {@code holds} propagate; a failing condition is never read as false.
     */
    public static CompiledBranch select(List<CompiledBranch> branches, Predicate<Expression> holds) {
        for (CompiledBranch branch : branches) {
            if (branch.fallback() || holds.test(branch.condition())) {
                return branch;
            }
        }
        throw new IllegalStateException("Branch list has no fallback");
    }
}
