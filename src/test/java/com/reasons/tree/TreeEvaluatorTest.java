package com.reasons.tree;

import com.reasons.exception.EvaluationException;
import com.reasons.runtime.DefaultActionExecutor;
import com.reasons.runtime.DefaultExpressionEvaluator;
import com.reasons.runtime.RuntimeEnvironment;
import com.reasons.trace.ExecutionTrace;
import com.reasons.trace.PathExplainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.reasons.tree.TreeTestSupport.compileOne;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TreeEvaluator.
 */
class TreeEvaluatorTest {

    private TreeEvaluator evaluator;

    @BeforeEach
    void setUp() {
        DefaultExpressionEvaluator expressions = new DefaultExpressionEvaluator();
        evaluator = new TreeEvaluator(expressions, new DefaultActionExecutor(expressions));
    }

    private static RuntimeEnvironment env(String name, Object value) {
        return RuntimeEnvironment.builder().variable(name, value).build();
    }

    @Test
    @DisplayName("Should follow the branch selected by the condition")
    void shouldSelectBranch() {
        DecisionTree tree = compileOne("if x > 1 then win else lose end");

        assertEquals("win", evaluator.evaluate(tree, env("x", 5)));
        assertEquals("lose", evaluator.evaluate(tree, env("x", 0)));
        assertEquals(2, tree.getEvaluationCount());
    }

    @Test
    @DisplayName("Should return null when the selected branch is absent")
    void shouldReturnNullForMissingBranch() {
        DecisionTree tree = compileOne("if x then win end");

        assertNull(evaluator.evaluate(tree, env("x", false)));
        assertNull(evaluator.evaluate(tree, RuntimeEnvironment.builder().build()));
    }

    @Test
    @DisplayName("Should return the value of the last successful action")
    void shouldReturnActionValue() {
        DecisionTree tree = compileOne("if x then total = 5 >> total * 2 end");
        RuntimeEnvironment environment = env("x", true);

        assertEquals(10.0, evaluator.evaluate(tree, environment));
        assertEquals(5.0, environment.get("total"));
    }

    @Test
    @DisplayName("Should record failed actions without failing the evaluation")
    void shouldRecordFailedAction() {
        DecisionTree tree = compileOne("1 / 0");

        assertNull(evaluator.evaluate(tree, RuntimeEnvironment.builder().build()));
        NodeStatistics stats = tree.getRoot().statistics();
        assertEquals(1, stats.executionCount());
        assertEquals(0.2, stats.falseProbability(), 1e-9);
    }

    @Test
    @DisplayName("Should propagate condition errors and restore the environment")
    void shouldPropagateConditionErrors() {
        DecisionTree tree = compileOne("if x < 1 then win end");
        RuntimeEnvironment environment = env("x", "text");

        assertThrows(EvaluationException.class, () -> evaluator.evaluate(tree, environment));
        assertEquals(1, environment.scopeDepth());
    }

    @Test
    @DisplayName("Should fill in tree variables the environment does not define")
    void shouldUseTreeVariables() {
        DecisionTree tree = compileOne("rule r { limit = 10; if x > limit then win else lose end }");

        assertEquals("win", evaluator.evaluate(tree, env("x", 20)));

        RuntimeEnvironment overriding = RuntimeEnvironment.builder()
                .variable("x", 20)
                .variable("limit", 100)
                .build();
        assertEquals("lose", evaluator.evaluate(tree, overriding));
        assertFalse(env("x", 20).isDefined("limit"));
    }

    @Test
    @DisplayName("Should converge branch probabilities over repeated evaluations")
    void shouldConvergeStatistics() {
        DecisionTree tree = compileOne("if x then win else lose end");
        RuntimeEnvironment environment = env("x", true);

        for (int i = 0; i < 50; i++) {
            evaluator.evaluate(tree, environment);
        }

        NodeStatistics root = tree.getRoot().statistics();
        assertEquals(50, root.executionCount());
        assertTrue(root.trueProbability() > 0.99);
        assertEquals(0.0, root.falseProbability());
        assertEquals(50, tree.getRoot().getTrueBranch().statistics().executionCount());
        assertEquals(0, tree.getRoot().getFalseBranch().statistics().executionCount());
    }

    @Test
    @DisplayName("Should decay the false probability on each true visit after false visits")
    void shouldDecayFalseProbability() {
        DecisionTree tree = compileOne("if x then win else lose end");
        for (int i = 0; i < 3; i++) {
            evaluator.evaluate(tree, env("x", false));
        }
        NodeStatistics before = tree.getRoot().statistics();
        assertTrue(before.falseProbability() > 0.0);
        assertEquals(0.0, before.trueProbability());

        for (int i = 0; i < 5; i++) {
            evaluator.evaluate(tree, env("x", true));
            NodeStatistics after = tree.getRoot().statistics();
            assertTrue(after.falseProbability() < before.falseProbability());
            assertTrue(after.falseProbability() > 0.0);
            assertTrue(after.trueProbability() > before.trueProbability());
            before = after;
        }
        assertEquals(8, before.executionCount());
    }

    @Test
    @DisplayName("Should report to the trace and the explainer")
    void shouldReportEvents() {
        DecisionTree tree = compileOne("if x then if y then win else lose end end");
        ExecutionTrace trace = new ExecutionTrace();
        PathExplainer explainer = new PathExplainer();
        RuntimeEnvironment environment = RuntimeEnvironment.builder()
                .variable("x", true)
                .variable("y", false)
                .build();

        assertEquals("lose", evaluator.evaluate(tree, environment, explainer, trace));

        assertEquals("x:T -> y:F -> \"lose\"", trace.decisionPath());
        assertEquals("Outcome 'lose' because x was true, then y was false", explainer.explanation());
    }

    @Test
    @DisplayName("Should cache the first explanation on the outcome node")
    void shouldCacheExplanation() {
        DecisionTree tree = compileOne("if x then win end");
        TreeNode outcome = tree.getRoot().getTrueBranch();

        evaluator.evaluate(tree, env("x", true), new PathExplainer(), null);
        assertEquals("Outcome 'win' because x was true", outcome.getExplanation());

        PathExplainer second = new PathExplainer();
        second.reportConsequence(tree.getRoot(), false);
        evaluator.evaluate(tree, env("x", 1), second, null);
        assertEquals("Outcome 'win' because x was true", outcome.getExplanation());
    }

    @Test
    @DisplayName("Should require both collaborators")
    void shouldRequireCollaborators() {
        assertThrows(NullPointerException.class, () -> new TreeEvaluator(null, null));
    }
}
