package com.reasons.engine;

import com.reasons.config.ConfigLoader;
import com.reasons.config.ReasonsConfig;
import com.reasons.parser.Diagnostic;
import com.reasons.parser.ParseResult;
import com.reasons.parser.SourceParser;
import com.reasons.runtime.ActionType;
import com.reasons.runtime.ConsequenceHandler;
import com.reasons.runtime.DefaultActionExecutor;
import com.reasons.runtime.DefaultExpressionEvaluator;
import com.reasons.runtime.ExpressionEvaluator;
import com.reasons.runtime.RuntimeEnvironment;
import com.reasons.trace.ExecutionTrace;
import com.reasons.trace.PathExplainer;
import com.reasons.tree.DecisionTree;
import com.reasons.tree.TreeBuilder;
import com.reasons.tree.TreeEvaluator;
import com.reasons.tree.TreeOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rule engine backed by the tree-walking evaluator.
 */
public class DefaultRuleEngine implements RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultRuleEngine.class);

    private final ReasonsConfig config;
    private final ExpressionEvaluator expressionEvaluator;
    private final DefaultActionExecutor actionExecutor;
    private final TreeEvaluator treeEvaluator;
    private final TreeBuilder treeBuilder;
    private final Map<String, DecisionTree> trees = new ConcurrentHashMap<>();

    public DefaultRuleEngine(ReasonsConfig config) {
        this.config = config;
        this.expressionEvaluator = new DefaultExpressionEvaluator();
        this.actionExecutor = new DefaultActionExecutor(expressionEvaluator);
        this.treeEvaluator = new TreeEvaluator(expressionEvaluator, actionExecutor);
        this.treeBuilder = new TreeBuilder(config.defaultWeight());
        log.info("Initialized rule engine '{}' (golf mode: {}, optimize: {})",
                config.name(), config.lexer().golfMode(), config.optimize());
        if (config.rulesPath() != null) {
            reload();
        }
    }

    @Override
    public CompilationResult load(String source) {
        ParseResult parsed = SourceParser.parse(source, config.lexer());
        log.debug("Lexed {} token(s) from {} byte(s)",
                parsed.statistics().tokensProduced(), parsed.statistics().totalBytes());

        if (!parsed.succeeded()) {
            for (Diagnostic diagnostic : parsed.diagnostics()) {
                log.warn("Rule source error {}", diagnostic);
            }
            return new CompilationResult(List.of(), parsed.diagnostics(), parsed.statistics());
        }

        List<String> names = new ArrayList<>();
        for (DecisionTree tree : treeBuilder.build(parsed.root())) {
            if (config.optimize()) {
                TreeOptimizer.optimize(tree);
            }
            trees.put(tree.getName(), tree);
            names.add(tree.getName());
        }
        log.info("Loaded {} decision tree(s): {}", names.size(), names);
        return new CompilationResult(names, List.of(), parsed.statistics());
    }

    @Override
    public void reload() {
        if (config.rulesPath() == null) {
            log.debug("No rules path configured, nothing to reload");
            return;
        }
        CompilationResult result = load(ConfigLoader.loadSource(config.rulesPath()));
        if (!result.succeeded()) {
            log.warn("Rules at {} have {} error(s); keeping previously loaded trees",
                    config.rulesPath(), result.diagnostics().size());
        }
    }

    @Override
    public EvaluationResult evaluate(String treeName, RuntimeEnvironment environment) {
        DecisionTree tree = tree(treeName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown decision tree: " + treeName));

        ExecutionTrace trace = config.tracing() ? new ExecutionTrace(config.maxTraceEntries()) : null;
        PathExplainer explainer = config.explanations() ? new PathExplainer() : null;

        Object value = treeEvaluator.evaluate(tree, environment, explainer, trace);
        String explanation = explainer != null ? explainer.explanation() : null;
        return DefaultEvaluationResult.of(treeName, value, explanation, trace);
    }

    @Override
    public ParseResult parseExpression(String expression) {
        return SourceParser.parseExpression(expression, config.lexer());
    }

    @Override
    public Object evaluateExpression(String expression, RuntimeEnvironment environment) {
        ParseResult parsed = parseExpression(expression);
        if (!parsed.succeeded()) {
            throw new IllegalArgumentException("Invalid expression '" + expression + "': "
                    + parsed.diagnostics().get(0));
        }
        return expressionEvaluator.evaluate(environment, parsed.root());
    }

    @Override
    public Optional<DecisionTree> tree(String name) {
        return Optional.ofNullable(trees.get(name));
    }

    @Override
    public Set<String> treeNames() {
        return new TreeSet<>(trees.keySet());
    }

    @Override
    public void registerHandler(ActionType type, ConsequenceHandler handler) {
        actionExecutor.registerHandler(type, handler);
    }
}
