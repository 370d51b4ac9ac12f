package com.reasons.tree;

import com.reasons.ast.AstNode;
import com.reasons.ast.AstNodeType;
import com.reasons.ast.AstValidator;
import com.reasons.runtime.ActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers parsed programs into decision trees.
 * <p>
 * Each rule becomes a tree named after the rule; statements outside rules
 * form the tree {@value #MAIN_TREE}. Statements are lowered in order: a
 * decision without {@code else} continues with the following statements when
 * its condition is false, any other statement ends the walk. Leading
 * assignments of literal values become tree variables. Shorthand consequences
 * become outcomes holding their keyword, literal consequences outcomes holding
 * the literal.
 * <p>
 * Expressions are copied into the tree, so the program can be reused.
 */
public class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    public static final String MAIN_TREE = "main";

    public static final double DEFAULT_WEIGHT = 1.0;

    private final double conditionWeight;

    public TreeBuilder() {
        this(DEFAULT_WEIGHT);
    }

    public TreeBuilder(double conditionWeight) {
        this.conditionWeight = conditionWeight;
    }

    /**
     * Lower every rule of a program, plus the top-level statements if any.
     *
     * @throws IllegalArgumentException if the node is not a valid program
     */
    public List<DecisionTree> build(AstNode program) {
        if (program == null || !program.is(AstNodeType.PROGRAM)) {
            throw new IllegalArgumentException("Expected a PROGRAM node");
        }
        AstValidator.Result validation = AstValidator.validate(program);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid syntax tree: " + validation.message());
        }

        List<DecisionTree> trees = new ArrayList<>();
        List<AstNode> topLevel = new ArrayList<>();
        for (AstNode declaration : program.children()) {
            if (declaration.is(AstNodeType.RULE)) {
                trees.add(buildRule(declaration));
            } else {
                topLevel.add(declaration);
            }
        }
        if (!topLevel.isEmpty()) {
            trees.add(buildTree(MAIN_TREE, topLevel));
        }
        return trees;
    }

    public DecisionTree buildRule(AstNode rule) {
        if (rule == null || !rule.is(AstNodeType.RULE)) {
            throw new IllegalArgumentException("Expected a RULE node");
        }
        return buildTree(rule.text(), rule.operand().children());
    }

    /**
     * Lower a statement list into a tree with the given name.
     */
    public DecisionTree buildTree(String name, List<AstNode> statements) {
        DecisionTree tree = new DecisionTree(name);

        int first = 0;
        while (first < statements.size() && isVariableDeclaration(statements.get(first))) {
            AstNode declaration = statements.get(first);
            tree.addVariable(declaration.text(), declaration.operand().literal());
            first++;
        }

        tree.setRoot(sequence(statements, first));

        List<TreeNode> nodes = tree.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            nodes.get(i).setId(name + "#" + i);
        }
        log.debug("Built tree '{}' with {} node(s) and {} variable(s)",
                name, nodes.size(), tree.getVariables().size());
        return tree;
    }

    private static boolean isVariableDeclaration(AstNode statement) {
        return statement.is(AstNodeType.ASSIGNMENT)
                && statement.operand() != null
                && statement.operand().is(AstNodeType.LITERAL);
    }

    private TreeNode sequence(List<AstNode> statements, int index) {
        if (index >= statements.size()) {
            return null;
        }
        AstNode statement = statements.get(index);
        if (statement.is(AstNodeType.DECISION)) {
            return decision(statement, () -> sequence(statements, index + 1));
        }
        if (index + 1 < statements.size()) {
            log.debug("Statements after '{}' (line {}) are unreachable", statement, statement.line());
        }
        return consequence(statement);
    }

    private TreeNode decision(AstNode decision, Continuation otherwise) {
        TreeNode node = TreeNode.createCondition(copyOf(decision.condition()), conditionWeight)
                .orElseThrow(() -> malformed(decision, "decision without a condition"));
        node.setDescription(decision.toString());
        node.setTrueBranch(consequence(decision.trueBranch()));
        node.setFalseBranch(decision.falseBranch() != null
                ? consequence(decision.falseBranch())
                : otherwise.lower());
        return node;
    }

    private TreeNode consequence(AstNode node) {
        if (node == null) {
            return null;
        }
        return switch (node.type()) {
            case DECISION -> decision(node, () -> null);
            case LITERAL -> TreeNode.createOutcome(node.literal());
            case CONSEQUENCE -> node.consequenceType().isShorthand()
                    ? TreeNode.createOutcome(node.consequenceType().keyword())
                    : action(List.of(node.copy()), ActionType.ANY, node);
            case RETURN -> {
                AstNode value = node.operand();
                if (value == null) {
                    yield TreeNode.createOutcome(null);
                }
                if (value.is(AstNodeType.LITERAL)) {
                    yield TreeNode.createOutcome(value.literal());
                }
                yield action(List.of(value.copy()), ActionType.CALCULATE, node);
            }
            case CHAIN -> {
                List<AstNode> actions = new ArrayList<>();
                ActionType common = null;
                for (AstNode item : node.children()) {
                    actions.add(item.copy());
                    ActionType itemType = actionType(item);
                    common = common == null || common == itemType ? itemType : ActionType.ANY;
                }
                yield action(actions, common, node);
            }
            default -> action(List.of(node.copy()), actionType(node), node);
        };
    }

    private TreeNode action(List<AstNode> actions, ActionType type, AstNode source) {
        TreeNode node = TreeNode.createAction(actions, type)
                .orElseThrow(() -> malformed(source, "action without actions"));
        node.setDescription(source.toString());
        return node;
    }

    private static ActionType actionType(AstNode action) {
        return switch (action.type()) {
            case ASSIGNMENT -> ActionType.UPDATE;
            case FUNCTION_CALL -> switch (action.text()) {
                case "notify" -> ActionType.NOTIFY;
                case "log" -> ActionType.LOG;
                default -> ActionType.CALCULATE;
            };
            case CONSEQUENCE -> ActionType.ANY;
            default -> ActionType.CALCULATE;
        };
    }

    private static AstNode copyOf(AstNode node) {
        return node == null ? null : node.copy();
    }

    private static IllegalArgumentException malformed(AstNode node, String problem) {
        return new IllegalArgumentException("Cannot lower " + problem + " at line " + node.line()
                + ", column " + node.column());
    }

    @FunctionalInterface
    private interface Continuation {
        TreeNode lower();
    }
}
