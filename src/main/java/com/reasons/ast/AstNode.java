package com.reasons.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A node of the abstract syntax tree.
 * <p>
 * A node owns its children; the parent link is a back-reference only. Kinds with
 * fixed operands (decisions, operators, assignments) keep them in positional
 * slots, where an absent operand is a null slot. Kinds with ordered children
 * (program, block, chain, call) grow through {@link #addChild(AstNode)}.
 */
public final class AstNode {

    private final AstNodeType type;
    private final List<AstNode> children = new ArrayList<>();
    private AstNode parent;

    private String text;
    private Object literal;
    private Operator operator;
    private ConsequenceType consequenceType;
    private ChainType chainType;

    private int line;
    private int column;

    private AstNode(AstNodeType type) {
        this.type = type;
    }

    // ---- constructors ----

    public static AstNode program() {
        return new AstNode(AstNodeType.PROGRAM);
    }

    public static AstNode rule(String name, AstNode body) {
        AstNode node = new AstNode(AstNodeType.RULE);
        node.text = Objects.requireNonNull(name, "name");
        node.slot(body);
        return node;
    }

    public static AstNode block() {
        return new AstNode(AstNodeType.BLOCK);
    }

    public static AstNode decision(AstNode condition, AstNode trueBranch, AstNode falseBranch) {
        AstNode node = new AstNode(AstNodeType.DECISION);
        node.slot(condition);
        node.slot(trueBranch);
        node.slot(falseBranch);
        return node;
    }

    public static AstNode consequence(ConsequenceType consequenceType, String action) {
        AstNode node = new AstNode(AstNodeType.CONSEQUENCE);
        node.consequenceType = Objects.requireNonNull(consequenceType, "consequenceType");
        node.text = action != null ? action : consequenceType.keyword();
        return node;
    }

    public static AstNode logic(Operator operator, AstNode left, AstNode right) {
        requireCategory(operator, Operator.Category.LOGIC);
        AstNode node = new AstNode(AstNodeType.LOGIC_OP);
        node.operator = operator;
        node.slot(left);
        if (!operator.isUnary()) {
            node.slot(right);
        }
        return node;
    }

    public static AstNode not(AstNode operand) {
        return logic(Operator.NOT, operand, null);
    }

    public static AstNode comparison(Operator operator, AstNode left, AstNode right) {
        requireCategory(operator, Operator.Category.COMPARISON);
        AstNode node = new AstNode(AstNodeType.COMPARISON);
        node.operator = operator;
        node.slot(left);
        node.slot(right);
        return node;
    }

    public static AstNode arithmetic(Operator operator, AstNode left, AstNode right) {
        requireCategory(operator, Operator.Category.ARITHMETIC);
        AstNode node = new AstNode(AstNodeType.ARITHMETIC);
        node.operator = operator;
        node.slot(left);
        if (!operator.isUnary()) {
            node.slot(right);
        }
        return node;
    }

    public static AstNode negate(AstNode operand) {
        return arithmetic(Operator.NEGATE, operand, null);
    }

    public static AstNode identifier(String name) {
        AstNode node = new AstNode(AstNodeType.IDENTIFIER);
        node.text = Objects.requireNonNull(name, "name");
        return node;
    }

    /**
     * @param value Boolean, Double, String or null
     */
    public static AstNode literal(Object value) {
        AstNode node = new AstNode(AstNodeType.LITERAL);
        node.literal = value;
        return node;
    }

    public static AstNode chain(ChainType chainType) {
        AstNode node = new AstNode(AstNodeType.CHAIN);
        node.chainType = Objects.requireNonNull(chainType, "chainType");
        return node;
    }

    public static AstNode assignment(String name, AstNode value) {
        AstNode node = new AstNode(AstNodeType.ASSIGNMENT);
        node.text = Objects.requireNonNull(name, "name");
        node.slot(value);
        return node;
    }

    public static AstNode call(String function) {
        AstNode node = new AstNode(AstNodeType.FUNCTION_CALL);
        node.text = Objects.requireNonNull(function, "function");
        return node;
    }

    public static AstNode propertyAccess(AstNode object, String property) {
        AstNode node = new AstNode(AstNodeType.PROPERTY_ACCESS);
        node.text = Objects.requireNonNull(property, "property");
        node.slot(object);
        return node;
    }

    public static AstNode returnValue(AstNode value) {
        AstNode node = new AstNode(AstNodeType.RETURN);
        node.slot(value);
        return node;
    }

    /**
     * Set the source position. Returns this node for chaining.
     */
    public AstNode at(int line, int column) {
        this.line = line;
        this.column = column;
        return this;
    }

    // ---- children ----

    /**
     * Append a child to a node with ordered children.
     *
     * @throws IllegalStateException    if this kind has fixed operand slots
     * @throws IllegalArgumentException if the child is already attached or is an ancestor of this node
     */
    public void addChild(AstNode child) {
        if (!type.hasOrderedChildren()) {
            throw new IllegalStateException(type + " nodes do not take ordered children");
        }
        Objects.requireNonNull(child, "child");
        attach(child);
        children.add(child);
    }

    /**
     * Detach a child (by identity) from a node with ordered children.
     *
     * @return true if the child was present
     */
    public boolean removeChild(AstNode child) {
        if (!type.hasOrderedChildren()) {
            throw new IllegalStateException(type + " nodes do not take ordered children");
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                children.remove(i);
                child.parent = null;
                return true;
            }
        }
        return false;
    }

    /**
     * Child at the given position, or null for an empty slot or an out-of-range index.
     */
    public AstNode getChild(int index) {
        if (index < 0 || index >= children.size()) {
            return null;
        }
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public List<AstNode> children() {
        return Collections.unmodifiableList(children);
    }

    private void slot(AstNode child) {
        if (child != null) {
            attach(child);
        }
        children.add(child);
    }

    private void attach(AstNode child) {
        if (child.parent != null) {
            throw new IllegalArgumentException("Node is already attached to a parent");
        }
        for (AstNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Node cannot be its own descendant");
            }
        }
        child.parent = this;
    }

    // ---- typed accessors ----

    public AstNode condition() {
        return getChild(0);
    }

    public AstNode trueBranch() {
        return getChild(1);
    }

    public AstNode falseBranch() {
        return getChild(2);
    }

    public AstNode left() {
        return getChild(0);
    }

    public AstNode right() {
        return getChild(1);
    }

    /**
     * Single operand of unary operators, assignments, returns, property
     * accesses and the body of a rule.
     */
    public AstNode operand() {
        return getChild(0);
    }

    public AstNodeType type() {
        return type;
    }

    public AstNode parent() {
        return parent;
    }

    /**
     * Identifier name, rule name, action name, function name, property name
     * or assignment target, depending on the kind.
     */
    public String text() {
        return text;
    }

    public Object literal() {
        return literal;
    }

    public Operator operator() {
        return operator;
    }

    public ConsequenceType consequenceType() {
        return consequenceType;
    }

    public ChainType chainType() {
        return chainType;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public boolean is(AstNodeType expected) {
        return type == expected;
    }

    // ---- traversal ----

    /**
     * Visit this node, then its children.
     *
     * @return false if the visitor stopped the traversal
     */
    public boolean traversePreOrder(AstVisitor visitor) {
        if (!visitor.visit(this)) {
            return false;
        }
        for (AstNode child : children) {
            if (child != null && !child.traversePreOrder(visitor)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Visit the children, then this node.
     *
     * @return false if the visitor stopped the traversal
     */
    public boolean traversePostOrder(AstVisitor visitor) {
        for (AstNode child : children) {
            if (child != null && !child.traversePostOrder(visitor)) {
                return false;
            }
        }
        return visitor.visit(this);
    }

    /**
     * First node in pre-order matching the predicate.
     */
    public Optional<AstNode> find(Predicate<AstNode> predicate) {
        AstNode[] found = new AstNode[1];
        traversePreOrder(node -> {
            if (predicate.test(node)) {
                found[0] = node;
                return false;
            }
            return true;
        });
        return Optional.ofNullable(found[0]);
    }

    /**
     * Height of the subtree rooted here; a leaf has depth 1.
     */
    public int depth() {
        int max = 0;
        for (AstNode child : children) {
            if (child != null) {
                max = Math.max(max, child.depth());
            }
        }
        return max + 1;
    }

    public int nodeCount() {
        int count = 1;
        for (AstNode child : children) {
            if (child != null) {
                count += child.nodeCount();
            }
        }
        return count;
    }

    // ---- copy and equality ----

    /**
     * Deep copy of this subtree. The copy is detached (no parent) and shares
     * no nodes with the source.
     */
    public AstNode copy() {
        AstNode copy = new AstNode(type);
        copy.text = text;
        copy.literal = literal;
        copy.operator = operator;
        copy.consequenceType = consequenceType;
        copy.chainType = chainType;
        copy.line = line;
        copy.column = column;
        for (AstNode child : children) {
            AstNode childCopy = child != null ? child.copy() : null;
            if (childCopy != null) {
                childCopy.parent = copy;
            }
            copy.children.add(childCopy);
        }
        return copy;
    }

    /**
     * Deep structural equality. Parent links and source positions are ignored.
     */
    public static boolean structurallyEqual(AstNode a, AstNode b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a.type != b.type
                || a.operator != b.operator
                || a.consequenceType != b.consequenceType
                || a.chainType != b.chainType
                || !Objects.equals(a.text, b.text)
                || !Objects.equals(a.literal, b.literal)
                || a.children.size() != b.children.size()) {
            return false;
        }
        for (int i = 0; i < a.children.size(); i++) {
            if (!structurallyEqual(a.children.get(i), b.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static void requireCategory(Operator operator, Operator.Category category) {
        Objects.requireNonNull(operator, "operator");
        if (operator.category() != category) {
            throw new IllegalArgumentException(operator + " is not a " + category + " operator");
        }
    }

    /**
     * Compact source-like rendering.
     */
    @Override
    public String toString() {
        return switch (type) {
            case PROGRAM -> joinChildren("; ");
            case RULE -> "rule " + text + " { " + render(operand()) + " }";
            case BLOCK -> joinChildren("; ");
            case DECISION -> {
                String rendered = "if " + render(condition()) + " then " + render(trueBranch());
                if (falseBranch() != null) {
                    rendered += " else " + render(falseBranch());
                }
                yield rendered + " end";
            }
            case CONSEQUENCE -> text;
            case LOGIC_OP, ARITHMETIC -> operator.isUnary()
                    ? operator.symbol() + (operator == Operator.NOT ? " " : "") + render(operand())
                    : "(" + render(left()) + " " + operator.symbol() + " " + render(right()) + ")";
            case COMPARISON -> "(" + render(left()) + " " + operator.symbol() + " " + render(right()) + ")";
            case IDENTIFIER -> text;
            case LITERAL -> literal instanceof String s ? "\"" + s + "\"" : formatLiteral(literal);
            case CHAIN -> joinChildren(" " + chainType.symbol() + " ");
            case ASSIGNMENT -> text + " = " + render(operand());
            case FUNCTION_CALL -> text + "(" + joinChildren(", ") + ")";
            case PROPERTY_ACCESS -> render(operand()) + "." + text;
            case RETURN -> operand() != null ? "return " + render(operand()) : "return";
        };
    }

    private String joinChildren(String separator) {
        StringBuilder sb = new StringBuilder();
        for (AstNode child : children) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(render(child));
        }
        return sb.toString();
    }

    private static String render(AstNode node) {
        return node == null ? "?" : node.toString();
    }

    private static String formatLiteral(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return String.valueOf(d.longValue());
        }
        return String.valueOf(value);
    }
}
