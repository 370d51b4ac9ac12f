package com.reasons.ast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AstNode.
 */
class AstNodeTest {

    private AstNode decision;

    @BeforeEach
    void setUp() {
        // if (x > 1) then win else notify("ops") end
        AstNode condition = AstNode.comparison(Operator.GT, AstNode.identifier("x"), AstNode.literal(1.0));
        AstNode call = AstNode.call("notify");
        call.addChild(AstNode.literal("ops"));
        decision = AstNode.decision(condition, AstNode.consequence(ConsequenceType.WIN, null), call);
    }

    @Test
    @DisplayName("Should link children back to their parent")
    void shouldLinkParents() {
        assertNull(decision.parent());
        assertSame(decision, decision.condition().parent());
        assertSame(decision.condition(), decision.condition().left().parent());
        assertEquals("win", decision.trueBranch().text());
    }

    @Test
    @DisplayName("Should keep empty slots for absent operands")
    void shouldKeepEmptySlots() {
        AstNode noElse = AstNode.decision(AstNode.identifier("a"), AstNode.identifier("b"), null);

        assertEquals(3, noElse.childCount());
        assertNull(noElse.falseBranch());
        assertNull(noElse.getChild(7));
        assertEquals(3, noElse.nodeCount());
    }

    @Test
    @DisplayName("Should reject ordered children on fixed-slot nodes")
    void shouldRejectAddOnFixedSlots() {
        assertThrows(IllegalStateException.class, () -> decision.addChild(AstNode.identifier("y")));
    }

    @Test
    @DisplayName("Should reject attaching a node twice or creating a cycle")
    void shouldRejectReattach() {
        AstNode block = AstNode.block();
        AstNode inner = AstNode.block();
        block.addChild(inner);

        assertThrows(IllegalArgumentException.class, () -> AstNode.block().addChild(inner));
        assertThrows(IllegalArgumentException.class, () -> inner.addChild(block));
        assertThrows(IllegalArgumentException.class, () -> block.addChild(block));
    }

    @Test
    @DisplayName("Should remove children by identity")
    void shouldRemoveChild() {
        AstNode block = AstNode.block();
        AstNode first = AstNode.identifier("a");
        AstNode second = AstNode.identifier("a");
        block.addChild(first);
        block.addChild(second);

        assertTrue(block.removeChild(second));
        assertFalse(block.removeChild(second));
        assertNull(second.parent());
        assertEquals(List.of(first), block.children());
    }

    @Test
    @DisplayName("Should traverse in pre-order and post-order")
    void shouldTraverse() {
        List<AstNodeType> pre = new ArrayList<>();
        List<AstNodeType> post = new ArrayList<>();

        assertTrue(decision.traversePreOrder(node -> pre.add(node.type())));
        assertTrue(decision.traversePostOrder(node -> post.add(node.type())));

        assertEquals(AstNodeType.DECISION, pre.get(0));
        assertEquals(AstNodeType.COMPARISON, pre.get(1));
        assertEquals(AstNodeType.IDENTIFIER, post.get(0));
        assertEquals(AstNodeType.DECISION, post.get(post.size() - 1));
        assertEquals(7, pre.size());
    }

    @Test
    @DisplayName("Should stop traversal when the visitor returns false")
    void shouldStopTraversal() {
        List<AstNode> visited = new ArrayList<>();

        boolean completed = decision.traversePreOrder(node -> {
            visited.add(node);
            return !node.is(AstNodeType.IDENTIFIER);
        });

        assertFalse(completed);
        assertEquals(3, visited.size());
    }

    @Test
    @DisplayName("Should find the first matching node")
    void shouldFind() {
        Optional<AstNode> literal = decision.find(node -> node.is(AstNodeType.LITERAL));

        assertTrue(literal.isPresent());
        assertEquals(1.0, literal.get().literal());
        assertTrue(decision.find(node -> node.is(AstNodeType.CHAIN)).isEmpty());
    }

    @Test
    @DisplayName("Should compute depth and node count")
    void shouldMeasure() {
        assertEquals(3, decision.depth());
        assertEquals(7, decision.nodeCount());
        assertEquals(1, AstNode.identifier("x").depth());
    }

    @Test
    @DisplayName("Should copy deeply and independently")
    void shouldCopyDeeply() {
        AstNode copy = decision.copy();

        assertNotSame(decision, copy);
        assertNull(copy.parent());
        assertTrue(AstNode.structurallyEqual(decision, copy));
        assertNotSame(decision.condition(), copy.condition());
        assertSame(copy, copy.condition().parent());

        copy.falseBranch().addChild(AstNode.literal(2.0));
        assertFalse(AstNode.structurallyEqual(decision, copy));
        assertEquals(1, decision.falseBranch().childCount());
    }

    @Test
    @DisplayName("Should ignore positions in structural equality")
    void shouldIgnorePositions() {
        AstNode a = AstNode.identifier("x").at(1, 1);
        AstNode b = AstNode.identifier("x").at(9, 4);

        assertTrue(AstNode.structurallyEqual(a, b));
        assertFalse(AstNode.structurallyEqual(a, AstNode.identifier("y")));
        assertFalse(AstNode.structurallyEqual(a, null));
        assertTrue(AstNode.structurallyEqual(null, null));
    }

    @Test
    @DisplayName("Should reject operators of the wrong category")
    void shouldRejectWrongOperator() {
        assertThrows(IllegalArgumentException.class,
                () -> AstNode.logic(Operator.ADD, AstNode.identifier("a"), AstNode.identifier("b")));
    }

    @Test
    @DisplayName("Should render a compact source form")
    void shouldRender() {
        assertEquals("if (x > 1) then win else notify(\"ops\") end", decision.toString());

        AstNode chain = AstNode.chain(ChainType.SEQUENTIAL);
        chain.addChild(AstNode.consequence(ConsequenceType.ACTION, "a"));
        chain.addChild(AstNode.consequence(ConsequenceType.PASS, null));
        assertEquals("a >> pass", chain.toString());
        assertEquals("not flag", AstNode.not(AstNode.identifier("flag")).toString());
    }
}
