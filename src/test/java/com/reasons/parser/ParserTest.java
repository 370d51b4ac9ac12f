package com.reasons.parser;

import com.reasons.ast.AstNode;
import com.reasons.ast.AstNodeType;
import com.reasons.ast.AstValidator;
import com.reasons.ast.ChainType;
import com.reasons.ast.ConsequenceType;
import com.reasons.ast.Operator;
import com.reasons.lexer.Lexer;
import com.reasons.lexer.LexerOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Parser.
 */
class ParserTest {

    private static AstNode parseOk(String source) {
        ParseResult result = SourceParser.parse(source);
        assertTrue(result.succeeded(), () -> "Unexpected diagnostics: " + result.diagnostics());
        return result.root();
    }

    private static AstNode expression(String source) {
        ParseResult result = SourceParser.parseExpression(source, LexerOptions.defaults());
        assertTrue(result.succeeded(), () -> "Unexpected diagnostics: " + result.diagnostics());
        return result.root();
    }

    private static String nested(int parens) {
        return "(".repeat(parens) + "x" + ")".repeat(parens);
    }

    private static String decisions(int levels) {
        return "if x then ".repeat(levels) + "win" + " end".repeat(levels);
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Should parse a rule with a complete decision")
        void shouldParseRule() {
            AstNode program = parseOk("rule R { if x > 1 then win else lose end }");

            assertEquals(AstNodeType.PROGRAM, program.type());
            AstNode rule = program.getChild(0);
            assertEquals(AstNodeType.RULE, rule.type());
            assertEquals("R", rule.text());

            AstNode decision = rule.operand().getChild(0);
            assertEquals(AstNodeType.DECISION, decision.type());
            assertEquals(Operator.GT, decision.condition().operator());
            assertEquals(ConsequenceType.WIN, decision.trueBranch().consequenceType());
            assertEquals(ConsequenceType.LOSE, decision.falseBranch().consequenceType());
            assertSame(decision, decision.condition().parent());
        }

        @Test
        @DisplayName("Should leave the false branch empty when there is no else")
        void shouldParseDecisionWithoutElse() {
            AstNode decision = parseOk("if ready then go end").getChild(0);

            assertEquals(ConsequenceType.ACTION, decision.trueBranch().consequenceType());
            assertEquals("go", decision.trueBranch().text());
            assertNull(decision.falseBranch());
        }

        @Test
        @DisplayName("Should parse when-do and postfix when")
        void shouldParseWhenForms() {
            AstNode program = parseOk("when x do notify(\"ops\"); alert when y");

            AstNode when = program.getChild(0);
            assertEquals(AstNodeType.DECISION, when.type());
            assertEquals(AstNodeType.FUNCTION_CALL, when.trueBranch().type());
            assertNull(when.falseBranch());

            AstNode postfix = program.getChild(1);
            assertEquals(AstNodeType.DECISION, postfix.type());
            assertEquals("y", postfix.condition().text());
            assertEquals("alert", postfix.trueBranch().text());
        }

        @Test
        @DisplayName("Should parse sequential chains")
        void shouldParseChain() {
            AstNode decision = parseOk("if x then a >> b seq c end").getChild(0);
            AstNode chain = decision.trueBranch();

            assertEquals(AstNodeType.CHAIN, chain.type());
            assertEquals(ChainType.SEQUENTIAL, chain.chainType());
            assertEquals(3, chain.childCount());
            assertEquals("c", chain.getChild(2).text());
        }

        @Test
        @DisplayName("Should parse return with and without a value")
        void shouldParseReturn() {
            AstNode decision = parseOk("if x then return 5 else return end").getChild(0);

            assertEquals(AstNodeType.RETURN, decision.trueBranch().type());
            assertEquals(5.0, decision.trueBranch().operand().literal());
            assertNull(decision.falseBranch().operand());
        }

        @Test
        @DisplayName("Should parse nested decisions as consequences")
        void shouldParseNestedDecision() {
            AstNode decision = parseOk("if a then if b then win end else lose end").getChild(0);

            assertEquals(AstNodeType.DECISION, decision.trueBranch().type());
            assertEquals(ConsequenceType.LOSE, decision.falseBranch().consequenceType());
        }

        @Test
        @DisplayName("Should parse golf programs with newline separators")
        void shouldParseGolf() {
            ParseResult result = SourceParser.parse("if a => w\nelse l end\nif T => d end", LexerOptions.golf());

            assertTrue(result.succeeded(), () -> result.diagnostics().toString());
            AstNode program = result.root();
            assertEquals(2, program.childCount());
            assertEquals(ConsequenceType.WIN, program.getChild(0).trueBranch().consequenceType());
            assertEquals(ConsequenceType.LOSE, program.getChild(0).falseBranch().consequenceType());
            assertEquals(Boolean.TRUE, program.getChild(1).condition().literal());
        }

        @Test
        @DisplayName("Should report statistics with the result")
        void shouldReportStatistics() {
            ParseResult result = SourceParser.parse("x = 1");

            assertEquals(4, result.statistics().tokensProduced());
            assertEquals(5, result.statistics().totalBytes());
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Should bind and tighter than or")
        void shouldRespectLogicPrecedence() {
            AstNode root = expression("a or b and c");

            assertEquals(Operator.OR, root.operator());
            assertEquals("a", root.left().text());
            assertEquals(Operator.AND, root.right().operator());
            assertEquals("(a or (b and c))", root.toString());
        }

        @Test
        @DisplayName("Should bind arithmetic by precedence and associate left")
        void shouldRespectArithmeticPrecedence() {
            assertEquals("(1 + (2 * 3))", expression("1 + 2 * 3").toString());
            assertEquals("((1 - 2) - 3)", expression("1 - 2 - 3").toString());
            assertEquals("((a + 1) > (b * 2))", expression("a + 1 > b * 2").toString());
        }

        @Test
        @DisplayName("Should parse unary operators")
        void shouldParseUnary() {
            AstNode not = expression("not a == b");
            assertEquals(Operator.EQ, not.operator());
            assertEquals(Operator.NOT, not.left().operator());

            AstNode negate = expression("-x * 2");
            assertEquals(Operator.MULTIPLY, negate.operator());
            assertEquals(Operator.NEGATE, negate.left().operator());
        }

        @Test
        @DisplayName("Should build a ternary with three independent operands")
        void shouldParseTernary() {
            AstNode root = expression("a ? 1 : 2");

            assertEquals(AstNodeType.DECISION, root.type());
            assertEquals("a", root.condition().text());
            assertEquals(1.0, root.trueBranch().literal());
            assertEquals(2.0, root.falseBranch().literal());
            assertNotSame(root.condition(), root.trueBranch());
            assertSame(root, root.falseBranch().parent());
        }

        @Test
        @DisplayName("Should parse calls, property access and assignment")
        void shouldParsePostfixForms() {
            AstNode call = expression("max(1, order.total)");
            assertEquals(AstNodeType.FUNCTION_CALL, call.type());
            assertEquals(2, call.childCount());
            AstNode property = call.getChild(1);
            assertEquals(AstNodeType.PROPERTY_ACCESS, property.type());
            assertEquals("total", property.text());
            assertEquals("order", property.operand().text());

            AstNode assignment = expression("x = y = 3");
            assertEquals(AstNodeType.ASSIGNMENT, assignment.type());
            assertEquals(AstNodeType.ASSIGNMENT, assignment.operand().type());
        }

        @Test
        @DisplayName("Should accept nesting just below the depth ceiling")
        void shouldAcceptDeepNesting() {
            AstNode program = parseOk("if " + nested(Parser.MAX_EXPRESSION_DEPTH - 1) + " then win end");
            assertEquals("x", program.getChild(0).condition().text());
        }

        @Test
        @DisplayName("Should reject nesting at the depth ceiling without crashing")
        void shouldRejectTooDeepNesting() {
            ParseResult result = SourceParser.parse("if " + nested(Parser.MAX_EXPRESSION_DEPTH) + " then win end");

            assertFalse(result.succeeded());
            assertEquals(1, result.diagnostics().size());
            Diagnostic diagnostic = result.diagnostics().get(0);
            assertEquals(ErrorKind.STRUCTURAL, diagnostic.kind());
            assertEquals("Expression too complex", diagnostic.message());
        }

        @Test
        @DisplayName("Should accept decisions nested up to the nesting ceiling")
        void shouldAcceptDecisionsAtCeiling() {
            AstNode program = parseOk(decisions(Parser.MAX_DECISION_NESTING));

            assertEquals(Parser.MAX_DECISION_NESTING + 1, program.getChild(0).depth());
        }

        @Test
        @DisplayName("Should reject decisions nested one level past the ceiling")
        void shouldRejectDecisionsPastCeiling() {
            ParseResult result = SourceParser.parse(decisions(Parser.MAX_DECISION_NESTING + 1));

            assertFalse(result.succeeded());
            assertEquals(1, result.diagnostics().size());
            Diagnostic diagnostic = result.diagnostics().get(0);
            assertEquals(ErrorKind.STRUCTURAL, diagnostic.kind());
            assertEquals("Decisions nested too deeply", diagnostic.message());
            assertEquals(1 + 10 * Parser.MAX_DECISION_NESTING, diagnostic.column());
        }

        @Test
        @DisplayName("Should reject very deep decisions without overflowing the stack")
        void shouldRejectVeryDeepDecisions() {
            ParseResult result = assertDoesNotThrow(() -> SourceParser.parse(decisions(20_000)));

            assertEquals(1, result.diagnostics().size());
            assertEquals(ErrorKind.STRUCTURAL, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("Should count when blocks against the nesting ceiling")
        void shouldCountWhenTowardsCeiling() {
            assertTrue(SourceParser.parse("when x do " + decisions(Parser.MAX_DECISION_NESTING - 1)).succeeded());

            ParseResult result = SourceParser.parse("when x do " + decisions(Parser.MAX_DECISION_NESTING));
            assertEquals(1, result.diagnostics().size());
            assertEquals("Decisions nested too deeply", result.diagnostics().get(0).message());
        }

        @Test
        @DisplayName("Should reject operator chains deeper than the tree limit")
        void shouldRejectLongOperatorChain() {
            String accepted = "total = " + "1 + ".repeat(1000) + "1";
            String rejected = "rule R { total = " + "1 + ".repeat(1100) + "1 }";

            assertTrue(SourceParser.parse(accepted).succeeded());
            ParseResult result = SourceParser.parse(rejected);
            assertFalse(result.succeeded());
            assertEquals(1, result.diagnostics().size());
            assertEquals(ErrorKind.STRUCTURAL, result.diagnostics().get(0).kind());
            assertEquals("Tree exceeds maximum depth of " + (AstValidator.MAX_DEPTH - 1),
                    result.diagnostics().get(0).message());
            assertEquals(1, result.diagnostics().get(0).column());
        }

        @Test
        @DisplayName("Should reject deep standalone expressions")
        void shouldRejectDeepStandaloneExpression() {
            ParseResult result = SourceParser.parseExpression("1" + " or 1".repeat(1100), LexerOptions.defaults());

            assertFalse(result.succeeded());
            assertEquals(ErrorKind.STRUCTURAL, result.diagnostics().get(0).kind());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Should report a missing consequence once at the then keyword")
        void shouldReportMissingConsequence() {
            ParseResult result = SourceParser.parse("rule R { if x then end }");

            assertFalse(result.succeeded());
            assertTrue(result.program().isEmpty());
            assertEquals(List.of(new Diagnostic(ErrorKind.SYNTAX, "Expected consequence after 'then'", 1, 15)),
                    result.diagnostics());
        }

        @Test
        @DisplayName("Should recover and report faults in separate statements")
        void shouldReportTwoFaults() {
            ParseResult result = SourceParser.parse("if then win end; if x then end");

            assertEquals(2, result.diagnostics().size());
            assertEquals("Expected expression", result.diagnostics().get(0).message());
            assertEquals("Expected consequence after 'then'", result.diagnostics().get(1).message());
        }

        @Test
        @DisplayName("Should report a fault inside a nested decision once")
        void shouldReportNestedFaultOnce() {
            ParseResult result = SourceParser.parse("rule R { if x then if then win end else lose end }");

            assertEquals(List.of(new Diagnostic(ErrorKind.SYNTAX, "Expected expression", 1, 23)),
                    result.diagnostics());
        }

        @Test
        @DisplayName("Should resume after a failed decision that lacks its end")
        void shouldResumeAfterUnclosedDecision() {
            ParseResult result = SourceParser.parse("if a then win; if then lose end");

            assertEquals(2, result.diagnostics().size());
            assertEquals("Expected 'end' to close 'if'", result.diagnostics().get(0).message());
            assertEquals("Expected expression", result.diagnostics().get(1).message());
        }

        @Test
        @DisplayName("Should report lexical errors through the parser")
        void shouldReportLexicalError() {
            ParseResult result = SourceParser.parse("if x @ then win end");

            assertEquals(1, result.diagnostics().size());
            Diagnostic diagnostic = result.diagnostics().get(0);
            assertEquals(ErrorKind.LEXICAL, diagnostic.kind());
            assertEquals("Unexpected character '@' (0x40)", diagnostic.message());
            assertEquals(6, diagnostic.column());
        }

        @Test
        @DisplayName("Should reject shorthand keywords outside consequences")
        void shouldRejectShorthandInCondition() {
            ParseResult result = SourceParser.parse("if win then pass end");

            assertEquals("'win' is only allowed as a consequence", result.diagnostics().get(0).message());
        }

        @Test
        @DisplayName("Should reject nested rules and stray braces")
        void shouldRejectStructureErrors() {
            assertEquals("Rule declarations cannot be nested",
                    SourceParser.parse("rule A { rule B { win } }").diagnostics().get(0).message());
            assertEquals("Unexpected '}' outside of a rule",
                    SourceParser.parse("}").diagnostics().get(0).message());
        }

        @Test
        @DisplayName("Should reject mixed chain operators")
        void shouldRejectMixedChain() {
            ParseResult result = SourceParser.parse("if x then a >> b par c end");

            assertTrue(result.diagnostics().get(0).message().startsWith("Cannot mix '>>'"));
        }

        @Test
        @DisplayName("Should reject invalid assignment targets")
        void shouldRejectInvalidAssignment() {
            ParseResult result = SourceParser.parseExpression("1 = 2", LexerOptions.defaults());

            assertFalse(result.succeeded());
            assertEquals("Invalid assignment target", result.diagnostics().get(0).message());
        }

        @Test
        @DisplayName("Should reject trailing input after an expression")
        void shouldRejectTrailingInput() {
            ParseResult result = SourceParser.parseExpression("a b", LexerOptions.defaults());

            assertEquals("Unexpected 'b' after expression", result.diagnostics().get(0).message());
        }

        @Test
        @DisplayName("Should require golf mode for the implies shorthand")
        void shouldRejectImpliesOutsideGolf() {
            ParseResult result = SourceParser.parse("if a => win end");

            assertEquals(ErrorKind.LEXICAL, result.diagnostics().get(0).kind());
        }

        @Test
        @DisplayName("Should expose the last diagnostic")
        void shouldExposeLastDiagnostic() {
            Parser parser = new Parser(new Lexer("if x then end; }"));

            assertTrue(parser.parse().isEmpty());
            assertTrue(parser.hadError());
            assertEquals("Unexpected '}' outside of a rule", parser.lastDiagnostic().orElseThrow().message());
            assertTrue(new Parser(new Lexer("win")).lastDiagnostic().isEmpty());
        }

        @Test
        @DisplayName("Should format diagnostics with position and kind")
        void shouldFormatDiagnostic() {
            Diagnostic diagnostic = new Diagnostic(ErrorKind.SYNTAX, "Expected expression", 3, 7);
            assertEquals("[3:7] syntax error: Expected expression", diagnostic.toString());
        }
    }
}
