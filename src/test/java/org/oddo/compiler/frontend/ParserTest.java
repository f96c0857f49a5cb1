package org.oddo.compiler.frontend;

import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.ParseException;
import org.oddo.compiler.diagnostics.Diagnostic;
import org.oddo.compiler.diagnostics.DiagnosticsEngine;
import org.oddo.compiler.frontend.lexer.Lexer;
import org.oddo.compiler.frontend.parser.CstNode;
import org.oddo.compiler.frontend.parser.CstRule;
import org.oddo.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify the shape of the concrete syntax tree for the main statement forms and
 * the way syntax errors are collected and reported.
 * These are unit tests and do not require external resources.
 */
public class ParserTest {

    private static CstNode parse(String source) throws CompilationException {
        return new Parser(new Lexer(source).scanTokens(), new DiagnosticsEngine(), "test.oddo").parseProgram();
    }

    private static ParseException parseFailure(String source) {
        Throwable thrown = catchThrowable(() -> parse(source));
        assertThat(thrown).isInstanceOf(ParseException.class);
        return (ParseException) thrown;
    }

    /**
     * Verifies that a program yields one statement node per line, in source order.
     * This is a unit test for the parser.
     */
    @Test
    @Tag("unit")
    void testProgramStatements() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "import { a } from \"mod\"",
                "x = a + 1",
                "export default x"
        );

        // Act
        CstNode program = parse(source);

        // Assert
        assertThat(program.rule()).isEqualTo(CstRule.PROGRAM);
        assertThat(program.nodes()).extracting(CstNode::rule)
                .containsExactly(CstRule.IMPORT, CstRule.EXPRESSION_STATEMENT, CstRule.EXPORT_DEFAULT);
    }

    /**
     * Verifies that a modifier block holds its indented statements in a nested block.
     * This is a unit test for the parser.
     */
    @Test
    @Tag("unit")
    void testModifierBlock() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "@state:",
                "  a = 1",
                "  b = 2",
                "c = 3"
        );

        // Act
        CstNode program = parse(source);

        // Assert
        assertThat(program.nodes()).hasSize(2);
        CstNode block = program.nodes().get(0);
        assertThat(block.rule()).isEqualTo(CstRule.MODIFIER_BLOCK);
        assertThat(block.child(CstRule.BLOCK).nodes()).hasSize(2);
    }

    /**
     * Verifies that an arrow function followed by a line break takes an indented block as its body,
     * and that the statement after the block is parsed normally.
     * This is a unit test for the parser.
     */
    @Test
    @Tag("unit")
    void testArrowFunctionWithBlockBody() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "add = (a, b) =>",
                "  sum = a + b",
                "  return sum",
                "result = add(1, 2)"
        );

        // Act
        CstNode program = parse(source);

        // Assert
        assertThat(program.nodes()).hasSize(2);
        CstNode assignment = program.nodes().get(0).nodes().get(0);
        CstNode arrow = assignment.nodes().get(1);
        assertThat(arrow.rule()).isEqualTo(CstRule.ARROW_FUNCTION);
        assertThat(arrow.child(CstRule.BLOCK).nodes()).extracting(CstNode::rule)
                .containsExactly(CstRule.EXPRESSION_STATEMENT, CstRule.RETURN_STATEMENT);
    }

    /**
     * Verifies that an expression may continue over several lines inside parentheses.
     * This is a unit test for the parser.
     */
    @Test
    @Tag("unit")
    void testLineContinuationInsideParentheses() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "total = (a +",
                "    b +",
                "    c)"
        );

        // Act
        CstNode program = parse(source);

        // Assert
        assertThat(program.nodes()).hasSize(1);
    }

    /**
     * Verifies that two expressions on the same line are rejected and that the parser recovers
     * at the next line, so that every erroneous statement is reported.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testErrorsAreCollectedPerStatement() {
        // Arrange
        String source = String.join("\n",
                "a = 1 2",
                "b = 3",
                "c = 4 5"
        );

        // Act
        ParseException error = parseFailure(source);

        // Assert
        assertThat(error.getDiagnostics()).hasSize(2);
        assertThat(error.getDiagnostics()).extracting(Diagnostic::lineNumber).containsExactly(1, 3);
        assertThat(error.getDiagnostics().get(0).message())
                .contains("Expected end of statement")
                .contains("statements must be on separate lines");
        assertThat(error.getDiagnostics().get(0).sourceName()).isEqualTo("test.oddo");
    }

    /**
     * Verifies that a line indented without an opening construct is rejected.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testUnexpectedIndentation() {
        // Arrange
        String source = String.join("\n",
                "x = a + b",
                "  + c"
        );

        // Act
        ParseException error = parseFailure(source);

        // Assert
        assertThat(error.getDiagnostics()).extracting(Diagnostic::message).contains("Unexpected indentation");
    }

    /**
     * Verifies that a plain name followed by a colon cannot open a block; only modifiers can.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testColonBlockWithoutModifierIsRejected() {
        // Arrange
        String source = String.join("\n",
                "fn:",
                "  x = 1"
        );

        // Act
        ParseException error = parseFailure(source);

        // Assert
        assertThat(error.getDiagnostics()).extracting(Diagnostic::message)
                .containsExactly("Expected end of statement but found ':' (statements must be on separate lines)",
                        "Unexpected indentation");
    }

    /**
     * Verifies that an array with an elided element is rejected; every slot needs an expression.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testArrayElisionIsRejected() {
        // Act
        ParseException error = parseFailure("[, b] = arr");

        // Assert
        assertThat(error.getDiagnostics()).hasSize(1);
        assertThat(error.getDiagnostics().get(0).message()).isEqualTo("Expected an expression but found ','");
        assertThat(error.getDiagnostics().get(0).columnNumber()).isEqualTo(2);
    }

    /**
     * Verifies that a modifier block header must be followed by a line break.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testModifierBlockNeedsLineBreak() {
        // Act
        ParseException error = parseFailure("@state: a = 1");

        // Assert
        assertThat(error.getDiagnostics().get(0).message()).contains("Expected a line break after '@state:'");
    }

    /**
     * Verifies that a parenthesized list that is not followed by '=>' is rejected.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testParameterListWithoutArrow() {
        // Act
        ParseException error = parseFailure("x = (a, b)");

        // Assert
        assertThat(error.getDiagnostics().get(0).message()).contains("Expected '=>' after parameter list");
    }

    /**
     * Verifies that a JSX closing tag has to match the opening tag.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testMismatchedJsxClosingTag() {
        // Act
        ParseException error = parseFailure("el = <div>text</span>");

        // Assert
        assertThat(error.getDiagnostics().get(0).message()).contains("Expected closing tag </div> but found </span>");
    }

    /**
     * Verifies that the expression entry point rejects trailing input.
     * This is a unit test for the parser's error handling.
     */
    @Test
    @Tag("unit")
    void testExpressionEntryPointRejectsTrailingTokens() {
        // Act
        Throwable thrown = catchThrowable(() ->
                Parser.forExpression(new Lexer("a b").scanTokens(), new DiagnosticsEngine(), "expr").parseExpression());

        // Assert
        assertThat(thrown).isInstanceOf(ParseException.class);
        ParseException error = (ParseException) thrown;
        assertThat(error.getDiagnostics().get(0).message()).contains("after expression");
    }
}
