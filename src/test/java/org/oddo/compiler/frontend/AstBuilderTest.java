package org.oddo.compiler.frontend;

import org.oddo.compiler.OddoCompiler;
import org.oddo.compiler.api.AstBuildException;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.frontend.builder.AstBuilder;
import org.oddo.compiler.frontend.parser.ast.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link AstBuilder}.
 * The tests run source text through the lexer and parser of an {@link OddoCompiler} and verify
 * the resulting AST: operator associativity, the distinction between declarations and
 * assignments, patterns, slices, template literals and JSX children.
 * These are unit tests and do not require external resources.
 */
public class AstBuilderTest {

    private OddoCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new OddoCompiler();
    }

    private Expression firstExpression(String source) throws CompilationException {
        Program program = compiler.parseProgram(source);
        return ((ExpressionStatement) program.body().get(0)).expression();
    }

    /**
     * Verifies that additive operators associate to the left.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testAdditionIsLeftAssociative() throws CompilationException {
        // Act
        Expression expression = compiler.parseExpression("1 + 2 + 3");

        // Assert
        assertThat(expression).isInstanceOf(Binary.class);
        Binary sum = (Binary) expression;
        assertThat(sum.operator()).isEqualTo("+");
        assertThat(sum.left()).isInstanceOf(Binary.class);
        assertThat(sum.right()).isEqualTo(new NumberLiteral(3, "3"));
    }

    /**
     * Verifies that exponentiation associates to the right.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testExponentiationIsRightAssociative() throws CompilationException {
        // Act
        Binary power = (Binary) compiler.parseExpression("2 ** 3 ** 2");

        // Assert
        assertThat(power.operator()).isEqualTo("**");
        assertThat(power.left()).isEqualTo(new NumberLiteral(2, "2"));
        assertThat(power.right()).isEqualTo(new Binary("**", new NumberLiteral(3, "3"), new NumberLiteral(2, "2")));
    }

    /**
     * Verifies that a minus written directly before a number literal becomes part of the literal,
     * while a parenthesized operand keeps its unary operator.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testNegativeNumberLiterals() throws CompilationException {
        // Act
        Expression folded = compiler.parseExpression("-5");
        Expression kept = compiler.parseExpression("-(5)");

        // Assert
        assertThat(folded).isEqualTo(new NumberLiteral(-5, "-5"));
        assertThat(kept).isEqualTo(new Unary("-", new NumberLiteral(5, "5")));
    }

    /**
     * Verifies that '=' declares while ':=' and the compound operators assign.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testDeclarationsAndAssignments() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "x = 1",
                "x := 2",
                "x +:= 3"
        );

        // Act
        List<Statement> body = compiler.parseProgram(source).body();

        // Assert
        assertThat(body).hasSize(3);
        assertThat(((ExpressionStatement) body.get(0)).expression())
                .isEqualTo(new Declaration(new Identifier("x"), new NumberLiteral(1, "1")));
        assertThat(((ExpressionStatement) body.get(1)).expression())
                .isEqualTo(new Assignment(":=", new Identifier("x"), new NumberLiteral(2, "2")));
        assertThat(((ExpressionStatement) body.get(2)).expression())
                .isEqualTo(new Assignment("+:=", new Identifier("x"), new NumberLiteral(3, "3")));
    }

    /**
     * Verifies that a parenthesized object in front of '=>' becomes a destructuring parameter
     * with a default value for one of its properties.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testObjectPatternParameter() throws CompilationException {
        // Act
        ArrowFunction arrow = (ArrowFunction) compiler.parseExpression("({x, y = 3}) => x + y");

        // Assert
        assertThat(arrow.parameters()).hasSize(1);
        PatternParameter parameter = (PatternParameter) arrow.parameters().get(0);
        ObjectPattern pattern = (ObjectPattern) parameter.pattern();
        assertThat(pattern.properties()).containsExactly(
                new PatternProperty(new Identifier("x"), new Identifier("x"), true, null),
                new PatternProperty(new Identifier("y"), new Identifier("y"), true, new NumberLiteral(3, "3")));
        assertThat(arrow.body()).isInstanceOf(Binary.class);
    }

    /**
     * Verifies that a spread in a parameter list becomes a rest parameter.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testRestParameter() throws CompilationException {
        // Act
        ArrowFunction arrow = (ArrowFunction) compiler.parseExpression("(first, ...rest) => rest");

        // Assert
        assertThat(arrow.parameters()).containsExactly(new SimpleParameter("first", null), new RestParameter("rest"));
    }

    /**
     * Verifies that a rest parameter in any position but the last is rejected.
     * This is a unit test for the AST builder's error handling.
     */
    @Test
    @Tag("unit")
    void testRestParameterMustBeLast() {
        assertThatThrownBy(() -> compiler.parseExpression("(...rest, last) => last"))
                .isInstanceOf(AstBuildException.class)
                .hasMessageContaining("A rest parameter must be the last parameter")
                .extracting(e -> ((AstBuildException) e).getCode())
                .isEqualTo(CompilerErrorCode.REST_NOT_LAST);
    }

    /**
     * Verifies that an array on the left of '=' declares through an array pattern with defaults and a rest element.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testArrayDestructuringDeclaration() throws CompilationException {
        // Act
        Declaration declaration = (Declaration) firstExpression("[a, b = 2, ...others] = list");

        // Assert
        ArrayPattern pattern = (ArrayPattern) declaration.target();
        assertThat(pattern.elements()).containsExactly(
                new Identifier("a"),
                new PatternDefault(new Identifier("b"), new NumberLiteral(2, "2")));
        assertThat(pattern.rest()).isEqualTo(new Identifier("others"));
        assertThat(declaration.value()).isEqualTo(new Identifier("list"));
    }

    /**
     * Verifies that an object pattern keeps renamed properties apart from shorthand ones.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testObjectDestructuringWithRename() throws CompilationException {
        // Act
        Declaration declaration = (Declaration) firstExpression("{ name, age: years } = person");

        // Assert
        ObjectPattern pattern = (ObjectPattern) declaration.target();
        assertThat(pattern.properties()).containsExactly(
                new PatternProperty(new Identifier("name"), new Identifier("name"), true, null),
                new PatternProperty(new Identifier("age"), new Identifier("years"), false, null));
        assertThat(pattern.rest()).isNull();
    }

    /**
     * Verifies the bounds recorded for the different array slice forms.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testArraySlices() throws CompilationException {
        // Act
        Expression whole = compiler.parseExpression("numbers[...]");
        Expression range = compiler.parseExpression("numbers[1...3]");
        Expression tail = compiler.parseExpression("numbers[2...]");

        // Assert
        Identifier numbers = new Identifier("numbers");
        assertThat(whole).isEqualTo(new ArraySlice(numbers, null, null));
        assertThat(range).isEqualTo(new ArraySlice(numbers, new NumberLiteral(1, "1"), new NumberLiteral(3, "3")));
        assertThat(tail).isEqualTo(new ArraySlice(numbers, new NumberLiteral(2, "2"), null));
    }

    /**
     * Verifies that ':=' on a slice produces a slice assignment.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testArraySliceAssignment() throws CompilationException {
        // Act
        Expression expression = firstExpression("arr[1...3] := values");

        // Assert
        assertThat(expression).isInstanceOf(ArraySliceAssignment.class);
        ArraySliceAssignment assignment = (ArraySliceAssignment) expression;
        assertThat(assignment.slice().object()).isEqualTo(new Identifier("arr"));
        assertThat(assignment.value()).isEqualTo(new Identifier("values"));
    }

    /**
     * Verifies that declaring a member or a slice with '=' is rejected with a hint to use ':='.
     * This is a unit test for the AST builder's error handling.
     */
    @Test
    @Tag("unit")
    void testMemberAndSliceTargetsRequireColonEqual() {
        assertThatThrownBy(() -> compiler.parseProgram("obj.x = 1"))
                .isInstanceOf(CompileException.class)
                .hasMessage("Member access assignments must use := operator, not =");
        assertThatThrownBy(() -> compiler.parseProgram("arr[0...2] = items"))
                .isInstanceOf(CompileException.class)
                .hasMessage("Array slice assignments must use := operator, not =");
    }

    /**
     * Verifies that a mixed call chain nests from left to right and keeps the optional flags.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testCallChain() throws CompilationException {
        // Act
        Call call = (Call) compiler.parseExpression("a.b()[0]?.c(d)");

        // Assert
        assertThat(call.optional()).isFalse();
        assertThat(call.arguments()).containsExactly(new Identifier("d"));
        MemberAccess member = (MemberAccess) call.callee();
        assertThat(member.optional()).isTrue();
        assertThat(member.property()).isEqualTo(new Identifier("c"));
        MemberAccess index = (MemberAccess) member.object();
        assertThat(index.computed()).isTrue();
        assertThat(index.object()).isInstanceOf(Call.class);
    }

    /**
     * Verifies that pipes nest to the left and composition nests to the right.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testPipeAndCompose() throws CompilationException {
        // Act
        Expression pipe = compiler.parseExpression("a |> f |> g");
        Expression compose = compiler.parseExpression("f <| g <| x");

        // Assert
        assertThat(pipe).isEqualTo(new Pipe(new Pipe(new Identifier("a"), new Identifier("f")), new Identifier("g")));
        assertThat(compose).isEqualTo(new Compose(new Identifier("f"), new Compose(new Identifier("g"), new Identifier("x"))));
    }

    /**
     * Verifies that a template literal is split into quasis and parsed interpolations.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testTemplateLiteral() throws CompilationException {
        // Act
        TemplateLiteral template = (TemplateLiteral) compiler.parseExpression("`a\\n${ b + 1 } c`");

        // Assert
        assertThat(template.quasis()).containsExactly(
                new TemplateElement("a\\n", "a\n", false),
                new TemplateElement(" c", " c", true));
        assertThat(template.expressions()).containsExactly(
                new Binary("+", new Identifier("b"), new NumberLiteral(1, "1")));
    }

    /**
     * Verifies that a JSX element inside an interpolation keeps text with an apostrophe.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testTemplateInterpolationWithJsx() throws CompilationException {
        // Act
        TemplateLiteral template = (TemplateLiteral) compiler.parseExpression("`${<p>don't</p>}`");

        // Assert
        assertThat(template.expressions()).hasSize(1);
        JsxElement paragraph = (JsxElement) template.expressions().get(0);
        assertThat(paragraph.name()).isEqualTo("p");
        assertThat(paragraph.children()).containsExactly(new JsxText("don't"));
    }

    /**
     * Verifies that whitespace between inline JSX children is kept as a single space,
     * while line breaks with indentation between children are dropped.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testJsxWhitespace() throws CompilationException {
        // Arrange
        String multiline = String.join("\n",
                "<ul>",
                "  <li>One</li>",
                "</ul>"
        );

        // Act
        JsxElement inline = (JsxElement) compiler.parseExpression("<div>Hello <b>World</b></div>");
        JsxElement block = (JsxElement) compiler.parseExpression(multiline);

        // Assert
        assertThat(inline.children()).hasSize(2);
        assertThat(inline.children().get(0)).isEqualTo(new JsxText("Hello "));
        assertThat(inline.children().get(1)).isInstanceOf(JsxElement.class);
        assertThat(block.children()).hasSize(1);
        assertThat(((JsxElement) block.children().get(0)).name()).isEqualTo("li");
    }

    /**
     * Verifies that HTML entities in JSX text and string attributes are decoded.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testJsxEntitiesAreDecoded() throws CompilationException {
        // Act
        JsxElement element = (JsxElement) compiler.parseExpression("<p title=\"Tom &amp; Jerry\">&copy; 2024 &#65;&#x42;</p>");

        // Assert
        assertThat(element.attributes()).containsExactly(new JsxAttribute("title", new StringLiteral("Tom & Jerry")));
        assertThat(element.children()).containsExactly(new JsxText("© 2024 AB"));
    }

    /**
     * Verifies that an empty expression container, such as a comment, does not produce a child.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testEmptyJsxExpressionIsDropped() throws CompilationException {
        // Act
        JsxElement element = (JsxElement) compiler.parseExpression("<p>{a}{/* note */}</p>");

        // Assert
        assertThat(element.children()).containsExactly(new JsxExpressionContainer(new Identifier("a")));
    }

    /**
     * Verifies that a computed key without a value is rejected.
     * This is a unit test for the AST builder's error handling.
     */
    @Test
    @Tag("unit")
    void testComputedKeyWithoutValue() {
        assertThatThrownBy(() -> compiler.parseProgram("o = { [k] }"))
                .isInstanceOf(AstBuildException.class)
                .hasMessageContaining("Computed key property must have both key and value expressions")
                .extracting(e -> ((AstBuildException) e).getCode())
                .isEqualTo(CompilerErrorCode.MISSING_SUBSTRUCTURE);
    }

    /**
     * Verifies that a shorthand property default is only accepted inside a pattern.
     * This is a unit test for the AST builder's error handling.
     */
    @Test
    @Tag("unit")
    void testShorthandDefaultOutsidePattern() {
        assertThatThrownBy(() -> compiler.parseProgram("o = { a = 1 }"))
                .isInstanceOf(AstBuildException.class)
                .extracting(e -> ((AstBuildException) e).getCode())
                .isEqualTo(CompilerErrorCode.INVALID_EXPRESSION);
    }

    /**
     * Verifies that modifiers are recorded on statements and that modifier blocks keep their children.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testModifiers() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "@state count = 0",
                "@computed:",
                "  double = count * 2"
        );

        // Act
        List<Statement> body = compiler.parseProgram(source).body();

        // Assert
        assertThat(((ExpressionStatement) body.get(0)).modifier()).isEqualTo("state");
        ModifierBlock block = (ModifierBlock) body.get(1);
        assertThat(block.modifier()).isEqualTo("computed");
        assertThat(block.block().body()).hasSize(1);
    }

    /**
     * Verifies the import and export statement forms.
     * This is a unit test for the AST builder.
     */
    @Test
    @Tag("unit")
    void testImportsAndExports() throws CompilationException {
        // Arrange
        String source = String.join("\n",
                "import React, { useState as state } from \"react\"",
                "import * as utils from './utils'",
                "export total := 1",
                "export { total as sum }"
        );

        // Act
        List<Statement> body = compiler.parseProgram(source).body();

        // Assert
        assertThat(body.get(0)).isEqualTo(new ImportStatement("React",
                List.of(new ImportSpecifier("useState", "state")), "react"));
        assertThat(body.get(1)).isEqualTo(new ImportNamespaceStatement("utils", "./utils"));
        assertThat(body.get(2)).isEqualTo(new ExportNamedStatement(
                new Declaration(new Identifier("total"), new NumberLiteral(1, "1")), List.of()));
        assertThat(body.get(3)).isEqualTo(new ExportNamedStatement(null, List.of(new ExportSpecifier("total", "sum"))));
    }

    /**
     * Verifies that an export of something that is not a declaration is rejected.
     * This is a unit test for the AST builder's error handling.
     */
    @Test
    @Tag("unit")
    void testExportRequiresDeclaration() {
        assertThatThrownBy(() -> compiler.parseProgram("export run()"))
                .isInstanceOf(AstBuildException.class)
                .hasMessageContaining("Export must be followed by a declaration");
    }
}
