package org.oddo.compiler.frontend.builder;

import org.oddo.compiler.api.AstBuildException;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.frontend.lexer.Token;
import org.oddo.compiler.frontend.lexer.TokenType;
import org.oddo.compiler.frontend.parser.CstNode;
import org.oddo.compiler.frontend.parser.CstRule;
import org.oddo.compiler.frontend.parser.ast.ArrayPattern;
import org.oddo.compiler.frontend.parser.ast.AstNode;
import org.oddo.compiler.frontend.parser.ast.Expression;
import org.oddo.compiler.frontend.parser.ast.Identifier;
import org.oddo.compiler.frontend.parser.ast.NumberLiteral;
import org.oddo.compiler.frontend.parser.ast.ObjectPattern;
import org.oddo.compiler.frontend.parser.ast.Parameter;
import org.oddo.compiler.frontend.parser.ast.PatternDefault;
import org.oddo.compiler.frontend.parser.ast.PatternParameter;
import org.oddo.compiler.frontend.parser.ast.PatternProperty;
import org.oddo.compiler.frontend.parser.ast.PatternTarget;
import org.oddo.compiler.frontend.parser.ast.RestParameter;
import org.oddo.compiler.frontend.parser.ast.SimpleParameter;
import org.oddo.compiler.frontend.parser.ast.StringLiteral;

import java.util.ArrayList;
import java.util.List;

/**
 * Reinterprets expression CST nodes as binding patterns.
 * <p>
 * The parser reads parameter lists and destructuring targets as ordinary expressions
 * (arrays, objects, identifiers and {@code name = default} assignments). Once the surrounding
 * context reveals a binding position, this class converts them into parameters and patterns,
 * rejecting anything that cannot bind a name.
 */
final class PatternBuilder {

    private final AstBuilder expressions;

    PatternBuilder(AstBuilder expressions) {
        this.expressions = expressions;
    }

    /**
     * Converts the header of an arrow function into its parameter list.
     * @param header An {@link CstRule#IDENTIFIER} or {@link CstRule#PARENTHESIZED} node.
     * @return The parameters in declaration order.
     * @throws CompilationException if an item cannot be a parameter or a rest parameter is not last.
     */
    List<Parameter> parameters(CstNode header) throws CompilationException {
        if (header.rule() == CstRule.IDENTIFIER) {
            return List.of(new SimpleParameter(name(header), null));
        }
        List<CstNode> items = header.nodes();
        List<Parameter> parameters = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            CstNode item = items.get(i);
            if (item.rule() == CstRule.SPREAD) {
                requireLast(i, items.size(), "A rest parameter must be the last parameter");
                parameters.add(new RestParameter(restName(item)));
                continue;
            }
            CstNode target = item;
            Expression defaultValue = null;
            if (isDefault(item)) {
                target = item.nodes().get(0);
                defaultValue = expressions.buildExpression(item.nodes().get(1));
            }
            if (target.rule() == CstRule.IDENTIFIER) {
                parameters.add(new SimpleParameter(name(target), defaultValue));
            } else if (target.rule() == CstRule.ARRAY || target.rule() == CstRule.OBJECT) {
                parameters.add(new PatternParameter(pattern(target), defaultValue));
            } else {
                throw invalid(target, "Invalid parameter");
            }
        }
        return parameters;
    }

    /**
     * Converts a destructuring target into a pattern.
     * @param node An identifier, array or object node.
     * @return The pattern.
     * @throws CompilationException if the node cannot bind names.
     */
    PatternTarget pattern(CstNode node) throws CompilationException {
        return switch (node.rule()) {
            case IDENTIFIER -> new Identifier(name(node));
            case ARRAY -> arrayPattern(node);
            case OBJECT -> objectPattern(node);
            default -> throw invalid(node, "Invalid destructuring target");
        };
    }

    private ArrayPattern arrayPattern(CstNode array) throws CompilationException {
        List<CstNode> items = array.nodes();
        List<AstNode> elements = new ArrayList<>();
        PatternTarget rest = null;
        for (int i = 0; i < items.size(); i++) {
            CstNode item = items.get(i);
            if (item.rule() == CstRule.SPREAD) {
                requireLast(i, items.size(), "A rest element must be the last element of an array pattern");
                rest = pattern(item.nodes().get(0));
            } else if (isDefault(item)) {
                elements.add(new PatternDefault(pattern(item.nodes().get(0)),
                        expressions.buildExpression(item.nodes().get(1))));
            } else {
                elements.add(pattern(item));
            }
        }
        return new ArrayPattern(elements, rest);
    }

    private ObjectPattern objectPattern(CstNode object) throws CompilationException {
        List<CstNode> members = object.nodes();
        List<PatternProperty> properties = new ArrayList<>();
        PatternTarget rest = null;
        for (int i = 0; i < members.size(); i++) {
            CstNode member = members.get(i);
            switch (member.rule()) {
                case SPREAD -> {
                    requireLast(i, members.size(), "A rest element must be the last property of an object pattern");
                    rest = new Identifier(restName(member));
                }
                case SHORTHAND_PROPERTY -> {
                    String name = member.firstToken().text();
                    Expression defaultValue = member.has(TokenType.EQUAL)
                            ? expressions.buildExpression(member.nodes().get(0))
                            : null;
                    properties.add(new PatternProperty(new Identifier(name), new Identifier(name), true, defaultValue));
                }
                case PROPERTY -> {
                    CstNode value = member.nodes().get(0);
                    Expression defaultValue = null;
                    if (isDefault(value)) {
                        defaultValue = expressions.buildExpression(value.nodes().get(1));
                        value = value.nodes().get(0);
                    }
                    properties.add(new PatternProperty(key(member.firstToken()), pattern(value), false, defaultValue));
                }
                default -> throw invalid(member, "Computed keys are not supported in object patterns");
            }
        }
        return new ObjectPattern(properties, rest);
    }

    private static Expression key(Token token) {
        return switch (token.type()) {
            case STRING -> new StringLiteral((String) token.value());
            case NUMBER -> new NumberLiteral((Double) token.value(), token.text());
            default -> new Identifier(token.text());
        };
    }

    private static boolean isDefault(CstNode node) {
        return node.rule() == CstRule.ASSIGNMENT && node.has(TokenType.EQUAL);
    }

    private static String restName(CstNode spread) throws AstBuildException {
        CstNode argument = spread.nodes().get(0);
        if (argument.rule() != CstRule.IDENTIFIER) {
            throw invalid(argument, "A rest element must be a plain identifier");
        }
        return name(argument);
    }

    private static String name(CstNode identifier) {
        return identifier.firstToken().text();
    }

    private static void requireLast(int index, int size, String message) throws AstBuildException {
        if (index != size - 1) {
            throw new AstBuildException(CompilerErrorCode.REST_NOT_LAST, message);
        }
    }

    private static AstBuildException invalid(CstNode node, String message) {
        return new AstBuildException(CompilerErrorCode.INVALID_PATTERN, message, node.firstToken().position());
    }
}
