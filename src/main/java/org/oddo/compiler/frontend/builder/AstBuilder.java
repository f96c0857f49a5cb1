package org.oddo.compiler.frontend.builder;

import org.oddo.compiler.api.AstBuildException;
import org.oddo.compiler.api.CompilationException;
import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.diagnostics.DiagnosticsEngine;
import org.oddo.compiler.frontend.lexer.Lexer;
import org.oddo.compiler.frontend.lexer.Token;
import org.oddo.compiler.frontend.lexer.TokenType;
import org.oddo.compiler.frontend.parser.CstElement;
import org.oddo.compiler.frontend.parser.CstNode;
import org.oddo.compiler.frontend.parser.CstRule;
import org.oddo.compiler.frontend.parser.CstToken;
import org.oddo.compiler.frontend.parser.Parser;
import org.oddo.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the concrete syntax tree produced by the {@link Parser} into the AST.
 * <p>
 * The builder walks the ordered children of each CST node. Operator chains are folded into
 * binary trees, call and member chains are folded around a running callee, parameter lists and
 * destructuring targets are reinterpreted as patterns, and template literals and JSX children are
 * split and normalized. All input comes from the {@link BuildContext} given at construction, so a
 * builder holds no mutable state and nested builds (template interpolations) use their own instance.
 */
public class AstBuilder {

    private final BuildContext context;
    private final PatternBuilder patterns;

    /**
     * Constructs a new AstBuilder.
     * @param context The source the CST was parsed from.
     */
    public AstBuilder(BuildContext context) {
        this.context = context;
        this.patterns = new PatternBuilder(this);
    }

    /**
     * Builds the AST of a whole program.
     * @param program The {@link CstRule#PROGRAM} node.
     * @return The program.
     * @throws CompilationException if the tree contains a construct that has no AST form.
     */
    public Program buildProgram(CstNode program) throws CompilationException {
        return new Program(statements(program));
    }

    // region Statements

    private List<Statement> statements(CstNode container) throws CompilationException {
        List<Statement> body = new ArrayList<>();
        for (CstNode statement : container.nodes()) {
            body.add(statement(statement));
        }
        return body;
    }

    private Statement statement(CstNode node) throws CompilationException {
        return switch (node.rule()) {
            case MODIFIER_BLOCK -> new ModifierBlock(modifier(node),
                    new BlockStatement(statements(node.child(CstRule.BLOCK))));
            case EXPRESSION_STATEMENT -> new ExpressionStatement(modifier(node), buildExpression(node.nodes().get(0)));
            case RETURN_STATEMENT -> new ReturnStatement(modifier(node),
                    node.nodes().isEmpty() ? null : buildExpression(node.nodes().get(0)));
            case EXPORT_DEFAULT -> new ExportDefaultStatement(buildExpression(node.nodes().get(0)));
            case EXPORT_NAMED -> exportNamed(node);
            case EXPORT_DECLARATION -> exportDeclaration(node);
            case IMPORT -> importStatement(node);
            case IMPORT_NAMESPACE -> new ImportNamespaceStatement(
                    ((CstToken) node.children().get(3)).token().text(), moduleName(node));
            default -> throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                    "Unexpected statement: " + node.rule(), node.firstToken().position());
        };
    }

    private static String modifier(CstNode node) {
        Token modifier = node.token(TokenType.MODIFIER);
        return modifier == null ? null : (String) modifier.value();
    }

    private ExportNamedStatement exportNamed(CstNode node) {
        List<ExportSpecifier> specifiers = new ArrayList<>();
        for (CstNode specifier : node.children(CstRule.EXPORT_SPECIFIER)) {
            List<CstElement> parts = specifier.children();
            String local = ((CstToken) parts.get(0)).token().text();
            String exported = ((CstToken) parts.get(parts.size() - 1)).token().text();
            specifiers.add(new ExportSpecifier(local, exported));
        }
        return new ExportNamedStatement(null, specifiers);
    }

    private ExportNamedStatement exportDeclaration(CstNode node) throws CompilationException {
        Expression expression = buildExpression(node.nodes().get(0));
        if (expression instanceof Declaration declaration) {
            return new ExportNamedStatement(declaration, List.of());
        }
        if (expression instanceof Assignment assignment && ":=".equals(assignment.operator())
                && assignment.target() instanceof Identifier identifier) {
            return new ExportNamedStatement(new Declaration(identifier, assignment.value()), List.of());
        }
        throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                "Export must be followed by a declaration such as 'export x = value'", node.firstToken().position());
    }

    private ImportStatement importStatement(CstNode node) {
        String defaultImport = null;
        if (node.children().get(1) instanceof CstToken first && first.type() == TokenType.IDENTIFIER) {
            defaultImport = first.token().text();
        }
        List<ImportSpecifier> specifiers = new ArrayList<>();
        for (CstNode specifier : node.children(CstRule.IMPORT_SPECIFIER)) {
            List<CstElement> parts = specifier.children();
            String imported = ((CstToken) parts.get(0)).token().text();
            String local = ((CstToken) parts.get(parts.size() - 1)).token().text();
            specifiers.add(new ImportSpecifier(imported, local));
        }
        return new ImportStatement(defaultImport, specifiers, moduleName(node));
    }

    private static String moduleName(CstNode node) {
        return (String) node.token(TokenType.STRING).value();
    }

    // endregion

    // region Expressions

    /**
     * Builds the AST of a single expression.
     * @param node The CST of the expression.
     * @return The expression.
     * @throws CompilationException if the tree contains a construct that has no AST form.
     */
    public Expression buildExpression(CstNode node) throws CompilationException {
        return switch (node.rule()) {
            case ASSIGNMENT -> assignment(node);
            case CONDITIONAL -> new Conditional(
                    buildExpression(node.nodes().get(0)),
                    buildExpression(node.nodes().get(1)),
                    buildExpression(node.nodes().get(2)));
            case LOGICAL_OR, LOGICAL_AND, NULLISH_COALESCING, PIPE, BITWISE_OR, BITWISE_XOR, BITWISE_AND,
                    EQUALITY, RELATIONAL, SHIFT, ADDITIVE, MULTIPLICATIVE -> foldLeft(node);
            case COMPOSE -> new Compose(buildExpression(node.nodes().get(0)), buildExpression(node.nodes().get(1)));
            case EXPONENTIATION -> new Binary("**",
                    buildExpression(node.nodes().get(0)), buildExpression(node.nodes().get(1)));
            case UNARY -> unary(node);
            case PREFIX_UPDATE -> new Update(node.firstToken().text(), true, buildExpression(node.nodes().get(0)));
            case POSTFIX_UPDATE -> new Update(((CstToken) node.children().get(1)).token().text(), false,
                    buildExpression(node.nodes().get(0)));
            case CALL_CHAIN -> callChain(node);
            case LITERAL -> literal(node.firstToken());
            case IDENTIFIER -> new Identifier(node.firstToken().text());
            case TEMPLATE -> template(node.firstToken());
            case ARRAY -> new ArrayLiteral(elements(node.nodes()));
            case OBJECT -> object(node);
            case PARENTHESIZED -> buildExpression(node.nodes().get(0));
            case ARROW_FUNCTION -> arrowFunction(node);
            case JSX_ELEMENT -> jsxElement(node);
            case JSX_FRAGMENT -> new JsxFragment(jsxChildren(node));
            case SPREAD -> throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                    "Spread is only allowed in arrays, objects and call arguments", node.firstToken().position());
            default -> throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                    "Unexpected expression: " + node.rule(), node.firstToken().position());
        };
    }

    private Expression foldLeft(CstNode node) throws CompilationException {
        List<CstElement> parts = node.children();
        Expression left = buildExpression((CstNode) parts.get(0));
        for (int i = 1; i + 1 < parts.size(); i += 2) {
            String operator = ((CstToken) parts.get(i)).token().text();
            Expression right = buildExpression((CstNode) parts.get(i + 1));
            left = switch (node.rule()) {
                case LOGICAL_OR, LOGICAL_AND -> new Logical(operator, left, right);
                case NULLISH_COALESCING -> new NullishCoalescing(left, right);
                case PIPE -> new Pipe(left, right);
                default -> new Binary(operator, left, right);
            };
        }
        return left;
    }

    private Expression unary(CstNode node) throws CompilationException {
        String operator = node.firstToken().text();
        Expression argument = buildExpression(node.nodes().get(0));
        if ("-".equals(operator) && argument instanceof NumberLiteral number && isPlainNumber(node.nodes().get(0))) {
            return new NumberLiteral(-number.value(), "-" + number.raw());
        }
        return new Unary(operator, argument);
    }

    // Only a literal written directly after the minus folds; '-(-1)' keeps its structure.
    private static boolean isPlainNumber(CstNode operand) {
        return operand.rule() == CstRule.LITERAL && operand.firstToken().type() == TokenType.NUMBER;
    }

    private Expression assignment(CstNode node) throws CompilationException {
        CstNode target = node.nodes().get(0);
        Token operator = ((CstToken) node.children().get(1)).token();
        Expression value = buildExpression(node.nodes().get(1));
        if (operator.type() == TokenType.EQUAL) {
            return declaration(target, value);
        }
        String spelling = operator.text();
        if (target.rule() == CstRule.ARRAY || target.rule() == CstRule.OBJECT) {
            if (operator.type() != TokenType.COLON_EQUAL) {
                throw new AstBuildException(CompilerErrorCode.INVALID_PATTERN,
                        "A destructuring pattern can only be assigned with :=", operator.position());
            }
            return new Assignment(spelling, patterns.pattern(target), value);
        }
        Expression left = buildExpression(target);
        if (left instanceof ArraySlice slice) {
            if (operator.type() != TokenType.COLON_EQUAL) {
                throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                        "Array slices only support := assignment", operator.position());
            }
            return new ArraySliceAssignment(slice, value);
        }
        if (left instanceof Identifier || (left instanceof MemberAccess member && !member.optional())) {
            return new Assignment(spelling, left, value);
        }
        throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                "Invalid assignment target", target.firstToken().position());
    }

    private Expression declaration(CstNode target, Expression value) throws CompilationException {
        switch (target.rule()) {
            case IDENTIFIER, ARRAY, OBJECT -> {
                return new Declaration(patterns.pattern(target), value);
            }
            case CALL_CHAIN -> {
                CstNode last = target.nodes().get(target.nodes().size() - 1);
                if (last.rule() == CstRule.SLICE) {
                    throw new CompileException(CompilerErrorCode.INVALID_DECLARATION_TARGET,
                            "Array slice assignments must use := operator, not =");
                }
                if (last.rule() == CstRule.MEMBER || last.rule() == CstRule.INDEX) {
                    throw new CompileException(CompilerErrorCode.INVALID_DECLARATION_TARGET,
                            "Member access assignments must use := operator, not =");
                }
                throw new CompileException(CompilerErrorCode.INVALID_DECLARATION_TARGET,
                        "Invalid declaration target");
            }
            default -> throw new CompileException(CompilerErrorCode.INVALID_DECLARATION_TARGET,
                    "Invalid declaration target");
        }
    }

    private Expression callChain(CstNode node) throws CompilationException {
        List<CstNode> links = node.nodes();
        Expression current = buildExpression(links.get(0));
        for (CstNode link : links.subList(1, links.size())) {
            boolean optional = link.firstToken().type() == TokenType.QUESTION_DOT;
            current = switch (link.rule()) {
                case MEMBER -> new MemberAccess(current,
                        new Identifier(((CstToken) link.children().get(1)).token().text()), false, optional);
                case INDEX -> new MemberAccess(current, buildExpression(link.nodes().get(0)), true, optional);
                case SLICE -> slice(current, link);
                case ARGUMENTS -> new Call(current, elements(link.nodes()), optional);
                case TAGGED_TEMPLATE -> new TaggedTemplate(current, template(link.firstToken()));
                default -> throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                        "Unexpected chain element: " + link.rule(), link.firstToken().position());
            };
        }
        return current;
    }

    private ArraySlice slice(Expression object, CstNode link) throws CompilationException {
        Expression start = null;
        Expression end = null;
        boolean afterEllipsis = false;
        for (CstElement part : link.children()) {
            if (part instanceof CstToken token && token.type() == TokenType.ELLIPSIS) {
                afterEllipsis = true;
            } else if (part instanceof CstNode bound) {
                if (afterEllipsis) {
                    end = buildExpression(bound);
                } else {
                    start = buildExpression(bound);
                }
            }
        }
        return new ArraySlice(object, start, end);
    }

    private List<Expression> elements(List<CstNode> items) throws CompilationException {
        List<Expression> elements = new ArrayList<>();
        for (CstNode item : items) {
            elements.add(item.rule() == CstRule.SPREAD
                    ? new SpreadElement(buildExpression(item.nodes().get(0)))
                    : buildExpression(item));
        }
        return elements;
    }

    private static Expression literal(Token token) {
        return switch (token.type()) {
            case NUMBER -> new NumberLiteral((Double) token.value(), token.text());
            case STRING -> new StringLiteral((String) token.value());
            case TRUE -> new BooleanLiteral(true);
            case FALSE -> new BooleanLiteral(false);
            default -> new NullLiteral();
        };
    }

    private ObjectLiteral object(CstNode node) throws CompilationException {
        List<ObjectMember> properties = new ArrayList<>();
        for (CstNode member : node.nodes()) {
            switch (member.rule()) {
                case SPREAD -> properties.add(new SpreadProperty(buildExpression(member.nodes().get(0))));
                case COMPUTED_PROPERTY -> properties.add(computedProperty(member));
                case PROPERTY -> {
                    Token key = member.firstToken();
                    Expression name = switch (key.type()) {
                        case STRING -> new StringLiteral((String) key.value());
                        case NUMBER -> new NumberLiteral((Double) key.value(), key.text());
                        default -> new Identifier(key.text());
                    };
                    properties.add(new Property(name, buildExpression(member.nodes().get(0)), false, false));
                }
                case SHORTHAND_PROPERTY -> {
                    if (member.has(TokenType.EQUAL)) {
                        throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                                "A property default is only allowed in a destructuring pattern",
                                member.firstToken().position());
                    }
                    Identifier name = new Identifier(member.firstToken().text());
                    properties.add(new Property(name, name, true, false));
                }
                default -> throw new AstBuildException(CompilerErrorCode.INVALID_EXPRESSION,
                        "Unexpected object member: " + member.rule(), member.firstToken().position());
            }
        }
        return new ObjectLiteral(properties);
    }

    private Property computedProperty(CstNode member) throws CompilationException {
        List<CstElement> parts = member.children();
        // [ key ] : value
        boolean hasKey = parts.size() > 1 && parts.get(1) instanceof CstNode;
        boolean hasValue = member.has(TokenType.COLON) && parts.get(parts.size() - 1) instanceof CstNode;
        if (!hasKey || !hasValue) {
            throw new AstBuildException(CompilerErrorCode.MISSING_SUBSTRUCTURE,
                    "Computed key property must have both key and value expressions");
        }
        return new Property(buildExpression((CstNode) parts.get(1)),
                buildExpression((CstNode) parts.get(parts.size() - 1)), false, true);
    }

    private ArrowFunction arrowFunction(CstNode node) throws CompilationException {
        CstNode header = node.nodes().get(0);
        CstNode body = node.nodes().get(1);
        List<Parameter> parameters = patterns.parameters(header);
        AstNode builtBody = body.rule() == CstRule.BLOCK
                ? new BlockStatement(statements(body))
                : buildExpression(body);
        return new ArrowFunction(parameters, builtBody);
    }

    private TemplateLiteral template(Token token) throws CompilationException {
        TemplateLiteralScanner.Scan scan = TemplateLiteralScanner.scan((String) token.value());
        List<Expression> expressions = new ArrayList<>();
        for (String source : scan.expressions()) {
            expressions.add(interpolation(source.strip()));
        }
        return new TemplateLiteral(scan.quasis(), expressions);
    }

    // Each interpolation runs through the full pipeline with a builder of its own.
    private Expression interpolation(String source) throws CompilationException {
        List<Token> tokens = new Lexer(source).scanTokens();
        CstNode expression = Parser.forExpression(tokens, new DiagnosticsEngine(), context.sourceName()).parseExpression();
        return new AstBuilder(context.embedded(source)).buildExpression(expression);
    }

    // endregion

    // region JSX

    private JsxElement jsxElement(CstNode node) throws CompilationException {
        String name = jsxName(node.child(CstRule.JSX_NAME));
        List<JsxAttributeItem> attributes = new ArrayList<>();
        for (CstNode part : node.nodes()) {
            if (part.rule() == CstRule.JSX_ATTRIBUTE) {
                attributes.add(jsxAttribute(part));
            } else if (part.rule() == CstRule.JSX_SPREAD_ATTRIBUTE) {
                attributes.add(new JsxSpreadAttribute(buildExpression(part.nodes().get(0))));
            }
        }
        boolean selfClosing = node.has(TokenType.JSX_SELF_CLOSE);
        return new JsxElement(name, attributes, selfClosing ? List.of() : jsxChildren(node), selfClosing);
    }

    private static String jsxName(CstNode name) {
        StringBuilder text = new StringBuilder();
        for (CstElement part : name.children()) {
            text.append(((CstToken) part).token().text());
        }
        return text.toString();
    }

    private JsxAttribute jsxAttribute(CstNode node) throws CompilationException {
        String name = node.firstToken().text();
        if (!node.has(TokenType.EQUAL)) {
            return new JsxAttribute(name, null);
        }
        Token string = node.token(TokenType.STRING);
        if (string != null) {
            return new JsxAttribute(name, new StringLiteral(HtmlEntities.decode((String) string.value())));
        }
        CstNode container = node.child(CstRule.JSX_EXPRESSION);
        return new JsxAttribute(name, buildExpression(container.nodes().get(0)));
    }

    private List<JsxChild> jsxChildren(CstNode node) throws CompilationException {
        List<JsxChildren.Span> spans = new ArrayList<>();
        boolean inChildren = false;
        for (CstElement part : node.children()) {
            if (part instanceof CstToken token) {
                if (token.type() == TokenType.JSX_CLOSE_TAG_OPEN) {
                    break;
                }
                if (token.type() == TokenType.JSX_TAG_END) {
                    inChildren = true;
                } else if (inChildren && token.type() == TokenType.JSX_TEXT) {
                    addText(spans, token.token());
                }
            } else if (inChildren) {
                CstNode child = (CstNode) part;
                spans.add(new JsxChildren.Span(child.start(), child.end(), jsxChild(child)));
            }
        }
        return JsxChildren.normalize(spans, context);
    }

    private JsxChild jsxChild(CstNode child) throws CompilationException {
        if (child.rule() == CstRule.JSX_EXPRESSION) {
            List<CstNode> expression = child.nodes();
            return expression.isEmpty() ? null : new JsxExpressionContainer(buildExpression(expression.get(0)));
        }
        return (JsxChild) buildExpression(child);
    }

    private static void addText(List<JsxChildren.Span> spans, Token token) {
        String text = token.text();
        int first = 0;
        int last = text.length();
        while (first < last && Character.isWhitespace(text.charAt(first))) first++;
        while (last > first && Character.isWhitespace(text.charAt(last - 1))) last--;
        if (first == last) {
            // Whitespace only: it stays part of the gap between its neighbours.
            return;
        }
        String value = HtmlEntities.decode(text.substring(first, last));
        spans.add(new JsxChildren.Span(token.start() + first, token.start() + last, new JsxText(value)));
    }

    // endregion
}
