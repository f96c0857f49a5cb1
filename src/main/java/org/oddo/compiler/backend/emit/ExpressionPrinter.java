package org.oddo.compiler.backend.emit;

import org.oddo.compiler.api.CompileException;
import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prints AST expressions as JavaScript source text.
 * <p>
 * Oddo-only constructs are lowered while printing: pipes and composition become calls,
 * array slices become {@code slice} and {@code splice} calls, {@code ==} and {@code !=} become
 * strict comparisons and {@code :=} forms become plain JavaScript assignments. Parentheses are
 * inserted from JavaScript operator precedence, since the AST carries none.
 */
final class ExpressionPrinter {

    // JavaScript precedence levels, lowest first.
    static final int LOWEST = 0;
    static final int ASSIGNMENT = 2;
    private static final int LOGICAL_OR = 3;
    private static final int LOGICAL_AND = 4;
    private static final int UNARY = 14;
    private static final int POSTFIX = 15;
    private static final int CALL = 17;
    private static final int PRIMARY = 20;

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("|", 5),
            Map.entry("^", 6),
            Map.entry("&", 7),
            Map.entry("==", 8), Map.entry("!=", 8),
            Map.entry("<", 9), Map.entry(">", 9), Map.entry("<=", 9), Map.entry(">=", 9),
            Map.entry("instanceof", 9), Map.entry("in", 9),
            Map.entry("<<", 10), Map.entry(">>", 10), Map.entry(">>>", 10),
            Map.entry("+", 11), Map.entry("-", 11),
            Map.entry("*", 12), Map.entry("/", 12), Map.entry("%", 12),
            Map.entry("**", 13)
    );

    private final CodeGenerator generator;

    ExpressionPrinter(CodeGenerator generator) {
        this.generator = generator;
    }

    /**
     * Prints an expression, parenthesized if it binds weaker than the surrounding context allows.
     * @param expression The expression to print.
     * @param minimum The lowest precedence that can stand in this position without parentheses.
     * @return The JavaScript text.
     * @throws CompileException if the expression contains a construct with no JavaScript form.
     */
    String print(Expression expression, int minimum) throws CompileException {
        String text = render(expression);
        return precedence(expression) < minimum ? "(" + text + ")" : text;
    }

    // region Precedence

    private static int precedence(Expression expression) {
        if (expression instanceof Binary binary) {
            return BINARY_PRECEDENCE.getOrDefault(binary.operator(), PRIMARY);
        }
        if (expression instanceof Logical logical) {
            return "&&".equals(logical.operator()) ? LOGICAL_AND : LOGICAL_OR;
        }
        if (expression instanceof NullishCoalescing) {
            return LOGICAL_OR;
        }
        if (expression instanceof Assignment || expression instanceof ArrowFunction
                || expression instanceof Conditional || expression instanceof SpreadElement
                || expression instanceof Declaration) {
            return ASSIGNMENT;
        }
        if (expression instanceof Unary) {
            return UNARY;
        }
        if (expression instanceof Update update) {
            return update.prefix() ? UNARY : POSTFIX;
        }
        if (expression instanceof NumberLiteral number) {
            return numberText(number).startsWith("-") ? UNARY : PRIMARY;
        }
        if (expression instanceof Call || expression instanceof MemberAccess || expression instanceof TaggedTemplate
                || expression instanceof ArraySlice || expression instanceof ArraySliceAssignment
                || expression instanceof Pipe || expression instanceof Compose) {
            return CALL;
        }
        return PRIMARY;
    }

    // endregion

    private String render(Expression expression) throws CompileException {
        if (expression instanceof Identifier identifier) {
            return identifier.name();
        }
        if (expression instanceof NumberLiteral number) {
            return numberText(number);
        }
        if (expression instanceof StringLiteral string) {
            return quote(string.value());
        }
        if (expression instanceof BooleanLiteral bool) {
            return String.valueOf(bool.value());
        }
        if (expression instanceof NullLiteral) {
            return "null";
        }
        if (expression instanceof TemplateLiteral template) {
            return template(template);
        }
        if (expression instanceof TaggedTemplate tagged) {
            return print(tagged.tag(), CALL) + template(tagged.template());
        }
        if (expression instanceof ArrayLiteral array) {
            return "[" + list(array.elements()) + "]";
        }
        if (expression instanceof ObjectLiteral object) {
            return object(object);
        }
        if (expression instanceof SpreadElement spread) {
            return "..." + print(spread.argument(), ASSIGNMENT);
        }
        if (expression instanceof ArrowFunction arrow) {
            return arrow(arrow);
        }
        if (expression instanceof Call call) {
            return print(call.callee(), CALL) + (call.optional() ? "?.(" : "(") + list(call.arguments()) + ")";
        }
        if (expression instanceof MemberAccess member) {
            return member(member);
        }
        if (expression instanceof ArraySlice slice) {
            return sliceRead(slice);
        }
        if (expression instanceof ArraySliceAssignment assignment) {
            return render(sliceWrite(assignment));
        }
        if (expression instanceof Binary binary) {
            return binary(binary);
        }
        if (expression instanceof Logical logical) {
            return logical(logical.operator(), logical.left(), logical.right());
        }
        if (expression instanceof NullishCoalescing nullish) {
            return logical("??", nullish.left(), nullish.right());
        }
        if (expression instanceof Unary unary) {
            return unary(unary);
        }
        if (expression instanceof Update update) {
            return update.prefix()
                    ? update.operator() + print(update.argument(), POSTFIX)
                    : print(update.argument(), CALL) + update.operator();
        }
        if (expression instanceof Conditional conditional) {
            return print(conditional.test(), LOGICAL_OR) + " ? " + print(conditional.consequent(), ASSIGNMENT)
                    + " : " + print(conditional.alternate(), ASSIGNMENT);
        }
        if (expression instanceof Assignment assignment) {
            return assignmentTarget(assignment.target()) + " " + assignmentOperator(assignment.operator()) + " "
                    + print(assignment.value(), ASSIGNMENT);
        }
        if (expression instanceof Pipe pipe) {
            return print(pipe.right(), CALL) + "(" + print(pipe.left(), ASSIGNMENT) + ")";
        }
        if (expression instanceof Compose compose) {
            return print(compose.left(), CALL) + "(" + print(compose.right(), ASSIGNMENT) + ")";
        }
        if (expression instanceof JsxElement element) {
            return jsxElement(element);
        }
        if (expression instanceof JsxFragment fragment) {
            return "<>" + jsxChildren(fragment.children()) + "</>";
        }
        if (expression instanceof Declaration) {
            throw new CompileException(CompilerErrorCode.INVALID_DECLARATION_TARGET,
                    "A declaration with = must be a statement of its own; use := to assign inside an expression");
        }
        throw new CompileException(CompilerErrorCode.UNSUPPORTED_NODE, "Unsupported expression: " + expression.type());
    }

    // region Operators

    private String binary(Binary binary) throws CompileException {
        int level = precedence(binary);
        String operator = switch (binary.operator()) {
            case "==" -> "===";
            case "!=" -> "!==";
            default -> binary.operator();
        };
        if ("**".equals(operator)) {
            // Right-associative; a unary operand on the left is a syntax error without parentheses.
            return print(binary.left(), POSTFIX) + " ** " + print(binary.right(), level);
        }
        return print(binary.left(), level) + " " + operator + " " + print(binary.right(), level + 1);
    }

    private String logical(String operator, Expression left, Expression right) throws CompileException {
        int level = "&&".equals(operator) ? LOGICAL_AND : LOGICAL_OR;
        return operand(operator, left, level) + " " + operator + " " + operand(operator, right, level + 1);
    }

    // '??' cannot be mixed with '||' or '&&' without parentheses.
    private String operand(String operator, Expression operand, int minimum) throws CompileException {
        boolean nullish = "??".equals(operator);
        boolean mixed = nullish ? operand instanceof Logical : operand instanceof NullishCoalescing;
        return mixed ? "(" + render(operand) + ")" : print(operand, minimum);
    }

    private String unary(Unary unary) throws CompileException {
        String operator = unary.operator();
        String argument = print(unary.argument(), UNARY);
        if (Character.isLetter(operator.charAt(0))) {
            return operator + " " + argument;
        }
        if (("-".equals(operator) || "+".equals(operator)) && argument.startsWith(operator)) {
            // '-(-1)' and '+(+x)' must not run together into '--' or '++'.
            argument = "(" + argument + ")";
        }
        return operator + argument;
    }

    private static String assignmentOperator(String operator) {
        // ':=' assigns, 'op:=' is the compound form of 'op='.
        return operator.substring(0, operator.length() - 2) + "=";
    }

    private String assignmentTarget(AstNode target) throws CompileException {
        if (target instanceof PatternTarget pattern && !(target instanceof Identifier)) {
            return pattern(pattern);
        }
        return print((Expression) target, CALL);
    }

    // endregion

    // region Access and slices

    private String member(MemberAccess member) throws CompileException {
        String object = print(member.object(), CALL);
        if (member.object() instanceof NumberLiteral number && !member.computed() && isInteger(numberText(number))) {
            object = "(" + object + ")";
        }
        if (member.computed()) {
            return object + (member.optional() ? "?.[" : "[") + print(member.property(), LOWEST) + "]";
        }
        return object + (member.optional() ? "?." : ".") + ((Identifier) member.property()).name();
    }

    private String sliceRead(ArraySlice slice) throws CompileException {
        List<Expression> arguments = new ArrayList<>();
        arguments.add(slice.start() != null ? slice.start() : number(0));
        if (slice.end() != null) {
            arguments.add(slice.end());
        }
        return render(new Call(new MemberAccess(slice.object(), new Identifier("slice"), false, false), arguments, false));
    }

    // a[s...e] := v  ->  Array.prototype.splice.apply(a, [s, e - s].concat(v))
    private static Call sliceWrite(ArraySliceAssignment assignment) {
        ArraySlice slice = assignment.slice();
        Expression object = slice.object();
        Expression start = slice.start() != null ? slice.start() : number(0);
        Expression length = new MemberAccess(object, new Identifier("length"), false, false);
        Expression deleteCount;
        if (slice.start() == null) {
            deleteCount = slice.end() != null ? slice.end() : length;
        } else if (slice.end() == null) {
            deleteCount = new Binary("-", length, start);
        } else if (slice.start() instanceof NumberLiteral from && slice.end() instanceof NumberLiteral to) {
            deleteCount = number(to.value() - from.value());
        } else {
            deleteCount = new Binary("-", slice.end(), start);
        }
        Expression replacement = new Call(
                new MemberAccess(new ArrayLiteral(List.of(start, deleteCount)), new Identifier("concat"), false, false),
                List.of(assignment.value()), false);
        Expression splice = new MemberAccess(
                new MemberAccess(
                        new MemberAccess(new Identifier("Array"), new Identifier("prototype"), false, false),
                        new Identifier("splice"), false, false),
                new Identifier("apply"), false, false);
        return new Call(splice, List.of(object, replacement), false);
    }

    // endregion

    // region Literals and functions

    private String template(TemplateLiteral template) throws CompileException {
        StringBuilder text = new StringBuilder("`");
        List<TemplateElement> quasis = template.quasis();
        for (int i = 0; i < quasis.size(); i++) {
            text.append(quasis.get(i).raw());
            if (i < template.expressions().size()) {
                text.append("${").append(print(template.expressions().get(i), LOWEST)).append("}");
            }
        }
        return text.append('`').toString();
    }

    private String object(ObjectLiteral object) throws CompileException {
        if (object.properties().isEmpty()) {
            return "{}";
        }
        List<String> members = new ArrayList<>();
        for (ObjectMember member : object.properties()) {
            if (member instanceof SpreadProperty spread) {
                members.add("..." + print(spread.argument(), ASSIGNMENT));
            } else if (member instanceof Property property) {
                members.add(property(property));
            } else {
                throw new CompileException(CompilerErrorCode.UNSUPPORTED_NODE, "Unsupported object member: " + member.type());
            }
        }
        return "{ " + String.join(", ", members) + " }";
    }

    private String property(Property property) throws CompileException {
        if (property.shorthand()) {
            return ((Identifier) property.key()).name();
        }
        String key = property.computed() ? "[" + print(property.key(), ASSIGNMENT) + "]" : key(property.key());
        return key + ": " + print(property.value(), ASSIGNMENT);
    }

    private static String key(Expression key) {
        if (key instanceof StringLiteral string) {
            return quote(string.value());
        }
        if (key instanceof NumberLiteral number) {
            return numberText(number);
        }
        return ((Identifier) key).name();
    }

    private String arrow(ArrowFunction arrow) throws CompileException {
        List<Parameter> parameters = arrow.parameters();
        String head;
        if (parameters.size() == 1 && parameters.get(0) instanceof SimpleParameter single && single.defaultValue() == null) {
            head = single.name();
        } else {
            List<String> printed = new ArrayList<>();
            for (Parameter parameter : parameters) {
                printed.add(parameter(parameter));
            }
            head = "(" + String.join(", ", printed) + ")";
        }
        if (arrow.body() instanceof BlockStatement block) {
            return head + " => " + generator.block(block.body());
        }
        String body = print((Expression) arrow.body(), ASSIGNMENT);
        return head + " => " + (body.startsWith("{") ? "(" + body + ")" : body);
    }

    private String parameter(Parameter parameter) throws CompileException {
        if (parameter instanceof SimpleParameter simple) {
            return simple.name() + defaultValue(simple.defaultValue());
        }
        if (parameter instanceof PatternParameter pattern) {
            return pattern(pattern.pattern()) + defaultValue(pattern.defaultValue());
        }
        if (parameter instanceof RestParameter rest) {
            return "..." + rest.name();
        }
        throw new CompileException(CompilerErrorCode.UNSUPPORTED_NODE, "Unsupported parameter: " + parameter.type());
    }

    /**
     * Prints a binding pattern as used by declarations, destructuring assignments and parameters.
     * @param pattern The pattern.
     * @return The JavaScript text.
     * @throws CompileException if a default value cannot be printed.
     */
    String pattern(PatternTarget pattern) throws CompileException {
        if (pattern instanceof Identifier identifier) {
            return identifier.name();
        }
        List<String> parts = new ArrayList<>();
        if (pattern instanceof ArrayPattern array) {
            for (AstNode element : array.elements()) {
                if (element instanceof PatternDefault withDefault) {
                    parts.add(pattern(withDefault.target()) + defaultValue(withDefault.defaultValue()));
                } else {
                    parts.add(pattern((PatternTarget) element));
                }
            }
            if (array.rest() != null) {
                parts.add("..." + pattern(array.rest()));
            }
            return "[" + String.join(", ", parts) + "]";
        }
        if (pattern instanceof ObjectPattern object) {
            for (PatternProperty property : object.properties()) {
                String value = property.shorthand()
                        ? key(property.key())
                        : key(property.key()) + ": " + pattern(property.value());
                parts.add(value + defaultValue(property.defaultValue()));
            }
            if (object.rest() != null) {
                parts.add("..." + pattern(object.rest()));
            }
            return parts.isEmpty() ? "{}" : "{ " + String.join(", ", parts) + " }";
        }
        throw new CompileException(CompilerErrorCode.UNSUPPORTED_NODE, "Unsupported pattern: " + pattern.type());
    }

    private String defaultValue(Expression value) throws CompileException {
        return value == null ? "" : " = " + print(value, ASSIGNMENT);
    }

    private String list(List<Expression> expressions) throws CompileException {
        List<String> printed = new ArrayList<>();
        for (Expression expression : expressions) {
            printed.add(print(expression, ASSIGNMENT));
        }
        return String.join(", ", printed);
    }

    private static NumberLiteral number(double value) {
        return new NumberLiteral(value, null);
    }

    static String numberText(NumberLiteral number) {
        if (number.raw() != null) {
            return number.raw();
        }
        double value = number.value();
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static boolean isInteger(String text) {
        return text.chars().allMatch(Character::isDigit);
    }

    /**
     * Quotes a string as a double-quoted JavaScript string literal.
     * @param value The string value.
     * @return The literal text.
     */
    static String quote(String value) {
        StringBuilder text = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> text.append("\\\"");
                case '\\' -> text.append("\\\\");
                case '\n' -> text.append("\\n");
                case '\r' -> text.append("\\r");
                case '\t' -> text.append("\\t");
                case '\u2028' -> text.append("\\u2028");
                case '\u2029' -> text.append("\\u2029");
                default -> {
                    if (c < 0x20) {
                        text.append(String.format("\\u%04x", (int) c));
                    } else {
                        text.append(c);
                    }
                }
            }
        }
        return text.append('"').toString();
    }

    // endregion

    // region JSX

    private String jsxElement(JsxElement element) throws CompileException {
        StringBuilder text = new StringBuilder("<").append(element.name());
        for (JsxAttributeItem attribute : element.attributes()) {
            text.append(' ').append(jsxAttribute(attribute));
        }
        if (element.selfClosing()) {
            return text.append(" />").toString();
        }
        return text.append('>').append(jsxChildren(element.children()))
                .append("</").append(element.name()).append('>').toString();
    }

    private String jsxAttribute(JsxAttributeItem attribute) throws CompileException {
        if (attribute instanceof JsxSpreadAttribute spread) {
            return "{..." + print(spread.argument(), ASSIGNMENT) + "}";
        }
        JsxAttribute plain = (JsxAttribute) attribute;
        if (plain.value() == null) {
            return plain.name();
        }
        if (plain.value() instanceof StringLiteral string) {
            String value = string.value();
            boolean entityLike = value.indexOf('&') >= 0;
            if (!entityLike && value.indexOf('"') < 0) {
                return plain.name() + "=\"" + value + "\"";
            }
            if (!entityLike && value.indexOf('\'') < 0) {
                return plain.name() + "='" + value + "'";
            }
            return plain.name() + "={" + quote(value) + "}";
        }
        return plain.name() + "={" + print(plain.value(), ASSIGNMENT) + "}";
    }

    private String jsxChildren(List<JsxChild> children) throws CompileException {
        StringBuilder text = new StringBuilder();
        for (JsxChild child : children) {
            if (child instanceof JsxText jsxText) {
                text.append(jsxText(jsxText.value()));
            } else if (child instanceof JsxExpressionContainer container) {
                text.append('{').append(print(container.expression(), ASSIGNMENT)).append('}');
            } else {
                text.append(render((Expression) child));
            }
        }
        return text.toString();
    }

    private static String jsxText(String value) {
        boolean significant = value.chars().anyMatch(c -> c == '{' || c == '}' || c == '<' || c == '>' || c == '&');
        // Text that only consists of whitespace would be dropped by a JSX parser.
        return significant || value.isBlank() ? "{" + quote(value) + "}" : value;
    }

    // endregion
}
