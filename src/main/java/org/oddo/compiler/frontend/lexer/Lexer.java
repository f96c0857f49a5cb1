package org.oddo.compiler.frontend.lexer;

import org.oddo.compiler.api.CompilerErrorCode;
import org.oddo.compiler.api.LexException;
import org.oddo.compiler.api.SourcePosition;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Besides plain expression tokens the lexer tracks bracket nesting, JSX tags and children,
 * and the indentation of logical lines. Newlines are only significant outside brackets and JSX,
 * where they produce {@link TokenType#NEWLINE}, {@link TokenType#INDENT} and {@link TokenType#DEDENT}.
 * Any unrecognized input aborts tokenization with a {@link LexException}.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("return", TokenType.RETURN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("null", TokenType.NULL),
            Map.entry("typeof", TokenType.TYPEOF),
            Map.entry("void", TokenType.VOID),
            Map.entry("delete", TokenType.DELETE),
            Map.entry("instanceof", TokenType.INSTANCEOF),
            Map.entry("in", TokenType.IN),
            Map.entry("export", TokenType.EXPORT),
            Map.entry("import", TokenType.IMPORT),
            Map.entry("default", TokenType.DEFAULT)
    );

    // Longer spellings first, so that ">>>:=" wins over ">>:=", ">>>" and ">>".
    private static final List<Map.Entry<String, TokenType>> OPERATORS = List.of(
            Map.entry(">>>:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("<<:=", TokenType.COMPOUND_ASSIGN),
            Map.entry(">>:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("**:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("&&:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("||:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("??:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("+:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("-:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("*:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("/:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("%:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("&:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("|:=", TokenType.COMPOUND_ASSIGN),
            Map.entry("^:=", TokenType.COMPOUND_ASSIGN),
            Map.entry(">>>", TokenType.SHIFT_RIGHT_UNSIGNED),
            Map.entry("...", TokenType.ELLIPSIS),
            Map.entry("==", TokenType.EQUAL_EQUAL),
            Map.entry("!=", TokenType.BANG_EQUAL),
            Map.entry("<=", TokenType.LESS_EQUAL),
            Map.entry(">=", TokenType.GREATER_EQUAL),
            Map.entry("|>", TokenType.PIPE_GREATER),
            Map.entry("<|", TokenType.LESS_PIPE),
            Map.entry("<<", TokenType.SHIFT_LEFT),
            Map.entry(">>", TokenType.SHIFT_RIGHT),
            Map.entry("**", TokenType.STAR_STAR),
            Map.entry("&&", TokenType.AMP_AMP),
            Map.entry("||", TokenType.PIPE_PIPE),
            Map.entry("??", TokenType.QUESTION_QUESTION),
            Map.entry("?.", TokenType.QUESTION_DOT),
            Map.entry(":=", TokenType.COLON_EQUAL),
            Map.entry("=>", TokenType.ARROW),
            Map.entry("++", TokenType.PLUS_PLUS),
            Map.entry("--", TokenType.MINUS_MINUS),
            Map.entry("=", TokenType.EQUAL),
            Map.entry("+", TokenType.PLUS),
            Map.entry("-", TokenType.MINUS),
            Map.entry("*", TokenType.STAR),
            Map.entry("/", TokenType.SLASH),
            Map.entry("%", TokenType.PERCENT),
            Map.entry("<", TokenType.LESS),
            Map.entry(">", TokenType.GREATER),
            Map.entry("&", TokenType.AMP),
            Map.entry("|", TokenType.PIPE),
            Map.entry("^", TokenType.CARET),
            Map.entry("!", TokenType.BANG),
            Map.entry("~", TokenType.TILDE),
            Map.entry("?", TokenType.QUESTION),
            Map.entry(":", TokenType.COLON),
            Map.entry("(", TokenType.LEFT_PAREN),
            Map.entry(")", TokenType.RIGHT_PAREN),
            Map.entry("[", TokenType.LEFT_BRACKET),
            Map.entry("]", TokenType.RIGHT_BRACKET),
            Map.entry("{", TokenType.LEFT_BRACE),
            Map.entry("}", TokenType.RIGHT_BRACE),
            Map.entry(",", TokenType.COMMA),
            Map.entry(".", TokenType.DOT),
            Map.entry(";", TokenType.SEMICOLON)
    );

    // Tokens after which a '<' is a comparison rather than the start of a JSX element.
    private static final Set<TokenType> OPERAND_END = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING, TokenType.TEMPLATE,
            TokenType.TRUE, TokenType.FALSE, TokenType.NULL,
            TokenType.RIGHT_PAREN, TokenType.RIGHT_BRACKET, TokenType.RIGHT_BRACE,
            TokenType.PLUS_PLUS, TokenType.MINUS_MINUS,
            TokenType.JSX_TAG_END, TokenType.JSX_SELF_CLOSE
    );

    private enum Frame { PAREN, BRACKET, BRACE, JSX_TAG, JSX_CHILDREN, JSX_CLOSING_TAG }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean atLineStart = true;
    private boolean lineHasTokens = false;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
        this.indents.push(0);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     * @throws LexException if the source contains input that cannot be tokenized.
     */
    public List<Token> scanTokens() throws LexException {
        while (!isAtEnd()) {
            if (atLineStart && frames.isEmpty()) {
                indentation();
                if (isAtEnd()) {
                    break;
                }
            }
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        finish();
        return tokens;
    }

    private void scanToken() throws LexException {
        Frame frame = frames.peek();
        if (frame == Frame.JSX_CHILDREN) {
            jsxChild();
        } else if (frame == Frame.JSX_TAG || frame == Frame.JSX_CLOSING_TAG) {
            jsxTag(frame);
        } else {
            expressionToken();
        }
    }

    private void expressionToken() throws LexException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\f':
                return;
            case '\n':
                newline();
                return;
            case '"', '\'':
                string(c);
                return;
            case '`':
                template();
                return;
            case '@':
                modifier();
                return;
            default:
                break;
        }
        if (c == '/' && peek() == '/') {
            while (peek() != '\n' && !isAtEnd()) advance();
        } else if (c == '/' && peek() == '*') {
            blockComment();
        } else if (isDigit(c)) {
            number();
        } else if (isIdentifierStart(c)) {
            identifier();
        } else if (c == '<' && startsJsx()) {
            addToken(TokenType.JSX_TAG_OPEN);
            frames.push(Frame.JSX_TAG);
        } else {
            operator(c);
        }
    }

    private void operator(char c) throws LexException {
        for (Map.Entry<String, TokenType> op : OPERATORS) {
            String spelling = op.getKey();
            if (!source.startsWith(spelling, start)) {
                continue;
            }
            // "a?.5:b" is a conditional, not optional chaining.
            if (op.getValue() == TokenType.QUESTION_DOT && isDigit(charAt(start + 2))) {
                continue;
            }
            current = start + spelling.length();
            addToken(op.getValue());
            trackBrackets(op.getValue());
            return;
        }
        throw error(CompilerErrorCode.UNRECOGNIZED_CHARACTER, "Unexpected character '" + c + "'");
    }

    private void trackBrackets(TokenType type) {
        switch (type) {
            case LEFT_PAREN -> frames.push(Frame.PAREN);
            case LEFT_BRACKET -> frames.push(Frame.BRACKET);
            case LEFT_BRACE -> frames.push(Frame.BRACE);
            case RIGHT_PAREN -> popIf(Frame.PAREN);
            case RIGHT_BRACKET -> popIf(Frame.BRACKET);
            case RIGHT_BRACE -> popIf(Frame.BRACE);
            default -> { }
        }
    }

    private void popIf(Frame expected) {
        // A mismatched closer is left for the parser to report.
        if (frames.peek() == expected) {
            frames.pop();
        }
    }

    private boolean startsJsx() {
        char next = peek();
        if (!isIdentifierStart(next) && next != '>') {
            return false;
        }
        return tokens.isEmpty() || !OPERAND_END.contains(tokens.get(tokens.size() - 1).type());
    }

    private void newline() {
        if (frames.isEmpty()) {
            if (lineHasTokens) {
                addLayoutToken(TokenType.NEWLINE);
            }
            atLineStart = true;
            lineHasTokens = false;
        }
    }

    private void indentation() throws LexException {
        int width = 0;
        while (peek() == ' ' || peek() == '\t') {
            advance();
            width++;
        }
        while (peek() == '/' && peekNext() == '*') {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            advance();
            blockComment();
            while (peek() == ' ' || peek() == '\t') advance();
        }
        char c = peek();
        if (isAtEnd() || c == '\n' || c == '\r' || (c == '/' && peekNext() == '/')) {
            // Blank and comment-only lines do not affect indentation.
            return;
        }
        atLineStart = false;
        if (width > indents.peek()) {
            indents.push(width);
            addLayoutToken(TokenType.INDENT);
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            addLayoutToken(TokenType.DEDENT);
        }
        if (width != indents.peek()) {
            throw new LexException(CompilerErrorCode.INCONSISTENT_INDENTATION,
                    "Inconsistent indentation: dedent does not match any outer indentation level",
                    new SourcePosition(current, line, current - lineStart + 1));
        }
    }

    private void finish() throws LexException {
        start = current;
        startLine = line;
        startColumn = current - lineStart + 1;
        for (Frame frame : frames) {
            if (frame == Frame.JSX_TAG || frame == Frame.JSX_CHILDREN || frame == Frame.JSX_CLOSING_TAG) {
                throw error(CompilerErrorCode.UNTERMINATED_JSX, "Unterminated JSX element");
            }
        }
        if (lineHasTokens) {
            addLayoutToken(TokenType.NEWLINE);
        }
        while (indents.peek() > 0) {
            indents.pop();
            addLayoutToken(TokenType.DEDENT);
        }
        addLayoutToken(TokenType.END_OF_FILE);
    }

    private void jsxTag(Frame frame) throws LexException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n', '\f':
                return;
            case '"', '\'':
                jsxAttributeString(c);
                return;
            case '{':
                addToken(TokenType.LEFT_BRACE);
                frames.push(Frame.BRACE);
                return;
            case '.':
                addToken(TokenType.DOT);
                return;
            case '=':
                addToken(TokenType.EQUAL);
                return;
            case '>':
                addToken(TokenType.JSX_TAG_END);
                frames.pop();
                if (frame == Frame.JSX_TAG) {
                    frames.push(Frame.JSX_CHILDREN);
                } else {
                    // A closing tag also ends the children of its element.
                    frames.pop();
                }
                return;
            case '/':
                if (frame == Frame.JSX_TAG && match('>')) {
                    addToken(TokenType.JSX_SELF_CLOSE);
                    frames.pop();
                    return;
                }
                break;
            default:
                if (isIdentifierStart(c)) {
                    while (isIdentifierPart(peek()) || peek() == '-') advance();
                    addToken(TokenType.IDENTIFIER);
                    return;
                }
                break;
        }
        throw error(CompilerErrorCode.UNRECOGNIZED_CHARACTER, "Unexpected character '" + c + "' in JSX tag");
    }

    private void jsxChild() {
        char c = peek();
        if (c == '<') {
            advance();
            if (match('/')) {
                addToken(TokenType.JSX_CLOSE_TAG_OPEN);
                frames.push(Frame.JSX_CLOSING_TAG);
            } else {
                addToken(TokenType.JSX_TAG_OPEN);
                frames.push(Frame.JSX_TAG);
            }
            return;
        }
        if (c == '{') {
            advance();
            addToken(TokenType.LEFT_BRACE);
            frames.push(Frame.BRACE);
            return;
        }
        while (!isAtEnd() && peek() != '<' && peek() != '{') advance();
        addToken(TokenType.JSX_TEXT);
    }

    private void jsxAttributeString(char quote) throws LexException {
        while (peek() != quote) {
            if (isAtEnd()) {
                throw error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string literal");
            }
            advance();
        }
        advance();
        // JSX attribute strings carry no escape sequences.
        addToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private void identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void modifier() throws LexException {
        if (!isIdentifierStart(peek())) {
            throw error(CompilerErrorCode.UNRECOGNIZED_CHARACTER, "Expected a modifier name after '@'");
        }
        while (isIdentifierPart(peek())) advance();
        addToken(TokenType.MODIFIER, source.substring(start + 1, current));
    }

    private void number() throws LexException {
        double value;
        char prefix = Character.toLowerCase(peek());
        if (previous() == '0' && (prefix == 'x' || prefix == 'b' || prefix == 'o')) {
            advance();
            int radix = prefix == 'x' ? 16 : prefix == 'b' ? 2 : 8;
            int digitsStart = current;
            while (Character.digit(peek(), radix) >= 0) advance();
            if (current == digitsStart) {
                throw error(CompilerErrorCode.INVALID_NUMBER, "Invalid number format: " + source.substring(start, current));
            }
            value = new BigInteger(source.substring(digitsStart, current), radix).doubleValue();
        } else {
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
            }
            if ((peek() == 'e' || peek() == 'E')
                    && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(charAt(current + 2))))) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
            value = Double.parseDouble(source.substring(start, current));
        }
        if (isIdentifierPart(peek())) {
            throw error(CompilerErrorCode.INVALID_NUMBER, "Invalid number format: " + source.substring(start, current + 1));
        }
        addToken(TokenType.NUMBER, value);
    }

    private void string(char quote) throws LexException {
        while (peek() != quote) {
            if (isAtEnd() || peek() == '\n') {
                throw error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string literal");
            }
            if (advance() == '\\' && !isAtEnd()) {
                advance();
            }
        }
        advance();
        try {
            addToken(TokenType.STRING, StringEscapes.unescape(source.substring(start + 1, current - 1)));
        } catch (IllegalArgumentException e) {
            throw error(CompilerErrorCode.INVALID_ESCAPE, e.getMessage());
        }
    }

    private void template() throws LexException {
        int end = InterpolationScanner.templateEnd(source, current);
        if (end < 0) {
            throw error(CompilerErrorCode.UNTERMINATED_TEMPLATE, "Unterminated template literal");
        }
        while (current < end) advance();
        // The value is the raw text between the backticks; it is split into quasis later.
        addToken(TokenType.TEMPLATE, source.substring(start + 1, current - 1));
    }

    private void blockComment() throws LexException {
        advance();
        while (!(peek() == '*' && peekNext() == '/')) {
            if (isAtEnd()) {
                throw error(CompilerErrorCode.UNTERMINATED_COMMENT, "Unterminated block comment");
            }
            advance();
        }
        advance();
        advance();
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, start, current, startLine, startColumn));
        lineHasTokens = true;
    }

    private void addLayoutToken(TokenType type) {
        tokens.add(new Token(type, "", null, current, current, line, current - lineStart + 1));
    }

    private LexException error(CompilerErrorCode code, String message) {
        return new LexException(code, message, new SourcePosition(start, startLine, startColumn));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private boolean match(char expected) {
        if (peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return charAt(current);
    }

    private char peekNext() {
        return charAt(current + 1);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }
}
