package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits Python source text into {@link Token}s following the rules of the language's own
 * {@code tokenize} module: INDENT/DEDENT from leading whitespace, NEWLINE at the end of a
 * logical line, NL for blank lines, comment lines and line breaks inside brackets.
 *
 * <p>Columns are 0-based character offsets into the physical line, lines are 1-based.
 */
@RequiredArgsConstructor
public final class Scanner {

    public static record Message(int line, int column, String message) {

        @Override
        public String toString() {
            return message + " [line " + line + ", col " + column + "]";
        }
    }

    static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "t",
        "br", "rb", "fr", "rf", "tr", "rt");

    // longest first
    static final List<String> OPERATORS = List.of(
        "**=", "//=", ">>=", "<<=", "...",
        "!=", "%=", "&=", "**", "*=", "+=", "-=", "->", "//", "/=", ":=",
        "<<", "<=", "<>", "==", ">=", ">>", "@=", "^=", "|=",
        "%", "&", "(", ")", "*", "+", ",", "-", ".", "/", ":", ";",
        "<", "=", ">", "@", "[", "]", "^", "{", "|", "}", "~");

    private static final String DIGITS = "[0-9](?:_?[0-9])*";
    private static final String EXPONENT = "[eE][-+]?" + DIGITS;
    private static final String POINT_FLOAT =
        "(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:" + EXPONENT + ")?";
    private static final String EXP_FLOAT = DIGITS + EXPONENT;
    private static final String FLOAT = "(?:" + POINT_FLOAT + "|" + EXP_FLOAT + ")";
    private static final String IMAGINARY = "(?:" + DIGITS + "[jJ]|" + FLOAT + "[jJ])";
    private static final String INTEGER = "(?:0[xX](?:_?[0-9a-fA-F])+"
        + "|0[bB](?:_?[01])+"
        + "|0[oO](?:_?[0-7])+"
        + "|0(?:_?0)*|[1-9](?:_?[0-9])*)";
    private static final Pattern NUMBER_PATTERN =
        Pattern.compile(IMAGINARY + "|" + FLOAT + "|" + INTEGER);

    private final @NonNull String source;
    private final List<Token> tokens = new ArrayList<>();

    @Getter
    private final List<Message> errors = new ArrayList<>();

    private final List<Integer> indents = new ArrayList<>(List.of(0));

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    private int startLine = 1;
    private int startLineOffset = 0;
    private int parenLevel = 0;
    private int logicalLine = 0;
    private boolean continued = false;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<Token> getTokens() {
        if (!tokens.isEmpty()) {
            return tokens;
        }

        if (source.startsWith("\uFEFF")) {
            current = 1;
            lineStart = 1;
        }

        var lineBegins = true;
        while (!isAtEnd()) {
            if (lineBegins) {
                lineBegins = false;
                if (parenLevel <= 0 && !continued) {
                    if (!indentation()) {
                        lineBegins = true;
                        continue;
                    }
                } else {
                    continued = false;
                }
            }
            if (isAtEnd()) {
                break;
            }
            markStart();
            lineBegins = scanToken();
        }

        finish();
        return tokens;
    }

    /**
     * Handles the start of a physical line that begins a new statement.
     *
     * @return false when the whole line was consumed as a blank or comment-only line
     */
    private boolean indentation() {
        var column = 0;
        while (!isAtEnd()) {
            var c = peek();
            if (c == ' ') {
                column++;
            } else if (c == '\t') {
                column = (column / 8 + 1) * 8;
            } else if (c == '\f') {
                column = 0;
            } else {
                break;
            }
            advance();
        }
        if (isAtEnd()) {
            return false;
        }

        var c = peek();
        if (c == '#' || isLineBreak()) {
            if (c == '#') {
                markStart();
                comment();
            }
            markStart();
            if (isLineBreak()) {
                lineBreak(NL);
            } else {
                addToken(NL);
                logicalLine++;
            }
            return false;
        }

        var indent = indents.get(indents.size() - 1);
        if (column > indent) {
            indents.add(column);
            start = lineStart;
            startLine = line;
            startLineOffset = lineStart;
            addToken(INDENT);
        }
        while (column < indents.get(indents.size() - 1)) {
            if (!indents.contains(column)) {
                error("unindent does not match any outer indentation level");
                var level = column;
                indents.removeIf(open -> open > level);
                indents.add(level);
                break;
            }
            indents.remove(indents.size() - 1);
            markStart();
            addToken(DEDENT);
        }
        return true;
    }

    /**
     * @return true when the token ended the physical line
     */
    private boolean scanToken() {
        var c = peek();
        switch (c) {
        case ' ':
        case '\t':
        case '\f':
            advance();
            return false;

        case '#':
            comment();
            return false;

        case '\r':
        case '\n':
            if (isLineBreak()) {
                lineBreak(parenLevel > 0 ? NL : NEWLINE);
                return true;
            }
            advance();
            addToken(ERRORTOKEN);
            return false;

        case '\\':
            advance();
            if (isLineBreak()) {
                consumeLineBreak();
                nextLine();
                continued = true;
                return true;
            }
            addToken(ERRORTOKEN);
            return false;

        case '\'':
        case '"':
            string("");
            return false;

        default:
            if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
                number();
            } else if (isIdentifierStart(source.codePointAt(current))) {
                identifier();
            } else {
                operator();
            }
            return false;
        }
    }

    private void comment() {
        while (!isAtEnd() && !isLineBreak()) {
            advance();
        }
        addToken(COMMENT);
    }

    private void lineBreak(Token.Type type) {
        consumeLineBreak();
        addToken(type, startLine, current - startLineOffset);
        if (type == NEWLINE || parenLevel <= 0) {
            logicalLine++;
        }
        nextLine();
    }

    private void identifier() {
        while (!isAtEnd() && isIdentifierPart(source.codePointAt(current))) {
            current += Character.charCount(source.codePointAt(current));
        }
        var word = source.substring(start, current);
        if (isQuote(peek()) && STRING_PREFIXES.contains(word.toLowerCase())) {
            string(word);
        } else {
            addToken(NAME);
        }
    }

    private void number() {
        // always matches: every caller starts on a digit or on '.' followed by one
        var matcher = NUMBER_PATTERN.matcher(source).region(current, source.length());
        matcher.lookingAt();
        current = matcher.end();
        addToken(NUMBER);
    }

    private void operator() {
        for (var op : OPERATORS) {
            if (source.startsWith(op, current)) {
                current += op.length();
                if (op.length() == 1) {
                    switch (op.charAt(0)) {
                    case '(':
                    case '[':
                    case '{':
                        parenLevel++;
                        break;
                    case ')':
                    case ']':
                    case '}':
                        parenLevel--;
                        break;
                    default:
                        break;
                    }
                }
                addToken(OP);
                return;
            }
        }
        current += Character.charCount(source.codePointAt(current));
        addToken(ERRORTOKEN);
    }

    private void string(String prefix) {
        var lower = prefix.toLowerCase();
        var formatted = lower.contains("f") || lower.contains("t");
        if (stringBody(formatted)) {
            addToken(STRING);
        }
    }

    /**
     * Consumes a quoted body starting at the opening quote.
     *
     * @return false if the literal is unterminated, an error has then been recorded
     */
    private boolean stringBody(boolean formatted) {
        var quote = advance();
        var triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
        } else if (peek() == quote) {
            // empty literal
            advance();
            return true;
        }

        for (;;) {
            if (isAtEnd()) {
                error(triple ? "EOF in multi-line string" : "unterminated string literal");
                return false;
            }
            var c = peek();
            if (!triple && isLineBreak()) {
                error("unterminated string literal");
                return false;
            }
            if (c == '\\') {
                advance();
                if (isLineBreak()) {
                    consumeLineBreak();
                    nextLine();
                } else if (!isAtEnd()) {
                    advance();
                }
            } else if (c == quote && (!triple || (peekNext() == quote && peekAt(2) == quote))) {
                current += triple ? 3 : 1;
                return true;
            } else if (formatted && c == '{') {
                advance();
                if (peek() == '{') {
                    advance();
                } else if (!replacementField(triple)) {
                    return false;
                }
            } else if (c == '\n') {
                advance();
                nextLine();
            } else {
                advance();
            }
        }
    }

    /**
     * Skips an f-string replacement field up to its closing brace; the opening brace has been
     * consumed. Nested string literals may reuse the enclosing quote.
     */
    private boolean replacementField(boolean triple) {
        var nesting = 0;
        for (;;) {
            if (isAtEnd() || (!triple && isLineBreak())) {
                error("unterminated string literal");
                return false;
            }
            var c = peek();
            if (isQuote(c)) {
                if (!stringBody(false)) {
                    return false;
                }
                continue;
            }
            if (isIdentifierStart(c)) {
                var wordStart = current;
                while (!isAtEnd() && isIdentifierPart(peek())) {
                    advance();
                }
                var word = source.substring(wordStart, current).toLowerCase();
                if (isQuote(peek()) && STRING_PREFIXES.contains(word)
                        && !stringBody(word.contains("f") || word.contains("t"))) {
                    return false;
                }
                continue;
            }
            advance();
            switch (c) {
            case '\n':
                nextLine();
                break;
            case '(':
            case '[':
            case '{':
                nesting++;
                break;
            case ')':
            case ']':
                nesting--;
                break;
            case '}':
                if (nesting == 0) {
                    return true;
                }
                nesting--;
                break;
            case ':':
                if (nesting == 0) {
                    return formatSpec(triple);
                }
                break;
            default:
                break;
            }
        }
    }

    private boolean formatSpec(boolean triple) {
        for (;;) {
            if (isAtEnd() || (!triple && isLineBreak())) {
                error("unterminated string literal");
                return false;
            }
            var c = advance();
            if (c == '{') {
                if (!replacementField(triple)) {
                    return false;
                }
            } else if (c == '}') {
                return true;
            } else if (c == '\n') {
                nextLine();
            }
        }
    }

    private void finish() {
        if (parenLevel > 0 || continued) {
            error("EOF in multi-line statement");
        }
        markStart();
        var last = last();
        if (last != null && last.type() != NEWLINE && last.type() != NL) {
            addToken(NEWLINE);
            logicalLine++;
        }
        if (current > lineStart) {
            nextLine();
            markStart();
        }
        for (var i = 1; i < indents.size(); i++) {
            addToken(DEDENT);
        }
        addToken(ENDMARKER);
    }

    private void markStart() {
        start = current;
        startLine = line;
        startLineOffset = lineStart;
    }

    private void nextLine() {
        line++;
        lineStart = current;
    }

    private boolean isLineBreak() {
        var c = peek();
        return c == '\n' || (c == '\r' && peekNext() == '\n');
    }

    private void consumeLineBreak() {
        if (peek() == '\r') {
            advance();
        }
        advance();
    }

    /**
     * The letters in front of the opening quote of a string literal.
     */
    static String prefixOf(String literal) {
        var i = 0;
        while (i < literal.length() && !isQuote(literal.charAt(i))) {
            i++;
        }
        return literal.substring(0, i);
    }

    static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(int c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(int c) {
        return c == '_' || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) {
            return '\0';
        }
        return source.charAt(current + offset);
    }

    private Token last() {
        if (tokens.isEmpty()) {
            return null;
        }
        return tokens.get(tokens.size() - 1);
    }

    private String physicalLine(int offset) {
        var end = source.indexOf('\n', offset);
        return end < 0 ? source.substring(offset) : source.substring(offset, end + 1);
    }

    private void addToken(Token.Type type) {
        addToken(type, line, current - lineStart);
    }

    private void addToken(Token.Type type, int endLine, int endColumn) {
        var text = source.substring(start, current);
        var begin = new Token.Position(startLine, start - startLineOffset);
        var end = new Token.Position(endLine, endColumn);
        tokens.add(new Token(type, text, begin, end, physicalLine(startLineOffset), logicalLine));
    }

    private void error(String msg) {
        errors.add(new Message(line, current - lineStart, msg));
    }
}
