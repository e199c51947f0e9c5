package pyminimizer.lang;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Decides what goes between two tokens that end up next to each other on an output line.
 *
 * <p>A missing separator that lets two tokens fuse changes the program, a superfluous one only
 * costs a byte, so every case this table does not know about gets a separator.
 */
@RequiredArgsConstructor
final class SpacingEngine {

    private final @NonNull MinimizerOptions options;

    /**
     * @return the text to write between {@code prev} and {@code next}, possibly empty
     */
    String separator(Token prev, Token next) {
        if (options.keepWhitespace()) {
            return originalGap(prev, next);
        }
        return needsSpace(prev, next) ? options.whitespaceChar() : "";
    }

    /**
     * The separator written in front of a kept inline comment; {@code prev} is null when the
     * comment starts a continuation line.
     */
    String separatorBeforeComment(Token prev, Token comment) {
        if (prev == null) {
            return "";
        }
        if (options.keepWhitespace() && sameLine(prev, comment)) {
            return originalGap(prev, comment);
        }
        return options.whitespaceChar();
    }

    private String originalGap(Token prev, Token next) {
        if (!sameLine(prev, next)) {
            // joined continuation line
            return options.whitespaceChar();
        }
        var from = prev.end().column();
        var to = next.start().column();
        if (to <= from || to > next.line().length()) {
            return "";
        }
        return next.line().substring(from, to);
    }

    private static boolean sameLine(Token prev, Token next) {
        return prev.end().line() == next.start().line();
    }

    static boolean needsSpace(Token prev, Token next) {
        switch (prev.type()) {
        case NAME:
            switch (next.type()) {
            case NAME:
            case NUMBER:
                return true;
            case STRING:
                return isStringPrefix(prev.lexeme()) || hasPrefix(next);
            case OP:
                return false;
            default:
                return true;
            }

        case NUMBER:
            switch (next.type()) {
            case NAME:
            case NUMBER:
                return true;
            case OP:
                // 1 .real must not read as the float 1.
                return next.lexeme().startsWith(".");
            case STRING:
                // 0x1 b'' would read as 0x1b ''
                return hasPrefix(next);
            default:
                return true;
            }

        case STRING:
            switch (next.type()) {
            case STRING:
                return opensTripleQuote(prev.lexeme(), next.lexeme());
            case NAME:
            case NUMBER:
            case OP:
                return false;
            default:
                return true;
            }

        case OP:
            switch (next.type()) {
            case OP:
                return operatorsFuse(prev.lexeme(), next.lexeme());
            case NUMBER:
                // . 5 must not read as the float .5
                return prev.lexeme().endsWith(".") && Character.isDigit(next.lexeme().charAt(0));
            case NAME:
            case STRING:
                return false;
            default:
                return true;
            }

        default:
            return true;
        }
    }

    private static boolean isStringPrefix(String name) {
        return Scanner.STRING_PREFIXES.contains(name.toLowerCase());
    }

    private static boolean hasPrefix(Token string) {
        return !Scanner.prefixOf(string.lexeme()).isEmpty();
    }

    /**
     * An empty literal followed by a literal opening with the same quote reads as a triple
     * quote: {@code "" "x"} must not become {@code """x"}.
     */
    private static boolean opensTripleQuote(String prev, String next) {
        var body = prev.substring(Scanner.prefixOf(prev).length());
        return body.length() == 2 && body.charAt(0) == body.charAt(1) && next.charAt(0) == body.charAt(1);
    }

    private static boolean operatorsFuse(String prev, String next) {
        if (prev.equals(".") && next.equals(".")) {
            // three lone dots would read as an ellipsis
            return true;
        }
        var joined = prev + next;
        for (var op : Scanner.OPERATORS) {
            if (joined.startsWith(op)) {
                return op.length() != prev.length();
            }
        }
        return true;
    }
}
