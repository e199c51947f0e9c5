package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.With;

/**
 * Tokens of one logical line, one blank line or one comment line, together with the
 * INDENT/DEDENT tokens that precede them.
 *
 * @param indentDepth block depth of the group once its own INDENT/DEDENT tokens are applied
 */
record TokenGroup(
    @NonNull List<Token> tokens,
    int indentDepth,
    @NonNull Kind kind,
    @With @NonNull Docstring docstring) {

    enum Kind {
        BLANK,
        COMMENT,
        STATEMENT,
        END;
    }

    enum Docstring {
        NONE,
        // the only statement of its body, must stay for the body to parse
        REQUIRED,
        REMOVABLE;
    }

    static TokenGroup of(List<Token> tokens, int indentDepth) {
        var kind = Kind.BLANK;
        for (var token : tokens) {
            if (token.type() == ENDMARKER) {
                kind = Kind.END;
                break;
            }
            switch (TokenClassifier.classify(token)) {
            case CONTENT:
                kind = Kind.STATEMENT;
                break;
            case COMMENT:
                if (kind == Kind.BLANK) {
                    kind = Kind.COMMENT;
                }
                break;
            default:
                break;
            }
        }
        return new TokenGroup(List.copyOf(tokens), indentDepth, kind, Docstring.NONE);
    }

    List<Token> content() {
        return tokens.stream().filter(TokenClassifier::isContent).collect(Collectors.toList());
    }

    int firstLine() {
        return tokens.isEmpty() ? 0 : tokens.get(0).start().line();
    }

    @Override
    public String toString() {
        return "TokenGroup { kind: " + kind + ", depth: " + indentDepth + ", docstring: " + docstring
            + ", tokens: " + tokens + " }";
    }
}
