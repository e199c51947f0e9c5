package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Block depth as re-emitted in the output: one {@code unit} per level, whatever the source used.
 */
@RequiredArgsConstructor
final class Indentation {

    private final @NonNull String unit;

    @Getter
    private int depth = 0;

    void apply(Token token) {
        if (token.type() == INDENT) {
            depth++;
        } else if (token.type() == DEDENT) {
            if (depth == 0) {
                throw new MalformedTokenStreamException(token, "DEDENT without matching INDENT");
            }
            depth--;
        }
    }

    void emit(StringBuilder out) {
        for (var i = 0; i < depth; i++) {
            out.append(unit);
        }
    }
}
