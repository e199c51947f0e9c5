package pyminimizer.lang;

import lombok.Getter;
import lombok.NonNull;

/**
 * Mutable state of one assembly pass. Bracket depth and block depth are tracked
 * independently; only the bracket depth decides whether a line break is significant.
 */
final class RunState {

    final StringBuilder out = new StringBuilder();

    @Getter
    private final Indentation indentation;

    @Getter
    private int bracketDepth = 0;

    // last token written on the current output line, null at the start of a line
    Token previous = null;
    boolean lineOpen = false;
    boolean lastLineBlank = false;
    boolean seenToken = false;

    RunState(@NonNull String indentUnit) {
        this.indentation = new Indentation(indentUnit);
    }

    void track(Token token) {
        switch (token.lexeme()) {
        case "(":
        case "[":
        case "{":
            bracketDepth++;
            break;
        case ")":
        case "]":
        case "}":
            if (bracketDepth == 0) {
                throw new MalformedTokenStreamException(token, "closing bracket without opener");
            }
            bracketDepth--;
            break;
        default:
            break;
        }
    }

    boolean hasOutput() {
        return out.length() > 0;
    }

    void endLine(boolean blank) {
        out.append('\n');
        previous = null;
        lineOpen = false;
        lastLineBlank = blank;
    }
}
