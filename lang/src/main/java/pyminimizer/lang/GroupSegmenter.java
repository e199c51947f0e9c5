package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits a token stream into {@link TokenGroup}s: a group ends after each NEWLINE, after each
 * NL outside brackets and at ENDMARKER.
 */
@RequiredArgsConstructor
final class GroupSegmenter {

    private final @NonNull MinimizerEventSink events;

    private final List<TokenGroup> groups = new ArrayList<>();
    private final List<Token> pending = new ArrayList<>();
    private final Indentation indentation = new Indentation("");
    private int bracketDepth = 0;

    List<TokenGroup> segment(List<Token> tokens) {
        var stream = new TokenStream(tokens);
        while (!stream.isAtEnd()) {
            var token = stream.advance();
            indentation.apply(token);
            if (token.type() == OP) {
                trackBrackets(token);
            }
            pending.add(token);
            if (token.type() == NEWLINE || (token.type() == NL && bracketDepth == 0)) {
                close();
            }
        }

        var end = stream.advance();
        if (bracketDepth > 0) {
            throw new MalformedTokenStreamException(end, bracketDepth + " bracket(s) still open at ENDMARKER");
        }
        if (pending.stream().anyMatch(token -> token.type() != INDENT && token.type() != DEDENT)) {
            // the last logical line was not terminated
            close();
        }
        pending.add(end);
        close();

        for (var token : stream.trailing()) {
            events.accept(new MinimizerEvent(
                MinimizerEvent.Type.TOKEN_AFTER_END_IGNORED, token.start().line(), token.toString()));
        }
        return groups;
    }

    private void trackBrackets(Token token) {
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

    private void close() {
        var group = TokenGroup.of(pending, indentation.getDepth());
        pending.clear();
        groups.add(group);
        events.accept(new MinimizerEvent(MinimizerEvent.Type.GROUP_CLOSED, group.firstLine(),
            group.kind() + " with " + group.tokens().size() + " tokens"));
    }
}
