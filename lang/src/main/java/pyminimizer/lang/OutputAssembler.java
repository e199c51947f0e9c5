package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import java.util.List;
import java.util.regex.Pattern;

import lombok.NonNull;
import pyminimizer.lang.MinimizerEvent.Type;
import pyminimizer.lang.TokenGroup.Docstring;

/**
 * Writes the surviving groups as text: re-emitted indentation at the start of every logical
 * line, separators from the {@link SpacingEngine}, one line break per NEWLINE.
 */
final class OutputAssembler {

    // PEP 263
    private static final Pattern CODING_DECLARATION = Pattern.compile("^#.*?coding[:=][ \\t]*[-\\w.]+");

    private final MinimizerOptions options;
    private final SpacingEngine spacing;
    private final MinimizerEventSink events;

    OutputAssembler(@NonNull MinimizerOptions options, @NonNull MinimizerEventSink events) {
        this.options = options;
        this.spacing = new SpacingEngine(options);
        this.events = events;
    }

    String assemble(List<TokenGroup> groups) {
        var state = new RunState(options.indentChar());
        for (var group : groups) {
            applyStructure(group, state);
            switch (group.kind()) {
            case BLANK:
                blankLine(group, state);
                break;
            case COMMENT:
                commentLine(group, state);
                break;
            case STATEMENT:
                statement(group, state);
                break;
            case END:
                return state.out.toString();
            }
        }
        return state.out.toString();
    }

    private void applyStructure(TokenGroup group, RunState state) {
        for (var token : group.tokens()) {
            if (token.type() == ENCODING && state.seenToken) {
                throw new UnsupportedTokenException(token, "encoding declaration token inside the stream");
            }
            state.seenToken = true;
            state.getIndentation().apply(token);
        }
    }

    private void blankLine(TokenGroup group, RunState state) {
        if (!options.keepBlankLines()) {
            events.accept(new MinimizerEvent(Type.BLANK_LINE_REMOVED, group.firstLine(), ""));
        } else if (!state.hasOutput() || state.lastLineBlank) {
            events.accept(new MinimizerEvent(Type.BLANK_LINE_COLLAPSED, group.firstLine(), ""));
        } else {
            state.endLine(true);
        }
    }

    private void commentLine(TokenGroup group, RunState state) {
        for (var token : group.tokens()) {
            if (token.type() != COMMENT) {
                continue;
            }
            if (options.keepComments() || isDeclaration(token)) {
                state.getIndentation().emit(state.out);
                state.out.append(token.lexeme());
                state.endLine(false);
            } else {
                events.accept(new MinimizerEvent(Type.COMMENT_REMOVED, token.start().line(), token.lexeme()));
            }
        }
    }

    /**
     * Shebang and source encoding declarations change how the file is run or read.
     */
    private static boolean isDeclaration(Token comment) {
        var line = comment.start().line();
        if (line == 1 && comment.lexeme().startsWith("#!")) {
            return true;
        }
        return line <= 2 && CODING_DECLARATION.matcher(comment.lexeme()).find();
    }

    private void statement(TokenGroup group, RunState state) {
        if (group.docstring() == Docstring.REMOVABLE && !options.keepDocstrings()) {
            events.accept(new MinimizerEvent(Type.DOCSTRING_REMOVED, group.firstLine(), ""));
            return;
        }
        if (group.docstring() == Docstring.REQUIRED && !options.keepDocstrings()) {
            events.accept(new MinimizerEvent(Type.DOCSTRING_RETAINED, group.firstLine(),
                "only statement of its body"));
        }

        var commentOnLine = false;
        for (var token : group.tokens()) {
            switch (token.type()) {
            case INDENT:
            case DEDENT:
            case ENCODING:
            case ENDMARKER:
                break;

            case NEWLINE:
                state.endLine(false);
                break;

            case NL:
                // a kept comment would swallow the rest of the logical line
                if (commentOnLine) {
                    state.out.append('\n');
                    state.previous = null;
                    commentOnLine = false;
                }
                break;

            case COMMENT:
                if (options.keepComments()) {
                    state.out.append(spacing.separatorBeforeComment(state.previous, token));
                    state.out.append(token.lexeme());
                    commentOnLine = true;
                } else {
                    events.accept(new MinimizerEvent(Type.INLINE_COMMENT_REMOVED, token.start().line(),
                        token.lexeme()));
                }
                break;

            default:
                if (!state.lineOpen) {
                    state.getIndentation().emit(state.out);
                    state.lineOpen = true;
                } else if (state.previous != null) {
                    state.out.append(spacing.separator(state.previous, token));
                }
                state.out.append(token.lexeme());
                state.previous = token;
                if (token.type() == OP) {
                    state.track(token);
                }
                break;
            }
        }
        if (state.lineOpen) {
            // stream ended without NEWLINE
            state.endLine(false);
        }
    }
}
