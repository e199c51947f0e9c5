package pyminimizer.lang;

/**
 * Something the engine decided while minimizing one source.
 *
 * @param line 1-based source line the decision concerns
 */
public record MinimizerEvent(Type type, int line, String detail) {

    public enum Type {
        GROUP_CLOSED,
        BLANK_LINE_REMOVED,
        BLANK_LINE_COLLAPSED,
        COMMENT_REMOVED,
        INLINE_COMMENT_REMOVED,
        DOCSTRING_REMOVED,
        DOCSTRING_RETAINED,
        TOKEN_AFTER_END_IGNORED;
    }
}
