package pyminimizer.lang;

import lombok.NonNull;

public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    @NonNull Position start,
    @NonNull Position end,
    @NonNull String line,
    int logicalLine) {

    public Token(Type type, String lexeme, Position start, Position end) {
        this(type, lexeme, start, end, "", 0);
    }

    public boolean is(Type type, String lexeme) {
        return this.type == type && this.lexeme.equals(lexeme);
    }

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme.replace("\n", "\\n") + "\" " + start + "-" + end + ")";
    }

    public record Position(int line, int column) {

        @Override
        public String toString() {
            return line + ":" + column;
        }
    }

    public enum Type {
        NAME,
        NUMBER,
        STRING,
        OP,

        // trivia
        COMMENT,
        NL,

        // structure
        NEWLINE,
        INDENT,
        DEDENT,
        ENDMARKER,

        // tokenizer extensions
        ERRORTOKEN,
        ENCODING;
    }
}
