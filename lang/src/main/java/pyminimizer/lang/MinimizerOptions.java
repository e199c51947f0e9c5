package pyminimizer.lang;

import lombok.NonNull;
import lombok.With;

/**
 * What to keep and which characters to write. Validated on construction, so an instance
 * that exists is always usable.
 *
 * @param keepBlankLines keep blank lines, collapsing runs to one
 * @param keepComments keep comment lines and inline comments
 * @param keepDocstrings keep docstrings
 * @param keepWhitespace copy the whitespace between tokens from the source
 * @param whitespaceChar separator written where two tokens would otherwise fuse
 * @param indentChar written once per indentation level
 */
@With
public record MinimizerOptions(
    boolean keepBlankLines,
    boolean keepComments,
    boolean keepDocstrings,
    boolean keepWhitespace,
    @NonNull String whitespaceChar,
    @NonNull String indentChar) {

    public static final String DEFAULT_WHITESPACE_CHAR = " ";
    public static final String DEFAULT_INDENT_CHAR = "\t";

    public MinimizerOptions {
        if (whitespaceChar.length() != 1 || " \t\f".indexOf(whitespaceChar.charAt(0)) < 0) {
            throw new InvalidOptionException(
                "whitespace character must be a single space, tab or form feed: \"" + whitespaceChar + "\"");
        }
        if (indentChar.isEmpty() || !indentChar.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new InvalidOptionException(
                "indent must be one or more spaces or tabs: \"" + indentChar + "\"");
        }
    }

    public static MinimizerOptions defaults() {
        return new MinimizerOptions(false, false, false, false, DEFAULT_WHITESPACE_CHAR, DEFAULT_INDENT_CHAR);
    }
}
