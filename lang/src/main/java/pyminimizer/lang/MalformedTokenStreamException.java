package pyminimizer.lang;

/**
 * The token stream broke the tokenizer contract: a DEDENT without a matching INDENT, a
 * closing bracket without an opener, or no ENDMARKER.
 */
public class MalformedTokenStreamException extends MinimizerException {

    MalformedTokenStreamException(String message) {
        super(message);
    }

    MalformedTokenStreamException(Token token, String message) {
        super(token, message);
    }
}
