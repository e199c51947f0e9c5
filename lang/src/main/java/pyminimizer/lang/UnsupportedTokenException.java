package pyminimizer.lang;

public class UnsupportedTokenException extends MinimizerException {

    UnsupportedTokenException(Token token, String message) {
        super(token, message);
    }
}
