package pyminimizer.lang;

public class InvalidOptionException extends MinimizerException {

    InvalidOptionException(String message) {
        super(message);
    }
}
