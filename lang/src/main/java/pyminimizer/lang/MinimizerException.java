package pyminimizer.lang;

import lombok.Getter;

public class MinimizerException extends RuntimeException {
    @Getter
    private final Token token;

    MinimizerException(String message) {
        this(null, message);
    }

    MinimizerException(Token token, String message) {
        super(token != null ? message + " at " + token.start() : message);
        this.token = token;
    }
}
