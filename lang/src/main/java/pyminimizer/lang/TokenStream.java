package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import java.util.List;

import lombok.NonNull;

/**
 * Cursor over a tokenizer's output that stops at the first ENDMARKER.
 */
final class TokenStream {

    private final List<Token> tokens;
    private final int end;

    private int current = 0;
    private Token previous = null;

    TokenStream(@NonNull List<Token> tokens) {
        this.tokens = tokens;
        this.end = indexOfEnd(tokens);
    }

    private static int indexOfEnd(List<Token> tokens) {
        for (var i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).type() == ENDMARKER) {
                return i;
            }
        }
        throw new MalformedTokenStreamException("token stream ends without ENDMARKER");
    }

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return current == end;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token advance() {
        previous = tokens.get(current);
        if (!isAtEnd()) {
            current++;
        }
        return previous;
    }

    /**
     * Tokens the tokenizer produced after ENDMARKER. They are never advanced over.
     */
    public List<Token> trailing() {
        return tokens.subList(end + 1, tokens.size());
    }
}
