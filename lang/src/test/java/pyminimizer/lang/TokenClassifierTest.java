package pyminimizer.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static pyminimizer.lang.Token.Type.*;

import org.junit.jupiter.api.Test;

import pyminimizer.lang.TokenClassifier.Category;

public class TokenClassifierTest {

    private static Token token(Token.Type type) {
        return new Token(type, "", new Token.Position(1, 0), new Token.Position(1, 0));
    }

    @Test
    void categories() {
        assertEquals(Category.STRUCTURAL, TokenClassifier.classify(token(INDENT)));
        assertEquals(Category.STRUCTURAL, TokenClassifier.classify(token(DEDENT)));
        assertEquals(Category.STRUCTURAL, TokenClassifier.classify(token(NEWLINE)));
        assertEquals(Category.STRUCTURAL, TokenClassifier.classify(token(ENDMARKER)));
        assertEquals(Category.STRUCTURAL, TokenClassifier.classify(token(ENCODING)));
        assertEquals(Category.COMMENT, TokenClassifier.classify(token(COMMENT)));
        assertEquals(Category.BLANK, TokenClassifier.classify(token(NL)));
        assertEquals(Category.CONTENT, TokenClassifier.classify(token(NAME)));
        assertEquals(Category.CONTENT, TokenClassifier.classify(token(NUMBER)));
        assertEquals(Category.CONTENT, TokenClassifier.classify(token(STRING)));
        assertEquals(Category.CONTENT, TokenClassifier.classify(token(OP)));
    }

    @Test
    void errorTokensAreForwarded() {
        assertTrue(TokenClassifier.isContent(token(ERRORTOKEN)));
        assertFalse(TokenClassifier.isContent(token(NL)));
    }
}
