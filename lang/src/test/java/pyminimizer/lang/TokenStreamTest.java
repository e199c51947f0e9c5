package pyminimizer.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static pyminimizer.lang.Token.Type.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token.Type type, String lexeme) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(type, stream.peek().type());
        var token = stream.advance();
        assertEquals(type, token.type());
        assertEquals(lexeme, token.lexeme());
        assertEquals(token, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var source = "hello;\nworld;42\n";
        var scanner = new Scanner(source);
        stream = new TokenStream(scanner.getTokens());
        expectAtEnd = false;
    }

    @Test
    void visible() {
        assertNextToken(NAME, "hello");
        assertNextToken(OP, ";");
        assertNextToken(NEWLINE, "\n");
        assertNextToken(NAME, "world");
        assertNextToken(OP, ";");
        assertNextToken(NUMBER, "42");
        assertNextToken(NEWLINE, "\n");
        expectAtEnd = true;
        assertNextToken(ENDMARKER, "");
        // stays on ENDMARKER
        assertNextToken(ENDMARKER, "");
        assertTrue(stream.trailing().isEmpty());
    }

    @Test
    void trailing() {
        var end = new Token(ENDMARKER, "", new Token.Position(1, 0), new Token.Position(1, 0));
        var extra = new Token(NAME, "x", new Token.Position(2, 0), new Token.Position(2, 1));
        stream = new TokenStream(List.of(end, extra));
        assertTrue(stream.isAtEnd());
        assertEquals(List.of(extra), stream.trailing());
    }

    @Test
    void missingEnd() {
        var name = new Token(NAME, "x", new Token.Position(1, 0), new Token.Position(1, 1));
        assertThrows(MalformedTokenStreamException.class, () -> new TokenStream(List.of(name)));
    }
}
