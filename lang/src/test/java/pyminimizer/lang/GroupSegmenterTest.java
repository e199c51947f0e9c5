package pyminimizer.lang;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static pyminimizer.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import pyminimizer.lang.TokenGroup.Kind;

public class GroupSegmenterTest {

    private final List<MinimizerEvent> events = new ArrayList<>();

    private List<TokenGroup> segment(String source) {
        return new GroupSegmenter(events::add).segment(new Scanner(source).getTokens());
    }

    private List<TokenGroup> segment(Token... tokens) {
        return new GroupSegmenter(events::add).segment(List.of(tokens));
    }

    private static Token token(Token.Type type, String lexeme) {
        return new Token(type, lexeme, new Token.Position(1, 0), new Token.Position(1, lexeme.length()));
    }

    @Test
    void kinds() {
        var groups = segment("x = 1\n\n# c\nif x:\n    y\n");
        assertThat(groups).extracting(TokenGroup::kind).containsExactly(
            Kind.STATEMENT, Kind.BLANK, Kind.COMMENT, Kind.STATEMENT, Kind.STATEMENT, Kind.END);
        assertThat(groups).extracting(TokenGroup::indentDepth).containsExactly(0, 0, 0, 0, 1, 0);
    }

    @Test
    void bracketsKeepOneGroup() {
        var groups = segment("f(1,\n\n   2)\n");
        assertEquals(2, groups.size());
        assertThat(groups.get(0).content()).extracting(Token::lexeme).containsExactly("f", "(", "1", ",", "2", ")");
    }

    @Test
    void inlineCommentStaysInStatement() {
        var groups = segment("y = 2  # comment\n");
        assertEquals(Kind.STATEMENT, groups.get(0).kind());
        assertThat(groups.get(0).tokens()).extracting(Token::type).containsExactly(
            NAME, OP, NUMBER, COMMENT, NEWLINE);
    }

    @Test
    void dedentsAtEndJoinEndGroup() {
        var groups = segment("if x:\n    y\n");
        var end = groups.get(groups.size() - 1);
        assertEquals(Kind.END, end.kind());
        assertThat(end.tokens()).extracting(Token::type).containsExactly(DEDENT, ENDMARKER);
    }

    @Test
    void unterminatedLastLine() {
        var groups = segment(token(NAME, "x"), token(ENDMARKER, ""));
        assertThat(groups).extracting(TokenGroup::kind).containsExactly(Kind.STATEMENT, Kind.END);
    }

    @Test
    void events() {
        segment("x\n");
        assertThat(events).extracting(MinimizerEvent::type).containsOnly(MinimizerEvent.Type.GROUP_CLOSED);
        assertEquals(2, events.size());
    }

    @Test
    void tokensAfterEndAreIgnored() {
        var groups = segment(token(ENDMARKER, ""), token(NAME, "late"));
        assertEquals(1, groups.size());
        assertThat(events).extracting(MinimizerEvent::type).contains(MinimizerEvent.Type.TOKEN_AFTER_END_IGNORED);
    }

    @Test
    void closingBracketWithoutOpener() {
        var ex = assertThrows(MalformedTokenStreamException.class, () -> segment(")\n"));
        assertEquals(")", ex.getToken().lexeme());
    }

    @Test
    void bracketOpenAtEnd() {
        assertThrows(MalformedTokenStreamException.class,
            () -> segment(token(OP, "("), token(ENDMARKER, "")));
    }

    @Test
    void unmatchedDedent() {
        assertThrows(MalformedTokenStreamException.class,
            () -> segment(token(DEDENT, ""), token(ENDMARKER, "")));
    }

    @Test
    void missingEndmarker() {
        assertThrows(MalformedTokenStreamException.class,
            () -> segment(token(NAME, "x"), token(NEWLINE, "\n")));
    }
}
