package pyminimizer.lang;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

class MinimizerPropertiesTest {

    private static final String[] LEXEMES = {
        "x", "r", "b", "f", "rb", "e", "j", "_a", "if", "not", "lambda", "größe",
        "1", "1.", "1.5", "0x1f", "1e5", "2j", ".5", "1_0", "0",
        "'a'", "\"\"", "''", "\"x\"", "'''t'''", "r'x'", "b\"y\"", "f'{z}'",
        "**=", "//=", ">>=", "<<=", "...", "!=", "%=", "&=", "**", "*=", "+=", "-=", "->", "//", "/=",
        ":=", "<<", "<=", "==", ">=", ">>", "@=", "^=", "|=",
        "%", "&", "(", ")", "*", "+", ",", "-", ".", "/", ":", ";", "<", "=", ">", "@",
        "[", "]", "^", "{", "|", "}", "~",
    };

    private static final String[] STATEMENTS = {
        "x = 1",
        "y = x  +  2 # add",
        "print ( 'a' , \"b\" )",
        "z = [1 ,\n     2]",
        "t = (1,  # one\n     2)",
        "",
        "# comment",
        "w = x if y else - 1",
        "a = 1 .real",
        "b = r'x' 'y'",
        "def f ( a , * args , ** kw ) :\n    return a ** 2",
        "class A :\n    '''doc'''\n    n = 0\n\n    def m ( self ) :\n        return self . n",
        "c = x [ 0 ] . y",
        "d = lambda : ...",
        "e = not x",
        "g = 1e-5 - .5 + 0x1f",
        "h = f'{x!r:>{w}}'",
        "i = x \\\n    + 1",
    };

    private static Token single(String lexeme) {
        return content(lexeme).get(0);
    }

    private static List<Token> content(String source) {
        return new Scanner(source).getTokens().stream()
            .filter(TokenClassifier::isContent)
            .collect(Collectors.toList());
    }

    private static List<String> contentLexemes(String source) {
        return content(source).stream().map(Token::lexeme).collect(Collectors.toList());
    }

    @Property(tries = 8000)
    void tokensWithoutSpaceDoNotFuse(@ForAll("lexemes") String left, @ForAll("lexemes") String right) {
        var prev = single(left);
        var next = single(right);
        var joined = SpacingEngine.needsSpace(prev, next) ? left + " " + right : left + right;

        var rescanned = content(joined);
        assertThat(rescanned).extracting(Token::lexeme).containsExactly(left, right);
        assertThat(rescanned).extracting(Token::type).containsExactly(prev.type(), next.type());
    }

    @Property
    void contentTokensSurvive(@ForAll("programs") String source, @ForAll boolean keepBlankLines,
            @ForAll boolean keepComments, @ForAll boolean keepWhitespace) {
        var options = MinimizerOptions.defaults()
            .withKeepBlankLines(keepBlankLines)
            .withKeepComments(keepComments)
            .withKeepDocstrings(true)
            .withKeepWhitespace(keepWhitespace);
        var minimized = Minimizer.minimize(source, options);

        assertThat(contentLexemes(minimized)).isEqualTo(contentLexemes(source));
    }

    @Property
    void minimizingTwiceChangesNothing(@ForAll("programs") String source, @ForAll boolean keepBlankLines,
            @ForAll boolean keepComments, @ForAll boolean keepDocstrings) {
        var options = MinimizerOptions.defaults()
            .withKeepBlankLines(keepBlankLines)
            .withKeepComments(keepComments)
            .withKeepDocstrings(keepDocstrings);
        var once = Minimizer.minimize(source, options);

        assertThat(Minimizer.minimize(once, options)).isEqualTo(once);
    }

    @Property
    void oneLineBreakPerLogicalLine(@ForAll("programs") String source) {
        var minimized = Minimizer.minimize(source, MinimizerOptions.defaults().withKeepDocstrings(true));
        var newlines = new Scanner(source).getTokens().stream()
            .filter(token -> token.type() == Token.Type.NEWLINE)
            .count();
        var lineBreaks = minimized.chars().filter(c -> c == '\n').count();

        assertThat(lineBreaks).isEqualTo(newlines);
    }

    @Provide
    Arbitrary<String> lexemes() {
        return Arbitraries.of(LEXEMES);
    }

    @Provide
    Arbitrary<String> programs() {
        return Arbitraries.of(STATEMENTS).list().ofMinSize(1).ofMaxSize(8)
            .map(lines -> String.join("\n", lines) + "\n");
    }
}
