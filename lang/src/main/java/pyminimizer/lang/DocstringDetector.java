package pyminimizer.lang;

import static pyminimizer.lang.Token.Type.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import pyminimizer.lang.TokenGroup.Docstring;
import pyminimizer.lang.TokenGroup.Kind;

/**
 * Marks the groups that are docstrings: a lone string literal as the first statement of the
 * module or of a {@code def}/{@code class} body.
 *
 * <p>One frame per open block; a frame expects a docstring until its first statement.
 */
final class DocstringDetector {

    private enum State {
        EXPECT_DOCSTRING,
        IN_BODY;
    }

    private static final class Frame {
        final boolean module;
        State state;

        Frame(boolean module, State state) {
            this.module = module;
            this.state = state;
        }
    }

    private DocstringDetector() {
    }

    static List<TokenGroup> detect(List<TokenGroup> groups) {
        var result = new ArrayList<TokenGroup>(groups.size());
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(true, State.EXPECT_DOCSTRING));
        var headerOpened = false;

        for (var i = 0; i < groups.size(); i++) {
            var group = groups.get(i);
            if (group.kind() != Kind.STATEMENT) {
                result.add(group);
                continue;
            }

            for (var token : group.tokens()) {
                if (token.type() == INDENT) {
                    frames.push(new Frame(false, headerOpened ? State.EXPECT_DOCSTRING : State.IN_BODY));
                } else if (token.type() == DEDENT && frames.size() > 1) {
                    frames.pop();
                }
            }

            var frame = frames.peek();
            if (frame.state == State.EXPECT_DOCSTRING && isLoneString(group)) {
                var removable = frame.module || hasFollowingStatement(groups, i);
                group = group.withDocstring(removable ? Docstring.REMOVABLE : Docstring.REQUIRED);
            }
            frame.state = State.IN_BODY;
            headerOpened = opensDocumentedBlock(group);
            result.add(group);
        }
        return result;
    }

    private static boolean isLoneString(TokenGroup group) {
        var content = group.content();
        if (content.size() != 1 || content.get(0).type() != STRING) {
            return false;
        }
        // f-strings are evaluated, they never become __doc__
        var prefix = Scanner.prefixOf(content.get(0).lexeme()).toLowerCase();
        return !prefix.contains("f") && !prefix.contains("t");
    }

    /**
     * <pre>
     *  header      :: ( "async" )? "def" ... ":" | "class" ... ":"
     * </pre>
     */
    private static boolean opensDocumentedBlock(TokenGroup group) {
        var content = group.content();
        if (content.size() < 2 || !content.get(content.size() - 1).is(OP, ":")) {
            return false;
        }
        var first = content.get(0);
        if (first.is(NAME, "async")) {
            first = content.get(1);
        }
        return first.is(NAME, "def") || first.is(NAME, "class");
    }

    private static boolean hasFollowingStatement(List<TokenGroup> groups, int index) {
        for (var i = index + 1; i < groups.size(); i++) {
            var group = groups.get(i);
            if (group.kind() == Kind.END) {
                return false;
            }
            if (group.kind() == Kind.STATEMENT) {
                return group.tokens().stream().noneMatch(token -> token.type() == DEDENT);
            }
        }
        return false;
    }
}
