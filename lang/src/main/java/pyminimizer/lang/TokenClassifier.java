package pyminimizer.lang;

final class TokenClassifier {

    enum Category {
        STRUCTURAL,
        CONTENT,
        COMMENT,
        BLANK;
    }

    private TokenClassifier() {
    }

    static Category classify(Token token) {
        switch (token.type()) {
        case INDENT:
        case DEDENT:
        case NEWLINE:
        case ENDMARKER:
        case ENCODING:
            return Category.STRUCTURAL;
        case COMMENT:
            return Category.COMMENT;
        case NL:
            return Category.BLANK;
        case NAME:
        case NUMBER:
        case STRING:
        case OP:
        case ERRORTOKEN:
        default:
            // unknown kinds are forwarded as content
            return Category.CONTENT;
        }
    }

    static boolean isContent(Token token) {
        return classify(token) == Category.CONTENT;
    }
}
