package bouncer.core.service.compiler;

/**
 * A lexical token of a matcher expression.
 *
 * @param type     the token kind
 * @param text     the token text; the unquoted value for strings
 * @param position offset of the token in the source text
 */
record Token(Type type, String text, int position) {

    enum Type {
        IDENTIFIER,
        STRING,
        NUMBER,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA,
        DOT,
        END
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }

    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equals(keyword);
    }
}
