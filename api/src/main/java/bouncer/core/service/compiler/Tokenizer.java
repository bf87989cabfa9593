package bouncer.core.service.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import bouncer.core.model.ModelCompileException;

/**
 * Splits matcher text into tokens.
 */
final class Tokenizer {

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("&&", "||", "==", "!=", "<=", ">=");
    private static final Set<Character> ONE_CHAR_OPERATORS = Set.of('!', '<', '>', '+');

    private final String source;
    private final String section;
    private int pos;

    Tokenizer(String source, String section) {
        this.source = source;
        this.section = section;
    }

    List<Token> tokenize() {
        final List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        final var start = pos;
        final var c = source.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(Token.Type.IDENTIFIER, source.substring(start, pos), start);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"' || c == '\'') {
            return string(start, c);
        }

        switch (c) {
            case '(':
                pos++;
                return new Token(Token.Type.LEFT_PAREN, "(", start);
            case ')':
                pos++;
                return new Token(Token.Type.RIGHT_PAREN, ")", start);
            case ',':
                pos++;
                return new Token(Token.Type.COMMA, ",", start);
            case '.':
                pos++;
                return new Token(Token.Type.DOT, ".", start);
            default:
                break;
        }

        if (pos + 1 < source.length()) {
            final var pair = source.substring(pos, pos + 2);
            if (TWO_CHAR_OPERATORS.contains(pair)) {
                pos += 2;
                return new Token(Token.Type.OPERATOR, pair, start);
            }
        }
        if (ONE_CHAR_OPERATORS.contains(c)) {
            pos++;
            return new Token(Token.Type.OPERATOR, String.valueOf(c), start);
        }
        throw new ModelCompileException(section, "Unsupported operator '" + c + "' at position " + start);
    }

    private Token number(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token string(int start, char quote) {
        pos++;
        final var value = new StringBuilder();
        while (pos < source.length()) {
            final var c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, value.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                value.append(source.charAt(pos++));
            } else {
                value.append(c);
            }
        }
        throw new ModelCompileException(section, "Unterminated string literal at position " + start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
