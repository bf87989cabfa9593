package bouncer.core.service.compiler;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import bouncer.core.model.ModelCompileException;
import bouncer.core.model.definition.AssertionDefinition;
import bouncer.core.model.expression.AttributeAccess;
import bouncer.core.model.expression.BinaryOperation;
import bouncer.core.model.expression.BinaryOperation.Operator;
import bouncer.core.model.expression.Expression;
import bouncer.core.model.expression.FieldReference;
import bouncer.core.model.expression.FunctionCall;
import bouncer.core.model.expression.Literal;
import bouncer.core.model.expression.Membership;
import bouncer.core.model.expression.Not;
import bouncer.core.service.function.FunctionRegistry;

/**
 * Recursive-descent parser for matcher expressions.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 * or         := and ( "||" and )*
 * and        := comparison ( "&amp;&amp;" comparison )*
 * comparison := additive ( ( "==" | "!=" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=" ) additive | "in" tuple )?
 * additive   := unary ( "+" unary )*
 * unary      := "!" unary | postfix
 * postfix    := primary ( "." identifier )*
 * primary    := string | number | "true" | "false" | call | field | "(" or ")"
 * call       := identifier "(" ( or ( "," or )* )? ")"
 * field      := ( "r" | "p" ) "." identifier
 * tuple      := "(" or ( "," or )* ")"
 * </pre>
 *
 * <p>Field names and function names are resolved while parsing; anything
 * undeclared is reported as a {@link ModelCompileException}.
 */
public class ExpressionParser {

    private static final Map<String, Operator> COMPARISONS = Map.of(
            "==", Operator.EQ,
            "!=", Operator.NE,
            "<", Operator.LT,
            "<=", Operator.LE,
            ">", Operator.GT,
            ">=", Operator.GE);

    private final AssertionDefinition request;
    private final AssertionDefinition policy;
    private final FunctionRegistry functions;
    private final String section;

    private List<Token> tokens;
    private int index;

    public ExpressionParser(
            AssertionDefinition request, AssertionDefinition policy, FunctionRegistry functions, String section) {
        this.request = request;
        this.policy = policy;
        this.functions = functions;
        this.section = section;
    }

    /**
     * Parse expression text into a resolved expression tree.
     *
     * <p>Instances are not thread-safe; create one parser per call site.
     *
     * @param text the expression
     * @return the expression tree
     * @throws ModelCompileException on syntax errors or unresolved names
     */
    public Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ModelCompileException(section, "Expression is empty");
        }
        tokens = new Tokenizer(text, section).tokenize();
        index = 0;

        final var expression = parseOr();
        if (!peek().is(Token.Type.END)) {
            throw error("Unexpected '" + peek().text() + "'", peek());
        }
        return expression;
    }

    private Expression parseOr() {
        var left = parseAnd();
        while (peek().isOperator("||")) {
            advance();
            left = new BinaryOperation(Operator.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        var left = parseComparison();
        while (peek().isOperator("&&")) {
            advance();
            left = new BinaryOperation(Operator.AND, left, parseComparison());
        }
        return left;
    }

    private Expression parseComparison() {
        final var left = parseAdditive();
        final var token = peek();
        if (token.is(Token.Type.OPERATOR) && COMPARISONS.containsKey(token.text())) {
            advance();
            return new BinaryOperation(COMPARISONS.get(token.text()), left, parseAdditive());
        }
        if (token.isKeyword("in")) {
            advance();
            return new Membership(left, parseTuple());
        }
        return left;
    }

    private Expression parseAdditive() {
        var left = parseUnary();
        while (peek().isOperator("+")) {
            advance();
            left = new BinaryOperation(Operator.PLUS, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (peek().isOperator("!")) {
            advance();
            return new Not(parseUnary());
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        var expression = parsePrimary();
        while (peek().is(Token.Type.DOT)) {
            advance();
            final var attribute = expect(Token.Type.IDENTIFIER, "attribute name");
            expression = new AttributeAccess(expression, attribute.text());
        }
        return expression;
    }

    private Expression parsePrimary() {
        final var token = advance();
        switch (token.type()) {
            case STRING:
                return new Literal(token.text());
            case NUMBER:
                return new Literal(parseNumber(token.text()));
            case LEFT_PAREN: {
                final var inner = parseOr();
                expect(Token.Type.RIGHT_PAREN, "')'");
                return inner;
            }
            case IDENTIFIER:
                return parseIdentifier(token);
            default:
                throw error("Unexpected '" + token.text() + "'", token);
        }
    }

    private Expression parseIdentifier(Token token) {
        final var name = token.text();
        if ("true".equals(name) || "false".equals(name)) {
            return new Literal(Boolean.valueOf(name));
        }
        if (peek().is(Token.Type.LEFT_PAREN)) {
            return parseCall(token);
        }
        if (peek().is(Token.Type.DOT)) {
            if (request.key().equals(name)) {
                advance();
                return field(FieldReference.Scope.REQUEST, request, expect(Token.Type.IDENTIFIER, "field name"));
            }
            if (policy.key().equals(name)) {
                advance();
                return field(FieldReference.Scope.POLICY, policy, expect(Token.Type.IDENTIFIER, "field name"));
            }
        }
        throw error("Unknown identifier '" + name + "'", token);
    }

    private Expression field(FieldReference.Scope scope, AssertionDefinition definition, Token fieldToken) {
        final var position = definition.indexOf(fieldToken.text());
        if (position.isEmpty()) {
            throw error("Field '" + definition.key() + "." + fieldToken.text() + "' is not declared in "
                    + definition.key() + " = " + String.join(", ", definition.fields()), fieldToken);
        }
        return new FieldReference(scope, fieldToken.text(), position.getAsInt());
    }

    private Expression parseCall(Token nameToken) {
        final var name = nameToken.text();
        final var definition = functions.lookup(name)
                .orElseThrow(() -> error("Unknown function '" + name + "'", nameToken));

        expect(Token.Type.LEFT_PAREN, "'('");
        final List<Expression> arguments = new ArrayList<>();
        if (!peek().is(Token.Type.RIGHT_PAREN)) {
            arguments.add(parseOr());
            while (peek().is(Token.Type.COMMA)) {
                advance();
                arguments.add(parseOr());
            }
        }
        expect(Token.Type.RIGHT_PAREN, "')'");

        if (!definition.accepts(arguments.size())) {
            throw error("Function '" + name + "' takes " + definition.arity() + " argument(s), got "
                    + arguments.size(), nameToken);
        }
        return new FunctionCall(name, definition.function(), arguments);
    }

    private List<Expression> parseTuple() {
        expect(Token.Type.LEFT_PAREN, "'(' after 'in'");
        final List<Expression> items = new ArrayList<>();
        items.add(parseOr());
        while (peek().is(Token.Type.COMMA)) {
            advance();
            items.add(parseOr());
        }
        expect(Token.Type.RIGHT_PAREN, "')'");
        return items;
    }

    private Object parseNumber(String text) {
        final var decimal = new BigDecimal(text);
        if (text.indexOf('.') < 0) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                return decimal.doubleValue();
            }
        }
        return decimal.doubleValue();
    }

    private Token expect(Token.Type type, String description) {
        final var token = advance();
        if (!token.is(type)) {
            throw error("Expected " + description + " but found '" + token.text() + "'", token);
        }
        return token;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        final var token = tokens.get(index);
        if (!token.is(Token.Type.END)) {
            index++;
        }
        return token;
    }

    private ModelCompileException error(String message, Token token) {
        final var where = token.is(Token.Type.END) ? "end of expression" : "position " + token.position();
        return new ModelCompileException(section, message + " at " + where);
    }
}
