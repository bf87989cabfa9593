package bouncer.core.model.expression;

/**
 * Reference to a request ({@code r.x}) or policy ({@code p.x}) field.
 *
 * @param scope the definition the field belongs to
 * @param name  the field name, kept for diagnostics
 * @param index the field's position in its definition
 */
public record FieldReference(Scope scope, String name, int index) implements Expression {

    public enum Scope {
        REQUEST("r"),
        POLICY("p");

        private final String key;

        Scope(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        return scope == Scope.REQUEST ? context.requestValue(index) : context.policyValue(index);
    }

    @Override
    public boolean referencesPolicy() {
        return scope == Scope.POLICY;
    }

    @Override
    public String toString() {
        return scope.key() + "." + name;
    }
}
