package bouncer.core.model.definition;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * The ordered field names of the request or policy definition.
 *
 * @param key    the section key ("r" or "p")
 * @param fields the field names, in declaration order
 */
public record AssertionDefinition(String key, List<String> fields) {

    public AssertionDefinition {
        fields = List.copyOf(fields);
    }

    public int arity() {
        return fields.size();
    }

    public OptionalInt indexOf(String field) {
        return IntStream.range(0, fields.size())
                .filter(i -> fields.get(i).equals(field))
                .findFirst();
    }

    public boolean declares(String field) {
        return fields.contains(field);
    }
}
