package com.stacker.update;

import com.stacker.model.StackerValidationException;
import com.stacker.schema.StackerSchema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders field assignments into a Painless script for update-by-query.
 *
 * <p>Each change becomes {@code ctx._source.<field> = <literal>}; statements are joined and
 * terminated by {@code ;}. Literals are rendered by type:</p>
 * <ul>
 *   <li>strings and dates: double-quoted, with {@code \} and {@code "} escaped</li>
 *   <li>booleans: {@code true} / {@code false}</li>
 *   <li>{@code null}: {@code null}</li>
 *   <li>integers: decimal; longs outside the int range get an {@code L} suffix</li>
 *   <li>decimals: their plain decimal form</li>
 *   <li>collections: {@code [a, b]}</li>
 * </ul>
 * Field names must exist in the index schema.
 */
public final class PainlessScriptBuilder {

    public static final String LANG = "painless";

    private PainlessScriptBuilder() {
    }

    public static String build(List<FieldChange> changes) {
        StringBuilder script = new StringBuilder();
        for (FieldChange change : changes) {
            if (!StackerSchema.hasField(change.getField())) {
                throw new StackerValidationException(change.getField(), "Unknown document field.");
            }
            script.append("ctx._source.")
                    .append(change.getField())
                    .append(" = ")
                    .append(literal(change.getField(), change.getValue()))
                    .append(';');
        }
        return script.toString();
    }

    static String literal(String field, Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return quote(value.toString());
        }
        if (value instanceof LocalDate) {
            return quote(value.toString());
        }
        if (value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Long) {
            long number = (Long) value;
            return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE
                    ? Long.toString(number) : number + "L";
        }
        if (value instanceof BigInteger) {
            return literal(field, ((BigInteger) value).longValueExact());
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            return value.toString();
        }
        if (value instanceof Collection) {
            StringJoiner items = new StringJoiner(", ", "[", "]");
            for (Object item : (Collection<?>) value) {
                items.add(literal(field, item));
            }
            return items.toString();
        }
        throw new StackerValidationException(field,
                "Unsupported value type " + value.getClass().getSimpleName() + ".");
    }

    private static String quote(String value) {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
