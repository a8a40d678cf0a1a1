package com.stacker.update;

import lombok.Value;

/**
 * Assignment of a new value to one document field.
 *
 * <p>Values are kept typed until rendered by {@link PainlessScriptBuilder}; supported are
 * {@code null}, strings, booleans, integral and decimal numbers, {@link java.time.LocalDate}s
 * and lists of those.</p>
 */
@Value(staticConstructor = "of")
public class FieldChange {

    String field;
    Object value;
}
