package com.stacker.query;

import com.stacker.model.StackerValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses request dates, given either as ISO-8601 ({@code 2021-01-31}) or US style
 * ({@code 01/31/2021}), into ISO-8601 strings for range clauses.
 */
public final class DateValues {

    private static final DateTimeFormatter US_FORMAT = DateTimeFormatter.ofPattern("MM/dd/uuuu");

    private DateValues() {
    }

    /**
     * @return the ISO date, or {@code null} for a null or blank value
     * @throws StackerValidationException if the value is not a recognisable date
     */
    public static String toIsoDate(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            if (text.indexOf('/') >= 0) {
                return LocalDate.parse(text, US_FORMAT).toString();
            }
            return LocalDate.parse(text).toString();
        } catch (DateTimeParseException e) {
            throw new StackerValidationException(field,
                    "Date has wrong format. Use one of these formats instead: MM/DD/YYYY, YYYY-MM-DD.");
        }
    }
}
