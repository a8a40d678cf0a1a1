package com.stacker.update;

import com.stacker.model.StackerValidationException;
import com.stacker.testing.PainlessAssignments;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PainlessScriptBuilderTest {

    @Test
    void rendersOneAssignmentPerChange() {
        String script = PainlessScriptBuilder.build(List.of(
                FieldChange.of("is_archived", true),
                FieldChange.of("tags", List.of(1, 2)),
                FieldChange.of("zip_code", "75001")));

        assertEquals("ctx._source.is_archived = true;ctx._source.tags = [1, 2];ctx._source.zip_code = \"75001\";",
                script);
    }

    @Test
    void literalsFollowTheValueType() {
        assertEquals("null", PainlessScriptBuilder.literal("f", null));
        assertEquals("42", PainlessScriptBuilder.literal("f", 42));
        assertEquals("42", PainlessScriptBuilder.literal("f", 42L));
        assertEquals("9876543210L", PainlessScriptBuilder.literal("f", 9_876_543_210L));
        assertEquals("9876543210L", PainlessScriptBuilder.literal("f", BigInteger.valueOf(9_876_543_210L)));
        assertEquals("0.000001", PainlessScriptBuilder.literal("f", new BigDecimal("1E-6")));
        assertEquals("1.5", PainlessScriptBuilder.literal("f", 1.5d));
        assertEquals("\"2021-01-31\"", PainlessScriptBuilder.literal("f", LocalDate.of(2021, 1, 31)));
        assertEquals("[\"a\", null]", PainlessScriptBuilder.literal("f", Arrays.asList("a", null)));
        assertEquals("[]", PainlessScriptBuilder.literal("f", List.of()));
    }

    @Test
    void quotesAndBackslashesCannotEscapeTheString() {
        String hostile = "O\"Brien\\\"; ctx._source.is_archived = true; \"";

        String script = PainlessScriptBuilder.build(List.of(FieldChange.of("name", hostile)));

        assertEquals(Map.of("name", hostile), PainlessAssignments.parse(script));
    }

    @Test
    void singleQuotesNeedNoEscaping() {
        assertEquals("\"O'Brien\"", PainlessScriptBuilder.literal("name", "O'Brien"));
    }

    @Test
    void unknownFieldIsRejected() {
        StackerValidationException e = assertThrows(StackerValidationException.class,
                () -> PainlessScriptBuilder.build(List.of(FieldChange.of("ctx._source.x", 1))));

        assertEquals("Unknown document field.", e.getFieldErrors().get("ctx._source.x"));
    }

    @Test
    void unsupportedValueIsRejected() {
        assertThrows(StackerValidationException.class,
                () -> PainlessScriptBuilder.literal("name", new Object()));
    }
}
