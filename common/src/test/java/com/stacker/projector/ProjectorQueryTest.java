package com.stacker.projector;

import com.stacker.schema.StackerSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectorQueryTest {

    private static final Pattern ALIAS = Pattern.compile("\\bAS (\\w+)$", Pattern.MULTILINE);

    @ParameterizedTest
    @EnumSource(ProjectorQuery.class)
    void columnsMatchTheSchemaFieldOrder(ProjectorQuery query) {
        assertEquals(StackerSchema.fields(), selectAliases(query.getSql()));
    }

    @ParameterizedTest
    @EnumSource(ProjectorQuery.class)
    void scopeTakesOneArrayParameter(ProjectorQuery query) {
        String sql = query.getSql();

        assertFalse(sql.contains(ProjectorQuery.SCOPE_PLACEHOLDER));
        assertTrue(sql.contains("= ANY(?)"));
        assertEquals(1, sql.chars().filter(c -> c == '?').count());
    }

    @Test
    void queriesAreCentredOnTheirDocumentType() {
        assertTrue(ProjectorQuery.PROPERTIES_BY_ID.getSql().contains("WHERE prop.id = ANY(?)"));
        assertTrue(ProjectorQuery.PROSPECTS_BY_COMPANY.getSql().contains("WHERE pros.company_id = ANY(?)"));
    }

    private static List<String> selectAliases(String sql) {
        String code = sql.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        String select = code.substring(code.indexOf("SELECT"), code.indexOf("\nFROM "));

        List<String> aliases = new ArrayList<>();
        Matcher matcher = ALIAS.matcher(select);
        while (matcher.find()) {
            aliases.add(matcher.group(1));
        }
        return aliases;
    }
}
