package com.stacker.api.persistence;

import com.stacker.bulk.StackerMutations;
import com.stacker.model.StackerValidationException;
import com.stacker.schema.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Relational side of the bulk actions, written with Spring JDBC against the application schema.
 * Every statement is restricted to the requesting company.
 */
@Slf4j
@Repository
public class JdbcStackerMutations implements StackerMutations {

    static final Set<String> PROSPECT_FLAGS = Set.of(
            "is_blocked", "do_not_call", "is_priority", "is_qualified_lead", "wrong_number", "opted_out");

    private static final String ADD_TAGS =
            "INSERT INTO properties_propertytagassignment (prop_id, tag_id) "
                    + "SELECT prop.id, tag.id FROM properties_property prop "
                    + "INNER JOIN properties_propertytag tag ON tag.company_id = prop.company_id "
                    + "WHERE prop.company_id = :companyId AND prop.id IN (:propertyIds) AND tag.id IN (:tagIds) "
                    + "AND NOT EXISTS (SELECT 1 FROM properties_propertytagassignment pta "
                    + "WHERE pta.prop_id = prop.id AND pta.tag_id = tag.id)";

    private static final String REMOVE_TAGS =
            "DELETE FROM properties_propertytagassignment pta USING properties_property prop "
                    + "WHERE prop.id = pta.prop_id AND prop.company_id = :companyId "
                    + "AND pta.prop_id IN (:propertyIds) AND pta.tag_id IN (:tagIds)";

    private static final String PROPERTY_IDS_OF_PROSPECTS =
            "SELECT DISTINCT prop_id FROM sherpa_prospect WHERE company_id = :companyId AND id IN (:prospectIds) "
                    + "AND prop_id IS NOT NULL ORDER BY prop_id";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcStackerMutations(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void setArchived(DocumentType type, int companyId, List<Integer> ids, boolean archived)
            throws IOException {
        String table = type == DocumentType.PROPERTY ? "properties_property" : "sherpa_prospect";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("archived", archived)
                .addValue("companyId", companyId)
                .addValue("ids", ids);
        int updated = execute("archive " + type, () -> jdbc.update(
                "UPDATE " + table + " SET is_archived = :archived WHERE company_id = :companyId AND id IN (:ids)",
                params));
        log.info("Set is_archived={} on {} {} row(s) of company {}", archived, updated, type, companyId);
    }

    @Override
    public void addPropertyTags(int companyId, List<Integer> propertyIds, List<Integer> tagIds) throws IOException {
        int inserted = execute("add property tags", () -> jdbc.update(ADD_TAGS, tagParams(companyId, propertyIds, tagIds)));
        log.info("Added {} tag assignment(s) for company {}", inserted, companyId);
    }

    @Override
    public void removePropertyTags(int companyId, List<Integer> propertyIds, List<Integer> tagIds)
            throws IOException {
        int deleted = execute("remove property tags",
                () -> jdbc.update(REMOVE_TAGS, tagParams(companyId, propertyIds, tagIds)));
        log.info("Removed {} tag assignment(s) for company {}", deleted, companyId);
    }

    @Override
    public void updateProspectFlags(int companyId, List<Integer> prospectIds, Map<String, Boolean> flags)
            throws IOException {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("ids", prospectIds);
        StringJoiner assignments = new StringJoiner(", ");
        flags.forEach((column, value) -> {
            if (!PROSPECT_FLAGS.contains(column)) {
                throw new StackerValidationException(column, "Unknown prospect flag.");
            }
            assignments.add(column + " = :" + column);
            params.addValue(column, value);
        });

        String sql = "UPDATE sherpa_prospect SET " + assignments
                + " WHERE company_id = :companyId AND id IN (:ids)";
        int updated = execute("update prospect flags", () -> jdbc.update(sql, params));
        log.info("Updated flags {} on {} prospect(s) of company {}", flags.keySet(), updated, companyId);
    }

    @Override
    public List<Integer> propertyIdsOfProspects(int companyId, List<Integer> prospectIds) throws IOException {
        if (prospectIds.isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("prospectIds", prospectIds);
        return execute("read prospect properties",
                () -> jdbc.queryForList(PROPERTY_IDS_OF_PROSPECTS, params, Integer.class));
    }

    private static MapSqlParameterSource tagParams(int companyId, List<Integer> propertyIds, List<Integer> tagIds) {
        return new MapSqlParameterSource()
                .addValue("companyId", companyId)
                .addValue("propertyIds", propertyIds)
                .addValue("tagIds", tagIds);
    }

    @FunctionalInterface
    private interface Statement<T> {
        T run();
    }

    private static <T> T execute(String operation, Statement<T> statement) throws IOException {
        try {
            return statement.run();
        } catch (DataAccessException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new IOException("Failed to " + operation, e);
        }
    }
}
