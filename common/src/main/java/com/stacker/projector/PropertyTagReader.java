package com.stacker.projector;

import com.stacker.model.PropertyTags;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the current tag assignments of properties, for refreshing the tag aggregates
 * ({@code tags}, {@code tags_length}, {@code distress_indicators}) without a full re-projection.
 */
@Slf4j
public class PropertyTagReader {

    private static final String SQL = ProjectorQuery.readResource("stacker/sql/property_tags.sql");

    private final DataSource dataSource;

    public PropertyTagReader(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Returns the tags of every requested property, in request order. Properties without any
     * assignment are present with no tags.
     */
    public List<PropertyTags> read(Collection<Integer> propertyIds) throws IOException {
        Map<Integer, PropertyTags> byProperty = new LinkedHashMap<>();
        for (Integer propertyId : propertyIds) {
            byProperty.put(propertyId, new PropertyTags(propertyId, new ArrayList<>(), 0));
        }
        if (byProperty.isEmpty()) {
            return new ArrayList<>();
        }

        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SQL)) {
            ps.setArray(1, connection.createArrayOf("integer", byProperty.keySet().toArray()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    PropertyTags tags = byProperty.get(rs.getInt(1));
                    tags.getTagIds().add(rs.getInt(2));
                    if (rs.getBoolean(3)) {
                        tags.setDistressCount(tags.getDistressCount() + 1);
                    }
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read tags of {} propert(ies): {}", byProperty.size(), e.getMessage(), e);
            throw new IOException("Failed to read property tags", e);
        }
        return new ArrayList<>(byProperty.values());
    }
}
