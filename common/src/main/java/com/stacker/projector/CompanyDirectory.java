package com.stacker.projector;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the companies whose data belongs in the Stacker indexes.
 */
@Slf4j
public class CompanyDirectory {

    private static final String SQL = ProjectorQuery.readResource("stacker/sql/active_companies.sql");

    private final DataSource dataSource;

    public CompanyDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Ids of every company with an active subscription.
     */
    public List<Integer> activeCompanyIds() throws IOException {
        List<Integer> ids = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(SQL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getInt(1));
            }
        } catch (SQLException e) {
            log.error("Failed to list active companies: {}", e.getMessage(), e);
            throw new IOException("Failed to list active companies", e);
        }
        return ids;
    }
}
