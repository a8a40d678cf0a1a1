package com.stacker.projector;

import com.stacker.schema.StackerSchema;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Produces denormalised Stacker documents straight from the relational store.
 *
 * <p>Rows are read through a server-side cursor ({@code fetchSize} = chunk size, auto-commit
 * off) and handed on in chunks, so a whole company never has to fit in memory.</p>
 */
@Slf4j
public class RowProjector {

    private final DataSource dataSource;
    private final RowConverter rowConverter;

    public RowProjector(DataSource dataSource) {
        this(dataSource, new RowConverter(StackerSchema.fields()));
    }

    public RowProjector(DataSource dataSource, RowConverter rowConverter) {
        this.dataSource = dataSource;
        this.rowConverter = rowConverter;
    }

    /**
     * Runs a projection for the given company or entity ids, passing documents to the handler in
     * chunks of at most {@code chunkSize}.
     *
     * @return number of documents produced
     */
    public int stream(ProjectorQuery query, Collection<Integer> ids, int chunkSize,
                      ChunkHandler handler) throws IOException {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }

        int produced = 0;
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement ps = connection.prepareStatement(query.getSql())) {
                ps.setFetchSize(chunkSize);
                ps.setArray(1, connection.createArrayOf("integer", ids.toArray()));

                try (ResultSet rs = ps.executeQuery()) {
                    rowConverter.checkColumns(rs);
                    List<Map<String, Object>> chunk = new ArrayList<>(Math.min(chunkSize, 1024));
                    while (rs.next()) {
                        chunk.add(rowConverter.toDocument(rs));
                        if (chunk.size() >= chunkSize) {
                            handler.accept(chunk);
                            produced += chunk.size();
                            chunk = new ArrayList<>(Math.min(chunkSize, 1024));
                        }
                    }
                    if (!chunk.isEmpty()) {
                        handler.accept(chunk);
                        produced += chunk.size();
                    }
                }
            } finally {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.error("Projection {} failed for {} id(s): {}", query, ids.size(), e.getMessage(), e);
            throw new IOException("Projection " + query + " failed", e);
        }

        log.debug("Projection {} produced {} document(s) for {} id(s)", query, produced, ids.size());
        return produced;
    }
}
