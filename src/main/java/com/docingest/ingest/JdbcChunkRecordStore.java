package com.docingest.ingest;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * {@link ChunkRecordStore} over the {@code document_chunk} table. Metadata is kept as JSON text.
 */
public class JdbcChunkRecordStore implements ChunkRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcChunkRecordStore.class);
    private static final String SERVICE = "chunk-store";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS document_chunk (
                id VARCHAR(512) PRIMARY KEY,
                content VARCHAR NOT NULL,
                content_type VARCHAR(32) NOT NULL,
                metadata VARCHAR NOT NULL,
                document_id VARCHAR(255) NOT NULL,
                embedding_id VARCHAR(512) NOT NULL,
                created_at TIMESTAMP NOT NULL
            )""";
    private static final String CREATE_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_document_chunk_document_id ON document_chunk (document_id)";
    private static final String INSERT = """
            INSERT INTO document_chunk (id, content, content_type, metadata, document_id, embedding_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)""";
    private static final String COLUMNS = "id, content, content_type, metadata, document_id, embedding_id, created_at";

    private final DataSource dataSource;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Clock clock;

    public JdbcChunkRecordStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    JdbcChunkRecordStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    /**
     * Creates the table and its document index when missing. The DDL targets H2 and PostgreSQL; other
     * databases should provision the table themselves.
     */
    public void initializeSchema() {
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE);
            statement.execute(CREATE_INDEX);
            log.info("chunk-store.schema.ready table=document_chunk");
        } catch (SQLException e) {
            throw translate("schema bootstrap failed", e);
        }
    }

    @Override
    public ChunkRecord create(ChunkRecord record) {
        ChunkRecord stored = record.withCreatedAt(clock.instant().truncatedTo(ChronoUnit.MILLIS));
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(INSERT)) {
            statement.setString(1, stored.id());
            statement.setString(2, stored.content());
            statement.setString(3, stored.contentType().label());
            statement.setString(4, writeMetadata(stored.metadata()));
            statement.setString(5, stored.documentId());
            statement.setString(6, stored.embeddingId());
            statement.setTimestamp(7, Timestamp.from(stored.createdAt()));
            statement.executeUpdate();
            return stored;
        } catch (SQLException e) {
            throw translate("insert of " + record.id() + " failed", e);
        }
    }

    @Override
    public Optional<ChunkRecord> findById(String id) {
        List<ChunkRecord> rows = query("SELECT " + COLUMNS + " FROM document_chunk WHERE id = ?", id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<ChunkRecord> findByDocumentId(String documentId) {
        List<ChunkRecord> rows = query("SELECT " + COLUMNS + " FROM document_chunk WHERE document_id = ?", documentId);
        rows.sort(Comparator.comparing(ChunkRecord::createdAt).thenComparingInt(ChunkRecord::chunkIndex));
        return rows;
    }

    private List<ChunkRecord> query(String sql, String parameter) {
        try (Connection connection = dataSource.getConnection();
                PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, parameter);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ChunkRecord> rows = new ArrayList<>();
                while (resultSet.next()) {
                    rows.add(map(resultSet));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw translate("query failed", e);
        }
    }

    private ChunkRecord map(ResultSet resultSet) throws SQLException {
        Timestamp createdAt = resultSet.getTimestamp("created_at");
        return new ChunkRecord(
                resultSet.getString("id"),
                resultSet.getString("content"),
                ContentType.fromLabel(resultSet.getString("content_type")),
                readMetadata(resultSet.getString("metadata")),
                resultSet.getString("document_id"),
                resultSet.getString("embedding_id"),
                createdAt == null ? Instant.EPOCH : createdAt.toInstant());
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw ExternalCallException.permanent(SERVICE, "metadata is not JSON serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        try {
            return mapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw ExternalCallException.permanent(SERVICE, "stored metadata is not valid JSON", e);
        }
    }

    static ExternalCallException translate(String message, SQLException e) {
        String state = e.getSQLState();
        boolean transientFailure = e instanceof SQLTransientException
                || e instanceof SQLRecoverableException
                || (state != null && state.startsWith("08"));
        return new ExternalCallException(SERVICE, transientFailure, message + ": " + e.getMessage(), e);
    }
}
