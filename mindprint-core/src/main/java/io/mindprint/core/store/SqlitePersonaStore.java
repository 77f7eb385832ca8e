package io.mindprint.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mindprint.core.error.StoreException;
import io.mindprint.core.error.StoreUnavailableException;
import io.mindprint.core.profile.CognitionDocument;
import io.mindprint.core.profile.CognitionProfile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqlitePersonaStore implements PersonaStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqlitePersonaStore.class);
    private static final TypeReference<Map<String, String>> METADATA = new TypeReference<>() {
    };
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final String SELLERS = "sellers";
    private static final String BUYERS = "buyers";

    private final String jdbcUrl;
    private final long busyTimeoutMillis;
    private final ObjectMapper mapper;

    public SqlitePersonaStore(Path dbPath, Duration busyTimeout) throws StoreException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        if (busyTimeout == null || busyTimeout.isNegative()) {
            throw new IllegalArgumentException("busyTimeout must be >= 0");
        }
        try {
            Files.createDirectories(dbPath.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new StoreException("Failed to create store directory for " + dbPath, e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.busyTimeoutMillis = busyTimeout.toMillis();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized void upsertSeller(InstallationRecord seller) throws StoreException {
        upsert(SELLERS, seller);
    }

    @Override
    public synchronized void upsertBuyer(InstallationRecord buyer) throws StoreException {
        upsert(BUYERS, buyer);
    }

    @Override
    public synchronized Optional<InstallationRecord> findSeller(String userId) throws StoreException {
        return find(SELLERS, userId);
    }

    @Override
    public synchronized Optional<InstallationRecord> findBuyer(String userId) throws StoreException {
        return find(BUYERS, userId);
    }

    @Override
    public synchronized void saveAsset(String sellerUserId, String filePath, CognitionProfile profile, Instant scannedAt)
        throws StoreException {
        if (profile == null) {
            throw new IllegalArgumentException("profile must not be null");
        }
        String content = CognitionDocument.render(profile);
        String hash = sha256(content);
        inTransaction("save asset", connection -> {
            try (PreparedStatement delete = connection.prepareStatement("DELETE FROM memory_data WHERE user_id = ?")) {
                delete.setString(1, sellerUserId);
                delete.executeUpdate();
            }
            String sql = """
                INSERT INTO memory_data (file_path, content, content_hash, scanned_at, user_id)
                VALUES (?, ?, ?, ?, ?)
                """;
            try (PreparedStatement insert = connection.prepareStatement(sql)) {
                insert.setString(1, filePath == null ? "" : filePath);
                insert.setString(2, content);
                insert.setString(3, hash);
                insert.setLong(4, scannedAt.toEpochMilli());
                insert.setString(5, sellerUserId);
                insert.executeUpdate();
            }
            return null;
        });
        LOG.debug("Saved cognition asset ({} bullets, hash {})", profile.bulletCount(), hash.substring(0, 12));
    }

    @Override
    public synchronized Optional<CognitionProfile> getAsset(String sellerUserId) throws StoreException {
        Optional<String> content = inTransaction("load asset", connection -> readAsset(connection, sellerUserId));
        return content.isEmpty() ? Optional.empty() : Optional.of(parseAsset(content.get()));
    }

    @Override
    public synchronized Optional<String> getSellerId(String token) throws StoreException {
        return inTransaction("load rental seller", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "SELECT seller_user_id FROM rentals WHERE token = ?")) {
                statement.setString(1, token);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(resultSet.getString(1)) : Optional.<String>empty();
                }
            }
        });
    }

    @Override
    public synchronized boolean createRental(Rental rental) throws StoreException {
        String sql = """
            INSERT INTO rentals (token, seller_user_id, created_at, expires_at, revoked_at)
            SELECT ?, ?, ?, ?, NULL
            WHERE EXISTS (SELECT 1 FROM memory_data WHERE user_id = ?)
            """;
        int inserted = inTransaction("create rental", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, rental.token());
                statement.setString(2, rental.sellerUserId());
                statement.setLong(3, rental.createdAt().toEpochMilli());
                setInstant(statement, 4, rental.expiresAt());
                statement.setString(5, rental.sellerUserId());
                return statement.executeUpdate();
            }
        });
        return inserted > 0;
    }

    @Override
    public synchronized Optional<RentalGrant> loadGrant(String token) throws StoreException {
        Optional<RawGrant> raw = inTransaction("load rental", connection -> {
            Optional<Rental> rental = readRental(connection, token);
            if (rental.isEmpty()) {
                return Optional.<RawGrant>empty();
            }
            return Optional.of(new RawGrant(rental.get(), readAsset(connection, rental.get().sellerUserId()).orElse(null)));
        });
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        String content = raw.get().content();
        return Optional.of(new RentalGrant(raw.get().rental(), content == null ? null : parseAsset(content)));
    }

    @Override
    public synchronized boolean revokeRental(String token, Instant at) throws StoreException {
        String sql = """
            UPDATE rentals SET revoked_at = ?
            WHERE token = ? AND revoked_at IS NULL AND (expires_at IS NULL OR expires_at >= ?)
            """;
        int updated = inTransaction("revoke rental", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, at.toEpochMilli());
                statement.setString(2, token);
                statement.setLong(3, at.toEpochMilli());
                return statement.executeUpdate();
            }
        });
        return updated > 0;
    }

    private void upsert(String table, InstallationRecord record) throws StoreException {
        String metadata;
        try {
            metadata = mapper.writeValueAsString(record.metadata());
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize installation metadata", e);
        }
        String sql = """
            INSERT INTO %s (user_id, host_fingerprint, first_seen, last_seen, metadata_json)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(user_id) DO UPDATE SET
                host_fingerprint = excluded.host_fingerprint,
                last_seen = MAX(last_seen, excluded.last_seen),
                metadata_json = excluded.metadata_json
            """.formatted(table);
        inTransaction("upsert " + table, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, record.userId());
                statement.setString(2, record.hostFingerprint());
                statement.setLong(3, record.firstSeen().toEpochMilli());
                statement.setLong(4, record.lastSeen().toEpochMilli());
                statement.setString(5, metadata);
                return statement.executeUpdate();
            }
        });
    }

    private Optional<InstallationRecord> find(String table, String userId) throws StoreException {
        String sql = "SELECT user_id, host_fingerprint, first_seen, last_seen, metadata_json FROM %s WHERE user_id = ?"
            .formatted(table);
        Optional<RawInstallation> raw = inTransaction("find " + table, connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, userId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.<RawInstallation>empty();
                    }
                    return Optional.of(new RawInstallation(
                        resultSet.getString("user_id"),
                        resultSet.getString("host_fingerprint"),
                        Instant.ofEpochMilli(resultSet.getLong("first_seen")),
                        Instant.ofEpochMilli(resultSet.getLong("last_seen")),
                        resultSet.getString("metadata_json")
                    ));
                }
            }
        });
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        RawInstallation row = raw.get();
        try {
            Map<String, String> metadata = row.metadataJson() == null || row.metadataJson().isBlank()
                ? Map.of()
                : mapper.readValue(row.metadataJson(), METADATA);
            return Optional.of(new InstallationRecord(row.userId(), row.hostFingerprint(), row.firstSeen(), row.lastSeen(), metadata));
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored installation metadata is not valid JSON", e);
        }
    }

    private Optional<Rental> readRental(Connection connection, String token) throws SQLException {
        String sql = "SELECT token, seller_user_id, created_at, expires_at, revoked_at FROM rentals WHERE token = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, token);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Rental(
                    resultSet.getString("token"),
                    resultSet.getString("seller_user_id"),
                    Instant.ofEpochMilli(resultSet.getLong("created_at")),
                    getInstant(resultSet, "expires_at"),
                    getInstant(resultSet, "revoked_at")
                ));
            }
        }
    }

    private Optional<String> readAsset(Connection connection, String sellerUserId) throws SQLException {
        String sql = "SELECT content FROM memory_data WHERE user_id = ? ORDER BY scanned_at DESC, id DESC LIMIT 1";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sellerUserId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getString(1)) : Optional.empty();
            }
        }
    }

    private CognitionProfile parseAsset(String content) throws StoreException {
        try {
            return CognitionDocument.parse(content);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Stored cognition asset is not a valid cognition document", e);
        }
    }

    private <T> T inTransaction(String action, SqlWork<T> work) throws StoreException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw translate(action, e);
        }
    }

    private void rollback(Connection connection, Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private StoreException translate(String action, SQLException e) {
        int primaryCode = e.getErrorCode() & 0xFF;
        if (e instanceof SQLTimeoutException || primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
            LOG.warn("Persona store busy during {}", action);
            return new StoreUnavailableException("Persona store is busy, failed to " + action, e);
        }
        return new StoreException("Failed to " + action, e);
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA busy_timeout=" + busyTimeoutMillis + ";");
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    private void init() throws StoreException {
        String memoryData = """
            CREATE TABLE IF NOT EXISTS memory_data (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_path TEXT NOT NULL,
                content TEXT NOT NULL,
                content_hash TEXT NOT NULL,
                scanned_at INTEGER NOT NULL,
                user_id TEXT NOT NULL,
                UNIQUE (user_id, file_path, content_hash)
            )
            """;
        String rentals = """
            CREATE TABLE IF NOT EXISTS rentals (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                token TEXT NOT NULL UNIQUE,
                seller_user_id TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                expires_at INTEGER,
                revoked_at INTEGER
            )
            """;
        String installations = """
            CREATE TABLE IF NOT EXISTS %s (
                user_id TEXT PRIMARY KEY,
                host_fingerprint TEXT NOT NULL,
                first_seen INTEGER NOT NULL,
                last_seen INTEGER NOT NULL,
                metadata_json TEXT NOT NULL
            )
            """;
        inTransaction("initialize persona store", connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute(memoryData);
                statement.execute("CREATE INDEX IF NOT EXISTS idx_memory_data_user ON memory_data(user_id)");
                statement.execute(rentals);
                statement.execute("CREATE INDEX IF NOT EXISTS idx_rentals_seller ON rentals(seller_user_id)");
                statement.execute(installations.formatted(SELLERS));
                statement.execute(installations.formatted(BUYERS));
            }
            return null;
        });
    }

    private static void setInstant(PreparedStatement statement, int index, Instant value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private record RawInstallation(String userId, String hostFingerprint, Instant firstSeen, Instant lastSeen,
                                   String metadataJson) {
    }

    private record RawGrant(Rental rental, String content) {
    }
}
