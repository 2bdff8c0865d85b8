package com.arco.gateway.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed cache store: one row per fingerprint in {@code response_cache}.
 *
 * Thread-Safety: a single connection is shared, so every statement runs under one lock.
 */
public final class SqliteCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(SqliteCacheStore.class);

    private final Connection connection;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReentrantLock lock = new ReentrantLock();

    public SqliteCacheStore(Path dbPath) {
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("SQLite cache store initialized: {}", dbPath);
        } catch (SQLException | IOException e) {
            throw new IllegalStateException("Failed to initialize cache database " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS response_cache (
                fingerprint TEXT PRIMARY KEY,
                payload TEXT NOT NULL,
                stored_at INTEGER NOT NULL
            )
            """;

        String createIndexSql = """
            CREATE INDEX IF NOT EXISTS idx_response_cache_stored_at
            ON response_cache(stored_at)
            """;

        lock.lock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute(createIndexSql);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CacheEntry> read(String fingerprint) throws IOException {
        String sql = "SELECT payload, stored_at FROM response_cache WHERE fingerprint = ?";

        lock.lock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, fingerprint);
            try (var rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                JsonNode payload = objectMapper.readTree(rs.getString("payload"));
                Instant storedAt = Instant.ofEpochMilli(rs.getLong("stored_at"));
                return Optional.of(new CacheEntry(fingerprint, payload, storedAt));
            }
        } catch (SQLException e) {
            throw new IOException("Cache read failed for " + fingerprint, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void write(CacheEntry entry) throws CacheWriteException {
        String sql = """
            INSERT INTO response_cache (fingerprint, payload, stored_at)
            VALUES (?, ?, ?)
            ON CONFLICT(fingerprint) DO UPDATE SET payload = excluded.payload, stored_at = excluded.stored_at
            """;

        lock.lock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, entry.fingerprint());
            stmt.setString(2, objectMapper.writeValueAsString(entry.payload()));
            stmt.setLong(3, entry.storedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException | IOException e) {
            throw new CacheWriteException("Failed to write cache entry " + entry.fingerprint(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String fingerprint) throws IOException {
        executeUpdate("DELETE FROM response_cache WHERE fingerprint = ?", fingerprint);
    }

    @Override
    public int deleteStoredBefore(Instant cutoff) throws IOException {
        return executeUpdate("DELETE FROM response_cache WHERE stored_at < ?", cutoff.toEpochMilli());
    }

    @Override
    public void clear() throws IOException {
        executeUpdate("DELETE FROM response_cache");
    }

    @Override
    public int size() throws IOException {
        lock.lock();
        try (var stmt = connection.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) AS count FROM response_cache")) {
            return rs.next() ? rs.getInt("count") : 0;
        } catch (SQLException e) {
            throw new IOException("Cache size query failed", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                logger.info("SQLite cache store closed");
            }
        } catch (SQLException e) {
            logger.error("Error closing cache database", e);
        } finally {
            lock.unlock();
        }
    }

    private int executeUpdate(String sql, Object... args) throws IOException {
        lock.lock();
        try (var stmt = connection.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                stmt.setObject(i + 1, args[i]);
            }
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Cache update failed: " + sql.trim(), e);
        } finally {
            lock.unlock();
        }
    }
}
