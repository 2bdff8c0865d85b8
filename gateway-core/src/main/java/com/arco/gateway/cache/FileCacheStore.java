package com.arco.gateway.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One JSON file per fingerprint under a cache directory.
 *
 * Writes go to a temp file in the same directory and are moved into place, so a reader
 * never sees a half-written entry.
 */
public final class FileCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(FileCacheStore.class);
    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCacheStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create cache directory " + directory, e);
        }
        logger.info("File cache store initialized: {}", directory.toAbsolutePath());
    }

    @Override
    public Optional<CacheEntry> read(String fingerprint) throws IOException {
        Path file = pathFor(fingerprint);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CacheEntry.class));
        } catch (NoSuchFileException e) {
            // Deleted between the exists() check and the read
            return Optional.empty();
        }
    }

    @Override
    public void write(CacheEntry entry) throws CacheWriteException {
        Path tmp = null;
        try {
            Path target = pathFor(entry.fingerprint());
            tmp = Files.createTempFile(directory, entry.fingerprint(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), entry);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CacheWriteException("Failed to write cache entry " + entry.fingerprint(), e);
        }
    }

    @Override
    public void delete(String fingerprint) throws IOException {
        Files.deleteIfExists(pathFor(fingerprint));
    }

    @Override
    public int deleteStoredBefore(Instant cutoff) throws IOException {
        int removed = 0;
        for (Path file : entryFiles()) {
            try {
                CacheEntry entry = objectMapper.readValue(file.toFile(), CacheEntry.class);
                if (entry.storedAt().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            } catch (NoSuchFileException e) {
                logger.debug("Cache file {} disappeared during purge", file.getFileName());
            } catch (IOException e) {
                logger.warn("Removing unreadable cache file {}: {}", file.getFileName(), e.getMessage());
                Files.deleteIfExists(file);
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() throws IOException {
        for (Path file : entryFiles()) {
            Files.deleteIfExists(file);
        }
    }

    @Override
    public int size() throws IOException {
        return entryFiles().size();
    }

    @Override
    public void close() {
        logger.debug("File cache store closed: {}", directory);
    }

    private Path pathFor(String fingerprint) throws IOException {
        if (fingerprint == null || !SAFE_NAME.matcher(fingerprint).matches()) {
            throw new IOException("Invalid cache fingerprint: " + fingerprint);
        }
        return directory.resolve(fingerprint + SUFFIX);
    }

    private List<Path> entryFiles() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList();
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.debug("Could not remove temp cache file {}: {}", tmp, e.getMessage());
        }
    }
}
