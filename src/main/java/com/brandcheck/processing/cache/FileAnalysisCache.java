package com.brandcheck.processing.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * File-backed analysis cache: one JSON document per fingerprint under {@code brandcheck.cache.dir}.
 * Writes go to a temp file in the same directory and are moved into place, so readers see either
 * the old entry or the new one, never a partial file.
 * Any storage failure is logged as a cache error and treated as a miss.
 */
@Service
public class FileAnalysisCache implements AnalysisCache {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalysisCache.class);
    private static final Pattern FINGERPRINT_PATTERN = Pattern.compile("[0-9a-f]{16,128}");
    private static final String ENTRY_SUFFIX = ".json";

    private final Path cacheDir;
    private final ObjectMapper objectMapper;
    private final CacheStatistics statistics = new CacheStatistics();

    public FileAnalysisCache(
            @Value("${brandcheck.cache.dir:.cache/validations}") String cacheDir,
            ObjectMapper objectMapper) {
        this.cacheDir = Paths.get(cacheDir).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;

        try {
            Files.createDirectories(this.cacheDir);
            logger.info("Analysis cache initialized with directory: {}", this.cacheDir);
        } catch (IOException e) {
            // Lookups will miss and stores will fail softly until the directory becomes usable
            logger.warn("CACHE_ERROR: could not create cache directory {}: {}", this.cacheDir, e.getMessage());
        }
    }

    @Override
    public Optional<CacheEntry> lookup(String fingerprint) {
        Path entryPath;
        try {
            entryPath = entryPath(fingerprint);
        } catch (IllegalArgumentException e) {
            statistics.recordError();
            logger.warn("CACHE_ERROR: rejected lookup key: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            CacheEntry entry = objectMapper.readValue(entryPath.toFile(), CacheEntry.class);
            if (entry == null || entry.getResult() == null) {
                statistics.recordError();
                logger.warn("CACHE_ERROR: cache entry {} has no result, treating as miss", shortKey(fingerprint));
                return Optional.empty();
            }
            statistics.recordHit();
            logger.debug("Cache hit: key={}, storedAt={}", shortKey(fingerprint), entry.getStoredAt());
            return Optional.of(entry);
        } catch (NoSuchFileException | FileNotFoundException e) {
            statistics.recordMiss();
            return Optional.empty();
        } catch (IOException e) {
            statistics.recordError();
            logger.warn("CACHE_ERROR: failed to read cache entry {}: {}", shortKey(fingerprint), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String fingerprint, CacheEntry entry) {
        Path tempFile = null;
        try {
            Path entryPath = entryPath(fingerprint);
            Files.createDirectories(cacheDir);
            tempFile = cacheDir.resolve(fingerprint + "." + UUID.randomUUID() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), entry);
            moveIntoPlace(tempFile, entryPath);
            statistics.recordStore();
            logger.debug("Cached result: key={}...", shortKey(fingerprint));
        } catch (IOException | IllegalArgumentException e) {
            statistics.recordError();
            logger.warn("CACHE_ERROR: failed to store cache entry {}: {}", shortKey(fingerprint), e.getMessage());
            deleteQuietly(tempFile);
        }
    }

    @Override
    public CacheStatistics statistics() {
        return statistics;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    /**
     * Counts stored entries and their size on disk.
     *
     * @throws IOException if the cache directory cannot be listed
     */
    public DirectoryUsage directoryUsage() throws IOException {
        long count = 0;
        long bytes = 0;
        if (!Files.isDirectory(cacheDir)) {
            return new DirectoryUsage(0, 0);
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDir, "*" + ENTRY_SUFFIX)) {
            for (Path entry : entries) {
                count++;
                bytes += Files.size(entry);
            }
        }
        return new DirectoryUsage(count, bytes);
    }

    /**
     * Deletes every stored entry, forcing the next run to re-analyze all pages.
     *
     * @return number of entries deleted
     * @throws IOException if the cache directory cannot be listed
     */
    public int clear() throws IOException {
        int deleted = 0;
        if (!Files.isDirectory(cacheDir)) {
            return 0;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDir, "*" + ENTRY_SUFFIX)) {
            for (Path entry : entries) {
                if (Files.deleteIfExists(entry)) {
                    deleted++;
                }
            }
        }
        logger.info("Cleared {} cache entries from {}", deleted, cacheDir);
        return deleted;
    }

    private Path entryPath(String fingerprint) {
        if (fingerprint == null || !FINGERPRINT_PATTERN.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Invalid fingerprint: " + fingerprint);
        }
        return cacheDir.resolve(fingerprint + ENTRY_SUFFIX);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete temp cache file {}: {}", file, e.getMessage());
        }
    }

    private static String shortKey(String fingerprint) {
        if (fingerprint == null) {
            return "null";
        }
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }

    /**
     * Entry count and total size of the cache directory.
     */
    public static class DirectoryUsage {
        private final long entryCount;
        private final long totalBytes;

        public DirectoryUsage(long entryCount, long totalBytes) {
            this.entryCount = entryCount;
            this.totalBytes = totalBytes;
        }

        public long getEntryCount() {
            return entryCount;
        }

        public long getTotalBytes() {
            return totalBytes;
        }
    }
}
