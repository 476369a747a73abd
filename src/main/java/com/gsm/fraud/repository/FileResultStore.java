package com.gsm.fraud.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsm.fraud.config.ScoringConfig;
import com.gsm.fraud.exception.ResultNotFoundException;
import com.gsm.fraud.exception.ResultStoreException;
import com.gsm.fraud.model.ResultListing;
import com.gsm.fraud.model.ScoringResult;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Result store backed by a directory of JSON documents, one per result ({@code <resultId>.json}).
 *
 * Each result is written to a temporary file in the same directory and then atomically
 * renamed into place, so a reader sees either the complete document or nothing. The listing
 * is served from an in-memory index that is rebuilt from disk at startup.
 */
@Repository
@ConditionalOnProperty(prefix = "scoring.result-store", name = "type", havingValue = "file", matchIfMissing = true)
public class FileResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(FileResultStore.class);

    private static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern RESULT_ID = Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    private final Map<String, ResultListing> index = new ConcurrentHashMap<>();
    // Identifiers handed out but not yet renamed into place
    private final Set<String> reserved = ConcurrentHashMap.newKeySet();
    // Strictly increasing creation stamps so same-millisecond saves still list newest first
    private final AtomicLong lastCreatedAt = new AtomicLong();

    @Autowired
    public FileResultStore(ScoringConfig scoringConfig) {
        this(Paths.get(scoringConfig.getResultStore().getDirectory()));
    }

    FileResultStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ResultStoreException("Cannot create result directory " + directory.toAbsolutePath(), e);
        }

        index.clear();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    // Leftover from a write interrupted before its rename
                    Files.deleteIfExists(file);
                } else if (name.endsWith(EXTENSION)) {
                    indexFile(file);
                }
            }
        } catch (IOException e) {
            throw new ResultStoreException("Cannot scan result directory " + directory.toAbsolutePath(), e);
        }

        lastCreatedAt.set(index.values().stream().mapToLong(ResultListing::getCreatedAt).max().orElse(0L));
        log.info("File result store at {} holds {} results", directory.toAbsolutePath(), index.size());
    }

    @Override
    public ScoringResult save(ScoringResult result) {
        String resultId = reserveId();
        ScoringResult stored = result.toBuilder()
                .resultId(resultId)
                .createdAt(nextCreatedAt())
                .build();

        Path target = pathFor(resultId);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, resultId + ".", TEMP_SUFFIX);
            objectMapper.writeValue(temp.toFile(), stored);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            index.put(resultId, ResultListing.of(stored));
        } catch (IOException e) {
            deleteQuietly(temp);
            log.error("Failed to persist result {}", resultId, e);
            throw new ResultStoreException("Failed to persist result " + resultId, e);
        } finally {
            reserved.remove(resultId);
        }

        log.info("Saved result {} ({} predictions) to {}", resultId,
                stored.getPredictions() == null ? 0 : stored.getPredictions().size(), target);
        return stored;
    }

    @Override
    public ScoringResult load(String resultId) {
        if (!isValidId(resultId)) {
            throw new ResultNotFoundException(resultId);
        }
        try (InputStream in = Files.newInputStream(pathFor(resultId))) {
            return objectMapper.readValue(in, ScoringResult.class);
        } catch (NoSuchFileException e) {
            throw new ResultNotFoundException(resultId);
        } catch (IOException e) {
            throw new ResultStoreException("Failed to read result " + resultId, e);
        }
    }

    @Override
    public List<ResultListing> list() {
        return index.values().stream()
                .sorted(Comparator.comparingLong(ResultListing::getCreatedAt).reversed()
                        .thenComparing(ResultListing::getResultId))
                .collect(Collectors.toList());
    }

    @Override
    public void purge(String resultId) {
        if (!isValidId(resultId)) {
            throw new ResultNotFoundException(resultId);
        }
        try {
            if (!Files.deleteIfExists(pathFor(resultId))) {
                throw new ResultNotFoundException(resultId);
            }
        } catch (IOException e) {
            throw new ResultStoreException("Failed to purge result " + resultId, e);
        }
        index.remove(resultId);
        log.info("Purged result {}", resultId);
    }

    private String reserveId() {
        while (true) {
            String candidate = UUID.randomUUID().toString();
            if (!index.containsKey(candidate) && !Files.exists(pathFor(candidate)) && reserved.add(candidate)) {
                return candidate;
            }
        }
    }

    private long nextCreatedAt() {
        return lastCreatedAt.updateAndGet(prev -> Math.max(prev + 1, System.currentTimeMillis()));
    }

    private void indexFile(Path file) {
        try {
            ScoringResult result = objectMapper.readValue(file.toFile(), ScoringResult.class);
            if (result.getResultId() == null) {
                log.warn("Skipping result file without identifier: {}", file);
                return;
            }
            index.put(result.getResultId(), ResultListing.of(result));
        } catch (IOException e) {
            log.warn("Skipping unreadable result file {}: {}", file, e.getMessage());
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", temp, e);
        }
    }

    private Path pathFor(String resultId) {
        return directory.resolve(resultId + EXTENSION);
    }

    private static boolean isValidId(String resultId) {
        return resultId != null && RESULT_ID.matcher(resultId).matches();
    }
}
