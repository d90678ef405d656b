package com.bank.patterns.cache;

import com.bank.patterns.config.PatternConfig;
import com.bank.patterns.model.CacheLevel;
import com.bank.patterns.model.CachedPatternSet;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Local best-effort backup: one JSON document per tenant under {@code patterns.cache.file-dir}.
 * Files are replaced through a temp file and a rename so a reader never sees half a document.
 * When disabled every call is a no-op miss.
 */
@Component
public class FilePatternTier implements CacheTier {

    private static final Logger log = LoggerFactory.getLogger(FilePatternTier.class);

    private final PatternConfig config;
    private final ObjectMapper objectMapper;

    public FilePatternTier(PatternConfig config) {
        this.config = config;
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Override
    public CacheLevel level() {
        return CacheLevel.FILE;
    }

    @Override
    public Optional<CachedPatternSet> get(String tenantId) {
        if (!config.getCache().isFileEnabled()) return Optional.empty();
        Path file = fileFor(tenantId);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CachedPatternSet.class));
        } catch (IOException e) {
            throw new TierUnavailableException(CacheLevel.FILE, "Failed to read cache file for tenant " + tenantId, e);
        }
    }

    @Override
    public void put(CachedPatternSet entry) {
        if (!config.getCache().isFileEnabled()) return;
        Path target = fileFor(entry.getTenantId());
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "patterns-", ".tmp");
            objectMapper.writeValue(temp.toFile(), entry);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TierUnavailableException(CacheLevel.FILE, "Failed to write cache file for tenant " + entry.getTenantId(), e);
        }
    }

    @Override
    public void invalidate(String tenantId) {
        try {
            Files.deleteIfExists(fileFor(tenantId));
        } catch (IOException e) {
            throw new TierUnavailableException(CacheLevel.FILE, "Failed to delete cache file for tenant " + tenantId, e);
        }
    }

    @Override
    public boolean contains(String tenantId) {
        return config.getCache().isFileEnabled() && Files.exists(fileFor(tenantId));
    }

    Path fileFor(String tenantId) {
        String name = URLEncoder.encode(tenantId, StandardCharsets.UTF_8) + ".json";
        return Paths.get(config.getCache().getFileDir()).resolve(name);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp cache file {}: {}", temp, e.getMessage());
        }
    }
}
