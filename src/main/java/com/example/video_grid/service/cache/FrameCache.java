package com.example.video_grid.service.cache;

import com.example.video_grid.config.FrameCacheProperties;
import com.example.video_grid.exception.CacheCorruptException;
import com.example.video_grid.model.CacheEntry;
import com.example.video_grid.model.ExtractedFrame;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Content-addressed store of selected frames, keyed by source path, modification time and frame
 * count. Entries are never evicted here; {@link #remove} and {@link #clear} exist for housekeeping.
 */
@Component
public class FrameCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameCache.class);
    private static final String SUFFIX = ".cache";

    private final FrameCacheProperties properties;
    private final ObjectMapper mapper;
    private final Executor writeExecutor;

    public FrameCache(FrameCacheProperties properties,
                      ObjectMapper mapper,
                      @Qualifier("cacheWriteExecutor") Executor writeExecutor) {
        this.properties = properties;
        this.mapper = mapper;
        this.writeExecutor = writeExecutor;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /**
     * Corrupt, unreadable or mismatching entries are reported as a miss.
     */
    public Optional<CacheEntry> lookup(Path source, int frameCount) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        String fingerprint = fingerprint(source, frameCount);
        Path file = entryPath(fingerprint);
        if (!Files.isRegularFile(file)) {
            LOGGER.debug("CACHE MISS fingerprint={} source={}", fingerprint, source.getFileName());
            return Optional.empty();
        }
        try {
            CacheEntry entry = read(file, fingerprint, frameCount);
            LOGGER.info("CACHE HIT fingerprint={} source={} frames={}", fingerprint, source.getFileName(), entry.frames().size());
            return Optional.of(entry);
        } catch (CacheCorruptException e) {
            LOGGER.warn("CACHE CORRUPT fingerprint={} file={} reason={}", fingerprint, file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Schedules a background write. The returned future never completes exceptionally.
     */
    public CompletableFuture<Void> store(Path source, int frameCount, List<ExtractedFrame> frames) {
        if (!isEnabled() || frames.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        List<ExtractedFrame> snapshot = List.copyOf(frames);
        String fingerprint = fingerprint(source, frameCount);
        try {
            return CompletableFuture
                    .runAsync(() -> write(source, frameCount, fingerprint, snapshot), writeExecutor)
                    .exceptionally(ex -> {
                        LOGGER.warn("CACHE WRITE failed fingerprint={} source={} err={}", fingerprint, source.getFileName(), ex.toString());
                        return null;
                    });
        } catch (RuntimeException e) {
            LOGGER.warn("CACHE WRITE rejected fingerprint={} err={}", fingerprint, e.toString());
            return CompletableFuture.completedFuture(null);
        }
    }

    public boolean remove(Path source, int frameCount) {
        Path file = entryPath(fingerprint(source, frameCount));
        try {
            boolean removed = Files.deleteIfExists(file);
            if (removed) {
                LOGGER.info("CACHE REMOVE file={}", file);
            }
            return removed;
        } catch (IOException e) {
            LOGGER.warn("CACHE REMOVE failed file={} err={}", file, e.toString());
            return false;
        }
    }

    /**
     * @return number of entries deleted.
     */
    public int clear() {
        Path dir = properties.getDir();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : stream) {
                try {
                    if (Files.deleteIfExists(file)) {
                        removed++;
                    }
                } catch (IOException e) {
                    LOGGER.warn("CACHE CLEAR skip file={} err={}", file, e.toString());
                }
            }
        } catch (IOException e) {
            LOGGER.warn("CACHE CLEAR failed dir={} err={}", dir, e.toString());
        }
        LOGGER.info("CACHE CLEAR dir={} removed={}", dir, removed);
        return removed;
    }

    /**
     * SHA-256 over {@code absolutePath|mtimeMillis|frameCount}, or over the path alone when the
     * modification time cannot be read.
     */
    public String fingerprint(Path source, int frameCount) {
        String absolute = source.toAbsolutePath().normalize().toString();
        String key;
        try {
            long mtime = Files.getLastModifiedTime(source).toMillis();
            key = absolute + "|" + mtime + "|" + frameCount;
        } catch (IOException e) {
            LOGGER.debug("No mtime for {}, fingerprinting path only: {}", source, e.toString());
            key = absolute;
        }
        return sha256(key);
    }

    Path entryPath(String fingerprint) {
        return properties.getDir().resolve(fingerprint + SUFFIX);
    }

    private CacheEntry read(Path file, String fingerprint, int frameCount) {
        CacheDocument doc;
        try {
            doc = mapper.readValue(file.toFile(), CacheDocument.class);
        } catch (IOException e) {
            throw new CacheCorruptException("Unreadable cache document " + file.getFileName(), e);
        }
        if (doc == null || doc.frames() == null || doc.frames().isEmpty()) {
            throw new CacheCorruptException("Empty cache document " + file.getFileName());
        }
        if (doc.version() != CacheDocument.CURRENT_VERSION) {
            throw new CacheCorruptException("Unsupported cache version " + doc.version());
        }
        if (doc.frameCount() != frameCount) {
            throw new CacheCorruptException("Entry holds frameCount=" + doc.frameCount() + ", wanted " + frameCount);
        }

        List<ExtractedFrame> frames = new ArrayList<>(doc.frames().size());
        for (CacheDocument.Frame f : doc.frames()) {
            if (f == null || f.image() == null || f.image().length == 0) {
                throw new CacheCorruptException("Frame without image data in " + file.getFileName());
            }
            BufferedImage image;
            try {
                image = ImageIO.read(new ByteArrayInputStream(f.image()));
            } catch (IOException e) {
                throw new CacheCorruptException("Undecodable frame in " + file.getFileName(), e);
            }
            if (image == null) {
                throw new CacheCorruptException("Undecodable frame in " + file.getFileName());
            }
            frames.add(new ExtractedFrame(image, f.timestampSeconds()));
        }
        return new CacheEntry(fingerprint, frames);
    }

    private void write(Path source, int frameCount, String fingerprint, List<ExtractedFrame> frames) {
        long t0 = System.nanoTime();
        List<CacheDocument.Frame> encoded = new ArrayList<>(frames.size());
        for (ExtractedFrame frame : frames) {
            encoded.add(new CacheDocument.Frame(frame.timestampSeconds(), png(frame.image())));
        }
        CacheDocument doc = new CacheDocument(CacheDocument.CURRENT_VERSION,
                source.toAbsolutePath().normalize().toString(), frameCount, encoded);

        Path target = entryPath(fingerprint);
        Path tmp = target.resolveSibling(fingerprint + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            mapper.writeValue(tmp.toFile(), doc);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.info("CACHE STORED fingerprint={} frames={} size={}B in={}ms",
                    fingerprint, frames.size(), Files.size(target), (System.nanoTime() - t0) / 1_000_000);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write cache entry " + target, e);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                LOGGER.debug("Cannot delete temp cache file {}: {}", tmp, e.toString());
            }
        }
    }

    private static byte[] png(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out) || out.size() == 0) {
                throw new IllegalStateException("PNG encoder produced no data");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    static String sha256(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
