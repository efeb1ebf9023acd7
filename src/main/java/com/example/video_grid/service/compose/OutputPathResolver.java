package com.example.video_grid.service.compose;

import com.example.video_grid.config.GridProperties;
import com.example.video_grid.model.GridConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Chooses where a grid image is written: an explicit folder, the video's own folder when it is
 * writable, otherwise the configured fallback folder.
 */
@Component
public class OutputPathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutputPathResolver.class);
    static final String EXTENSION = ".jpg";

    private final Path fallbackFolder;

    public OutputPathResolver(GridProperties properties) {
        this.fallbackFolder = properties.getFallbackFolder();
    }

    /**
     * @return a path that did not exist when checked. Callers still create it exclusively.
     */
    public Path resolve(Path source, GridConfig config, @Nullable Path outputFolder) throws IOException {
        Path dir = resolveDirectory(source, outputFolder);
        String base = baseName(source) + "_" + config.rows() + "x" + config.columns();
        Path candidate = dir.resolve(base + EXTENSION);
        int counter = 1;
        while (Files.exists(candidate)) {
            candidate = dir.resolve(base + "_" + counter + EXTENSION);
            counter++;
        }
        return candidate;
    }

    Path resolveDirectory(Path source, @Nullable Path outputFolder) throws IOException {
        if (outputFolder != null) {
            Files.createDirectories(outputFolder);
            return outputFolder;
        }
        Path sourceDir = source.toAbsolutePath().getParent();
        if (sourceDir != null && isWritable(sourceDir)) {
            return sourceDir;
        }
        LOGGER.warn("OUTPUT source folder not writable dir={} fallback={}", sourceDir, fallbackFolder);
        Files.createDirectories(fallbackFolder);
        return fallbackFolder;
    }

    /** Writes and deletes a throwaway file; directory permission bits alone are not trusted. */
    static boolean isWritable(Path dir) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        Path probe = null;
        try {
            probe = Files.createTempFile(dir, ".write_probe_", ".tmp");
            return true;
        } catch (IOException | SecurityException e) {
            LOGGER.debug("Write probe failed dir={} err={}", dir, e.toString());
            return false;
        } finally {
            if (probe != null) {
                try {
                    Files.deleteIfExists(probe);
                } catch (IOException e) {
                    LOGGER.debug("Cannot delete write probe {}: {}", probe, e.toString());
                }
            }
        }
    }

    static String baseName(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
