package com.example.video_grid.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Expands user supplied paths into the list of supported video files.
 */
public final class VideoFileCollector {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoFileCollector.class);
    private static final Set<String> ALLOWED_EXTENSIONS = Set.of("mp4", "m4v", "mov");

    private VideoFileCollector() {
    }

    /**
     * Keeps supported files as given and walks directories recursively, skipping hidden entries.
     * Missing paths are ignored.
     *
     * @param inputs files and/or directories.
     * @return video files in discovery order.
     */
    public static List<Path> collect(Collection<Path> inputs) {
        List<Path> result = new ArrayList<>();
        for (Path input : inputs) {
            if (input == null || !Files.exists(input)) {
                LOGGER.debug("VideoFileCollector skip missing path={}", input);
                continue;
            }
            if (Files.isDirectory(input)) {
                result.addAll(walk(input));
            } else if (isSupported(input)) {
                result.add(input);
            }
        }
        return result;
    }

    public static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && ALLOWED_EXTENSIONS.contains(name.substring(dot + 1));
    }

    private static List<Path> walk(Path dir) {
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream
                    .filter(p -> !isHidden(dir, p))
                    .filter(Files::isRegularFile)
                    .filter(VideoFileCollector::isSupported)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list directory " + dir, e);
        }
    }

    private static boolean isHidden(Path root, Path p) {
        for (Path part : root.relativize(p)) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
