package com.example.video_grid.engine;

import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.example.video_grid.exception.DecodeFailureException;
import com.example.video_grid.model.DisplaySize;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link VideoAssetAdapter} backed by the ffmpeg/ffprobe command line tools.
 */
public class FfmpegVideoAssetAdapter implements VideoAssetAdapter {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegVideoAssetAdapter.class);
    private static final int LOG_SNIPPET_MAX = 2_000;

    private final String ffmpegBin;
    private final String ffprobeBin;
    private final ObjectMapper mapper;

    public FfmpegVideoAssetAdapter(String ffmpegBin, String ffprobeBin, ObjectMapper mapper) {
        this.ffmpegBin = ffmpegBin;
        this.ffprobeBin = ffprobeBin;
        this.mapper = mapper;
    }

    @Override
    public double getDuration(Path source) throws IOException, InterruptedException {
        JsonNode root = probe(source, "format=duration");
        double duration = parseDuration(root);
        if (Double.isNaN(duration)) {
            throw new IOException("ffprobe reported no duration for " + source);
        }
        return duration;
    }

    @Override
    public BufferedImage decodeFrame(Path source, double timestampSeconds, int maxSize) throws IOException, InterruptedException {
        List<String> cmd = List.of(
                ffmpegBin, "-v", "error", "-nostdin",
                "-ss", String.format(Locale.ROOT, "%.3f", Math.max(0.0, timestampSeconds)),
                "-i", source.toAbsolutePath().toString(),
                "-frames:v", "1",
                "-vf", "scale='min(iw," + maxSize + ")':'min(ih," + maxSize + ")':force_original_aspect_ratio=decrease",
                "-f", "image2pipe",
                "-vcodec", "png",
                "-"
        );
        ProcessResult result = runProcess(cmd);
        if (result.code() != 0 || result.stdout().length == 0) {
            throw new DecodeFailureException(String.format(Locale.ROOT,
                    "Cannot decode frame at %.3fs of %s (exit=%d): %s",
                    timestampSeconds, source.getFileName(), result.code(), truncate(result.stderr())));
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(result.stdout()));
        if (image == null) {
            throw new DecodeFailureException(String.format(Locale.ROOT,
                    "Unreadable frame at %.3fs of %s", timestampSeconds, source.getFileName()));
        }
        LOGGER.trace("DECODE ok source={} t={} size={}x{}", source.getFileName(), timestampSeconds, image.getWidth(), image.getHeight());
        return image;
    }

    @Override
    public Optional<DisplaySize> getNativeDisplaySize(Path source) {
        try {
            JsonNode root = probe(source, "stream=width,height,sample_aspect_ratio:stream_tags=rotate:stream_side_data=rotation");
            return parseDisplaySize(root);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            LOGGER.debug("Display size unavailable source={} err={}", source, e.toString());
            return Optional.empty();
        }
    }

    private JsonNode probe(Path source, String entries) throws IOException, InterruptedException {
        List<String> cmd = List.of(
                ffprobeBin, "-v", "error",
                "-select_streams", "v:0",
                "-show_entries", entries,
                "-of", "json",
                source.toAbsolutePath().toString()
        );
        ProcessResult result = runProcess(cmd);
        if (result.code() != 0) {
            throw new IOException("ffprobe failed (exit=" + result.code() + ") for " + source + ": " + truncate(result.stderr()));
        }
        return mapper.readTree(result.stdout());
    }

    static double parseDuration(JsonNode root) {
        JsonNode duration = root.path("format").path("duration");
        if (duration.isMissingNode() || duration.isNull()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(duration.asText());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static Optional<DisplaySize> parseDisplaySize(JsonNode root) {
        JsonNode streams = root.path("streams");
        if (!streams.isArray() || streams.isEmpty()) {
            return Optional.empty();
        }
        JsonNode stream = streams.get(0);
        int width = stream.path("width").asInt(0);
        int height = stream.path("height").asInt(0);
        if (width <= 0 || height <= 0) {
            return Optional.empty();
        }

        double sar = parseRatio(stream.path("sample_aspect_ratio").asText(""));
        if (sar > 0 && Math.abs(sar - 1.0) > 1e-6) {
            width = (int) Math.round(width * sar);
        }

        int rotation = rotationOf(stream);
        if (Math.abs(rotation) % 180 == 90) {
            return Optional.of(new DisplaySize(height, width));
        }
        return Optional.of(new DisplaySize(width, height));
    }

    private static int rotationOf(JsonNode stream) {
        JsonNode sideData = stream.path("side_data_list");
        if (sideData.isArray()) {
            for (JsonNode entry : sideData) {
                if (entry.has("rotation")) {
                    return entry.path("rotation").asInt(0);
                }
            }
        }
        return stream.path("tags").path("rotate").asInt(0);
    }

    private static double parseRatio(String value) {
        int colon = value.indexOf(':');
        if (colon <= 0) {
            return 0.0;
        }
        try {
            double num = Double.parseDouble(value.substring(0, colon));
            double den = Double.parseDouble(value.substring(colon + 1));
            return den > 0 ? num / den : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /**
     * Runs a command with stdout captured in memory and stderr captured in a temp file so the two
     * pipes cannot block each other. Interruption of the caller kills the child process.
     */
    protected ProcessResult runProcess(List<String> cmd) throws IOException, InterruptedException {
        Path errLog = Files.createTempFile("ffmpeg-", ".log");
        Process process = null;
        try {
            process = new ProcessBuilder(cmd)
                    .redirectError(errLog.toFile())
                    .start();
            byte[] stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = in.readAllBytes();
            }
            int code = process.waitFor();
            String stderr = Files.readString(errLog, StandardCharsets.UTF_8);
            return new ProcessResult(code, stdout, stderr);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                Files.deleteIfExists(errLog);
            } catch (IOException e) {
                LOGGER.debug("Cannot delete ffmpeg log {}: {}", errLog, e.toString());
            }
        }
    }

    private static String truncate(String log) {
        if (log == null) {
            return "";
        }
        String trimmed = log.strip();
        return trimmed.length() <= LOG_SNIPPET_MAX ? trimmed : trimmed.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    protected record ProcessResult(int code, byte[] stdout, String stderr) { }
}
