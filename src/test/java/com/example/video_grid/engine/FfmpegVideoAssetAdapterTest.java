package com.example.video_grid.engine;

import com.example.video_grid.exception.DecodeFailureException;
import com.example.video_grid.model.DisplaySize;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FfmpegVideoAssetAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tmp;

    @Test
    void parsesDurationFromFormatSection() throws IOException {
        assertThat(FfmpegVideoAssetAdapter.parseDuration(json("{\"format\":{\"duration\":\"62.480000\"}}")))
                .isCloseTo(62.48, within(1e-9));
        assertThat(FfmpegVideoAssetAdapter.parseDuration(json("{\"format\":{}}"))).isNaN();
        assertThat(FfmpegVideoAssetAdapter.parseDuration(json("{\"format\":{\"duration\":\"N/A\"}}"))).isNaN();
    }

    @Test
    void displaySizeSwapsForQuarterTurnRotation() throws IOException {
        JsonNode sideData = json("{\"streams\":[{\"width\":1920,\"height\":1080,"
                + "\"side_data_list\":[{\"side_data_type\":\"Display Matrix\",\"rotation\":-90}]}]}");
        JsonNode tag = json("{\"streams\":[{\"width\":1920,\"height\":1080,\"tags\":{\"rotate\":\"270\"}}]}");

        assertThat(FfmpegVideoAssetAdapter.parseDisplaySize(sideData)).contains(new DisplaySize(1080, 1920));
        assertThat(FfmpegVideoAssetAdapter.parseDisplaySize(tag)).contains(new DisplaySize(1080, 1920));
    }

    @Test
    void displaySizeAppliesSampleAspectRatio() throws IOException {
        JsonNode anamorphic = json("{\"streams\":[{\"width\":720,\"height\":576,\"sample_aspect_ratio\":\"64:45\"}]}");
        JsonNode square = json("{\"streams\":[{\"width\":1280,\"height\":720,\"sample_aspect_ratio\":\"1:1\",\"tags\":{\"rotate\":\"180\"}}]}");

        assertThat(FfmpegVideoAssetAdapter.parseDisplaySize(anamorphic)).contains(new DisplaySize(1024, 576));
        assertThat(FfmpegVideoAssetAdapter.parseDisplaySize(square)).contains(new DisplaySize(1280, 720));
    }

    @Test
    void displaySizeMissingWithoutVideoStream() throws IOException {
        assertThat(FfmpegVideoAssetAdapter.parseDisplaySize(json("{\"streams\":[]}"))).isEmpty();
        assertThat(FfmpegVideoAssetAdapter.parseDisplaySize(json("{\"streams\":[{\"width\":0,\"height\":0}]}"))).isEmpty();
    }

    @Test
    void failedDecodeCarriesStderr() {
        List<List<String>> commands = new ArrayList<>();
        FfmpegVideoAssetAdapter adapter = new FfmpegVideoAssetAdapter("ffmpeg", "ffprobe", mapper) {
            @Override
            protected ProcessResult runProcess(List<String> cmd) {
                commands.add(cmd);
                return new ProcessResult(1, new byte[0], "moov atom not found");
            }
        };

        assertThatThrownBy(() -> adapter.decodeFrame(tmp.resolve("broken.mp4"), 12.5, 480))
                .isInstanceOf(DecodeFailureException.class)
                .hasMessageContaining("12.500")
                .hasMessageContaining("moov atom not found");
        assertThat(commands).singleElement().satisfies(cmd -> {
            assertThat(cmd).containsSequence("-ss", "12.500");
            assertThat(cmd).containsSequence("-frames:v", "1");
            assertThat(String.join(" ", cmd)).contains("min(iw,480)");
        });
    }

    @Test
    void unavailableProbeGivesNoDisplaySize() {
        FfmpegVideoAssetAdapter adapter = new FfmpegVideoAssetAdapter("ffmpeg", "ffprobe", mapper) {
            @Override
            protected ProcessResult runProcess(List<String> cmd) {
                return new ProcessResult(1, new byte[0], "No such file");
            }
        };

        assertThat(adapter.getNativeDisplaySize(tmp.resolve("missing.mp4"))).isEmpty();
        assertThatThrownBy(() -> adapter.getDuration(tmp.resolve("missing.mp4"))).isInstanceOf(IOException.class);
    }

    @Test
    void probesAndDecodesARealClip() throws Exception {
        assumeTrue(isOnPath("ffmpeg") && isOnPath("ffprobe"), "ffmpeg/ffprobe not available");
        Path clip = tmp.resolve("clip.mp4");
        Process p = new ProcessBuilder("ffmpeg", "-v", "error", "-y", "-f", "lavfi", "-i", "testsrc=size=640x360:rate=25",
                "-t", "2", "-pix_fmt", "yuv420p", clip.toString()).redirectErrorStream(true).start();
        String log = new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assumeTrue(p.waitFor() == 0 && Files.exists(clip), "could not synthesize clip: " + log);

        FfmpegVideoAssetAdapter adapter = new FfmpegVideoAssetAdapter("ffmpeg", "ffprobe", mapper);

        assertThat(adapter.getDuration(clip)).isCloseTo(2.0, within(0.1));
        Optional<DisplaySize> size = adapter.getNativeDisplaySize(clip);
        assertThat(size).contains(new DisplaySize(640, 360));
        BufferedImage frame = adapter.decodeFrame(clip, 1.0, 320);
        assertThat(frame.getWidth()).isLessThanOrEqualTo(320);
        assertThat(frame.getHeight()).isLessThanOrEqualTo(320);
    }

    private JsonNode json(String text) throws IOException {
        return mapper.readTree(text);
    }

    private static boolean isOnPath(String binary) {
        try {
            Process p = new ProcessBuilder(binary, "-version").redirectErrorStream(true).start();
            p.getInputStream().readAllBytes();
            return p.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
