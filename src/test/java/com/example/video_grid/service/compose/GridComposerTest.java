package com.example.video_grid.service.compose;

import com.example.video_grid.FrameFixtures;
import com.example.video_grid.config.GridProperties;
import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.example.video_grid.exception.CompositionException;
import com.example.video_grid.model.DisplaySize;
import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.model.GridConfig;
import com.example.video_grid.util.AspectMode;
import com.example.video_grid.util.BackgroundTheme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GridComposerTest {

    @Mock
    private VideoAssetAdapter adapter;

    @TempDir
    Path tmp;

    private GridComposer composer;
    private Path video;

    @BeforeEach
    void setUp() throws IOException {
        GridProperties properties = new GridProperties();
        properties.setFallbackFolder(tmp.resolve("fallback"));
        composer = new GridComposer(adapter, new OutputPathResolver(properties));
        video = Files.write(tmp.resolve("clip.mp4"), new byte[]{1});
    }

    @Test
    void defaultLayoutFillsTheTargetWidth() {
        GridComposer.Layout layout = GridComposer.layout(GridConfig.defaults(), GridComposer.DEFAULT_ASPECT);

        assertThat(layout).isEqualTo(new GridComposer.Layout(466, 262, 1920, 1214));
    }

    @Test
    void writesJpegNextToTheSource() throws Exception {
        when(adapter.getDuration(video)).thenReturn(75.0);

        Path out = composer.compose(frames(16, Color.RED), video, GridConfig.defaults(), null);

        assertThat(out).isEqualTo(tmp.resolve("clip_4x4.jpg"));
        BufferedImage written = ImageIO.read(out.toFile());
        assertThat(written.getWidth()).isEqualTo(1920);
        assertThat(written.getHeight()).isEqualTo(1214);
    }

    @Test
    void existingOutputsGetNumberedSuffixes() throws Exception {
        when(adapter.getDuration(video)).thenReturn(75.0);
        Files.write(tmp.resolve("clip_2x3.jpg"), new byte[]{1});
        GridConfig config = new GridConfig(2, 3, 960, AspectMode.FIT, BackgroundTheme.WHITE, false);

        Path first = composer.compose(frames(6, Color.BLUE), video, config, null);
        Path second = composer.compose(frames(6, Color.BLUE), video, config, null);

        assertThat(first.getFileName()).hasToString("clip_2x3_1.jpg");
        assertThat(second.getFileName()).hasToString("clip_2x3_2.jpg");
    }

    @Test
    void explicitOutputFolderIsCreated() throws Exception {
        when(adapter.getDuration(video)).thenThrow(new IOException("no probe"));
        Path folder = tmp.resolve("out/nested");

        Path out = composer.compose(frames(4, Color.GREEN), video, new GridConfig(2, 2, 640, AspectMode.FILL, BackgroundTheme.BLACK, true), folder);

        assertThat(out).isEqualTo(folder.resolve("clip_2x2.jpg")).exists();
    }

    @Test
    void sourceModePrefersNativeDisplaySize() {
        when(adapter.getNativeDisplaySize(video)).thenReturn(Optional.of(new DisplaySize(1080, 1920)));
        GridConfig config = new GridConfig(4, 4, 1920, AspectMode.SOURCE, BackgroundTheme.BLACK, true);

        double aspect = composer.determineAspectRatio(video, frames(1, Color.RED), config);

        assertThat(aspect).isCloseTo(0.5625, within(1e-9));
        assertThat(GridComposer.layout(config, aspect).thumbHeight()).isEqualTo(828);
    }

    @Test
    void sourceModeFallsBackToFirstFrameDimensions() {
        when(adapter.getNativeDisplaySize(video)).thenReturn(Optional.empty());
        GridConfig config = new GridConfig(4, 4, 1920, AspectMode.SOURCE, BackgroundTheme.BLACK, true);
        List<ExtractedFrame> wide = List.of(new ExtractedFrame(FrameFixtures.solid(Color.RED, 200, 100), 1.0));

        assertThat(composer.determineAspectRatio(video, wide, config)).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void otherModesAssumeSixteenByNine() {
        double aspect = composer.determineAspectRatio(video, frames(1, Color.RED), GridConfig.defaults());

        assertThat(aspect).isCloseTo(16.0 / 9.0, within(1e-9));
        verify(adapter, never()).getNativeDisplaySize(any());
    }

    @Test
    void backgroundFollowsTheTheme() {
        GridConfig white = new GridConfig(2, 2, 640, AspectMode.FILL, BackgroundTheme.WHITE, true);
        GridConfig black = new GridConfig(2, 2, 640, AspectMode.FILL, BackgroundTheme.BLACK, true);

        BufferedImage w = composer.render(frames(4, Color.RED), video, white, GridComposer.DEFAULT_ASPECT, "1m 0s");
        BufferedImage b = composer.render(frames(4, Color.RED), video, black, GridComposer.DEFAULT_ASPECT, "1m 0s");

        assertThat(w.getRGB(0, w.getHeight() - 1)).isEqualTo(Color.WHITE.getRGB());
        assertThat(b.getRGB(0, b.getHeight() - 1)).isEqualTo(Color.BLACK.getRGB());
    }

    @Test
    void fillCoversTheCellAndFitLetterboxes() {
        List<ExtractedFrame> square = List.of(new ExtractedFrame(FrameFixtures.solid(Color.RED, 100, 100), 0.0));
        GridConfig fill = new GridConfig(1, 1, 640, AspectMode.FILL, BackgroundTheme.BLACK, false);
        GridConfig fit = new GridConfig(1, 1, 640, AspectMode.FIT, BackgroundTheme.BLACK, false);
        GridComposer.Layout layout = GridComposer.layout(fill, GridComposer.DEFAULT_ASPECT);
        int left = GridComposer.FRAME_PADDING + GridComposer.BORDER_WIDTH + 4;
        int middleY = GridComposer.TITLE_HEIGHT + GridComposer.FRAME_PADDING + GridComposer.BORDER_WIDTH + layout.thumbHeight() / 2;
        int middleX = GridComposer.FRAME_PADDING + GridComposer.BORDER_WIDTH + layout.thumbWidth() / 2;

        BufferedImage filled = composer.render(square, video, fill, GridComposer.DEFAULT_ASPECT, "");
        BufferedImage fitted = composer.render(square, video, fit, GridComposer.DEFAULT_ASPECT, "");

        assertThat(new Color(filled.getRGB(left, middleY))).isEqualTo(Color.RED);
        assertThat(new Color(fitted.getRGB(middleX, middleY))).isEqualTo(Color.RED);
        assertThat(new Color(fitted.getRGB(left, middleY))).isEqualTo(Color.BLACK);
    }

    @Test
    void framesBeyondTheGridAreIgnored() {
        GridConfig config = new GridConfig(1, 2, 640, AspectMode.FILL, BackgroundTheme.BLACK, true);

        BufferedImage image = composer.render(frames(5, Color.RED), video, config, GridComposer.DEFAULT_ASPECT, "");

        assertThat(image.getWidth()).isEqualTo(GridComposer.layout(config, GridComposer.DEFAULT_ASPECT).width());
    }

    @Test
    void nothingToComposeFails() {
        assertThatThrownBy(() -> composer.compose(List.of(), video, GridConfig.defaults(), null))
                .isInstanceOf(CompositionException.class);
        verifyNoInteractions(adapter);
    }

    @Test
    void tooNarrowTargetFails() {
        GridConfig config = new GridConfig(1, 20, 100, AspectMode.FILL, BackgroundTheme.BLACK, true);

        assertThatThrownBy(() -> GridComposer.layout(config, GridComposer.DEFAULT_ASPECT))
                .isInstanceOf(CompositionException.class);
    }

    private static List<ExtractedFrame> frames(int count, Color color) {
        List<ExtractedFrame> frames = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            frames.add(FrameFixtures.frame(color, i * 10.0));
        }
        return frames;
    }
}
