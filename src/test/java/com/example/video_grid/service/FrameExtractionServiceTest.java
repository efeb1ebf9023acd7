package com.example.video_grid.service;

import com.example.video_grid.FrameFixtures;
import com.example.video_grid.config.ExtractionProperties;
import com.example.video_grid.config.FrameCacheProperties;
import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.example.video_grid.exception.VideoTooShortException;
import com.example.video_grid.model.ExtractionResult;
import com.example.video_grid.selector.DistinctnessSelector;
import com.example.video_grid.service.cache.FrameCache;
import com.example.video_grid.util.ExtractionPhase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FrameExtractionServiceTest {

    @Mock
    private VideoAssetAdapter adapter;

    @TempDir
    Path tmp;

    private FrameExtractionService service;
    private Path video;

    @BeforeEach
    void setUp() throws IOException {
        FrameCacheProperties cacheProperties = new FrameCacheProperties();
        cacheProperties.setDir(tmp.resolve("cache"));
        FrameCache cache = new FrameCache(cacheProperties, new ObjectMapper(), Runnable::run);
        FrameSampler sampler = new FrameSampler(adapter, new ExtractionProperties());
        service = new FrameExtractionService(adapter, sampler, new DistinctnessSelector(new MetricComputer()), cache);
        video = Files.write(tmp.resolve("holiday.mp4"), new byte[]{1, 2, 3});
    }

    @Test
    void secondRunIsServedFromCacheWithTheSameTimestamps() throws Exception {
        when(adapter.getDuration(video)).thenReturn(60.0);
        when(adapter.decodeFrame(eq(video), anyDouble(), eq(480))).thenAnswer(inv -> {
            double t = inv.getArgument(1);
            int shade = (int) (t * 4) % 200 + 30;
            return FrameFixtures.solid(new Color(shade, 255 - shade, (shade * 7) % 256), 48, 27);
        });

        ExtractionResult first = service.extract(video, 16, CancellationToken.none(), null);
        List<String> events = new ArrayList<>();
        ExtractionResult second = service.extract(video, 16, CancellationToken.none(), (phase, f) -> events.add(phase + ":" + f));

        assertThat(first.fromCache()).isFalse();
        assertThat(first.frames()).hasSize(16);
        assertThat(FrameFixtures.timestamps(first.frames())).isSorted().allSatisfy(t -> assertThat(t).isBetween(3.0, 57.0));
        assertThat(second.fromCache()).isTrue();
        assertThat(FrameFixtures.timestamps(second.frames())).containsExactlyElementsOf(FrameFixtures.timestamps(first.frames()));
        assertThat(events).containsExactly(ExtractionPhase.SELECTING + ":1.0");
        verify(adapter, times(1)).getDuration(video);
        verify(adapter, times(24)).decodeFrame(eq(video), anyDouble(), eq(480));
    }

    @Test
    void reportsExtractionThenSelectionProgress() throws Exception {
        when(adapter.getDuration(video)).thenReturn(30.0);
        when(adapter.decodeFrame(eq(video), anyDouble(), eq(480)))
                .thenAnswer(inv -> FrameFixtures.solid(Color.DARK_GRAY, 16, 9));
        List<ExtractionPhase> phases = new ArrayList<>();

        ExtractionResult result = service.extract(video, 4, CancellationToken.none(), (phase, f) -> phases.add(phase));

        assertThat(result.frames()).hasSize(4);
        assertThat(phases).startsWith(ExtractionPhase.EXTRACTING).endsWith(ExtractionPhase.SELECTING);
        assertThat(phases.indexOf(ExtractionPhase.SELECTING)).isGreaterThan(phases.lastIndexOf(ExtractionPhase.EXTRACTING));
    }

    @Test
    void tooShortVideoNeverDecodes() throws Exception {
        when(adapter.getDuration(video)).thenReturn(0.0);

        assertThatThrownBy(() -> service.extract(video, 16, CancellationToken.none(), null))
                .isInstanceOf(VideoTooShortException.class);
        verify(adapter, never()).decodeFrame(eq(video), anyDouble(), eq(480));
    }
}
