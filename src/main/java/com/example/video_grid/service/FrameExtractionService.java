package com.example.video_grid.service;

import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.example.video_grid.model.CacheEntry;
import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.model.ExtractionResult;
import com.example.video_grid.selector.FrameSelector;
import com.example.video_grid.selector.SelectorConfig;
import com.example.video_grid.service.cache.FrameCache;
import com.example.video_grid.util.ExtractionPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Produces the frames for one grid: cache first, otherwise sample, select and store.
 */
@Service
public class FrameExtractionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameExtractionService.class);

    private final VideoAssetAdapter adapter;
    private final FrameSampler sampler;
    private final FrameSelector selector;
    private final FrameCache cache;
    private final SelectorConfig selectorConfig;

    public FrameExtractionService(VideoAssetAdapter adapter, FrameSampler sampler, FrameSelector selector, FrameCache cache) {
        this.adapter = adapter;
        this.sampler = sampler;
        this.selector = selector;
        this.cache = cache;
        this.selectorConfig = SelectorConfig.defaults();
    }

    /**
     * @throws java.io.IOException when the duration cannot be probed.
     */
    public ExtractionResult extract(Path source, int frameCount, CancellationToken token, ExtractionListener listener)
            throws IOException {
        ExtractionListener progress = listener == null ? ExtractionListener.NONE : listener;
        token.checkpoint();

        Optional<CacheEntry> cached = cache.lookup(source, frameCount);
        if (cached.isPresent()) {
            progress.onProgress(ExtractionPhase.SELECTING, 1.0);
            return new ExtractionResult(cached.get().frames(), true);
        }

        long t0 = System.nanoTime();
        double duration;
        try {
            duration = adapter.getDuration(source);
        } catch (InterruptedException e) {
            throw token.interrupted(e);
        }
        token.checkpoint();

        List<ExtractedFrame> candidates = sampler.extractCandidates(source, duration, frameCount, token,
                f -> progress.onProgress(ExtractionPhase.EXTRACTING, f));
        token.checkpoint();

        List<ExtractedFrame> selected = selector.select(candidates, frameCount, selectorConfig, token,
                f -> progress.onProgress(ExtractionPhase.SELECTING, f));
        token.checkpoint();

        LOGGER.info("EXTRACT done source={} duration={}s candidates={} selected={} in={}ms",
                source.getFileName(), duration, candidates.size(), selected.size(), (System.nanoTime() - t0) / 1_000_000);

        cache.store(source, frameCount, selected);
        return new ExtractionResult(selected, false);
    }
}
