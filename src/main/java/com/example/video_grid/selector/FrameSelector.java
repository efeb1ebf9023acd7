package com.example.video_grid.selector;

import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.service.CancellationToken;

import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * Picks the frames that go into a grid from an oversampled candidate list.
 */
public interface FrameSelector {
    /**
     * Selects {@code requestedCount} frames, or every usable candidate when there are fewer.
     *
     * @param candidates     candidates in chronological order.
     * @param requestedCount number of frames the grid needs.
     * @param cfg            thresholds and weights; {@code null} means {@link SelectorConfig#defaults()}.
     * @param token          cancellation checkpoint polled while scoring.
     * @param progress       receives coarse progress in {@code [0,1]}.
     * @return selected frames in chronological order.
     */
    List<ExtractedFrame> select(List<ExtractedFrame> candidates,
                                int requestedCount,
                                SelectorConfig cfg,
                                CancellationToken token,
                                DoubleConsumer progress);
}
