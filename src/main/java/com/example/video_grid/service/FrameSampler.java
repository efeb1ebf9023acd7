package com.example.video_grid.service;

import com.example.video_grid.config.ExtractionProperties;
import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.example.video_grid.exception.DecodeFailureException;
import com.example.video_grid.exception.VideoTooShortException;
import com.example.video_grid.model.ExtractedFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleConsumer;

/**
 * Picks evenly spaced candidate timestamps inside the trimmed span of a video and decodes them.
 */
@Service
public class FrameSampler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameSampler.class);

    private final VideoAssetAdapter adapter;
    private final ExtractionProperties properties;

    public FrameSampler(VideoAssetAdapter adapter, ExtractionProperties properties) {
        this.adapter = adapter;
        this.properties = properties;
    }

    /**
     * @return {@code ceil(requestedCount * oversample)} timestamps in ascending order.
     * @throws VideoTooShortException when nothing is left after trimming intro and outro.
     */
    public List<Double> sample(double durationSeconds, int requestedCount) {
        if (requestedCount <= 0) {
            throw new IllegalArgumentException("requestedCount must be positive: " + requestedCount);
        }
        double skip = properties.getSkipFraction();
        double skipStart = durationSeconds * skip;
        double usable = durationSeconds * (1.0 - 2 * skip);
        if (!(usable > 0)) {
            throw new VideoTooShortException(durationSeconds);
        }

        int candidateCount = candidateCount(requestedCount, properties.getOversampleFactor());
        double interval = usable / (candidateCount + 1);
        List<Double> timestamps = new ArrayList<>(candidateCount);
        for (int i = 0; i < candidateCount; i++) {
            timestamps.add(skipStart + interval * (i + 1));
        }
        return timestamps;
    }

    static int candidateCount(int requestedCount, double oversampleFactor) {
        // the epsilon keeps 16 * 1.5 at 24 instead of drifting to 25
        return Math.max(requestedCount, (int) Math.ceil(requestedCount * oversampleFactor - 1e-9));
    }

    /**
     * Decodes every candidate. One failed decode aborts the whole extraction.
     *
     * @param progress receives the decoded fraction in {@code [0,1]}.
     */
    public List<ExtractedFrame> extractCandidates(Path source,
                                                  double durationSeconds,
                                                  int requestedCount,
                                                  CancellationToken token,
                                                  DoubleConsumer progress) {
        List<Double> timestamps = sample(durationSeconds, requestedCount);
        int maxSize = properties.getMaxDecodeSize();
        int yieldEvery = Math.max(1, properties.getDecodeYieldEvery());
        long t0 = System.nanoTime();

        List<ExtractedFrame> frames = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            token.checkpoint();
            double t = timestamps.get(i);
            BufferedImage image;
            try {
                image = adapter.decodeFrame(source, t, maxSize);
            } catch (InterruptedException e) {
                throw token.interrupted(e);
            } catch (IOException e) {
                throw new DecodeFailureException(String.format(Locale.ROOT,
                        "Cannot decode frame at %.3fs of %s", t, source.getFileName()), e);
            }
            if (image == null) {
                throw new DecodeFailureException(String.format(Locale.ROOT,
                        "No frame at %.3fs of %s", t, source.getFileName()));
            }
            frames.add(new ExtractedFrame(image, t));
            if (progress != null) {
                progress.accept((double) (i + 1) / timestamps.size());
            }
            if ((i + 1) % yieldEvery == 0) {
                token.yieldPoint();
            }
        }
        LOGGER.debug("SAMPLE done source={} candidates={} in={}ms",
                source.getFileName(), frames.size(), (System.nanoTime() - t0) / 1_000_000);
        return frames;
    }
}
