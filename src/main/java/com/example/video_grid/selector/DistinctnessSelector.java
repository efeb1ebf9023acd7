package com.example.video_grid.selector;

import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.model.FrameMetrics;
import com.example.video_grid.service.CancellationToken;
import com.example.video_grid.service.MetricComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.DoubleConsumer;

/**
 * Scores each candidate against a handful of fixed partners (its time neighbours plus the
 * quarter, half and three-quarter points) instead of all pairs, keeping selection near-linear.
 */
@Component
public class DistinctnessSelector implements FrameSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(DistinctnessSelector.class);

    private final MetricComputer metricComputer;

    public DistinctnessSelector(MetricComputer metricComputer) {
        this.metricComputer = metricComputer;
    }

    @Override
    public List<ExtractedFrame> select(List<ExtractedFrame> candidates,
                                       int requestedCount,
                                       SelectorConfig cfg,
                                       CancellationToken token,
                                       DoubleConsumer progress) {
        SelectorConfig effective = cfg == null ? SelectorConfig.defaults() : cfg;
        DoubleConsumer report = progress == null ? p -> { } : progress;
        if (requestedCount <= 0) {
            throw new IllegalArgumentException("requestedCount must be positive: " + requestedCount);
        }

        if (candidates.size() <= requestedCount) {
            report.accept(1.0);
            return List.copyOf(candidates);
        }

        if (requestedCount <= effective.fastPathMaxCount()) {
            report.accept(1.0);
            return evenlySpaced(candidates, requestedCount);
        }

        LOGGER.debug("selector start candidates={} requested={}", candidates.size(), requestedCount);
        report.accept(0.1);

        List<FrameMetrics> metrics = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (i % effective.yieldEvery() == 0) {
                token.yieldPoint();
            }
            Optional<FrameMetrics> m = metricComputer.compute(i, candidates.get(i),
                    effective.usesEdgeDensity(), effective.usesHistogram());
            m.ifPresent(metrics::add);
        }
        report.accept(0.3);

        if (metrics.size() <= requestedCount) {
            LOGGER.warn("selector not enough usable frames usable={} requested={}; using all usable", metrics.size(), requestedCount);
            report.accept(1.0);
            return metrics.stream().map(m -> candidates.get(m.index())).toList();
        }

        List<FrameMetrics> valid = metrics.stream()
                .filter(m -> m.brightness() > effective.minBrightness()
                        && m.brightness() < effective.maxBrightness()
                        && m.colorVariance() > effective.minColorVariance())
                .toList();
        List<FrameMetrics> toScore;
        if (valid.size() < requestedCount) {
            LOGGER.debug("selector filter too aggressive kept={} requested={}; scoring all {}", valid.size(), requestedCount, metrics.size());
            toScore = metrics;
        } else {
            LOGGER.debug("selector quality filter {} -> {} frames", metrics.size(), valid.size());
            toScore = valid;
        }
        report.accept(0.5);

        List<ScoredFrame> scores = score(toScore, effective, token, report);
        scores.sort(Comparator.comparingDouble(ScoredFrame::score).reversed());

        List<ScoredFrame> top = scores.subList(0, requestedCount);
        LOGGER.debug("selector picked={} avgScore={}", requestedCount,
                String.format(Locale.ROOT, "%.3f", top.stream().mapToDouble(ScoredFrame::score).average().orElse(0)));

        List<ExtractedFrame> selected = top.stream()
                .map(ScoredFrame::index)
                .sorted()
                .map(candidates::get)
                .toList();
        report.accept(1.0);
        return selected;
    }

    private List<ScoredFrame> score(List<FrameMetrics> frames, SelectorConfig cfg, CancellationToken token, DoubleConsumer report) {
        int total = frames.size();
        List<ScoredFrame> scores = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            if (i % cfg.yieldEvery() == 0) {
                token.yieldPoint();
                report.accept(0.5 + ((double) i / total) * 0.4);
            }
            FrameMetrics metric = frames.get(i);
            double sum = 0;
            List<Integer> partners = comparisonIndices(i, total, cfg.maxComparisons());
            for (int idx : partners) {
                sum += difference(metric, frames.get(idx), cfg);
            }
            double avg = partners.isEmpty() ? 0.0 : sum / partners.size();
            scores.add(new ScoredFrame(metric.index(), avg));
        }
        return scores;
    }

    /**
     * Immediate neighbours first, then the quarter, half and three-quarter points, skipping self
     * and duplicates, capped at {@code max}.
     */
    static List<Integer> comparisonIndices(int index, int total, int max) {
        List<Integer> indices = new ArrayList<>(max);
        if (index > 0) {
            indices.add(index - 1);
        }
        if (index < total - 1) {
            indices.add(index + 1);
        }
        for (int distant : new int[]{total / 4, total / 2, (total * 3) / 4}) {
            if (indices.size() >= max) {
                break;
            }
            if (distant != index && distant < total && !indices.contains(distant)) {
                indices.add(distant);
            }
        }
        return indices;
    }

    static double difference(FrameMetrics a, FrameMetrics b, SelectorConfig cfg) {
        double score = cfg.brightnessWeight() * Math.abs(a.brightness() - b.brightness())
                + cfg.varianceWeight() * Math.abs(a.colorVariance() - b.colorVariance());
        if (cfg.usesEdgeDensity() && a.edgeDensity() != null && b.edgeDensity() != null) {
            score += cfg.edgeWeight() * Math.abs(a.edgeDensity() - b.edgeDensity());
        }
        if (cfg.usesHistogram() && a.histogram() != null && b.histogram() != null) {
            score += cfg.histogramWeight() * histogramDistance(a.histogram(), b.histogram());
        }
        return score;
    }

    /** Half the L1 distance between two normalised histograms, in {@code [0,1]}. */
    static double histogramDistance(double[] a, double[] b) {
        double d = 0;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            d += Math.abs(a[i] - b[i]);
        }
        return d / 2.0;
    }

    /** Frames at {@code floor(i * size / count)} for {@code i = 0..count-1}. */
    static List<ExtractedFrame> evenlySpaced(List<ExtractedFrame> candidates, int count) {
        int size = candidates.size();
        List<ExtractedFrame> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int idx = (int) Math.min(size - 1, ((long) i * size) / count);
            out.add(candidates.get(idx));
        }
        return out;
    }
}
