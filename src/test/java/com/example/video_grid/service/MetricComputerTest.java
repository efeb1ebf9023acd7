package com.example.video_grid.service;

import com.example.video_grid.FrameFixtures;
import com.example.video_grid.model.ExtractedFrame;
import com.example.video_grid.model.FrameMetrics;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricComputerTest {

    private final MetricComputer computer = new MetricComputer();

    @Test
    void solidFrameHasItsLuminanceAndNoVariance() {
        ExtractedFrame gray = FrameFixtures.frame(new Color(128, 128, 128), 1.0);

        FrameMetrics m = computer.compute(3, gray).orElseThrow();

        assertThat(m.index()).isEqualTo(3);
        assertThat(m.brightness()).isCloseTo(128 / 255.0, within(1e-9));
        assertThat(m.colorVariance()).isCloseTo(0.0, within(1e-12));
        assertThat(m.edgeDensity()).isNull();
        assertThat(m.histogram()).isNull();
    }

    @Test
    void luminanceWeightsChannels() {
        FrameMetrics red = computer.compute(0, FrameFixtures.frame(Color.RED, 0)).orElseThrow();
        FrameMetrics green = computer.compute(1, FrameFixtures.frame(Color.GREEN, 0)).orElseThrow();

        assertThat(red.brightness()).isCloseTo(0.299, within(1e-9));
        assertThat(green.brightness()).isCloseTo(0.587, within(1e-9));
    }

    @Test
    void halfBlackHalfWhiteFrame() {
        ExtractedFrame split = new ExtractedFrame(split(32, 32), 0);

        FrameMetrics m = computer.compute(0, split, true, true).orElseThrow();

        assertThat(m.brightness()).isCloseTo(0.5, within(1e-9));
        assertThat(m.colorVariance()).isCloseTo(0.25, within(1e-9));
        // one vertical edge crossing 15 of the 15x15 sampled positions
        assertThat(m.edgeDensity()).isCloseTo(15.0 / 225.0, within(1e-9));
        assertThat(m.histogram()).hasSize(FrameMetrics.HISTOGRAM_BINS);
        assertThat(m.histogram()[0]).isCloseTo(0.5, within(1e-9));
        assertThat(m.histogram()[FrameMetrics.HISTOGRAM_BINS - 1]).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void imagesSmallerThanTheGridStillProduceMetrics() {
        ExtractedFrame tiny = new ExtractedFrame(FrameFixtures.solid(Color.WHITE, 3, 2), 0);

        assertThat(computer.compute(0, tiny)).hasValueSatisfying(m ->
                assertThat(m.brightness()).isCloseTo(1.0, within(1e-9)));
    }

    @Test
    void missingFrameYieldsNoMetrics() {
        assertThat(computer.compute(0, null)).isEmpty();
    }

    private static BufferedImage split(int w, int h) {
        BufferedImage image = FrameFixtures.solid(Color.BLACK, w, h);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(w / 2, 0, w / 2, h);
        g.dispose();
        return image;
    }
}
