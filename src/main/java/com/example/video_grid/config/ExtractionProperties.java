package com.example.video_grid.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Candidate sampling parameters.
 */
@Validated
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    @DecimalMin("1.0")
    private double oversampleFactor = 1.5;
    @DecimalMin("0.0") @DecimalMax("0.49")
    private double skipFraction = 0.05;
    @Min(16)
    private int maxDecodeSize = 480;
    @Min(1)
    private int decodeYieldEvery = 5;

    public double getOversampleFactor() { return oversampleFactor; }
    public void setOversampleFactor(double oversampleFactor) { this.oversampleFactor = oversampleFactor; }

    public double getSkipFraction() { return skipFraction; }
    public void setSkipFraction(double skipFraction) { this.skipFraction = skipFraction; }

    public int getMaxDecodeSize() { return maxDecodeSize; }
    public void setMaxDecodeSize(int maxDecodeSize) { this.maxDecodeSize = maxDecodeSize; }

    public int getDecodeYieldEvery() { return decodeYieldEvery; }
    public void setDecodeYieldEvery(int decodeYieldEvery) { this.decodeYieldEvery = decodeYieldEvery; }
}
