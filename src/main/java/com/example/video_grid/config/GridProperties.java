package com.example.video_grid.config;

import com.example.video_grid.model.GridConfig;
import com.example.video_grid.util.AspectMode;
import com.example.video_grid.util.BackgroundTheme;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Grid layout defaults and output locations.
 */
@Validated
@ConfigurationProperties(prefix = "grid")
public class GridProperties {

    @Min(1) @Max(20)
    private int rows = 4;
    @Min(1) @Max(20)
    private int columns = 4;
    @Min(320) @Max(16384)
    private int targetWidth = 1920;
    @NotNull
    private AspectMode aspectMode = AspectMode.FILL;
    @NotNull
    private BackgroundTheme backgroundTheme = BackgroundTheme.BLACK;
    private boolean showTimestamps = true;
    private Path outputFolder;
    private Path fallbackFolder = Path.of(System.getProperty("user.home"), "Downloads");

    public int getRows() { return rows; }
    public void setRows(int rows) { this.rows = rows; }

    public int getColumns() { return columns; }
    public void setColumns(int columns) { this.columns = columns; }

    public int getTargetWidth() { return targetWidth; }
    public void setTargetWidth(int targetWidth) { this.targetWidth = targetWidth; }

    public AspectMode getAspectMode() { return aspectMode; }
    public void setAspectMode(AspectMode aspectMode) { this.aspectMode = aspectMode; }

    public BackgroundTheme getBackgroundTheme() { return backgroundTheme; }
    public void setBackgroundTheme(BackgroundTheme backgroundTheme) { this.backgroundTheme = backgroundTheme; }

    public boolean isShowTimestamps() { return showTimestamps; }
    public void setShowTimestamps(boolean showTimestamps) { this.showTimestamps = showTimestamps; }

    public Path getOutputFolder() { return outputFolder; }
    public void setOutputFolder(Path outputFolder) { this.outputFolder = outputFolder; }

    public Path getFallbackFolder() { return fallbackFolder; }
    public void setFallbackFolder(Path fallbackFolder) { this.fallbackFolder = fallbackFolder; }

    public GridConfig toGridConfig() {
        return new GridConfig(rows, columns, targetWidth, aspectMode, backgroundTheme, showTimestamps);
    }
}
