package com.example.video_grid.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "cache.frames")
public class FrameCacheProperties {
    private boolean enabled = true;
    private Path dir = Path.of(System.getProperty("user.home"), ".cache", "video-grid", "frame-cache");

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Path getDir() { return dir; }
    public void setDir(Path dir) { this.dir = dir; }
}
