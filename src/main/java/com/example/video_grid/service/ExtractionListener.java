package com.example.video_grid.service;

import com.example.video_grid.util.ExtractionPhase;

@FunctionalInterface
public interface ExtractionListener {
    ExtractionListener NONE = (phase, fraction) -> { };

    void onProgress(ExtractionPhase phase, double fraction);
}
