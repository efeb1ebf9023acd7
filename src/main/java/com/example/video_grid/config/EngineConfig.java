package com.example.video_grid.config;

import com.example.video_grid.engine.FfmpegVideoAssetAdapter;
import com.example.video_grid.engine.Interfaces.VideoAssetAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public VideoAssetAdapter videoAssetAdapter(
            @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
            @Value("${ffprobe.binary:ffprobe}") String ffprobeBin,
            ObjectMapper objectMapper
    ) {
        org.slf4j.LoggerFactory.getLogger(EngineConfig.class)
                .info("Video adapter wired: ffmpeg={}, ffprobe={}", ffmpegBin, ffprobeBin);
        return new FfmpegVideoAssetAdapter(ffmpegBin, ffprobeBin, objectMapper);
    }
}
