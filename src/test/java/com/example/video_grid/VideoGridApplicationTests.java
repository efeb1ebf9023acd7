package com.example.video_grid;

import com.example.video_grid.service.PipelineScheduler;
import com.example.video_grid.service.cache.FrameCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "cache.frames.dir=${java.io.tmpdir}/video-grid-test-cache",
        "pipeline.max-concurrency=3"
})
class VideoGridApplicationTests {

    @Autowired
    private PipelineScheduler scheduler;
    @Autowired
    private FrameCache frameCache;

    @Test
    void contextLoads() {
        assertThat(scheduler.jobs()).isEmpty();
        assertThat(frameCache.isEnabled()).isTrue();
    }
}
