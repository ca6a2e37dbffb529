package com.compliance.retention.pipeline;

import com.compliance.retention.tracing.TracingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineOptions Tests")
class PipelineOptionsTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        PipelineOptions options = PipelineOptions.defaults();

        assertEquals(4, options.maxConcurrency());
        assertEquals(Duration.ofMinutes(5), options.categoryTimeout());
        assertEquals(1000, options.deleteBatchSize());
    }

    @Test
    @DisplayName("Builder validates its values")
    void builderValidates() {
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().maxConcurrency(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> PipelineOptions.builder().categoryTimeout(Duration.ofSeconds(-5)).build());
        assertThrows(IllegalArgumentException.class, () -> PipelineOptions.builder().deleteBatchSize(0).build());
    }

    @Test
    @DisplayName("Stage labels feed span names")
    void stageSpanNames() {
        assertEquals("retention.hold-filter", TracingService.stageSpanName(PipelineStage.HOLD_FILTER.label()));
        assertEquals("delete", PipelineStage.DELETE.label());
    }
}
