package com.eyelevel.flambientprocessor.dto.imagen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UploadResultTest {

    @Test
    @DisplayName("Three of four uploaded is a 75% success rate and not fully successful")
    void successRate_partial() {
        UploadResult result = new UploadResult(4, List.of("a.jpg", "b.jpg", "c.jpg"), List.of("d.jpg"));

        assertThat(result.getSuccessRate()).isEqualTo(75.0);
        assertThat(result.isFullySuccessful()).isFalse();
    }

    @Test
    @DisplayName("An empty batch has a zero success rate")
    void successRate_emptyBatch() {
        UploadResult result = new UploadResult(0, List.of(), List.of());

        assertThat(result.getSuccessRate()).isZero();
        assertThat(result.isFullySuccessful()).isTrue();
    }
}
