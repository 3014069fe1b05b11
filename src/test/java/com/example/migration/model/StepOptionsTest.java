package com.example.migration.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StepOptions")
class StepOptionsTest {

    @Test
    @DisplayName("should default to batches of 500, no dry run and no resume")
    void shouldApplyDefaults() {
        StepOptions options = StepOptions.forSource("users");

        assertThat(options.batchSize()).isEqualTo(500);
        assertThat(options.dryRun()).isFalse();
        assertThat(options.resume()).isFalse();
    }

    @Test
    @DisplayName("should copy with changed values")
    void shouldCopyWithChangedValues() {
        StepOptions options = StepOptions.forSource("users").withBatchSize(50).withDryRun(true).withResume(true);

        assertThat(options).isEqualTo(new StepOptions("users", 50, true, true));
    }

    @Test
    @DisplayName("should reject a non-positive batch size")
    void shouldRejectNonPositiveBatchSize() {
        assertThatThrownBy(() -> StepOptions.forSource("users").withBatchSize(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
    }

    @Test
    @DisplayName("should reject a blank source collection")
    void shouldRejectBlankSource() {
        assertThatThrownBy(() -> StepOptions.forSource(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StepOptions.forSource(null))
                .isInstanceOf(NullPointerException.class);
    }
}
