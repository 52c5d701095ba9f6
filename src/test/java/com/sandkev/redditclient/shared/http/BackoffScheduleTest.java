package com.sandkev.redditclient.shared.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffScheduleTest {

    @Test
    void defaultIsFourEightSixteenSeconds() {
        assertThat(BackoffSchedule.DEFAULT.waits())
                .containsExactly(Duration.ofSeconds(4), Duration.ofSeconds(8), Duration.ofSeconds(16));
        assertThat(BackoffSchedule.DEFAULT.maxAttempts()).isEqualTo(4);
    }

    @Test
    void emptyScheduleMeansSingleAttempt() {
        assertThat(BackoffSchedule.of().maxAttempts()).isEqualTo(1);
    }

    @Test
    void rejectsNegativeWaits() {
        assertThatThrownBy(() -> BackoffSchedule.of(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
