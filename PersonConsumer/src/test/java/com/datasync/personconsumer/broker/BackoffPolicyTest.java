package com.datasync.personconsumer.broker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void standardScheduleDoublesUpToThirtySeconds() {
        BackoffPolicy policy = BackoffPolicy.standard();

        List<Long> delays = new ArrayList<>();
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            delays.add(policy.delayForAttempt(attempt));
        }

        assertThat(policy.getMaxAttempts()).isEqualTo(10);
        assertThat(delays).containsExactly(
                1000L, 2000L, 4000L, 8000L, 16000L, 30000L, 30000L, 30000L, 30000L, 30000L);
    }

    @Test
    void largeAttemptNumbersStayCapped() {
        BackoffPolicy policy = new BackoffPolicy(100, 1000, 30000);

        assertThat(policy.delayForAttempt(63)).isEqualTo(30000L);
        assertThat(policy.delayForAttempt(100)).isEqualTo(30000L);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new BackoffPolicy(0, 1000, 30000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(3, 5000, 1000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.standard().delayForAttempt(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
