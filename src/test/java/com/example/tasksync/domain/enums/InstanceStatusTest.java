package com.example.tasksync.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InstanceStatus Tests")
class InstanceStatusTest {

    @Test
    @DisplayName("Only resolved statuses are retirable")
    void shouldNeverRetirePending() {
        assertThat(InstanceStatus.retirable()).containsExactlyInAnyOrder(InstanceStatus.COMPLETED, InstanceStatus.SKIPPED);
        assertThat(InstanceStatus.PENDING.isResolved()).isFalse();
        assertThat(InstanceStatus.SKIPPED.isResolved()).isTrue();
    }

    @Test
    @DisplayName("Should resolve statuses from their codes")
    void shouldResolveFromCode() {
        assertThat(InstanceStatus.fromCode("skipped")).isEqualTo(InstanceStatus.SKIPPED);
        assertThatThrownBy(() -> InstanceStatus.fromCode("done")).isInstanceOf(IllegalArgumentException.class);
    }
}
