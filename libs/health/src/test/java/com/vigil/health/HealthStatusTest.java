package com.vigil.health;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HealthStatus")
class HealthStatusTest {

    @Test
    @DisplayName("should declare statuses in severity order")
    void shouldDeclareInSeverityOrder() {
        assertThat(HealthStatus.values())
                .containsExactly(HealthStatus.GREEN, HealthStatus.YELLOW, HealthStatus.RED);
    }

    @Nested
    @DisplayName("isWorseThan")
    class IsWorseThan {

        @Test
        @DisplayName("should rank RED worse than YELLOW and GREEN")
        void shouldRankRedWorst() {
            assertThat(HealthStatus.RED.isWorseThan(HealthStatus.YELLOW)).isTrue();
            assertThat(HealthStatus.RED.isWorseThan(HealthStatus.GREEN)).isTrue();
        }

        @Test
        @DisplayName("should rank YELLOW worse than GREEN only")
        void shouldRankYellow() {
            assertThat(HealthStatus.YELLOW.isWorseThan(HealthStatus.GREEN)).isTrue();
            assertThat(HealthStatus.YELLOW.isWorseThan(HealthStatus.RED)).isFalse();
        }

        @Test
        @DisplayName("should not rank a status worse than itself")
        void shouldNotRankSelf() {
            for (HealthStatus status : HealthStatus.values()) {
                assertThat(status.isWorseThan(status)).isFalse();
            }
        }
    }

    @Nested
    @DisplayName("worst")
    class Worst {

        @Test
        @DisplayName("should return the more severe status regardless of order")
        void shouldReturnMoreSevere() {
            assertThat(HealthStatus.worst(HealthStatus.GREEN, HealthStatus.YELLOW)).isEqualTo(HealthStatus.YELLOW);
            assertThat(HealthStatus.worst(HealthStatus.RED, HealthStatus.YELLOW)).isEqualTo(HealthStatus.RED);
            assertThat(HealthStatus.worst(HealthStatus.GREEN, HealthStatus.GREEN)).isEqualTo(HealthStatus.GREEN);
        }
    }
}
