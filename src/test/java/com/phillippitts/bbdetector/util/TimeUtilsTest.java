package com.phillippitts.bbdetector.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(2_500_000L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(999_999L)).isZero();
    }

    @Test
    void tickIntervalFromFps() {
        assertThat(TimeUtils.tickInterval(10)).isEqualTo(Duration.ofMillis(100));
        assertThat(TimeUtils.tickInterval(30)).isEqualTo(Duration.ofNanos(33_333_333L));
        assertThatThrownBy(() -> TimeUtils.tickInterval(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsClock() {
        assertThat(TimeUtils.formatClock(0)).isEqualTo("0:00:00");
        assertThat(TimeUtils.formatClock(3_723_000L)).isEqualTo("1:02:03");
        assertThat(TimeUtils.formatClock(-5)).isEqualTo("0:00:00");
    }
}
