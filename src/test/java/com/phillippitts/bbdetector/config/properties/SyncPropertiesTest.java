package com.phillippitts.bbdetector.config.properties;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SyncPropertiesTest {

    @Test
    void appliesDefaults() {
        SyncProperties props = new SyncProperties(null, null, null, null, null, null, null, null, null);

        assertThat(props.getUrl()).isEqualTo(SyncProperties.DEFAULT_URL);
        assertThat(props.getRoute()).containsExactly(Map.entry("bloodborne", "true"));
        assertThat(props.getProfile()).isEmpty();
        assertThat(props.getPassword()).isEmpty();
        assertThat(props.isAutoConnect()).isTrue();
        assertThat(props.getReconnectDelay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(props.getMaxReconnectDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getSendTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.getPingInterval()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void maxDelayNeverBelowBaseDelay() {
        SyncProperties props = new SyncProperties(null, null, null, null, null,
                Duration.ofSeconds(10), Duration.ofSeconds(5), null, null);

        assertThat(props.getMaxReconnectDelay()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void toStringHidesPassword() {
        SyncProperties props = new SyncProperties(null, null, " hunter ", "s3cret", false, null, null, null, null);

        assertThat(props.getProfile()).isEqualTo("hunter");
        assertThat(props.toString()).contains("hunter").doesNotContain("s3cret");
    }
}
