package com.phillippitts.bbdetector.service.sync;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CharacterStatsTest {

    @Test
    void acceptsBoundaryValues() {
        CharacterStats low = new CharacterStats(1, 1, 1, 1, 1, 1, 1);
        CharacterStats high = new CharacterStats(544, 99, 99, 99, 99, 99, 99);

        assertThat(low.level()).isEqualTo(1);
        assertThat(high.arcane()).isEqualTo(99);
    }

    @Test
    void rejectsLevelAboveCap() {
        assertThatThrownBy(() -> new CharacterStats(545, 10, 10, 10, 10, 10, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("level");
    }

    @Test
    void rejectsAttributeOutOfRange() {
        assertThatThrownBy(() -> new CharacterStats(10, 10, 0, 10, 10, 10, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("endurance");
        assertThatThrownBy(() -> new CharacterStats(10, 10, 10, 10, 10, 100, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bloodtinge");
    }
}
