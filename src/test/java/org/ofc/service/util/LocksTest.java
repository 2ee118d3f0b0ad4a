package org.ofc.service.util;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class LocksTest {

    @Test
    void of_sameIdSameMonitor() {
        Locks locks = new Locks(16);

        assertThat(locks.of("game-1")).isSameAs(locks.of("game-1"));
        assertThat(locks.of(null)).isSameAs(locks.of(null));
        assertThat(locks.size()).isEqualTo(16);
    }

    @Test
    void constructor_requiresPowerOfTwo() {
        assertThatThrownBy(() -> new Locks(12)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Locks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
