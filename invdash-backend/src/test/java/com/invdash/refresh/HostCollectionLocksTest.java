package com.invdash.refresh;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostCollectionLocksTest {

    @Test
    void spellingsOfOneHostShareALock() {
        HostCollectionLocks locks = new HostCollectionLocks();

        assertThat(locks.forHost(" ESX-01 ")).isSameAs(locks.forHost("esx-01"));
        assertThat(locks.forHost("esx-02")).isNotSameAs(locks.forHost("esx-01"));
        assertThat(locks.size()).isEqualTo(2);
    }

    @Test
    void blankHostIsRejected() {
        assertThatThrownBy(() -> new HostCollectionLocks().forHost(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
