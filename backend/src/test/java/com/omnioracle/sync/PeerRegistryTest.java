package com.omnioracle.sync;

import com.omnioracle.domain.InvalidConfigurationException;
import com.omnioracle.domain.PeerEndpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeerRegistryTest {

    private static final String REF = "0x1234567890123456789012345678901234567890";

    private final PeerRegistry registry = new PeerRegistry();

    @Test
    @DisplayName("registering and deactivating maintains the active id list")
    void activeList() {
        registry.register(10, REF);
        assertThat(registry.activeIds()).containsExactly(10L);

        registry.register(20, REF);
        assertThat(registry.activeIds()).containsExactly(10L, 20L);

        registry.setActive(10, false);
        assertThat(registry.activeIds()).containsExactly(20L);
        assertThat(registry.get(10)).get().extracting(PeerEndpoint::active).isEqualTo(false);
    }

    @Test
    @DisplayName("removal swaps the last id into the vacated slot")
    void swapRemove() {
        registry.register(10, REF);
        registry.register(20, REF);
        registry.register(30, REF);

        registry.setActive(10, false);

        assertThat(registry.activeIds()).containsExactly(30L, 20L);
    }

    @Test
    void reactivationDoesNotDuplicate() {
        registry.register(10, REF);
        registry.setActive(10, true);
        registry.register(10, REF);

        assertThat(registry.activeIds()).containsExactly(10L);
    }

    @Test
    @DisplayName("a blank or zero reference registers the peer inactive")
    void unsetReference() {
        registry.register(10, " ");
        registry.register(20, "0x0000000000000000000000000000000000000000");

        assertThat(registry.activeIds()).isEmpty();
        assertThat(registry.all()).hasSize(2);

        registry.register(30, REF);
        registry.register(30, null);
        assertThat(registry.activeIds()).isEmpty();
    }

    @Test
    void invalidChainOrUnknownPeer_throws() {
        assertThatThrownBy(() -> registry.register(0, REF)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> registry.setActive(99, true)).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("older responses are ignored, equal or newer replace the cached price")
    void recordPrice() {
        registry.register(10, REF);

        assertThat(registry.recordPrice(10, BigInteger.TEN, BigInteger.ZERO, 100)).isTrue();
        assertThat(registry.recordPrice(10, BigInteger.ONE, BigInteger.ZERO, 99)).isFalse();
        assertThat(registry.get(10).orElseThrow().lastPrice18()).isEqualTo(BigInteger.TEN);

        assertThat(registry.recordPrice(10, BigInteger.TWO, BigInteger.TEN, 100)).isTrue();
        assertThat(registry.get(10).orElseThrow().lastPrice18()).isEqualTo(BigInteger.TWO);
        assertThat(registry.get(10).orElseThrow().lastNativePrice18()).isEqualTo(BigInteger.TEN);
        assertThat(registry.recordPrice(77, BigInteger.TWO, BigInteger.ZERO, 100)).isFalse();
    }
}
