package com.respkv.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class KeyValuePairTest {

    private static final byte[] VALUE = "value".getBytes(StandardCharsets.UTF_8);

    @Test
    void noExpiry_neverExpires() {
        KeyValuePair entry = new KeyValuePair(VALUE);

        assertThat(entry.hasTtl()).isFalse();
        assertThat(entry.isExpiredAt(Long.MAX_VALUE)).isFalse();
        assertThat(entry.getRemainingTtl(0)).isEqualTo(-1);
    }

    @Test
    void isExpiredAt_boundaryIsInclusive() {
        KeyValuePair entry = new KeyValuePair(VALUE, 1000);

        assertThat(entry.isExpiredAt(999)).isFalse();
        assertThat(entry.isExpiredAt(1000)).isTrue();
        assertThat(entry.isExpiredAt(1001)).isTrue();
    }

    @Test
    void getRemainingTtl_clampsAtZero() {
        KeyValuePair entry = new KeyValuePair(VALUE, 1000);

        assertThat(entry.getRemainingTtl(400)).isEqualTo(600);
        assertThat(entry.getRemainingTtl(5000)).isZero();
    }

    @Test
    void getValue_returnsDefensiveCopy() {
        KeyValuePair entry = new KeyValuePair(VALUE);

        entry.getValue()[0] = 'X';

        assertThat(entry.getValue()).isEqualTo(VALUE);
    }

    @Test
    void constructor_rejectsInvalidArguments() {
        assertThatThrownBy(() -> new KeyValuePair(null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new KeyValuePair(VALUE, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void equality_usesContent() {
        assertThat(new KeyValuePair(VALUE, 5)).isEqualTo(new KeyValuePair(VALUE.clone(), 5));
        assertThat(new KeyValuePair(VALUE, 5)).isNotEqualTo(new KeyValuePair(VALUE, 6));
    }

    @Test
    void byteKey_equalityAndDisplay() {
        ByteKey a = ByteKey.of("user:1");
        ByteKey b = ByteKey.of("user:1".getBytes(StandardCharsets.UTF_8));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.toString()).isEqualTo("user:1");
        assertThat(a.length()).isEqualTo(6);
    }
}
