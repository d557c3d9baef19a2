package com.ledgerimport.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentDigestTest {

    @Test
    void sha256Hex_knownVector() {
        assertThat(ContentDigest.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sha256Hex_isStableAndSensitive() {
        assertThat(ContentDigest.sha256Hex("acc-1|12.50|2024-03-01|coffee"))
                .isEqualTo(ContentDigest.sha256Hex("acc-1|12.50|2024-03-01|coffee"))
                .isNotEqualTo(ContentDigest.sha256Hex("acc-1|12.51|2024-03-01|coffee"))
                .hasSize(64);
    }
}
