package com.callshield.infrastructure.evidence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HmacSigningServiceTest {

    private static final String HASH = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";

    @Test
    @DisplayName("a signature verifies against the hash it was made for")
    void sign_and_verify() {
        HmacSigningService signer = new HmacSigningService("test-signing-key");

        String signature = signer.sign(HASH);

        assertThat(signer.verify(HASH, signature)).isTrue();
        assertThat(signer.verify(HASH.replace('9', '8'), signature)).isFalse();
        assertThat(signer.verify(HASH, null)).isFalse();
    }

    @Test
    @DisplayName("the same key produces the same signature")
    void keyed() {
        assertThat(new HmacSigningService("k1").sign(HASH)).isEqualTo(new HmacSigningService("k1").sign(HASH));
        assertThat(new HmacSigningService("k1").sign(HASH)).isNotEqualTo(new HmacSigningService("k2").sign(HASH));
    }

    @Test
    @DisplayName("without a configured key an ephemeral key still signs consistently")
    void ephemeral_key() {
        HmacSigningService signer = new HmacSigningService("");

        assertThat(signer.verify(HASH, signer.sign(HASH))).isTrue();
        assertThat(signer.algorithm()).isEqualTo("HmacSHA256");
    }
}
