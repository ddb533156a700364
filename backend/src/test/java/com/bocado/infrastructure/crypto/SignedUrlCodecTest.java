/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.crypto;

import com.bocado.domain.model.MediaSize;
import com.bocado.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignedUrlCodecTest {
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private MutableClock clock;
    private SignedUrlCodec codec;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        codec = new SignedUrlCodec("active-secret", List.of("old-secret"), clock);
    }

    @Test
    void signedUrlVerifiesUntilExpiry() {
        SignedUrlCodec.SignedUrl url = codec.signedPath("place1", "photo1", MediaSize.THUMBNAIL, Duration.ofHours(1));

        assertEquals(NOW.plusSeconds(3600).getEpochSecond(), url.exp());
        assertTrue(url.path().startsWith("/media/place1/photo1?size=thumbnail&exp=" + url.exp() + "&sig="));
        assertEquals(SignatureCheck.VALID, codec.verify("place1", "photo1", MediaSize.THUMBNAIL, url.exp(), url.sig()));

        clock.advance(Duration.ofSeconds(3600));
        assertEquals(SignatureCheck.VALID, codec.verify("place1", "photo1", MediaSize.THUMBNAIL, url.exp(), url.sig()));

        clock.advance(Duration.ofSeconds(1));
        assertEquals(SignatureCheck.EXPIRED, codec.verify("place1", "photo1", MediaSize.THUMBNAIL, url.exp(), url.sig()));
    }

    @Test
    void signedTuplesVerifyForEverySizeAndExpiry() {
        long[] lifetimes = {0, 1, 59, 3600, 7 * 24 * 3600};
        String[][] refs = {{"place1", "photo1"}, {"ChIJ-x_9", "AUc7tXW_long-ref"}, {"p", "v"}};
        for (MediaSize size : MediaSize.values()) {
            for (long lifetime : lifetimes) {
                for (String[] ref : refs) {
                    long exp = NOW.plusSeconds(lifetime).getEpochSecond();
                    String sig = codec.sign(ref[0], ref[1], size, exp);
                    assertEquals(SignatureCheck.VALID, codec.verify(ref[0], ref[1], size, exp, sig),
                            () -> ref[0] + "/" + ref[1] + " " + size + " exp=" + exp);
                }
            }
        }
    }

    @Test
    void tamperedFieldsAreRejected() {
        long exp = NOW.plusSeconds(600).getEpochSecond();
        String sig = codec.sign("place1", "photo1", MediaSize.MEDIUM, exp);

        assertEquals(SignatureCheck.INVALID, codec.verify("place2", "photo1", MediaSize.MEDIUM, exp, sig));
        assertEquals(SignatureCheck.INVALID, codec.verify("place1", "photo2", MediaSize.MEDIUM, exp, sig));
        assertEquals(SignatureCheck.INVALID, codec.verify("place1", "photo1", MediaSize.FULL, exp, sig));
        assertEquals(SignatureCheck.INVALID, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp + 1, sig));
        assertEquals(SignatureCheck.INVALID, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp, ""));
    }

    @Test
    void anySingleSignatureCharacterChangedIsInvalid() {
        long exp = NOW.plusSeconds(600).getEpochSecond();
        String sig = codec.sign("place1", "photo1", MediaSize.MEDIUM, exp);

        for (int i = 0; i < sig.length(); i++) {
            String tampered = withCharacterChanged(sig, i);
            int index = i;
            assertEquals(SignatureCheck.INVALID, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp, tampered),
                    () -> "character " + index);
        }
    }

    @Test
    void expiredUrlReportsExpiredWhateverItsSignature() {
        long exp = NOW.minusSeconds(1).getEpochSecond();
        String sig = codec.sign("place1", "photo1", MediaSize.MEDIUM, exp);

        assertEquals(SignatureCheck.EXPIRED, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp, sig));
        assertEquals(SignatureCheck.EXPIRED, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp, withCharacterChanged(sig, 0)));
        assertEquals(SignatureCheck.EXPIRED, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp, withCharacterChanged(sig, sig.length() - 1)));
    }

    @Test
    void signatureIsLowercaseHexHmacOfCanonicalString() {
        long exp = 1_800_000_000L;
        String expected = Digests.hmacSha256Hex("active-secret".getBytes(java.nio.charset.StandardCharsets.UTF_8),
                "place1:photo1:full:1800000000");

        assertEquals(expected, codec.sign("place1", "photo1", MediaSize.FULL, exp));
        assertTrue(expected.matches("[0-9a-f]{64}"));
    }

    @Test
    void previousSecretStillVerifies() {
        SignedUrlCodec old = new SignedUrlCodec("old-secret", List.of(), clock);
        long exp = NOW.plusSeconds(60).getEpochSecond();
        String sig = old.sign("place1", "photo1", MediaSize.MEDIUM, exp);

        assertEquals(SignatureCheck.VALID, codec.verify("place1", "photo1", MediaSize.MEDIUM, exp, sig));

        SignedUrlCodec rotatedAway = new SignedUrlCodec("active-secret", List.of(), clock);
        assertEquals(SignatureCheck.INVALID, rotatedAway.verify("place1", "photo1", MediaSize.MEDIUM, exp, sig));
    }

    @Test
    void blankSecretRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SignedUrlCodec(" ", List.of(), clock));
    }

    private static String withCharacterChanged(String sig, int index) {
        char replacement = sig.charAt(index) == '0' ? '1' : '0';
        return sig.substring(0, index) + replacement + sig.substring(index + 1);
    }
}
