/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.crypto;

import com.bocado.domain.model.MediaSize;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Issues and verifies expiring media URLs.
 * <p>
 * The signature is the lowercase hex HMAC-SHA256 of {@code resourceId:variantRef:size:exp} where
 * {@code exp} is in epoch seconds. New URLs are always signed with the active secret; verification
 * also accepts the configured previous secrets so a rotation does not break URLs already handed out.
 */
public class SignedUrlCodec {
    private final byte[] activeSecret;
    private final List<byte[]> previousSecrets;
    private final Clock clock;

    public SignedUrlCodec(String activeSecret, List<String> previousSecrets, Clock clock) {
        if (activeSecret == null || activeSecret.isBlank()) {
            throw new IllegalArgumentException("Signing secret must not be blank");
        }
        this.activeSecret = activeSecret.getBytes(StandardCharsets.UTF_8);
        List<byte[]> previous = new ArrayList<>();
        if (previousSecrets != null) {
            for (String secret : previousSecrets) {
                if (secret != null && !secret.isBlank()) {
                    previous.add(secret.trim().getBytes(StandardCharsets.UTF_8));
                }
            }
        }
        this.previousSecrets = List.copyOf(previous);
        this.clock = clock;
    }

    public String sign(String resourceId, String variantRef, MediaSize size, long exp) {
        return Digests.hmacSha256Hex(activeSecret, canonical(resourceId, variantRef, size, exp));
    }

    public SignedUrl signedPath(String resourceId, String variantRef, MediaSize size, Duration ttl) {
        long exp = clock.instant().plus(ttl).getEpochSecond();
        String sig = sign(resourceId, variantRef, size, exp);
        String path = "/media/"
                + UriUtils.encodePathSegment(resourceId, StandardCharsets.UTF_8)
                + "/"
                + UriUtils.encodePathSegment(variantRef, StandardCharsets.UTF_8)
                + "?size=" + size.param()
                + "&exp=" + exp
                + "&sig=" + sig;
        return new SignedUrl(path, exp, sig);
    }

    public SignatureCheck verify(String resourceId, String variantRef, MediaSize size, long exp, String sig) {
        if (sig == null || sig.isBlank()) return SignatureCheck.INVALID;
        if (clock.instant().getEpochSecond() > exp) return SignatureCheck.EXPIRED;

        String payload = canonical(resourceId, variantRef, size, exp);
        boolean matched = Digests.constantTimeEquals(Digests.hmacSha256Hex(activeSecret, payload), sig);
        for (byte[] secret : previousSecrets) {
            matched |= Digests.constantTimeEquals(Digests.hmacSha256Hex(secret, payload), sig);
        }
        return matched ? SignatureCheck.VALID : SignatureCheck.INVALID;
    }

    static String canonical(String resourceId, String variantRef, MediaSize size, long exp) {
        return resourceId + ":" + variantRef + ":" + size.param() + ":" + exp;
    }

    public record SignedUrl(String path, long exp, String sig) {}
}
