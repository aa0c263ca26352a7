package com.callshield.infrastructure.evidence;

import com.callshield.domain.evidence.service.SigningService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signer keyed by a system-held secret.
 * Without a configured key an ephemeral one is generated, so signatures only verify within this process.
 */
@Slf4j
@Service
public class HmacSigningService implements SigningService {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public HmacSigningService(@Value("${callshield.evidence.signing-key:}") String signingKey) {
        byte[] material;
        if (signingKey == null || signingKey.isBlank()) {
            log.warn("callshield.evidence.signing-key is not set, using an ephemeral signing key");
            material = new byte[32];
            new SecureRandom().nextBytes(material);
        } else {
            material = signingKey.getBytes(StandardCharsets.UTF_8);
        }
        this.key = new SecretKeySpec(material, ALGORITHM);
    }

    @Override
    public String sign(String hash) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(hash.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    @Override
    public boolean verify(String hash, String signature) {
        if (signature == null) {
            return false;
        }
        byte[] expected = sign(hash).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }
}
