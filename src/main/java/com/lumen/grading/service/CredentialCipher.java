package com.lumen.grading.service;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Service;

import com.lumen.grading.config.GradingProperties;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps LMS API keys encrypted at rest (AES-256-GCM, key derived from the
 * master key with PBKDF2).
 *
 * Stored form: Base64 of nonce (12 bytes) followed by ciphertext and tag.
 * Connectors decrypt right before each call; plaintext keys are never
 * persisted or logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final int PBKDF2_ROUNDS = 100_000;
    private static final byte[] KEY_SALT = "LumenGrading-Cred-Salt".getBytes(StandardCharsets.UTF_8);

    private final GradingProperties properties;
    private final SecureRandom random = new SecureRandom();
    private SecretKey apiKeyKey;

    @PostConstruct
    public void init() {
        String master = properties.getEncryption().getMasterKey();
        if (master == null || master.isBlank()) {
            log.error("LUMEN_MASTER_KEY is not set, LMS integrations cannot be created or used");
            return;
        }
        apiKeyKey = deriveKey(master);
        log.info("Credential cipher ready");
    }

    public String encrypt(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);

        byte[] sealed;
        try {
            sealed = cipher(Cipher.ENCRYPT_MODE, nonce).doFinal(apiKey.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not encrypt LMS API key", e);
        }

        byte[] stored = Arrays.copyOf(nonce, NONCE_BYTES + sealed.length);
        System.arraycopy(sealed, 0, stored, NONCE_BYTES, sealed.length);
        return Base64.getEncoder().encodeToString(stored);
    }

    /**
     * @return the plain API key, or null when nothing was stored
     * @throws IllegalStateException if the value was not produced with the current master key
     */
    public String decrypt(String stored) {
        if (stored == null || stored.isBlank()) {
            return null;
        }
        byte[] raw = Base64.getDecoder().decode(stored);
        if (raw.length <= NONCE_BYTES) {
            throw new IllegalStateException("Stored LMS API key is truncated");
        }

        try {
            byte[] plain = cipher(Cipher.DECRYPT_MODE, Arrays.copyOf(raw, NONCE_BYTES))
                    .doFinal(raw, NONCE_BYTES, raw.length - NONCE_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not decrypt LMS API key", e);
        }
    }

    private Cipher cipher(int mode, byte[] nonce) throws GeneralSecurityException {
        if (apiKeyKey == null) {
            throw new IllegalStateException("No credential key; set LUMEN_MASTER_KEY");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, apiKeyKey, new GCMParameterSpec(TAG_BITS, nonce));
        return cipher;
    }

    private static SecretKey deriveKey(String master) {
        PBEKeySpec spec = new PBEKeySpec(master.toCharArray(), KEY_SALT, PBKDF2_ROUNDS, 256);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not derive credential key", e);
        } finally {
            spec.clearPassword();
        }
    }
}
