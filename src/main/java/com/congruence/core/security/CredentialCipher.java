package com.congruence.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * AES-GCM decryption of stored git credentials. Payloads are Base64 of
 * a 12-byte IV followed by the ciphertext and 128-bit tag.
 * Plaintext secrets only ever live in memory.
 */
@Component
public class CredentialCipher {

    private static final Logger log = LoggerFactory.getLogger(CredentialCipher.class);

    private static final String ENCRYPTION_ALGO = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private final SecretKey currentKey;
    private final SecretKey oldKey;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public CredentialCipher(SecurityProperties properties) {
        this(properties.getEncryptionKey(), properties.getOldEncryptionKey());
    }

    public CredentialCipher(String base64CurrentKey, String base64OldKey) {
        this.currentKey = decodeKey(base64CurrentKey);
        this.oldKey = decodeKey(base64OldKey);
        if (currentKey == null) {
            log.warn("No credential encryption key configured; stored credentials cannot be used");
        }
    }

    private static SecretKey decodeKey(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            return null;
        }
        return new SecretKeySpec(Base64.getDecoder().decode(base64Key.trim()), "AES");
    }

    public boolean isConfigured() {
        return currentKey != null;
    }

    public String encrypt(String data) throws GeneralSecurityException {
        if (currentKey == null) {
            throw new GeneralSecurityException("No encryption key configured");
        }
        byte[] iv = new byte[GCM_IV_LENGTH];
        random.nextBytes(iv);
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.ENCRYPT_MODE, currentKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        byte[] encrypted = cipher.doFinal(data.getBytes(StandardCharsets.UTF_8));
        byte[] withIv = new byte[iv.length + encrypted.length];
        System.arraycopy(iv, 0, withIv, 0, iv.length);
        System.arraycopy(encrypted, 0, withIv, iv.length, encrypted.length);
        return Base64.getEncoder().encodeToString(withIv);
    }

    public String decrypt(String encrypted) throws GeneralSecurityException {
        if (currentKey == null) {
            throw new GeneralSecurityException("No encryption key configured");
        }
        try {
            return decryptWithKey(encrypted, currentKey);
        } catch (GeneralSecurityException e) {
            if (oldKey != null) {
                return decryptWithKey(encrypted, oldKey);
            }
            throw e;
        }
    }

    /**
     * Decrypts, or returns empty when the payload is missing, malformed or
     * encrypted with an unknown key.
     */
    public Optional<String> tryDecrypt(String encrypted) {
        if (encrypted == null || encrypted.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(decrypt(encrypted));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Credential decryption failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String decryptWithKey(String encrypted, SecretKey key) throws GeneralSecurityException {
        byte[] decoded = Base64.getDecoder().decode(encrypted);
        if (decoded.length <= GCM_IV_LENGTH) {
            throw new GeneralSecurityException("Payload too short");
        }
        byte[] iv = new byte[GCM_IV_LENGTH];
        byte[] body = new byte[decoded.length - GCM_IV_LENGTH];
        System.arraycopy(decoded, 0, iv, 0, GCM_IV_LENGTH);
        System.arraycopy(decoded, GCM_IV_LENGTH, body, 0, body.length);
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return new String(cipher.doFinal(body), StandardCharsets.UTF_8);
    }
}
