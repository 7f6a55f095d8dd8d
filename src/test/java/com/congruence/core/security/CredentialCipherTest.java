package com.congruence.core.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CredentialCipherTest {

    private static String key(int fill) {
        byte[] bytes = new byte[32];
        Arrays.fill(bytes, (byte) fill);
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Test
    @DisplayName("encrypt/decrypt round trip with a random IV")
    void roundTrip() throws GeneralSecurityException {
        var cipher = new CredentialCipher(key(1), null);

        String first = cipher.encrypt("ghp_secret");
        String second = cipher.encrypt("ghp_secret");

        assertNotEquals(first, second);
        assertEquals("ghp_secret", cipher.decrypt(first));
    }

    @Test
    @DisplayName("Payloads from the previous key still decrypt after rotation")
    void keyRotation() throws GeneralSecurityException {
        String legacy = new CredentialCipher(key(1), null).encrypt("token");

        var rotated = new CredentialCipher(key(2), key(1));

        assertEquals("token", rotated.decrypt(legacy));
        assertEquals(Optional.empty(), new CredentialCipher(key(3), null).tryDecrypt(legacy));
    }

    @Test
    @DisplayName("Without a key nothing can be encrypted or decrypted")
    void unconfigured() {
        var cipher = new CredentialCipher(" ", null);

        assertFalse(cipher.isConfigured());
        assertThrows(GeneralSecurityException.class, () -> cipher.encrypt("x"));
        assertEquals(Optional.empty(), cipher.tryDecrypt("AAAA"));
    }

    @Test
    @DisplayName("Malformed payloads decrypt to empty")
    void malformed() {
        var cipher = new CredentialCipher(key(1), null);

        assertEquals(Optional.empty(), cipher.tryDecrypt("not base64!"));
        assertEquals(Optional.empty(), cipher.tryDecrypt("AAAA"));
        assertEquals(Optional.empty(), cipher.tryDecrypt(null));
    }
}
