package com.congruence.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Keys for credential decryption. Both are Base64 AES keys; the old key is only
 * consulted when the current one fails, which allows key rotation.
 */
@Component
@ConfigurationProperties(prefix = "congruence.security")
public class SecurityProperties {

    private String encryptionKey = "";
    private String oldEncryptionKey = "";

    public String getEncryptionKey() { return encryptionKey; }
    public void setEncryptionKey(String encryptionKey) { this.encryptionKey = encryptionKey; }

    public String getOldEncryptionKey() { return oldEncryptionKey; }
    public void setOldEncryptionKey(String oldEncryptionKey) { this.oldEncryptionKey = oldEncryptionKey; }
}
