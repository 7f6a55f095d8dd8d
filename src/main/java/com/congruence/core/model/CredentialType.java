package com.congruence.core.model;

/**
 * Kind of secret stored for a git provider. Declaration order is resolution preference.
 */
public enum CredentialType {
    HTTPS_TOKEN,
    BASIC_AUTH,
    SSH_KEY
}
