package com.example.toolgateway.exception;

/**
 * Credential encryption or decryption failed. Callers must abort; an
 * undecryptable blob is never treated as "no credentials".
 */
public class VaultException extends GatewayException {

    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
