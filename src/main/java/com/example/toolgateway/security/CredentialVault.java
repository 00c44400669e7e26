package com.example.toolgateway.security;

import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.exception.VaultException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;

/**
 * Encrypts connection credential maps at rest with AES-GCM.
 *
 * Blob format: {@code v1:} + base64(nonce || ciphertext+tag). The key is loaded
 * once at startup from {@code tool-gateway.vault.key}; a missing or malformed key
 * fails startup. A blob that was produced under another key, or tampered with,
 * fails GCM authentication and raises {@link VaultException}.
 */
@Slf4j
@Component
public class CredentialVault {

    private static final String PREFIX = "v1:";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final SecretKey key;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    public CredentialVault(GatewayProperties properties, ObjectMapper objectMapper) {
        this.key = loadKey(properties.getVault().getKey());
        this.objectMapper = objectMapper;
        log.info("Credential vault initialized (AES-{})", key.getEncoded().length * 8);
    }

    public String encrypt(Map<String, Object> credentials) {
        try {
            byte[] plaintext = objectMapper.writeValueAsBytes(credentials != null ? credentials : Map.of());
            byte[] nonce = new byte[NONCE_BYTES];
            random.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext);

            byte[] payload = ByteBuffer.allocate(nonce.length + ciphertext.length)
                    .put(nonce)
                    .put(ciphertext)
                    .array();
            return PREFIX + Base64.getEncoder().encodeToString(payload);
        } catch (Exception e) {
            throw new VaultException("Credential encryption failed", e);
        }
    }

    public Map<String, Object> decrypt(String blob) {
        if (blob == null || !blob.startsWith(PREFIX)) {
            throw new VaultException("Not a vault blob");
        }
        try {
            byte[] payload = Base64.getDecoder().decode(blob.substring(PREFIX.length()));
            if (payload.length <= NONCE_BYTES) {
                throw new VaultException("Vault blob is truncated");
            }
            byte[] nonce = Arrays.copyOfRange(payload, 0, NONCE_BYTES);
            byte[] ciphertext = Arrays.copyOfRange(payload, NONCE_BYTES, payload.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            return objectMapper.readValue(cipher.doFinal(ciphertext), MAP_TYPE);
        } catch (VaultException e) {
            throw e;
        } catch (Exception e) {
            throw new VaultException("Credential decryption failed", e);
        }
    }

    private static SecretKey loadKey(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalStateException(
                    "tool-gateway.vault.key is not set. Configure TOOL_GATEWAY_VAULT_KEY with a base64 AES key.");
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("tool-gateway.vault.key is not valid base64", e);
        }
        if (raw.length != 16 && raw.length != 24 && raw.length != 32) {
            throw new IllegalStateException(
                    "tool-gateway.vault.key must decode to 16, 24 or 32 bytes, got " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }
}
