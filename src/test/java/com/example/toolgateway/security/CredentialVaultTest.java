package com.example.toolgateway.security;

import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.exception.VaultException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CredentialVaultTest {

    private static final String KEY = Base64.getEncoder().encodeToString("0123456789abcdef0123456789abcdef".getBytes());
    private static final String OTHER_KEY = Base64.getEncoder().encodeToString("fedcba9876543210fedcba9876543210".getBytes());

    private final CredentialVault vault = vault(KEY);

    @Test
    void roundTripsCredentialMap() {
        Map<String, Object> credentials = Map.of("username", "reporter", "password", "s3cret!", "port", 5432);

        String blob = vault.encrypt(credentials);

        assertTrue(blob.startsWith("v1:"));
        assertFalse(blob.contains("s3cret"));
        assertEquals(credentials, vault.decrypt(blob));
    }

    @Test
    void usesFreshNoncePerEncryption() {
        Map<String, Object> credentials = Map.of("api_key", "abc");

        assertNotEquals(vault.encrypt(credentials), vault.encrypt(credentials));
    }

    @Test
    void rejectsBlobFromAnotherKey() {
        String blob = vault(OTHER_KEY).encrypt(Map.of("password", "x"));

        assertThrows(VaultException.class, () -> vault.decrypt(blob));
    }

    @Test
    void rejectsTamperedBlob() {
        String blob = vault.encrypt(Map.of("password", "x"));
        byte[] payload = Base64.getDecoder().decode(blob.substring(3));
        payload[payload.length - 1] ^= 0x01;
        String tampered = "v1:" + Base64.getEncoder().encodeToString(payload);

        assertThrows(VaultException.class, () -> vault.decrypt(tampered));
    }

    @Test
    void rejectsForeignStrings() {
        assertThrows(VaultException.class, () -> vault.decrypt("plaintext"));
        assertThrows(VaultException.class, () -> vault.decrypt("v1:AAAA"));
        assertThrows(VaultException.class, () -> vault.decrypt(null));
    }

    @Test
    void missingKeyFailsStartup() {
        assertThrows(IllegalStateException.class, () -> vault(""));
        assertThrows(IllegalStateException.class, () -> vault("not base64!"));
        assertThrows(IllegalStateException.class, () -> vault(Base64.getEncoder().encodeToString(new byte[10])));
    }

    private static CredentialVault vault(String key) {
        GatewayProperties properties = new GatewayProperties();
        properties.getVault().setKey(key);
        return new CredentialVault(properties, new ObjectMapper());
    }
}
