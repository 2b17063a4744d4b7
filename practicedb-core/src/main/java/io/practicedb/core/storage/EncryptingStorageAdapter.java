package io.practicedb.core.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decorator that encrypts the values of sensitive keys with AES-GCM before they reach the
 * delegate. Other keys pass through untouched.
 * <p>
 * Stored envelope: {@code {"alg": "AES-GCM", "payload": base64(iv || ciphertext)}}. A value that
 * cannot be decrypted reads as absent.
 */
public class EncryptingStorageAdapter implements StorageAdapter {
    private static final Logger LOGGER = Logger.getLogger(EncryptingStorageAdapter.class.getName());
    private static final String ALGORITHM = "AES-GCM";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;
    private static final TypeReference<Map<String, Object>> ENVELOPE = new TypeReference<Map<String, Object>>() {
    };

    private final StorageAdapter delegate;
    private final SecretKey key;
    private final Set<String> sensitiveKeys;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SecureRandom random = new SecureRandom();

    public EncryptingStorageAdapter(StorageAdapter delegate, SecretKey key, Set<String> sensitiveKeys) {
        this.delegate = delegate;
        this.key = key;
        this.sensitiveKeys = Set.copyOf(sensitiveKeys);
    }

    public static SecretKey generateKey() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(256);
            return generator.generateKey();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation unavailable", e);
        }
    }

    public static SecretKey keyFromBase64(String encoded) {
        return new SecretKeySpec(Base64.getDecoder().decode(encoded), "AES");
    }

    public static String keyToBase64(SecretKey key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }

    public boolean isSensitive(String storageKey) {
        return sensitiveKeys.contains(storageKey);
    }

    @Override
    public <T> T get(String storageKey, TypeReference<T> type) throws IOException {
        if (!isSensitive(storageKey)) {
            return delegate.get(storageKey, type);
        }
        Map<String, Object> envelope = delegate.get(storageKey, ENVELOPE);
        if (envelope == null || !ALGORITHM.equals(envelope.get("alg"))) {
            return null;
        }
        try {
            byte[] plain = decrypt(Base64.getDecoder().decode((String) envelope.get("payload")));
            return mapper.readValue(plain, type);
        } catch (GeneralSecurityException | IllegalArgumentException | ClassCastException | IOException e) {
            LOGGER.log(Level.WARNING, "Could not decrypt key ''{0}'', treating as absent: {1}",
                    new Object[]{storageKey, e.getMessage()});
            return null;
        }
    }

    @Override
    public void set(String storageKey, Object value) throws IOException {
        if (!isSensitive(storageKey)) {
            delegate.set(storageKey, value);
            return;
        }
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("alg", ALGORITHM);
            envelope.put("payload", Base64.getEncoder().encodeToString(encrypt(mapper.writeValueAsBytes(value))));
            delegate.set(storageKey, envelope);
        } catch (GeneralSecurityException e) {
            throw new IOException("Encryption failed for key " + storageKey, e);
        }
    }

    @Override
    public void delete(String storageKey) throws IOException {
        delegate.delete(storageKey);
    }

    @Override
    public List<String> keys(String prefix) throws IOException {
        return delegate.keys(prefix);
    }

    @Override
    public void clear(String prefix) throws IOException {
        delegate.clear(prefix);
    }

    private byte[] encrypt(byte[] plain) throws GeneralSecurityException {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
        byte[] sealed = cipher.doFinal(plain);
        return ByteBuffer.allocate(iv.length + sealed.length).put(iv).put(sealed).array();
    }

    private byte[] decrypt(byte[] payload) throws GeneralSecurityException {
        if (payload.length <= IV_LENGTH) {
            throw new GeneralSecurityException("Payload too short");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, payload, 0, IV_LENGTH));
        return cipher.doFinal(payload, IV_LENGTH, payload.length - IV_LENGTH);
    }
}
