package com.dicomweb.oauth.security;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * Keeps client secrets and cached tokens encrypted while they sit in memory, using an
 * AES-256-GCM key generated per instance and never written anywhere.
 * <p>
 * This only defeats passive inspection such as heap dumps or a debugger browsing fields.
 * Anyone able to read memory while {@link #open(SealedSecret)} runs sees the plaintext;
 * it is no substitute for a secrets manager.
 * <p>
 * The key is read-only after construction, so sealing and opening need no locking.
 */
@Slf4j
public final class SecretVault implements AutoCloseable {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final byte[] key = new byte[KEY_BYTES];
    private final SecureRandom random = new SecureRandom();
    private volatile boolean closed;

    public SecretVault() {
        random.nextBytes(key);
    }

    public SealedSecret seal(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        ensureOpen();
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, iv));
            return new SealedSecret(iv, cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to seal secret", e);
        }
    }

    public String open(SealedSecret sealed) {
        Objects.requireNonNull(sealed, "sealed");
        ensureOpen();
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_BITS, sealed.iv()));
            return new String(cipher.doFinal(sealed.ciphertext()), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sealed secret does not belong to this vault or was altered", e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Zeroes the key. Every later {@code seal}/{@code open} fails.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            Arrays.fill(key, (byte) 0);
            log.debug("Secret vault key erased");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Secret vault is closed");
        }
    }
}
