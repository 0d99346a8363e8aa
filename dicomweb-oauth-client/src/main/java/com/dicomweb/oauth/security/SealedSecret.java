package com.dicomweb.oauth.security;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;

/**
 * Ciphertext handle produced by {@link SecretVault#seal(String)}. Holds no key material
 * and prints nothing but its size.
 */
public final class SealedSecret {

    private final byte[] iv;
    private final byte[] ciphertext;

    SealedSecret(byte[] iv, byte[] ciphertext) {
        this.iv = iv.clone();
        this.ciphertext = ciphertext.clone();
    }

    byte[] iv() {
        return iv.clone();
    }

    byte[] ciphertext() {
        return ciphertext.clone();
    }

    /**
     * Base64 of {@code iv || ciphertext}.
     */
    public String serialize() {
        ByteBuffer buffer = ByteBuffer.allocate(1 + iv.length + ciphertext.length);
        buffer.put((byte) iv.length).put(iv).put(ciphertext);
        return Base64.getEncoder().encodeToString(buffer.array());
    }

    public static SealedSecret deserialize(String serialized) {
        byte[] raw = Base64.getDecoder().decode(serialized);
        if (raw.length < 1 || raw[0] <= 0 || raw[0] >= raw.length) {
            throw new IllegalArgumentException("Not a sealed secret");
        }
        int ivLength = raw[0];
        return new SealedSecret(
            Arrays.copyOfRange(raw, 1, 1 + ivLength),
            Arrays.copyOfRange(raw, 1 + ivLength, raw.length));
    }

    @Override
    public String toString() {
        return "SealedSecret[" + ciphertext.length + " bytes]";
    }
}
