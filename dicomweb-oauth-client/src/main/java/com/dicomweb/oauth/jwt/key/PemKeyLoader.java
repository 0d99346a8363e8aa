package com.dicomweb.oauth.jwt.key;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;

/**
 * Reads RSA and EC keys from PEM text: {@code PUBLIC KEY} (X.509 SubjectPublicKeyInfo),
 * {@code CERTIFICATE}, and PKCS#8 {@code PRIVATE KEY}.
 */
public final class PemKeyLoader {

    private static final String[] KEY_ALGORITHMS = {"RSA", "EC"};

    private PemKeyLoader() {}

    public static PublicKey loadPublicKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("Public key PEM is empty");
        }
        if (pem.contains("-----BEGIN CERTIFICATE-----")) {
            List<X509Certificate> certificates = loadCertificates(pem);
            if (certificates.isEmpty()) {
                throw new IllegalArgumentException("No certificate found in PEM");
            }
            return certificates.get(0).getPublicKey();
        }
        byte[] der = decode(pem, "PUBLIC KEY");
        InvalidKeySpecException failure = null;
        for (String algorithm : KEY_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePublic(new X509EncodedKeySpec(der));
            } catch (InvalidKeySpecException e) {
                failure = e;
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(algorithm + " not available", e);
            }
        }
        throw new IllegalArgumentException("Failed to parse public key from PEM: neither RSA nor EC", failure);
    }

    public static PrivateKey loadPrivateKey(String pem) {
        byte[] der = decode(pem, "PRIVATE KEY");
        InvalidKeySpecException failure = null;
        for (String algorithm : KEY_ALGORITHMS) {
            try {
                return KeyFactory.getInstance(algorithm).generatePrivate(new PKCS8EncodedKeySpec(der));
            } catch (InvalidKeySpecException e) {
                failure = e;
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(algorithm + " not available", e);
            }
        }
        throw new IllegalArgumentException("Failed to parse private key from PEM: neither RSA nor EC", failure);
    }

    public static List<X509Certificate> loadCertificates(String pem) {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            Collection<? extends Certificate> certificates =
                factory.generateCertificates(new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)));
            List<X509Certificate> result = new ArrayList<>();
            for (Certificate certificate : certificates) {
                result.add((X509Certificate) certificate);
            }
            return result;
        } catch (CertificateException e) {
            throw new IllegalArgumentException("Failed to parse certificates from PEM", e);
        }
    }

    private static byte[] decode(String pem, String type) {
        String content = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s+", "");
        try {
            return Base64.getDecoder().decode(content.getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("PEM body is not valid base64 for " + type, e);
        }
    }
}
