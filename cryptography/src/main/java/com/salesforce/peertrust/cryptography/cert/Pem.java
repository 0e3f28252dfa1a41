/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import com.salesforce.peertrust.cryptography.ConfigLoadException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.*;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * Reading and writing of PEM encoded certificates and private keys. Every read failure is a
 * {@link ConfigLoadException} naming the offending file.
 */
public final class Pem {
    private static final JcaX509CertificateConverter CERTIFICATES = new JcaX509CertificateConverter();
    private static final byte[]                      PROBE        = "peertrust key pair probe".getBytes(
    StandardCharsets.UTF_8);

    private Pem() {
        throw new IllegalStateException("Do not instantiate.");
    }

    /**
     * Load a file that must hold exactly one certificate
     */
    public static X509Certificate loadCertificate(Path path) throws ConfigLoadException {
        List<X509Certificate> certificates = loadCertificates(path);
        if (certificates.size() != 1) {
            throw new ConfigLoadException(path,
                                          "Expected exactly one certificate, found " + certificates.size());
        }
        return certificates.get(0);
    }

    /**
     * Load every certificate in the file, in order. Objects other than certificates are ignored.
     *
     * @throws ConfigLoadException if the file cannot be read, cannot be parsed or holds no certificate
     */
    public static List<X509Certificate> loadCertificates(Path path) throws ConfigLoadException {
        List<X509Certificate> certificates = new ArrayList<>();
        for (Object o : readAll(path)) {
            if (o instanceof X509CertificateHolder holder) {
                try {
                    certificates.add(CERTIFICATES.getCertificate(holder));
                } catch (CertificateException e) {
                    throw new ConfigLoadException(path, "Invalid certificate", e);
                }
            }
        }
        if (certificates.isEmpty()) {
            throw new ConfigLoadException(path, "No PEM certificate found");
        }
        return certificates;
    }

    /**
     * Load an endpoint identity. The certificate file must hold one certificate and the key must be the private half of
     * the certificate's public key.
     */
    public static CertificateWithPrivateKey loadIdentity(Path certificateFile, Path keyFile)
    throws ConfigLoadException {
        X509Certificate certificate = loadCertificate(certificateFile);
        PrivateKey privateKey = loadPrivateKey(keyFile);
        boolean matches;
        try {
            matches = matches(certificate.getPublicKey(), privateKey);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ConfigLoadException(keyFile, "Unable to use private key", e);
        }
        if (!matches) {
            throw new ConfigLoadException(keyFile,
                                          "Private key does not match the public key of certificate " + certificateFile);
        }
        return new CertificateWithPrivateKey(certificate, privateKey);
    }

    /**
     * Load the first private key in the file. PKCS#8 ("PRIVATE KEY") and the traditional OpenSSL key pair formats are
     * understood; encrypted keys are not.
     */
    public static PrivateKey loadPrivateKey(Path path) throws ConfigLoadException {
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        for (Object o : readAll(path)) {
            try {
                if (o instanceof PrivateKeyInfo info) {
                    return converter.getPrivateKey(info);
                }
                if (o instanceof PEMKeyPair pair) {
                    return converter.getKeyPair(pair).getPrivate();
                }
            } catch (IOException e) {
                throw new ConfigLoadException(path, "Invalid private key", e);
            }
            if (o instanceof PEMEncryptedKeyPair || o instanceof PKCS8EncryptedPrivateKeyInfo) {
                throw new ConfigLoadException(path, "Encrypted private keys are not supported");
            }
        }
        throw new ConfigLoadException(path, "No PEM private key found");
    }

    public static String print(X509Certificate certificate) {
        StringWriter sw = new StringWriter();
        try {
            write(certificate, sw);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return sw.toString();
    }

    public static void write(X509Certificate certificate, Path path) throws IOException {
        try (Writer fw = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(certificate, fw);
        }
    }

    /**
     * Write the key unencrypted in PKCS#8 form
     */
    public static void write(PrivateKey privateKey, Path path) throws IOException {
        try (Writer fw = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             JcaPEMWriter writer = new JcaPEMWriter(fw)) {
            writer.writeObject(new JcaPKCS8Generator(privateKey, null));
            writer.flush();
        }
    }

    private static boolean matches(PublicKey publicKey, PrivateKey privateKey) throws GeneralSecurityException {
        if (!publicKey.getAlgorithm().equals(privateKey.getAlgorithm())) {
            return false;
        }
        String algorithm = Certificates.signatureAlgorithm(privateKey);
        Signature signer = Signature.getInstance(algorithm);
        signer.initSign(privateKey);
        signer.update(PROBE);
        byte[] signature = signer.sign();
        Signature verifier = Signature.getInstance(algorithm);
        verifier.initVerify(publicKey);
        verifier.update(PROBE);
        return verifier.verify(signature);
    }

    private static List<Object> readAll(Path path) throws ConfigLoadException {
        List<Object> objects = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             PEMParser parser = new PEMParser(reader)) {
            for (Object o = parser.readObject(); o != null; o = parser.readObject()) {
                objects.add(o);
            }
        } catch (IOException | RuntimeException e) {
            throw new ConfigLoadException(path, "Unable to read PEM file", e);
        }
        return objects;
    }

    private static void write(X509Certificate certificate, Writer out) throws IOException {
        JcaPEMWriter writer = new JcaPEMWriter(out);
        writer.writeObject(certificate);
        writer.flush();
    }
}
