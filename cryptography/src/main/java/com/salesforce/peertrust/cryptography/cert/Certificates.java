/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import com.google.common.net.InetAddresses;
import org.bouncycastle.asn1.x509.*;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.math.BigInteger;
import java.security.*;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Key pair generation and self-signing of endpoint certificates
 */
public class Certificates {
    private static final SecureRandom ENTROPY = new SecureRandom();

    /**
     * The extensions of a TLS endpoint certificate: not a CA, usable for signatures and key encipherment, valid for
     * both server and client authentication and, when alternative names are supplied, bound to those DNS names and IP
     * addresses.
     */
    public static List<CertExtension> endpointExtensions(List<String> alternativeNames) {
        List<CertExtension> extensions = new ArrayList<>();
        extensions.add(new CertExtension(Extension.basicConstraints, true, new BasicConstraints(false)));
        extensions.add(new CertExtension(Extension.keyUsage, true,
                                         new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment)));
        extensions.add(new CertExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(
        new KeyPurposeId[] { KeyPurposeId.id_kp_serverAuth, KeyPurposeId.id_kp_clientAuth })));
        if (alternativeNames != null && !alternativeNames.isEmpty()) {
            GeneralName[] names = alternativeNames.stream()
                                                  .map(name -> InetAddresses.isInetAddress(name) ? new GeneralName(
                                                  GeneralName.iPAddress, name) : new GeneralName(GeneralName.dNSName,
                                                                                                   name))
                                                  .toArray(GeneralName[]::new);
            extensions.add(new CertExtension(Extension.subjectAlternativeName, false, new GeneralNames(names)));
        }
        return extensions;
    }

    /**
     * @param algorithm - "RSA" or "EC"
     * @param keySize   - modulus size for RSA, field size for EC (256 selects P-256)
     */
    public static KeyPair generateKeyPair(String algorithm, int keySize) {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm);
            generator.initialize(keySize, ENTROPY);
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException | InvalidParameterException e) {
            throw new IllegalArgumentException("Cannot generate " + algorithm + " key of size " + keySize, e);
        }
    }

    public static X509Certificate selfSign(BcX500NameDnImpl dn, KeyPair keyPair, Instant notBefore, Instant notAfter,
                                           List<CertExtension> extensions) {
        return selfSign(dn, serialNumber(), keyPair, notBefore, notAfter, extensions);
    }

    public static X509Certificate selfSign(BcX500NameDnImpl dn, BigInteger serialNumber, KeyPair keyPair,
                                           Instant notBefore, Instant notAfter, List<CertExtension> extensions) {
        try {
            final ContentSigner sigGen = new JcaContentSignerBuilder(
            signatureAlgorithm(keyPair.getPrivate())).build(keyPair.getPrivate());

            final JcaX509ExtensionUtils extUtils = new JcaX509ExtensionUtils();
            final X509v3CertificateBuilder certBuilder = new JcaX509v3CertificateBuilder(dn.getX500Name(),
                                                                                         serialNumber,
                                                                                         Date.from(notBefore),
                                                                                         Date.from(notAfter),
                                                                                         dn.getX500Name(),
                                                                                         keyPair.getPublic());
            certBuilder.addExtension(Extension.subjectKeyIdentifier, false,
                                     extUtils.createSubjectKeyIdentifier(keyPair.getPublic()));
            certBuilder.addExtension(Extension.authorityKeyIdentifier, false,
                                     extUtils.createAuthorityKeyIdentifier(keyPair.getPublic()));

            for (final CertExtension e : extensions) {
                certBuilder.addExtension(e.oid(), e.critical(), e.value());
            }

            final X509CertificateHolder holder = certBuilder.build(sigGen);
            final X509Certificate cert = new JcaX509CertificateConverter().getCertificate(holder);

            cert.verify(keyPair.getPublic());

            return cert;
        } catch (final OperatorCreationException | CertificateException | InvalidKeyException | NoSuchAlgorithmException
                       | NoSuchProviderException | SignatureException | CertIOException e) {
            throw new IllegalStateException("Unable to self sign: " + dn, e);
        }
    }

    /**
     * @return the JCA signature algorithm used with keys of the given type
     */
    public static String signatureAlgorithm(Key key) {
        return switch (key.getAlgorithm()) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            case "Ed25519", "EdDSA" -> "Ed25519";
            default -> throw new IllegalArgumentException("Unsupported key algorithm: " + key.getAlgorithm());
        };
    }

    private static BigInteger serialNumber() {
        return new BigInteger(127, ENTROPY).add(BigInteger.ONE);
    }
}
