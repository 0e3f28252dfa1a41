/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.codahale.metrics.Meter;
import com.salesforce.peertrust.cryptography.cert.BcX500NameDnImpl;
import com.salesforce.peertrust.cryptography.cert.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Authorizes a connecting peer by the fingerprint of its leaf certificate. The identity claimed in the certificate's
 * subject common name selects the registry entry, and the presented certificate must hash to exactly that entry's
 * fingerprint. Certificates beyond the leaf are ignored, as are issuer, validity period and signatures.
 * <p>
 * Every outcome is reported on this class's logger: the identity and fingerprint under verification, then either
 * acceptance or the reason for rejection.
 */
public class KnownPeerValidator implements CertificateValidator {
    private static final Logger log = LoggerFactory.getLogger(KnownPeerValidator.class);

    private final KnownPeers          knownPeers;
    private final VerificationMetrics metrics;

    public KnownPeerValidator(KnownPeers knownPeers) {
        this(knownPeers, null);
    }

    /**
     * @param metrics - may be null
     */
    public KnownPeerValidator(KnownPeers knownPeers, VerificationMetrics metrics) {
        this.knownPeers = knownPeers;
        this.metrics = metrics;
    }

    /**
     * Verify the DER encoded certificates as presented on the wire, leaf first
     *
     * @return the authorized identity
     */
    public String validate(List<byte[]> rawCertificates) throws PeerVerificationException {
        if (rawCertificates == null || rawCertificates.isEmpty()) {
            return absent();
        }
        X509Certificate leaf;
        try {
            leaf = (X509Certificate) CertificateFactory.getInstance("X.509")
                                                       .generateCertificate(
                                                       new ByteArrayInputStream(rawCertificates.get(0)));
        } catch (CertificateException | RuntimeException e) {
            return malformed(e);
        }
        return verify(leaf, Fingerprint.of(rawCertificates.get(0)));
    }

    @Override
    public String validateClient(X509Certificate[] chain) throws CertificateException {
        if (chain == null || chain.length == 0 || chain[0] == null) {
            return absent();
        }
        Fingerprint presented;
        try {
            presented = Fingerprint.of(chain[0]);
        } catch (CertificateEncodingException e) {
            return malformed(e);
        }
        return verify(chain[0], presented);
    }

    private String absent() throws CredentialAbsentException {
        log.warn("Authentication failed: no client certificate presented");
        mark(VerificationMetrics::credentialAbsent);
        throw new CredentialAbsentException();
    }

    private String malformed(Exception e) throws MalformedCredentialException {
        log.warn("Authentication failed: unable to parse client certificate: {}", e.toString());
        mark(VerificationMetrics::malformedCredential);
        throw new MalformedCredentialException(e.getMessage(), e);
    }

    private void mark(Function<VerificationMetrics, Meter> meter) {
        if (metrics != null) {
            meter.apply(metrics).mark();
        }
    }

    private String verify(X509Certificate leaf, Fingerprint presented) throws PeerVerificationException {
        String identity = BcX500NameDnImpl.subjectOf(leaf).getCommonName();
        if (identity == null) {
            identity = "";
        }
        log.info("Verifying peer: identity='{}', fingerprint='{}'", identity, presented);

        Optional<Fingerprint> expected = knownPeers.expected(identity);
        if (expected.isEmpty()) {
            log.warn("Authentication failed: identity '{}' not found in known peers", identity);
            mark(VerificationMetrics::notAuthorized);
            throw new PeerNotAuthorizedException(identity, presented);
        }
        if (!expected.get().equals(presented)) {
            log.warn("Authentication failed: fingerprint mismatch for identity '{}', expected '{}' got '{}'",
                     identity, expected.get(), presented);
            mark(VerificationMetrics::credentialMismatch);
            throw new PeerCredentialMismatchException(identity, expected.get(), presented);
        }
        log.info("Peer authenticated via fingerprint: identity='{}'", identity);
        mark(VerificationMetrics::accepted);
        return identity;
    }
}
