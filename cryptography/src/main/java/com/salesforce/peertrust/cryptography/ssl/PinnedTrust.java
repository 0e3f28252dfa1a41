/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.Fingerprint;

import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Objects;

/**
 * Certificate pinning for the connecting role. The trust anchor set holds exactly one certificate, so a server is
 * trusted only if it presents that certificate.
 */
public class PinnedTrust {
    private static final String PINNED_ALIAS = "pinned";

    private final X509Certificate pinned;

    public PinnedTrust(X509Certificate pinned) {
        this.pinned = Objects.requireNonNull(pinned, "pinned");
    }

    public Fingerprint fingerprint() throws CertificateEncodingException {
        return Fingerprint.of(pinned);
    }

    public X509Certificate getPinned() {
        return pinned;
    }

    /**
     * @return a PKIX trust manager factory whose only anchor is the pinned certificate
     */
    public TrustManagerFactory trustManagerFactory() {
        try {
            KeyStore anchors = KeyStore.getInstance(KeyStore.getDefaultType());
            anchors.load(null, null);
            anchors.setCertificateEntry(PINNED_ALIAS, pinned);
            TrustManagerFactory factory = TrustManagerFactory.getInstance("PKIX");
            factory.init(anchors);
            return factory;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Unable to create pinned trust anchors", e);
        }
    }

    @Override
    public String toString() {
        return "Pinned[" + pinned.getSubjectX500Principal().getName() + "]";
    }
}
