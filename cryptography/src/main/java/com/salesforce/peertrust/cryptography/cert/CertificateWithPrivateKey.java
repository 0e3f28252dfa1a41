/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * The identity an endpoint presents during the handshake: its self-signed certificate and the matching private key
 */
public class CertificateWithPrivateKey {
    private final X509Certificate cert;
    private final PrivateKey      privateKey;

    public CertificateWithPrivateKey(X509Certificate cert, PrivateKey privateKey) {
        assert cert != null;
        assert privateKey != null;
        this.cert = cert;
        this.privateKey = privateKey;
    }

    /**
     * @return the subject common name of the certificate, or null if it has none
     */
    public String getIdentity() {
        return BcX500NameDnImpl.subjectOf(cert).getCommonName();
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public X509Certificate getX509Certificate() {
        return cert;
    }

    @Override
    public String toString() {
        return "Identity[" + getIdentity() + "]";
    }
}
