/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.comm;

import com.salesforce.peertrust.cryptography.cert.BcX500NameDnImpl;
import com.salesforce.peertrust.cryptography.cert.Fingerprint;

import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;

/**
 * The peer on the other end of an authorized connection
 *
 * @param identity    - the common name of the peer's certificate
 * @param fingerprint - of the peer's certificate
 */
public record AuthenticatedPeer(String identity, Fingerprint fingerprint) {

    /**
     * @param session - a session whose handshake completed
     */
    public static AuthenticatedPeer from(SSLSession session)
    throws SSLPeerUnverifiedException, CertificateEncodingException {
        var certificates = session.getPeerCertificates();
        if (certificates.length == 0 || !(certificates[0] instanceof X509Certificate leaf)) {
            throw new SSLPeerUnverifiedException("No X.509 peer certificate");
        }
        var identity = BcX500NameDnImpl.subjectOf(leaf).getCommonName();
        return new AuthenticatedPeer(identity == null ? "" : identity, Fingerprint.of(leaf));
    }
}
