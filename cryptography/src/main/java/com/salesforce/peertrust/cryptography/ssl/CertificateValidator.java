/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

/**
 * The authorization gate of the accepting role. Installed in place of chain of trust validation, it decides from the
 * certificates a connecting peer presented whether that peer may proceed.
 */
@FunctionalInterface
public interface CertificateValidator {

    /**
     * @param chain - the certificates presented by the peer, leaf first. Implementations must not assume the chain is
     *              non-empty.
     * @return the authorized identity of the peer
     * @throws CertificateException if the peer is rejected. The rejection is final for the connection.
     */
    String validateClient(X509Certificate[] chain) throws CertificateException;
}
