/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import java.security.cert.CertificateException;

/**
 * Why a connecting peer was refused. Raised from the trust manager, so the handshake fails with it.
 */
abstract public class PeerVerificationException extends CertificateException {
    private static final long serialVersionUID = 1L;

    private final String identity;

    protected PeerVerificationException(String identity, String message) {
        super(message);
        this.identity = identity;
    }

    protected PeerVerificationException(String identity, String message, Throwable cause) {
        super(message, cause);
        this.identity = identity;
    }

    /**
     * @return the identity the peer claimed, or null if no identity could be read
     */
    public String getIdentity() {
        return identity;
    }
}
