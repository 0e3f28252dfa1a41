/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.Fingerprint;

public class PeerCredentialMismatchException extends PeerVerificationException {
    private static final long serialVersionUID = 1L;

    private final Fingerprint expected;
    private final Fingerprint presented;

    public PeerCredentialMismatchException(String identity, Fingerprint expected, Fingerprint presented) {
        super(identity, String.format("certificate fingerprint for client '%s' does not match", identity));
        this.expected = expected;
        this.presented = presented;
    }

    public Fingerprint getExpected() {
        return expected;
    }

    public Fingerprint getPresented() {
        return presented;
    }
}
