/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.Fingerprint;

public class PeerNotAuthorizedException extends PeerVerificationException {
    private static final long serialVersionUID = 1L;

    private final Fingerprint presented;

    public PeerNotAuthorizedException(String identity, Fingerprint presented) {
        super(identity, String.format("client '%s' is not authorized", identity));
        this.presented = presented;
    }

    public Fingerprint getPresented() {
        return presented;
    }
}
