/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

public class MalformedCredentialException extends PeerVerificationException {
    private static final long serialVersionUID = 1L;

    public MalformedCredentialException(String message, Throwable cause) {
        super(null, "failed to parse client certificate: " + message, cause);
    }
}
