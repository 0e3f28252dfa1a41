/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import java.security.Provider;
import java.security.Security;

final class Tls {
    static final String   IDENTITY_ALIAS = "identity";
    static final Provider PROVIDER_JSSE  = Security.getProvider("SunJSSE");
    static final String   TLS_V1_2       = "TLSv1.2";
    static final String   TLS_V1_3       = "TLSv1.3";
    static final String[] PROTOCOLS      = { TLS_V1_3, TLS_V1_2 };

    private Tls() {
    }
}
