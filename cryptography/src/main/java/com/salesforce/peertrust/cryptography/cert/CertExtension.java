/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;

public record CertExtension(ASN1ObjectIdentifier oid, boolean critical, ASN1Encodable value) {

    @Override
    public String toString() {
        return "Extension [" + oid + (critical ? "!" : "") + "=" + value + "]";
    }
}
