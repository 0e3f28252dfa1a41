/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;

import javax.security.auth.x500.X500Principal;
import java.security.cert.X509Certificate;

/**
 * Distinguished name of a certificate subject. The common name is the identity a peer is authorized by.
 */
public class BcX500NameDnImpl {
    private final X500Name x500Name;

    public BcX500NameDnImpl(final String name) {
        this.x500Name = new X500Name(name);
    }

    public BcX500NameDnImpl(final X500Principal principal) {
        this.x500Name = X500Name.getInstance(principal.getEncoded());
    }

    public static BcX500NameDnImpl subjectOf(X509Certificate certificate) {
        return new BcX500NameDnImpl(certificate.getSubjectX500Principal());
    }

    /**
     * @return the value of the last CN attribute, or null if the name carries none
     */
    public String getCommonName() {
        RDN[] rdns = x500Name.getRDNs(BCStyle.CN);
        if (rdns.length == 0) {
            return null;
        }
        ASN1Encodable value = rdns[rdns.length - 1].getFirst().getValue();
        if (value instanceof ASN1String string) {
            return string.getString();
        }
        return IETFUtils.valueToString(value);
    }

    public String getName() {
        return x500Name.toString();
    }

    public X500Name getX500Name() {
        return x500Name;
    }

    @Override
    public String toString() {
        return getName();
    }
}
