/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.io.Serializable;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SHA-256 digest of a certificate's DER encoding, rendered as uppercase hexadecimal octets joined by colons
 * ({@code AA:BB:...:FF}). This is the same rendering {@code openssl x509 -noout -fingerprint -sha256} produces, so
 * registry files written by either tool compare equal.
 * <p>
 * Fingerprints parsed from text are upper-cased, which makes every comparison case-insensitive.
 */
public final class Fingerprint implements Serializable {

    public static final int DIGEST_LENGTH = 32;

    private static final Pattern      CANONICAL        = Pattern.compile(
    "[0-9A-F]{2}(:[0-9A-F]{2}){" + (DIGEST_LENGTH - 1) + "}");
    private static final BaseEncoding ENCODING         = BaseEncoding.base16().upperCase().withSeparator(":", 2);
    private static final long         serialVersionUID = 1L;

    private final String value;

    private Fingerprint(String value) {
        this.value = value;
    }

    /**
     * Fingerprint the raw encoded bytes of a certificate
     */
    public static Fingerprint of(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded");
        return new Fingerprint(ENCODING.encode(Hashing.sha256().hashBytes(encoded).asBytes()));
    }

    public static Fingerprint of(X509Certificate certificate) throws CertificateEncodingException {
        return of(certificate.getEncoded());
    }

    /**
     * Accept a fingerprint as written in a registry. The text is trimmed and upper-cased but otherwise taken as is;
     * see {@link #isCanonical()}.
     */
    public static Fingerprint parse(String text) {
        Objects.requireNonNull(text, "text");
        return new Fingerprint(text.strip().toUpperCase(Locale.ROOT));
    }

    /**
     * @return true if this value has the shape of a SHA-256 fingerprint. A non canonical value can never equal a
     * computed fingerprint.
     */
    public boolean isCanonical() {
        return CANONICAL.matcher(value).matches();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Fingerprint other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
