/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.Fingerprint;
import org.junit.jupiter.api.Test;

import javax.net.ssl.X509TrustManager;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import static org.junit.jupiter.api.Assertions.*;

public class PinnedTrustTest {

    @Test
    public void testOnlyThePinnedCertificate() throws Exception {
        var server = Identities.ec("localhost", "localhost", "127.0.0.1").getX509Certificate();
        var other = Identities.ec("localhost", "localhost", "127.0.0.1").getX509Certificate();

        var pinned = new PinnedTrust(server);
        var managers = pinned.trustManagerFactory().getTrustManagers();
        assertEquals(1, managers.length);
        var trust = (X509TrustManager) managers[0];

        assertArrayEquals(new X509Certificate[] { server }, trust.getAcceptedIssuers());
        trust.checkServerTrusted(new X509Certificate[] { server }, "ECDHE_ECDSA");
        assertThrows(CertificateException.class,
                     () -> trust.checkServerTrusted(new X509Certificate[] { other }, "ECDHE_ECDSA"));
    }

    @Test
    public void testFingerprint() throws Exception {
        var server = Identities.ec("localhost").getX509Certificate();
        var pinned = new PinnedTrust(server);
        assertSame(server, pinned.getPinned());
        assertEquals(Fingerprint.of(server), pinned.fingerprint());
    }
}
