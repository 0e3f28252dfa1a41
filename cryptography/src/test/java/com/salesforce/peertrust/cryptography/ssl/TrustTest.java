/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLEngine;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class TrustTest {

    @Test
    public void testDelegatesClientDecisions() throws Exception {
        var validator = mock(CertificateValidator.class);
        var chain = new X509Certificate[] { Identities.ec("alice").getX509Certificate() };
        when(validator.validateClient(chain)).thenReturn("alice");

        var trust = new Trust(validator);
        trust.checkClientTrusted(chain, "UNKNOWN");
        trust.checkClientTrusted(chain, "UNKNOWN", (SSLEngine) null);
        verify(validator, times(2)).validateClient(chain);
    }

    @Test
    public void testRejectionPropagates() throws Exception {
        var validator = mock(CertificateValidator.class);
        when(validator.validateClient(any())).thenThrow(new CredentialAbsentException());

        var trust = new Trust(validator);
        assertThrows(CredentialAbsentException.class,
                     () -> trust.checkClientTrusted(new X509Certificate[0], "UNKNOWN", (SSLEngine) null));
    }

    @Test
    public void testNoAnchors() throws Exception {
        var validator = mock(CertificateValidator.class);
        var trust = new Trust(validator);
        var chain = new X509Certificate[] { Identities.ec("server").getX509Certificate() };

        assertEquals(0, trust.getAcceptedIssuers().length);
        assertThrows(CertificateException.class, () -> trust.checkServerTrusted(chain, "ECDHE_ECDSA"));
        verifyNoInteractions(validator);
    }

    @Test
    public void testFactory() {
        var factory = new NodeTrustManagerFactory(chain -> "anyone", Tls.PROVIDER_JSSE);
        var managers = factory.getTrustManagers();
        assertEquals(1, managers.length);
        assertTrue(managers[0] instanceof Trust);
    }
}
