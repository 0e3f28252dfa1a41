/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.cert;

import com.salesforce.peertrust.cryptography.ssl.Identities;
import org.junit.jupiter.api.Test;

import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CertificatesTest {

    @Test
    public void testEndpointCertificate() throws Exception {
        var identity = Identities.rsa("localhost", "localhost", "127.0.0.1");
        X509Certificate cert = identity.getX509Certificate();

        assertEquals("localhost", identity.getIdentity());
        assertEquals(cert.getSubjectX500Principal(), cert.getIssuerX500Principal());
        assertEquals(-1, cert.getBasicConstraints());
        assertTrue(cert.getKeyUsage()[0]);
        assertTrue(cert.getKeyUsage()[2]);
        assertTrue(cert.getExtendedKeyUsage().containsAll(List.of("1.3.6.1.5.5.7.3.1", "1.3.6.1.5.5.7.3.2")));

        var alternativeNames = cert.getSubjectAlternativeNames();
        assertNotNull(alternativeNames);
        assertTrue(alternativeNames.contains(List.of(2, "localhost")));
        assertTrue(alternativeNames.contains(List.of(7, "127.0.0.1")));
        cert.verify(cert.getPublicKey());
    }

    @Test
    public void testCommonName() {
        var dn = new BcX500NameDnImpl("C=US, ST=California, L=SanFrancisco, O=MyOrg, OU=Server, CN=localhost");
        assertEquals("localhost", dn.getCommonName());
        assertNull(new BcX500NameDnImpl("O=MyOrg").getCommonName());
    }

    @Test
    public void testLastCommonNameWins() throws Exception {
        var dn = new BcX500NameDnImpl("CN=decoy, O=MyOrg, CN=my_secure_client");
        assertEquals("my_secure_client", dn.getCommonName());

        var keyPair = Certificates.generateKeyPair("EC", 256);
        var now = Instant.now();
        var cert = Certificates.selfSign(dn, keyPair, now, now.plus(Duration.ofDays(1)),
                                         Certificates.endpointExtensions(List.of()));
        assertEquals("my_secure_client", BcX500NameDnImpl.subjectOf(cert).getCommonName());
    }

    @Test
    public void testSignatureAlgorithm() {
        assertEquals("SHA256withRSA",
                     Certificates.signatureAlgorithm(Certificates.generateKeyPair("RSA", 2048).getPrivate()));
        assertEquals("SHA256withECDSA",
                     Certificates.signatureAlgorithm(Certificates.generateKeyPair("EC", 256).getPrivate()));
        assertThrows(IllegalArgumentException.class, () -> Certificates.generateKeyPair("NOPE", 1));
    }
}
