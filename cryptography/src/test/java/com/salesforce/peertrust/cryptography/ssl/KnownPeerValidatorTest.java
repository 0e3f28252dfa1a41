/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.codahale.metrics.MetricRegistry;
import com.salesforce.peertrust.cryptography.cert.CertificateWithPrivateKey;
import com.salesforce.peertrust.cryptography.cert.Fingerprint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class KnownPeerValidatorTest {
    private static CertificateWithPrivateKey client;
    private static CertificateWithPrivateKey impostor;
    private static CertificateWithPrivateKey stranger;

    private ListAppender<ILoggingEvent> audit;
    private MetricRegistry              registry;

    @BeforeAll
    public static void identities() {
        client = Identities.ec("my_secure_client");
        impostor = Identities.ec("my_secure_client");
        stranger = Identities.ec("stranger");
    }

    private static X509Certificate[] chain(CertificateWithPrivateKey identity) {
        return new X509Certificate[] { identity.getX509Certificate() };
    }

    @BeforeEach
    public void before() {
        registry = new MetricRegistry();
        audit = new ListAppender<>();
        audit.start();
        ((Logger) LoggerFactory.getLogger(KnownPeerValidator.class)).addAppender(audit);
    }

    @AfterEach
    public void after() {
        ((Logger) LoggerFactory.getLogger(KnownPeerValidator.class)).detachAppender(audit);
    }

    @Test
    public void testAccepted() throws Exception {
        var validator = validator();

        assertEquals("my_secure_client", validator.validateClient(chain(client)));
        assertEquals(1, registry.meter(VerificationMetrics.ACCEPTED).getCount());

        assertTrue(logged(Level.INFO, "Verifying peer: identity='my_secure_client', fingerprint='"
                                      + Fingerprint.of(client.getX509Certificate()) + "'"));
        assertTrue(logged(Level.INFO, "Peer authenticated via fingerprint: identity='my_secure_client'"));
    }

    @Test
    public void testAbsent() throws Exception {
        var validator = validator();

        assertThrows(CredentialAbsentException.class, () -> validator.validateClient(new X509Certificate[0]));
        assertThrows(CredentialAbsentException.class, () -> validator.validateClient(null));
        assertThrows(CredentialAbsentException.class, () -> validator.validate(List.of()));
        assertEquals(3, registry.meter(VerificationMetrics.CREDENTIAL_ABSENT).getCount());
        assertTrue(audit.list.stream().allMatch(e -> e.getLevel() == Level.WARN));
    }

    @Test
    public void testConcurrentVerification() throws Exception {
        var validator = validator();
        var executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                var identity = i % 2 == 0 ? client : impostor;
                tasks.add(() -> {
                    try {
                        validator.validateClient(chain(identity));
                        return true;
                    } catch (PeerCredentialMismatchException e) {
                        return false;
                    }
                });
            }
            int accepted = 0;
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                if (result.get()) {
                    accepted++;
                }
            }
            assertEquals(100, accepted);
            assertEquals(100, registry.meter(VerificationMetrics.ACCEPTED).getCount());
            assertEquals(100, registry.meter(VerificationMetrics.CREDENTIAL_MISMATCH).getCount());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testLeafOnly() throws Exception {
        var validator = validator();
        var chain = new X509Certificate[] { client.getX509Certificate(), stranger.getX509Certificate() };
        assertEquals("my_secure_client", validator.validateClient(chain));

        var reversed = new X509Certificate[] { stranger.getX509Certificate(), client.getX509Certificate() };
        assertThrows(PeerNotAuthorizedException.class, () -> validator.validateClient(reversed));
    }

    @Test
    public void testMalformed() throws Exception {
        var validator = validator();

        var e = assertThrows(MalformedCredentialException.class,
                             () -> validator.validate(List.of(new byte[] { 0x30, 0x03, 0x01, 0x02 })));
        assertNull(e.getIdentity());
        assertEquals(1, registry.meter(VerificationMetrics.MALFORMED_CREDENTIAL).getCount());
        assertTrue(audit.list.stream().anyMatch(event -> event.getLevel() == Level.WARN));
    }

    @Test
    public void testMismatch() throws Exception {
        var validator = validator();
        var expected = Fingerprint.of(client.getX509Certificate());
        var presented = Fingerprint.of(impostor.getX509Certificate());

        var e = assertThrows(PeerCredentialMismatchException.class, () -> validator.validateClient(chain(impostor)));
        assertEquals("my_secure_client", e.getIdentity());
        assertEquals(expected, e.getExpected());
        assertEquals(presented, e.getPresented());
        assertEquals(1, registry.meter(VerificationMetrics.CREDENTIAL_MISMATCH).getCount());
        assertEquals(0, registry.meter(VerificationMetrics.NOT_AUTHORIZED).getCount());

        assertTrue(audit.list.stream()
                             .anyMatch(event -> event.getLevel() == Level.WARN && event.getFormattedMessage()
                                                                                       .contains(expected.toString())
                             && event.getFormattedMessage().contains(presented.toString())));
    }

    @Test
    public void testCaseInsensitiveRegistry() throws Exception {
        var text = "my_secure_client " + Fingerprint.of(client.getX509Certificate()).toString().toLowerCase();
        var validator = new KnownPeerValidator(KnownPeers.parse(new StringReader(text), "lower"));

        assertEquals("my_secure_client", validator.validateClient(chain(client)));
    }

    @Test
    public void testRawCertificates() throws Exception {
        var validator = validator();

        assertEquals("my_secure_client", validator.validate(List.of(client.getX509Certificate().getEncoded())));
        assertThrows(PeerCredentialMismatchException.class,
                     () -> validator.validate(List.of(impostor.getX509Certificate().getEncoded())));
    }

    @Test
    public void testEmptyRegistryRejectsEveryone() throws Exception {
        var validator = new KnownPeerValidator(KnownPeers.of(Collections.emptyMap()));

        assertThrows(PeerNotAuthorizedException.class, () -> validator.validateClient(chain(client)));
    }

    @Test
    public void testUnknown() throws Exception {
        var validator = validator();

        var e = assertThrows(PeerNotAuthorizedException.class, () -> validator.validateClient(chain(stranger)));
        assertEquals("stranger", e.getIdentity());
        assertEquals(Fingerprint.of(stranger.getX509Certificate()), e.getPresented());
        assertEquals(1, registry.meter(VerificationMetrics.NOT_AUTHORIZED).getCount());
        assertTrue(logged(Level.WARN, "Authentication failed: identity 'stranger' not found in known peers"));
    }

    private boolean logged(Level level, String message) {
        return audit.list.stream().anyMatch(e -> e.getLevel() == level && e.getFormattedMessage().equals(message));
    }

    private KnownPeerValidator validator() throws Exception {
        var peers = KnownPeers.of(Map.of("my_secure_client", Fingerprint.of(client.getX509Certificate())));
        return new KnownPeerValidator(peers, new VerificationMetricsImpl(registry));
    }
}
