/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.provisioning;

import com.salesforce.peertrust.cryptography.cert.Fingerprint;
import com.salesforce.peertrust.cryptography.cert.Pem;
import com.salesforce.peertrust.cryptography.ssl.KnownPeerValidator;
import com.salesforce.peertrust.cryptography.ssl.KnownPeers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ProvisionerTest {
    @TempDir
    Path dir;

    @Test
    public void testDefaults() throws Exception {
        var parameters = ProvisioningParameters.newBuilder().setOutputDirectory(dir.resolve("certs")).build();
        var provisioned = new Provisioner(parameters).provision();

        var server = Pem.loadIdentity(provisioned.serverCertificate(), provisioned.serverKey());
        var client = Pem.loadIdentity(provisioned.clientCertificate(), provisioned.clientKey());

        assertEquals("localhost", server.getIdentity());
        assertEquals("my_secure_client", client.getIdentity());
        assertEquals("my_secure_client", provisioned.clientIdentity());
        assertEquals("RSA", server.getPrivateKey().getAlgorithm());
        assertTrue(server.getX509Certificate().getSubjectX500Principal().getName().contains("OU=Server"));

        var alternativeNames = server.getX509Certificate().getSubjectAlternativeNames();
        assertTrue(alternativeNames.contains(List.of(2, "localhost")));
        assertTrue(alternativeNames.contains(List.of(7, "127.0.0.1")));

        var lifetime = Duration.between(server.getX509Certificate().getNotBefore().toInstant(),
                                        server.getX509Certificate().getNotAfter().toInstant());
        assertEquals(Duration.ofDays(365), lifetime);
    }

    @Test
    public void testKnownClientsAuthorizesTheClient() throws Exception {
        var parameters = ProvisioningParameters.newBuilder().setOutputDirectory(dir).build();
        var provisioned = new Provisioner(parameters).provision();

        var lines = Files.readAllLines(provisioned.knownClients());
        assertTrue(lines.get(0).startsWith("#"));
        assertEquals("my_secure_client " + provisioned.clientFingerprint(), lines.get(lines.size() - 1));

        var client = Pem.loadCertificate(provisioned.clientCertificate());
        assertEquals(Fingerprint.of(client), provisioned.clientFingerprint());

        var peers = KnownPeers.load(provisioned.knownClients());
        assertEquals(1, peers.size());
        assertTrue(peers.getMalformedLines().isEmpty());
        assertEquals("my_secure_client",
                     new KnownPeerValidator(peers).validateClient(new X509Certificate[] { client }));
    }

    @Test
    public void testKeysOwnerReadOnly() throws Exception {
        var parameters = ProvisioningParameters.newBuilder().setOutputDirectory(dir).build();
        var provisioned = new Provisioner(parameters).provision();
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            assertEquals(Set.of(PosixFilePermission.OWNER_READ),
                         Files.getPosixFilePermissions(provisioned.serverKey()));
            assertEquals(Set.of(PosixFilePermission.OWNER_READ),
                         Files.getPosixFilePermissions(provisioned.clientKey()));
        }
    }

    @Test
    public void testReplacesExisting() throws Exception {
        var parameters = ProvisioningParameters.newBuilder().setOutputDirectory(dir).build();
        var first = new Provisioner(parameters).provision();
        var second = new Provisioner(parameters).provision();

        assertNotEquals(first.clientFingerprint(), second.clientFingerprint());
        assertEquals(second.clientFingerprint(), Fingerprint.of(Pem.loadCertificate(second.clientCertificate())));
        assertEquals(second.clientFingerprint(),
                     KnownPeers.load(second.knownClients()).expected("my_secure_client").orElseThrow());
    }

    @Test
    public void testEllipticCurve() throws Exception {
        var parameters = ProvisioningParameters.newBuilder()
                                               .setOutputDirectory(dir)
                                               .setKeyAlgorithm("EC")
                                               .setKeySize(256)
                                               .setClientSubject("CN=edge-7")
                                               .setValidity(Duration.ofDays(30))
                                               .build();
        var provisioned = new Provisioner(parameters).provision();

        var client = Pem.loadIdentity(provisioned.clientCertificate(), provisioned.clientKey());
        assertEquals("EC", client.getPrivateKey().getAlgorithm());
        assertEquals("edge-7", provisioned.clientIdentity());
        assertTrue(KnownPeers.load(provisioned.knownClients()).expected("edge-7").isPresent());
    }

    @Test
    public void testClientSubjectRequiresCommonName() {
        var parameters = ProvisioningParameters.newBuilder()
                                               .setOutputDirectory(dir)
                                               .setClientSubject("O=MyOrg")
                                               .build();
        assertThrows(IllegalArgumentException.class, () -> new Provisioner(parameters).provision());
    }
}
