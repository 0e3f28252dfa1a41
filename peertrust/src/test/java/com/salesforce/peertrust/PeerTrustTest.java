/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust;

import com.codahale.metrics.MetricRegistry;
import com.salesforce.peertrust.cryptography.ssl.VerificationMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PeerTrustTest {
    @TempDir
    Path dir;

    @Test
    public void testProvisionServeAndRequest() throws Exception {
        var configuration = configuration();
        var registry = new MetricRegistry();
        var peerTrust = new PeerTrust(configuration, registry);

        var provisioned = peerTrust.provision();
        assertTrue(Files.exists(provisioned.knownClients()));

        var server = peerTrust.startServer();
        try {
            configuration.client.url = "https://127.0.0.1:" + server.getPort() + "/hello";
            var out = new ByteArrayOutputStream();
            var response = peerTrust.request(new PrintStream(out, true, StandardCharsets.UTF_8));

            assertEquals(200, response.status());
            assertEquals("Server Response:\nHello, authenticated client 'my_secure_client'!\n",
                         out.toString(StandardCharsets.UTF_8));
            assertEquals(1, registry.meter(VerificationMetrics.ACCEPTED).getCount());
        } finally {
            server.stop();
        }
    }

    @Test
    public void testUsage() throws Exception {
        var err = new ByteArrayOutputStream();
        var stream = new PrintStream(err, true, StandardCharsets.UTF_8);

        assertEquals(1, PeerTrust.run(new String[0], System.out, stream));
        assertEquals(1, PeerTrust.run(new String[] { "serve" }, System.out, stream));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("usage: PeerTrust"));
    }

    @Test
    public void testMissingCertificates() throws Exception {
        var file = dir.resolve("client.yaml");
        Files.writeString(file, """
                                client:
                                  certificate: %s
                                  privateKey: %s
                                """.formatted(dir.resolve("absent.crt"), dir.resolve("absent.key")));
        var err = new ByteArrayOutputStream();

        assertEquals(1, PeerTrust.run(new String[] { "client", file.toString() }, System.out,
                                      new PrintStream(err, true, StandardCharsets.UTF_8)));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("absent.crt"));
    }

    @Test
    public void testPortInUse() throws Exception {
        var configuration = configuration();
        var peerTrust = new PeerTrust(configuration, new MetricRegistry());
        peerTrust.provision();

        var server = peerTrust.startServer();
        try {
            var file = dir.resolve("server.yaml");
            Files.writeString(file, """
                                    server:
                                      certificate: %s
                                      privateKey: %s
                                      knownPeers: %s
                                      address: 127.0.0.1
                                      port: %d
                                    """.formatted(configuration.server.certificate,
                                                  configuration.server.privateKey,
                                                  configuration.server.knownPeers, server.getPort()));
            var err = new ByteArrayOutputStream();

            assertEquals(1, PeerTrust.run(new String[] { "server", file.toString() }, System.out,
                                          new PrintStream(err, true, StandardCharsets.UTF_8)));
            assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("server failed: Unable to bind server"));
        } finally {
            server.stop();
        }
    }

    @Test
    public void testProvisionRole() throws Exception {
        var file = dir.resolve("provision.yaml");
        Files.writeString(file, """
                                provisioning:
                                  outputDirectory: %s
                                  keyAlgorithm: EC
                                  keySize: 256
                                """.formatted(dir.resolve("out")));

        assertEquals(0, PeerTrust.run(new String[] { "provision", file.toString() }, System.out, System.err));
        assertTrue(Files.exists(dir.resolve("out").resolve("knownClients.txt")));
        assertTrue(Files.exists(dir.resolve("out").resolve("server.crt")));
    }

    private PeerTrustConfiguration configuration() {
        var certs = dir.resolve("certs");
        var configuration = new PeerTrustConfiguration();
        configuration.provisioning.outputDirectory = certs.toString();
        configuration.provisioning.keyAlgorithm = "EC";
        configuration.provisioning.keySize = 256;
        configuration.server.certificate = certs.resolve("server.crt").toString();
        configuration.server.privateKey = certs.resolve("server.key").toString();
        configuration.server.knownPeers = certs.resolve("knownClients.txt").toString();
        configuration.server.address = "127.0.0.1";
        configuration.server.port = 0;
        configuration.client.certificate = certs.resolve("client.crt").toString();
        configuration.client.privateKey = certs.resolve("client.key").toString();
        configuration.client.serverCertificate = certs.resolve("server.crt").toString();
        return configuration;
    }
}
