/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.salesforce.peertrust.comm.HelloHandler;
import com.salesforce.peertrust.comm.MtlsClient;
import com.salesforce.peertrust.comm.MtlsServer;
import com.salesforce.peertrust.cryptography.ConfigLoadException;
import com.salesforce.peertrust.cryptography.ssl.ClientHandshakePolicy;
import com.salesforce.peertrust.cryptography.ssl.ServerHandshakePolicy;
import com.salesforce.peertrust.cryptography.ssl.VerificationMetricsImpl;
import com.salesforce.peertrust.provisioning.Provisioner;
import com.salesforce.peertrust.provisioning.Provisioner.Provisioned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs one of the roles: the mutual TLS server, the client, or provisioning of the certificates both need.
 */
public class PeerTrust {
    private static final Set<String> ROLES = Set.of("server", "client", "provision");
    private static final String      USAGE = "usage: PeerTrust <server|client|provision> [configuration]";
    private static final Logger      log   = LoggerFactory.getLogger(PeerTrust.class);

    public static void main(String[] argv) throws Exception {
        int status = run(argv, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    static int run(String[] argv, PrintStream out, PrintStream err) throws InterruptedException {
        if (argv.length < 1 || argv.length > 2 || !ROLES.contains(argv[0])) {
            err.println(USAGE);
            return 1;
        }
        try {
            var configuration = PeerTrustConfiguration.load(
            argv.length == 2 ? argv[1] : PeerTrustConfiguration.DEFAULT_RESOURCE);
            var peerTrust = new PeerTrust(configuration, new MetricRegistry());
            switch (argv[0]) {
                case "server" -> {
                    var server = peerTrust.startServer();
                    Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "PeerTrust shutdown"));
                    log.info("Server started, running until terminated");
                    server.join();
                }
                case "client" -> peerTrust.request(out);
                default -> peerTrust.provision();
            }
            return 0;
        } catch (ConfigLoadException e) {
            err.println("Configuration error: " + e.getMessage()
                        + (e.getCause() == null ? "" : ": " + e.getCause().getMessage()));
            return 1;
        } catch (IOException | IllegalStateException e) {
            err.println(argv[0] + " failed: " + e.getMessage());
            return 1;
        }
    }

    private final PeerTrustConfiguration configuration;
    private final MetricRegistry         registry;
    private Slf4jReporter                reporter;

    public PeerTrust(PeerTrustConfiguration configuration, MetricRegistry registry) {
        this.configuration = configuration;
        this.registry = registry;
    }

    public PeerTrustConfiguration getConfiguration() {
        return configuration;
    }

    public Provisioned provision() throws IOException {
        return new Provisioner(configuration.provisioning.toParameters()).provision();
    }

    /**
     * Perform the configured client request, printing the response body
     */
    public MtlsClient.Response request(PrintStream out) throws IOException, InterruptedException {
        var c = configuration.client;
        var policy = ClientHandshakePolicy.newBuilder()
                                          .loadIdentity(Path.of(c.certificate), Path.of(c.privateKey))
                                          .loadPinnedCertificate(Path.of(c.serverCertificate))
                                          .setVerifyHostname(c.verifyHostname)
                                          .build();
        try (var client = new MtlsClient(policy, c.timeout)) {
            log.info("Sending request to {}...", c.url);
            var response = client.get(URI.create(c.url));
            log.info("Received response: Status Code {}", response.status());
            out.print("Server Response:\n" + response.body());
            out.flush();
            return response;
        }
    }

    /**
     * Build the accepting role from the configured files and start listening
     *
     * @throws IllegalStateException if the listener cannot bind
     */
    public MtlsServer startServer() throws ConfigLoadException {
        var s = configuration.server;
        var policy = ServerHandshakePolicy.newBuilder()
                                          .loadIdentity(Path.of(s.certificate), Path.of(s.privateKey))
                                          .loadKnownPeers(Path.of(s.knownPeers))
                                          .setMetrics(new VerificationMetricsImpl(registry))
                                          .build();
        startReporting();
        var server = new MtlsServer(policy, new InetSocketAddress(s.address, s.port), new HelloHandler()) {
            @Override
            public void stop() {
                super.stop();
                stopReporting();
            }
        };
        try {
            return server.start();
        } catch (IllegalStateException e) {
            server.stop();
            throw e;
        }
    }

    private void startReporting() {
        if (configuration.metricsInterval == null) {
            return;
        }
        reporter = Slf4jReporter.forRegistry(registry)
                                .outputTo(LoggerFactory.getLogger("com.salesforce.peertrust.metrics"))
                                .convertRatesTo(TimeUnit.SECONDS)
                                .convertDurationsTo(TimeUnit.MILLISECONDS)
                                .build();
        reporter.start(configuration.metricsInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void stopReporting() {
        final var current = reporter;
        if (current != null) {
            current.stop();
        }
    }
}
