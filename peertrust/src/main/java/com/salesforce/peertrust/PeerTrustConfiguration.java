/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.salesforce.peertrust.cryptography.ConfigLoadException;
import com.salesforce.peertrust.provisioning.ProvisioningParameters;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the three roles. Every field has the default of the bundled {@value #DEFAULT_RESOURCE}, so a
 * configuration file need only name what it changes.
 */
public class PeerTrustConfiguration {
    public static class Client {
        public String   certificate       = "certs/client.crt";
        public String   privateKey        = "certs/client.key";
        public String   serverCertificate = "certs/server.crt";
        public Duration timeout           = Duration.ofSeconds(10);
        public String   url               = "https://localhost:8443/hello";
        public boolean  verifyHostname    = true;
    }

    public static class Provisioning {
        public String       clientSubject          = ProvisioningParameters.DEFAULT_CLIENT_SUBJECT;
        public String       keyAlgorithm           = "RSA";
        public int          keySize                = 2048;
        public String       outputDirectory        = "certs";
        public List<String> serverAlternativeNames = new ArrayList<>(
        ProvisioningParameters.DEFAULT_SERVER_ALTERNATIVE_NAMES);
        public String       serverSubject          = ProvisioningParameters.DEFAULT_SERVER_SUBJECT;
        public Duration     validity               = Duration.ofDays(365);

        public ProvisioningParameters toParameters() {
            return ProvisioningParameters.newBuilder()
                                         .setOutputDirectory(Path.of(outputDirectory))
                                         .setServerSubject(serverSubject)
                                         .setServerAlternativeNames(serverAlternativeNames)
                                         .setClientSubject(clientSubject)
                                         .setKeyAlgorithm(keyAlgorithm)
                                         .setKeySize(keySize)
                                         .setValidity(validity)
                                         .build();
        }
    }

    public static class Server {
        public String address     = "0.0.0.0";
        public String certificate = "certs/server.crt";
        public String knownPeers  = "certs/knownClients.txt";
        public int    port        = 8443;
        public String privateKey  = "certs/server.key";
    }

    public static final String DEFAULT_RESOURCE = "peertrust.yaml";

    public Client       client          = new Client();
    /**
     * Interval of metrics reports to the log, null for none
     */
    public Duration     metricsInterval;
    public Provisioning provisioning    = new Provisioning();
    public Server       server          = new Server();

    /**
     * Load the configuration from a file, or failing that from a classpath resource of that name
     */
    public static PeerTrustConfiguration load(String resource) throws ConfigLoadException {
        Path file = Path.of(resource);
        URL yaml;
        try {
            yaml = Files.isRegularFile(file) ? file.toUri().toURL() : PeerTrustConfiguration.class.getResource(
            resource.startsWith("/") ? resource : "/" + resource);
        } catch (IOException e) {
            throw new ConfigLoadException(file, "Cannot resolve configuration", e);
        }
        if (yaml == null) {
            throw new ConfigLoadException(file, "Cannot find configuration resource");
        }
        try (InputStream is = yaml.openStream()) {
            var loaded = mapper().readValue(is, PeerTrustConfiguration.class);
            return loaded == null ? new PeerTrustConfiguration() : loaded;
        } catch (IOException e) {
            throw new ConfigLoadException(file, "Invalid configuration: " + e.getMessage(), e);
        }
    }

    static ObjectMapper mapper() {
        return new ObjectMapper(new YAMLFactory()).registerModule(new JavaTimeModule());
    }
}
