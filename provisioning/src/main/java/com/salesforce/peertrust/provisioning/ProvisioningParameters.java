/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.provisioning;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * What to provision and where
 */
public class ProvisioningParameters {
    public static class Builder {
        private String       clientSubject          = DEFAULT_CLIENT_SUBJECT;
        private String       keyAlgorithm           = "RSA";
        private int          keySize                = 2048;
        private Path         outputDirectory        = Path.of("certs");
        private List<String> serverAlternativeNames = DEFAULT_SERVER_ALTERNATIVE_NAMES;
        private String       serverSubject          = DEFAULT_SERVER_SUBJECT;
        private Duration     validity               = Duration.ofDays(365);

        public ProvisioningParameters build() {
            return new ProvisioningParameters(outputDirectory, serverSubject, serverAlternativeNames, clientSubject,
                                              keyAlgorithm, keySize, validity);
        }

        public String getClientSubject() {
            return clientSubject;
        }

        public String getKeyAlgorithm() {
            return keyAlgorithm;
        }

        public int getKeySize() {
            return keySize;
        }

        public Path getOutputDirectory() {
            return outputDirectory;
        }

        public List<String> getServerAlternativeNames() {
            return serverAlternativeNames;
        }

        public String getServerSubject() {
            return serverSubject;
        }

        public Duration getValidity() {
            return validity;
        }

        public Builder setClientSubject(String clientSubject) {
            this.clientSubject = clientSubject;
            return this;
        }

        /**
         * @param keyAlgorithm - "RSA" or "EC"
         */
        public Builder setKeyAlgorithm(String keyAlgorithm) {
            this.keyAlgorithm = keyAlgorithm;
            return this;
        }

        public Builder setKeySize(int keySize) {
            this.keySize = keySize;
            return this;
        }

        public Builder setOutputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder setServerAlternativeNames(List<String> serverAlternativeNames) {
            this.serverAlternativeNames = serverAlternativeNames;
            return this;
        }

        public Builder setServerSubject(String serverSubject) {
            this.serverSubject = serverSubject;
            return this;
        }

        public Builder setValidity(Duration validity) {
            this.validity = validity;
            return this;
        }
    }

    public static final String       CLIENT_CERTIFICATE               = "client.crt";
    public static final String       CLIENT_KEY                       = "client.key";
    public static final String       DEFAULT_CLIENT_SUBJECT           = "C=US, ST=California, L=SanFrancisco, O=MyOrg, OU=Client, CN=my_secure_client";
    public static final List<String> DEFAULT_SERVER_ALTERNATIVE_NAMES = List.of("localhost", "127.0.0.1");
    public static final String       DEFAULT_SERVER_SUBJECT           = "C=US, ST=California, L=SanFrancisco, O=MyOrg, OU=Server, CN=localhost";
    public static final String       KNOWN_CLIENTS                    = "knownClients.txt";
    public static final String       SERVER_CERTIFICATE               = "server.crt";
    public static final String       SERVER_KEY                       = "server.key";

    private final String       clientSubject;
    private final String       keyAlgorithm;
    private final int          keySize;
    private final Path         outputDirectory;
    private final List<String> serverAlternativeNames;
    private final String       serverSubject;
    private final Duration     validity;

    private ProvisioningParameters(Path outputDirectory, String serverSubject, List<String> serverAlternativeNames,
                                   String clientSubject, String keyAlgorithm, int keySize, Duration validity) {
        this.outputDirectory = outputDirectory;
        this.serverSubject = serverSubject;
        this.serverAlternativeNames = ImmutableList.copyOf(serverAlternativeNames);
        this.clientSubject = clientSubject;
        this.keyAlgorithm = keyAlgorithm;
        this.keySize = keySize;
        this.validity = validity;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Path clientCertificate() {
        return outputDirectory.resolve(CLIENT_CERTIFICATE);
    }

    public Path clientKey() {
        return outputDirectory.resolve(CLIENT_KEY);
    }

    public String getClientSubject() {
        return clientSubject;
    }

    public String getKeyAlgorithm() {
        return keyAlgorithm;
    }

    public int getKeySize() {
        return keySize;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public List<String> getServerAlternativeNames() {
        return serverAlternativeNames;
    }

    public String getServerSubject() {
        return serverSubject;
    }

    public Duration getValidity() {
        return validity;
    }

    public Path knownClients() {
        return outputDirectory.resolve(KNOWN_CLIENTS);
    }

    public Path serverCertificate() {
        return outputDirectory.resolve(SERVER_CERTIFICATE);
    }

    public Path serverKey() {
        return outputDirectory.resolve(SERVER_KEY);
    }
}
