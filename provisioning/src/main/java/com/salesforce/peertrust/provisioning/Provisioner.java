/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.provisioning;

import com.salesforce.peertrust.cryptography.cert.BcX500NameDnImpl;
import com.salesforce.peertrust.cryptography.cert.CertificateWithPrivateKey;
import com.salesforce.peertrust.cryptography.cert.Certificates;
import com.salesforce.peertrust.cryptography.cert.Fingerprint;
import com.salesforce.peertrust.cryptography.cert.Pem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.security.cert.CertificateEncodingException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Generates a self-signed server identity, a self-signed client identity and the known clients registry that
 * authorizes that client. No certificate authority is involved: the client pins the server certificate, and the
 * server knows the client by the fingerprint recorded here.
 */
public class Provisioner {
    /**
     * The files written by a provisioning run
     */
    public record Provisioned(Path serverCertificate, Path serverKey, Path clientCertificate, Path clientKey,
                              Path knownClients, String clientIdentity, Fingerprint clientFingerprint) {
    }

    private static final Duration BACKDATE = Duration.ofMinutes(1);
    private static final String   HEADER   = """
                                             # Known client certificates
                                             # Format: <CommonName> <SHA256 Fingerprint>
                                             """;
    private static final Logger   log      = LoggerFactory.getLogger(Provisioner.class);

    private final ProvisioningParameters parameters;

    public Provisioner(ProvisioningParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Provision into the output directory, replacing any files of the same names
     */
    public Provisioned provision() throws IOException {
        var clientDn = new BcX500NameDnImpl(parameters.getClientSubject());
        var clientIdentity = clientDn.getCommonName();
        checkArgument(clientIdentity != null && !clientIdentity.isBlank(), "Client subject has no common name: %s",
                      parameters.getClientSubject());

        Files.createDirectories(parameters.getOutputDirectory());

        log.info("Generating self-signed server certificate: {}", parameters.getServerSubject());
        var server = selfSigned(new BcX500NameDnImpl(parameters.getServerSubject()),
                                parameters.getServerAlternativeNames());
        write(server, parameters.serverCertificate(), parameters.serverKey());

        log.info("Generating self-signed client certificate: {}", parameters.getClientSubject());
        var client = selfSigned(clientDn, List.of());
        write(client, parameters.clientCertificate(), parameters.clientKey());

        Fingerprint fingerprint;
        try {
            fingerprint = Fingerprint.of(client.getX509Certificate());
        } catch (CertificateEncodingException e) {
            throw new IllegalStateException("Unable to encode generated client certificate", e);
        }
        var entry = clientIdentity + " " + fingerprint;
        Files.deleteIfExists(parameters.knownClients());
        Files.writeString(parameters.knownClients(), HEADER + entry + "\n", StandardCharsets.UTF_8);
        log.info("Known client entry: {}", entry);

        log.info("Provisioning complete, certificates and {} are in: {}", ProvisioningParameters.KNOWN_CLIENTS,
                 parameters.getOutputDirectory());
        return new Provisioned(parameters.serverCertificate(), parameters.serverKey(), parameters.clientCertificate(),
                               parameters.clientKey(), parameters.knownClients(), clientIdentity, fingerprint);
    }

    private void ownerReadOnly(Path key) throws IOException {
        if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            log.debug("POSIX permissions not supported, leaving permissions of: {}", key);
            return;
        }
        Files.setPosixFilePermissions(key, EnumSet.of(PosixFilePermission.OWNER_READ));
    }

    private CertificateWithPrivateKey selfSigned(BcX500NameDnImpl dn, List<String> alternativeNames) {
        var keyPair = Certificates.generateKeyPair(parameters.getKeyAlgorithm(), parameters.getKeySize());
        var notBefore = Instant.now().minus(BACKDATE);
        var notAfter = notBefore.plus(parameters.getValidity());
        var cert = Certificates.selfSign(dn, keyPair, notBefore, notAfter,
                                         Certificates.endpointExtensions(alternativeNames));
        return new CertificateWithPrivateKey(cert, keyPair.getPrivate());
    }

    private void write(CertificateWithPrivateKey identity, Path certificate, Path key) throws IOException {
        Files.deleteIfExists(certificate);
        Files.deleteIfExists(key);
        Pem.write(identity.getX509Certificate(), certificate);
        Pem.write(identity.getPrivateKey(), key);
        ownerReadOnly(key);
    }
}
