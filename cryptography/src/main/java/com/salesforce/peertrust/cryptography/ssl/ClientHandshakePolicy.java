/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.ConfigLoadException;
import com.salesforce.peertrust.cryptography.cert.CertificateWithPrivateKey;
import com.salesforce.peertrust.cryptography.cert.Pem;
import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.nio.file.Path;
import java.security.cert.X509Certificate;

import static com.google.common.base.Preconditions.checkState;

/**
 * The TLS configuration of the connecting role: present our identity, and trust the server only if it presents the
 * pinned certificate.
 */
public class ClientHandshakePolicy {
    public static class Builder {
        private CertificateWithPrivateKey identity;
        private X509Certificate           pinned;
        private boolean                   verifyHostname = true;

        public ClientHandshakePolicy build() {
            checkState(identity != null, "Client identity has not been supplied");
            checkState(pinned != null, "Server certificate to pin has not been supplied");
            var trust = new PinnedTrust(pinned);
            return new ClientHandshakePolicy(identity, trust, verifyHostname, forClient(identity, trust));
        }

        public Builder loadIdentity(Path certificate, Path privateKey) throws ConfigLoadException {
            return setIdentity(Pem.loadIdentity(certificate, privateKey));
        }

        public Builder loadPinnedCertificate(Path certificate) throws ConfigLoadException {
            return setPinnedCertificate(Pem.loadCertificate(certificate));
        }

        public Builder setIdentity(CertificateWithPrivateKey identity) {
            this.identity = identity;
            return this;
        }

        public Builder setPinnedCertificate(X509Certificate pinned) {
            this.pinned = pinned;
            return this;
        }

        /**
         * Check the host name dialed against the pinned certificate's subject alternative names. On by default.
         */
        public Builder setVerifyHostname(boolean verifyHostname) {
            this.verifyHostname = verifyHostname;
            return this;
        }
    }

    private static final String ENDPOINT_IDENTIFICATION = "HTTPS";
    private static final Logger log                     = LoggerFactory.getLogger(ClientHandshakePolicy.class);

    private final CertificateWithPrivateKey identity;
    private final PinnedTrust               pinned;
    private final SslContext                sslContext;
    private final boolean                   verifyHostname;

    private ClientHandshakePolicy(CertificateWithPrivateKey identity, PinnedTrust pinned, boolean verifyHostname,
                                  SslContext sslContext) {
        this.identity = identity;
        this.pinned = pinned;
        this.verifyHostname = verifyHostname;
        this.sslContext = sslContext;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private static SslContext forClient(CertificateWithPrivateKey identity, PinnedTrust pinned) {
        try {
            SslContext context = SslContextBuilder.forClient()
                                                  .sslProvider(SslProvider.JDK)
                                                  .sslContextProvider(Tls.PROVIDER_JSSE)
                                                  .protocols(Tls.PROTOCOLS)
                                                  .keyManager(new NodeKeyManagerFactory(Tls.IDENTITY_ALIAS, identity,
                                                                                        Tls.PROVIDER_JSSE))
                                                  .trustManager(pinned.trustManagerFactory())
                                                  .build();
            log.info("Connecting role configured for: {} pinning: {}", identity.getIdentity(), pinned);
            return context;
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot build ssl client context", e);
        }
    }

    public CertificateWithPrivateKey getIdentity() {
        return identity;
    }

    public PinnedTrust getPinned() {
        return pinned;
    }

    public SslContext getSslContext() {
        return sslContext;
    }

    public boolean isVerifyHostname() {
        return verifyHostname;
    }

    /**
     * @param host - the name dialed, checked against the pinned certificate when host name verification is on
     */
    public SslHandler newHandler(ByteBufAllocator allocator, String host, int port) {
        SslHandler handler = sslContext.newHandler(allocator, host, port);
        if (verifyHostname) {
            SSLEngine engine = handler.engine();
            SSLParameters parameters = engine.getSSLParameters();
            parameters.setEndpointIdentificationAlgorithm(ENDPOINT_IDENTIFICATION);
            engine.setSSLParameters(parameters);
        }
        return handler;
    }
}
