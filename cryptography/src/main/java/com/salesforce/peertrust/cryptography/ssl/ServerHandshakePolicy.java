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
import io.netty.handler.ssl.ClientAuth;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkState;

/**
 * The TLS configuration of the accepting role. A client certificate is required, but it is never validated against
 * a chain of trust; the {@link CertificateValidator} is the only thing that decides whether a client may connect.
 */
public class ServerHandshakePolicy {
    public static class Builder {
        private CertificateWithPrivateKey identity;
        private KnownPeers                knownPeers;
        private VerificationMetrics       metrics;
        private CertificateValidator      validator;

        public ServerHandshakePolicy build() {
            checkState(identity != null, "Server identity has not been supplied");
            checkState(validator != null || knownPeers != null, "Neither known peers nor a validator supplied");
            CertificateValidator gate = validator != null ? validator : new KnownPeerValidator(knownPeers, metrics);
            return new ServerHandshakePolicy(identity, gate, forServer(identity, gate));
        }

        public Builder loadIdentity(Path certificate, Path privateKey) throws ConfigLoadException {
            return setIdentity(Pem.loadIdentity(certificate, privateKey));
        }

        public Builder loadKnownPeers(Path registry) throws ConfigLoadException {
            return setKnownPeers(KnownPeers.load(registry));
        }

        public Builder setIdentity(CertificateWithPrivateKey identity) {
            this.identity = identity;
            return this;
        }

        public Builder setKnownPeers(KnownPeers knownPeers) {
            this.knownPeers = knownPeers;
            return this;
        }

        public Builder setMetrics(VerificationMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Replace the known peers verification entirely
         */
        public Builder setValidator(CertificateValidator validator) {
            this.validator = validator;
            return this;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(ServerHandshakePolicy.class);

    private final CertificateWithPrivateKey identity;
    private final SslContext                sslContext;
    private final CertificateValidator      validator;

    private ServerHandshakePolicy(CertificateWithPrivateKey identity, CertificateValidator validator,
                                  SslContext sslContext) {
        this.identity = identity;
        this.validator = validator;
        this.sslContext = sslContext;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private static SslContext forServer(CertificateWithPrivateKey identity, CertificateValidator validator) {
        try {
            SslContext context = SslContextBuilder.forServer(
                                                  new NodeKeyManagerFactory(Tls.IDENTITY_ALIAS, identity,
                                                                            Tls.PROVIDER_JSSE))
                                                  .sslProvider(SslProvider.JDK)
                                                  .sslContextProvider(Tls.PROVIDER_JSSE)
                                                  .protocols(Tls.PROTOCOLS)
                                                  .trustManager(
                                                  new NodeTrustManagerFactory(validator, Tls.PROVIDER_JSSE))
                                                  .clientAuth(ClientAuth.REQUIRE)
                                                  .build();
            log.info("Accepting role configured for: {}", identity.getIdentity());
            return context;
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot build ssl server context", e);
        }
    }

    public CertificateWithPrivateKey getIdentity() {
        return identity;
    }

    public SslContext getSslContext() {
        return sslContext;
    }

    public CertificateValidator getValidator() {
        return validator;
    }

    public SslHandler newHandler(ByteBufAllocator allocator) {
        return sslContext.newHandler(allocator);
    }
}
