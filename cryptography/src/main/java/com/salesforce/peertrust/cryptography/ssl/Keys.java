/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.CertificateWithPrivateKey;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedKeyManager;
import java.net.Socket;
import java.security.Principal;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Objects;

/**
 * Presents a single identity, whatever the peer asks for
 */
public class Keys extends X509ExtendedKeyManager {
    private final String                    alias;
    private final CertificateWithPrivateKey identity;

    public Keys(String alias, CertificateWithPrivateKey identity) {
        this.alias = Objects.requireNonNull(alias, "alias");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public String chooseClientAlias(String[] keyType, Principal[] issuers, Socket socket) {
        return alias;
    }

    @Override
    public String chooseEngineClientAlias(String[] keyType, Principal[] issuers, SSLEngine engine) {
        return alias;
    }

    @Override
    public String chooseEngineServerAlias(String keyType, Principal[] issuers, SSLEngine engine) {
        return alias;
    }

    @Override
    public String chooseServerAlias(String keyType, Principal[] issuers, Socket socket) {
        return alias;
    }

    @Override
    public X509Certificate[] getCertificateChain(String alias) {
        return this.alias.equals(alias) ? new X509Certificate[] { identity.getX509Certificate() } : null;
    }

    @Override
    public String[] getClientAliases(String keyType, Principal[] issuers) {
        return new String[] { alias };
    }

    @Override
    public PrivateKey getPrivateKey(String alias) {
        return this.alias.equals(alias) ? identity.getPrivateKey() : null;
    }

    @Override
    public String[] getServerAliases(String keyType, Principal[] issuers) {
        return new String[] { alias };
    }
}
