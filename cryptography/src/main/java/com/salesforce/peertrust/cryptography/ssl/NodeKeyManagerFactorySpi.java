/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.CertificateWithPrivateKey;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactorySpi;
import javax.net.ssl.ManagerFactoryParameters;
import java.security.KeyStore;

public class NodeKeyManagerFactorySpi extends KeyManagerFactorySpi {

    private final String                    alias;
    private final CertificateWithPrivateKey identity;

    public NodeKeyManagerFactorySpi(String alias, CertificateWithPrivateKey identity) {
        this.alias = alias;
        this.identity = identity;
    }

    @Override
    protected KeyManager[] engineGetKeyManagers() {
        return new KeyManager[] { new Keys(alias, identity) };
    }

    @Override
    protected void engineInit(KeyStore ks, char[] password) {
    }

    @Override
    protected void engineInit(ManagerFactoryParameters parameters) {
    }
}
