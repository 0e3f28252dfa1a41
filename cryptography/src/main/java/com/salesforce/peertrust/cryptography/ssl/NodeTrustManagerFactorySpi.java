/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import javax.net.ssl.ManagerFactoryParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactorySpi;
import java.security.KeyStore;

public class NodeTrustManagerFactorySpi extends TrustManagerFactorySpi {

    private final CertificateValidator validator;

    public NodeTrustManagerFactorySpi(CertificateValidator validator) {
        this.validator = validator;
    }

    @Override
    protected TrustManager[] engineGetTrustManagers() {
        return new TrustManager[] { new Trust(validator) };
    }

    // the validator is the only source of trust; key stores and parameters are ignored
    @Override
    protected void engineInit(KeyStore ks) {
    }

    @Override
    protected void engineInit(ManagerFactoryParameters parameters) {
    }
}
