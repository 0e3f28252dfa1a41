/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.salesforce.peertrust.cryptography.cert.CertificateWithPrivateKey;

import javax.net.ssl.KeyManagerFactory;
import java.security.Provider;

public class NodeKeyManagerFactory extends KeyManagerFactory {

    public NodeKeyManagerFactory(String alias, CertificateWithPrivateKey identity, Provider provider) {
        super(new NodeKeyManagerFactorySpi(alias, identity), provider, "Keys");
    }
}
