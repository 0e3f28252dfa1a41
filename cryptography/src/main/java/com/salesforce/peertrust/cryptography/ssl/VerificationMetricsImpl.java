/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

public class VerificationMetricsImpl implements VerificationMetrics {
    private final Meter accepted;
    private final Meter credentialAbsent;
    private final Meter credentialMismatch;
    private final Meter malformedCredential;
    private final Meter notAuthorized;

    public VerificationMetricsImpl(MetricRegistry registry) {
        accepted = registry.meter(ACCEPTED);
        credentialAbsent = registry.meter(CREDENTIAL_ABSENT);
        credentialMismatch = registry.meter(CREDENTIAL_MISMATCH);
        malformedCredential = registry.meter(MALFORMED_CREDENTIAL);
        notAuthorized = registry.meter(NOT_AUTHORIZED);
    }

    @Override
    public Meter accepted() {
        return accepted;
    }

    @Override
    public Meter credentialAbsent() {
        return credentialAbsent;
    }

    @Override
    public Meter credentialMismatch() {
        return credentialMismatch;
    }

    @Override
    public Meter malformedCredential() {
        return malformedCredential;
    }

    @Override
    public Meter notAuthorized() {
        return notAuthorized;
    }
}
