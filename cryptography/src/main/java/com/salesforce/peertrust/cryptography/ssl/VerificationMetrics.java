/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.codahale.metrics.Meter;

/**
 * Outcome counters of peer verification
 */
public interface VerificationMetrics {

    String ACCEPTED             = "peer.verification.accepted";
    String CREDENTIAL_ABSENT    = "peer.verification.rejected.absent";
    String CREDENTIAL_MISMATCH  = "peer.verification.rejected.mismatch";
    String MALFORMED_CREDENTIAL = "peer.verification.rejected.malformed";
    String NOT_AUTHORIZED       = "peer.verification.rejected.unknown";

    Meter accepted();

    Meter credentialAbsent();

    Meter credentialMismatch();

    Meter malformedCredential();

    Meter notAuthorized();
}
