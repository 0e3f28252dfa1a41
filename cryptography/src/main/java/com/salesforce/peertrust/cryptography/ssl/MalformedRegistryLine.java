/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

/**
 * A known peers line that was skipped while loading
 *
 * @param source     - where the line was read from
 * @param lineNumber - 1 based
 * @param content    - the line as read
 * @param problem    - why the line was skipped
 */
public record MalformedRegistryLine(String source, int lineNumber, String content, String problem) {
}
