/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A registry, certificate or key file could not be read or understood. Raised at startup, before any network
 * activity, and fatal for the role being initialized.
 */
public class ConfigLoadException extends IOException {

    private static final long serialVersionUID = 1L;
    private final        Path path;

    public ConfigLoadException(Path path, String message) {
        super(format(path, message));
        this.path = path;
    }

    public ConfigLoadException(Path path, String message, Throwable cause) {
        super(format(path, message), cause);
        this.path = path;
    }

    private static String format(Path path, String message) {
        return path == null ? message : String.format("%s [%s]", message, path);
    }

    /**
     * @return the file that failed to load, or null when the failure is not tied to a single file
     */
    public Path getPath() {
        return path;
    }
}
