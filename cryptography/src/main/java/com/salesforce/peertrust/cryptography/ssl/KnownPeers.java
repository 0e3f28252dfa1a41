/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.cryptography.ssl;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.salesforce.peertrust.cryptography.ConfigLoadException;
import com.salesforce.peertrust.cryptography.cert.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The registry of authorized peers: identity name to the fingerprint of the certificate provisioned for it.
 * <p>
 * The source is line oriented UTF-8 text, one {@code <identity> <fingerprint>} pair per line. Blank lines and lines
 * starting with {@code #} are ignored. A line of any other shape is skipped with a warning and recorded in
 * {@link #getMalformedLines()}; it never aborts the load. When an identity is listed more than once the last line
 * wins. Fingerprints are upper-cased as they are read.
 * <p>
 * Instances are immutable and safe to share between any number of concurrent verifications.
 */
public final class KnownPeers {
    private static final Splitter FIELDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final Logger   log    = LoggerFactory.getLogger(KnownPeers.class);

    private final ImmutableList<MalformedRegistryLine> malformedLines;
    private final ImmutableMap<String, Fingerprint>    peers;
    private final String                               source;

    private KnownPeers(String source, ImmutableMap<String, Fingerprint> peers,
                       ImmutableList<MalformedRegistryLine> malformedLines) {
        this.source = source;
        this.peers = peers;
        this.malformedLines = malformedLines;
    }

    /**
     * Load the registry from a file. Bytes that are not valid UTF-8 are replaced, so they damage only the line they
     * are on.
     *
     * @throws ConfigLoadException if the file cannot be opened or read
     */
    public static KnownPeers load(Path path) throws ConfigLoadException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                                                       .onMalformedInput(CodingErrorAction.REPLACE)
                                                       .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            return parse(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigLoadException(path, "Unable to read known peers", e);
        }
    }

    /**
     * Build a registry directly from identity and fingerprint pairs
     */
    public static KnownPeers of(Map<String, Fingerprint> peers) {
        return new KnownPeers("<memory>", ImmutableMap.copyOf(peers), ImmutableList.of());
    }

    /**
     * Parse the registry from the supplied source. Only failures of the reader itself are raised.
     *
     * @param source - a description of the source used in diagnostics
     */
    public static KnownPeers parse(Reader reader, String source) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        Map<String, Fingerprint> peers = new LinkedHashMap<>();
        ImmutableList.Builder<MalformedRegistryLine> malformed = ImmutableList.builder();

        int lineNumber = 0;
        for (String line = lines.readLine(); line != null; line = lines.readLine()) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            List<String> fields = FIELDS.splitToList(trimmed);
            if (fields.size() != 2) {
                var skipped = new MalformedRegistryLine(source, lineNumber, line,
                                                        "format should be '<identity> <fingerprint>', found "
                                                        + fields.size() + " fields");
                log.warn("Skipping invalid line {} in {}: {}", lineNumber, source, skipped.problem());
                malformed.add(skipped);
                continue;
            }
            String identity = fields.get(0);
            Fingerprint fingerprint = Fingerprint.parse(fields.get(1));
            if (!fingerprint.isCanonical()) {
                log.warn("Line {} in {}: fingerprint of '{}' is not a SHA-256 fingerprint and will never match",
                         lineNumber, source, identity);
            }
            Fingerprint replaced = peers.put(identity, fingerprint);
            if (replaced != null) {
                log.debug("Line {} in {}: '{}' listed again, later entry replaces the earlier", lineNumber, source,
                          identity);
            }
        }

        if (peers.isEmpty()) {
            log.warn("No valid peer entries found in {}, every peer will be rejected", source);
        } else {
            log.info("Loaded {} known peers from {}", peers.size(), source);
        }
        return new KnownPeers(source, ImmutableMap.copyOf(peers), malformed.build());
    }

    /**
     * @return the fingerprint provisioned for the identity, if the identity is known
     */
    public Optional<Fingerprint> expected(String identity) {
        return identity == null ? Optional.empty() : Optional.ofNullable(peers.get(identity));
    }

    /**
     * @return the entries, in the order their identities first appeared
     */
    public Map<String, Fingerprint> getEntries() {
        return peers;
    }

    public List<MalformedRegistryLine> getMalformedLines() {
        return malformedLines;
    }

    public String getSource() {
        return source;
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }

    public int size() {
        return peers.size();
    }

    @Override
    public String toString() {
        return "KnownPeers[" + source + ": " + peers.keySet() + "]";
    }
}
