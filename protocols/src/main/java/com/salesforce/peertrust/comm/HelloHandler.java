/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.comm;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greets the authenticated client by name
 */
public class HelloHandler implements RequestHandler {
    private static final Logger log = LoggerFactory.getLogger(HelloHandler.class);

    @Override
    public FullHttpResponse handle(AuthenticatedPeer peer, FullHttpRequest request) {
        log.info("Received request from {} for {}", peer.identity(), new QueryStringDecoder(request.uri()).path());
        return RequestHandler.text(HttpResponseStatus.OK,
                                   String.format("Hello, authenticated client '%s'!\n", peer.identity()));
    }
}
