/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.comm;

import com.google.common.primitives.Ints;
import com.salesforce.peertrust.cryptography.ssl.ClientHandshakePolicy;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * HTTPS over mutual TLS, one connection per request. The server must present the certificate pinned by the
 * {@link ClientHandshakePolicy}.
 */
public class MtlsClient implements Closeable {
    /**
     * @param status - the HTTP status code
     * @param body   - decoded as UTF-8
     */
    public record Response(int status, String body) {
    }

    private static class Exchange extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final FullHttpRequest             request;
        private final CompletableFuture<Response> result;

        private Exchange(FullHttpRequest request, CompletableFuture<Response> result) {
            this.request = request;
            this.result = result;
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.completeExceptionally(new IOException("Connection closed before a response was received"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            var failure = cause instanceof DecoderException && cause.getCause() != null ? cause.getCause() : cause;
            result.completeExceptionally(
            failure instanceof IOException io ? io : new IOException(failure.getMessage(), failure));
            ctx.close();
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof SslHandshakeCompletionEvent handshake) {
                if (handshake.isSuccess()) {
                    ctx.writeAndFlush(request);
                } else {
                    request.release();
                    result.completeExceptionally(
                    new IOException("TLS handshake failed: " + handshake.cause().getMessage(), handshake.cause()));
                    ctx.close();
                }
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            result.complete(
            new Response(response.status().code(), response.content().toString(StandardCharsets.UTF_8)));
            ctx.close();
        }
    }

    private static final int    DEFAULT_PORT       = 443;
    private static final int    MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final Logger log                = LoggerFactory.getLogger(MtlsClient.class);

    private final EventLoopGroup        group;
    private final ClientHandshakePolicy policy;
    private final Duration              timeout;

    public MtlsClient(ClientHandshakePolicy policy, Duration timeout) {
        this(policy, timeout, new NioEventLoopGroup(1));
    }

    public MtlsClient(ClientHandshakePolicy policy, Duration timeout, EventLoopGroup group) {
        this.policy = policy;
        this.timeout = timeout;
        this.group = group;
    }

    /**
     * @return the connect timeout in the int millis the channel option takes, saturated for long timeouts
     */
    int connectTimeoutMillis() {
        return Ints.saturatedCast(timeout.toMillis());
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    /**
     * Issue a GET on a fresh connection
     *
     * @throws IOException if the connection, the handshake or the exchange fails, or the timeout elapses first
     */
    public Response get(URI uri) throws IOException, InterruptedException {
        checkArgument("https".equalsIgnoreCase(uri.getScheme()), "Not an https URI: %s", uri);
        final var host = uri.getHost();
        checkArgument(host != null, "No host in: %s", uri);
        final var port = uri.getPort() == -1 ? DEFAULT_PORT : uri.getPort();

        var path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        var request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, path);
        request.headers()
               .set(HttpHeaderNames.HOST, host + ":" + port)
               .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE)
               .set(HttpHeaderNames.CONTENT_LENGTH, 0);

        var result = new CompletableFuture<Response>();
        var bootstrap = new Bootstrap().group(group)
                                       .channel(NioSocketChannel.class)
                                       .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis())
                                       .option(ChannelOption.TCP_NODELAY, true)
                                       .handler(new ChannelInitializer<SocketChannel>() {
                                           @Override
                                           protected void initChannel(SocketChannel ch) {
                                               ChannelPipeline pipeline = ch.pipeline();
                                               pipeline.addLast(policy.newHandler(ch.alloc(), host, port));
                                               pipeline.addLast(new HttpClientCodec());
                                               pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                                               pipeline.addLast(new Exchange(request, result));
                                           }
                                       });
        log.debug("Connecting to: {}:{}", host, port);
        var connect = bootstrap.connect(host, port);
        connect.addListener(f -> {
            if (!f.isSuccess()) {
                result.completeExceptionally(new IOException("Unable to connect to " + host + ":" + port, f.cause()));
            }
        });
        Channel channel = connect.channel();
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            log.debug("Request to: {} failed: {}", uri, cause.toString());
            throw cause instanceof IOException io ? io : new IOException(cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IOException("Timed out after " + timeout + " waiting for " + uri, e);
        } finally {
            channel.close();
        }
    }
}
