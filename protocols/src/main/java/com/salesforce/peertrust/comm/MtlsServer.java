/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.peertrust.comm;

import com.salesforce.peertrust.cryptography.ssl.ServerHandshakePolicy;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.security.cert.CertificateEncodingException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkState;

/**
 * HTTP/1.1 over mutual TLS. Each connection is authorized by the {@link ServerHandshakePolicy} during the handshake;
 * requests of authorized connections are handed to the {@link RequestHandler} together with the authenticated peer.
 * A failed handshake closes that connection only.
 */
public class MtlsServer {
    private class Dispatcher extends SimpleChannelInboundHandler<FullHttpRequest> {
        private volatile AuthenticatedPeer peer;

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof DecoderException && cause.getCause() instanceof SSLException) {
                log.debug("TLS failure with: {}: {}", ctx.channel().remoteAddress(), cause.getCause().toString());
            } else {
                log.warn("Error caught on connection: {}", ctx.channel().remoteAddress(), cause);
            }
            ctx.close();
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof SslHandshakeCompletionEvent handshake) {
                if (!handshake.isSuccess()) {
                    log.warn("TLS handshake failed with: {}: {}", ctx.channel().remoteAddress(),
                             handshake.cause().getMessage());
                    ctx.close();
                    return;
                }
                try {
                    peer = AuthenticatedPeer.from(ctx.pipeline().get(SslHandler.class).engine().getSession());
                    log.debug("Connection authorized for: {} from: {}", peer.identity(),
                              ctx.channel().remoteAddress());
                } catch (SSLException | CertificateEncodingException e) {
                    log.warn("Unable to identify peer: {}", ctx.channel().remoteAddress(), e);
                    ctx.close();
                    return;
                }
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            final var current = peer;
            if (current == null) {
                ctx.close();
                return;
            }
            FullHttpResponse response;
            try {
                response = handler.handle(current, request);
            } catch (IOException | RuntimeException e) {
                log.warn("Request handler failed for: {} on: {}", current.identity(), request.uri(), e);
                response = RequestHandler.text(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal Server Error\n");
            }
            HttpUtil.setContentLength(response, response.content().readableBytes());
            if (HttpUtil.isKeepAlive(request)) {
                HttpUtil.setKeepAlive(response, true);
                ctx.writeAndFlush(response);
            } else {
                HttpUtil.setKeepAlive(response, false);
                ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            }
        }
    }

    private static final int    MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int    SHUTDOWN_SECONDS   = 5;
    private final static Logger log                = LoggerFactory.getLogger(MtlsServer.class);

    private final InetSocketAddress     address;
    private final EventLoopGroup        bossGroup;
    private volatile Channel            channel;
    private final CountDownLatch        closed = new CountDownLatch(1);
    private final RequestHandler        handler;
    private final ServerHandshakePolicy policy;
    private final EventLoopGroup        workerGroup;

    public MtlsServer(ServerHandshakePolicy policy, InetSocketAddress address, RequestHandler handler) {
        this(policy, address, handler, new NioEventLoopGroup(1), new NioEventLoopGroup());
    }

    public MtlsServer(ServerHandshakePolicy policy, InetSocketAddress address, RequestHandler handler,
                      EventLoopGroup bossGroup, EventLoopGroup workerGroup) {
        this.policy = policy;
        this.address = address;
        this.handler = handler;
        this.bossGroup = bossGroup;
        this.workerGroup = workerGroup;
    }

    /**
     * @return the bound port, meaningful once started
     */
    public int getPort() {
        final var current = channel;
        checkState(current != null, "Server has not been started");
        return ((InetSocketAddress) current.localAddress()).getPort();
    }

    /**
     * Wait until the server has been stopped
     */
    public void join() throws InterruptedException {
        closed.await();
    }

    public MtlsServer start() {
        log.debug("Server starting, binding to: {}", address);
        ChannelFuture future = new ServerBootstrap().option(ChannelOption.SO_BACKLOG, 128)
                                                    .option(ChannelOption.SO_REUSEADDR, true)
                                                    .childOption(ChannelOption.TCP_NODELAY, true)
                                                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                                                    .childOption(ChannelOption.ALLOCATOR,
                                                                 PooledByteBufAllocator.DEFAULT)
                                                    .group(bossGroup, workerGroup)
                                                    .channel(NioServerSocketChannel.class)
                                                    .childHandler(new ChannelInitializer<SocketChannel>() {
                                                        @Override
                                                        protected void initChannel(SocketChannel ch) {
                                                            ChannelPipeline pipeline = ch.pipeline();
                                                            pipeline.addLast(policy.newHandler(ch.alloc()));
                                                            pipeline.addLast(new HttpServerCodec());
                                                            pipeline.addLast(
                                                            new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                                                            pipeline.addLast(new Dispatcher());
                                                        }
                                                    })
                                                    .bind(address);
        try {
            future.sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Binding sync interrupted", e);
        } catch (Exception e) {
            log.error("Server unable to bind to: {}", address, e);
            throw new IllegalStateException("Unable to bind server to: " + address, e);
        }
        channel = future.channel();
        log.info("Server listening on: {}", channel.localAddress());
        return this;
    }

    /**
     * Close the listener and shut down the event loops, allowing them a few seconds to drain
     */
    public void stop() {
        final var current = channel;
        if (current != null) {
            current.close().awaitUninterruptibly();
        }
        bossGroup.shutdownGracefully(0, SHUTDOWN_SECONDS, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, SHUTDOWN_SECONDS, TimeUnit.SECONDS)
                   .awaitUninterruptibly(SHUTDOWN_SECONDS, TimeUnit.SECONDS);
        log.info("Server stopped: {}", address);
        closed.countDown();
    }
}
