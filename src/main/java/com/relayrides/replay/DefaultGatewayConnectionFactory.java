/* Copyright (c) 2013 RelayRides
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package com.relayrides.replay;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslProvider;
import io.netty.util.concurrent.Future;

import java.util.concurrent.atomic.AtomicInteger;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Opens TLS connections to a push gateway with Netty. The SSL context is built from the client's credentials the
 * first time a connection is requested and reused afterward; if building it fails, the next connection attempt tries
 * again.</p>
 *
 * <p>Every connection verifies the gateway's certificate against the gateway's host name, which is also sent as the
 * SNI server name. Both the TCP connection and the TLS handshake are bounded by the configured connect timeout.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
class DefaultGatewayConnectionFactory implements GatewayConnectionFactory {

	private final PushGateway gateway;
	private final ClientCredentials credentials;
	private final EventLoopGroup eventLoopGroup;
	private final PushClientConfiguration configuration;
	private final String namePrefix;

	private final AtomicInteger connectionCounter = new AtomicInteger(0);

	private SslContext sslContext;

	private static final Logger log = LoggerFactory.getLogger(DefaultGatewayConnectionFactory.class);

	public DefaultGatewayConnectionFactory(final PushGateway gateway, final ClientCredentials credentials,
			final EventLoopGroup eventLoopGroup, final PushClientConfiguration configuration, final String namePrefix) {

		if (gateway == null) {
			throw new NullPointerException("Gateway must not be null.");
		}

		if (credentials == null) {
			throw new NullPointerException("Client credentials must not be null.");
		}

		if (eventLoopGroup == null) {
			throw new NullPointerException("Event loop group must not be null.");
		}

		if (configuration == null) {
			throw new NullPointerException("Configuration must not be null.");
		}

		this.gateway = gateway;
		this.credentials = credentials;
		this.eventLoopGroup = eventLoopGroup;
		this.configuration = configuration;
		this.namePrefix = namePrefix;
	}

	synchronized SslContext getSslContext() throws ClientCertificateException {
		if (this.sslContext == null) {
			final SslContextBuilder sslContextBuilder = SslContextBuilder.forClient()
					.sslProvider(SslProvider.JDK)
					.protocols(this.configuration.getTlsProtocols());

			try {
				if (this.configuration.getTrustedCertificatesFile() != null) {
					sslContextBuilder.trustManager(this.configuration.getTrustedCertificatesFile());
				}

				this.credentials.configureKeyManager(sslContextBuilder);
				this.sslContext = sslContextBuilder.build();
			} catch (IllegalArgumentException e) {
				throw new ClientCertificateException(String.format("Could not load %s.", this.credentials), e);
			} catch (SSLException e) {
				throw new ClientCertificateException(String.format("Could not build an SSL context from %s.",
						this.credentials), e);
			}
		}

		return this.sslContext;
	}

	@Override
	public GatewayConnection connect(final GatewayConnectionListener listener)
			throws ClientCertificateException, GatewayConnectionException, InterruptedException {

		final SslContext sslContext = this.getSslContext();
		final String host = this.gateway.getHost();
		final int port = this.gateway.getPort();
		final long timeoutMillis = this.configuration.getConnectTimeoutMillis();

		final String name = String.format("%s-connection-%d", this.namePrefix, this.connectionCounter.getAndIncrement());

		final Bootstrap bootstrap = new Bootstrap();
		bootstrap.group(this.eventLoopGroup);
		bootstrap.channel(NioSocketChannel.class);
		bootstrap.option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT);
		bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE));

		bootstrap.handler(new ChannelInitializer<SocketChannel>() {

			@Override
			protected void initChannel(final SocketChannel channel) {
				final SslHandler sslHandler = sslContext.newHandler(channel.alloc(), host, port);

				final SSLEngine sslEngine = sslHandler.engine();
				final SSLParameters sslParameters = sslEngine.getSSLParameters();
				sslParameters.setEndpointIdentificationAlgorithm("HTTPS");
				sslEngine.setSSLParameters(sslParameters);

				sslHandler.setHandshakeTimeoutMillis(timeoutMillis);

				channel.pipeline().addLast("ssl", sslHandler);
			}
		});

		log.debug("{} beginning connection process.", name);

		final ChannelFuture connectFuture = bootstrap.connect(host, port);
		boolean connected = false;

		try {
			if (!connectFuture.await(timeoutMillis)) {
				throw new GatewayConnectionException(String.format("%s timed out while connecting to %s.",
						name, this.gateway), null);
			}

			if (!connectFuture.isSuccess()) {
				log.debug("{} failed to connect to gateway.", name, connectFuture.cause());
				throw new GatewayConnectionException(String.format("%s failed to connect to %s.", name, this.gateway),
						connectFuture.cause());
			}

			log.debug("{} connected; waiting for TLS handshake.", name);

			final Channel channel = connectFuture.channel();
			final Future<Channel> handshakeFuture = channel.pipeline().get(SslHandler.class).handshakeFuture();

			if (!handshakeFuture.await(timeoutMillis)) {
				throw new GatewayConnectionException(String.format("%s timed out during TLS handshake with %s.",
						name, this.gateway), null);
			}

			if (!handshakeFuture.isSuccess()) {
				log.debug("{} failed to complete TLS handshake with gateway.", name, handshakeFuture.cause());
				throw new GatewayConnectionException(String.format("%s failed to complete TLS handshake with %s.",
						name, this.gateway), handshakeFuture.cause());
			}

			log.debug("{} successfully completed TLS handshake.", name);

			final GatewayConnection connection = new GatewayConnection(channel, name, listener);
			connected = true;

			return connection;
		} finally {
			if (!connected) {
				connectFuture.channel().close();
			}
		}
	}
}
