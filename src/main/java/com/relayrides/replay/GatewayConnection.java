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

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>A single connection to a push gateway. A gateway connection wraps an established (and, outside of tests,
 * TLS-secured) Netty channel and attaches the inbound side of the protocol to it: a {@link RejectedNotificationDecoder}
 * followed by a handler that reports what it reads to a {@link GatewayConnectionListener}.</p>
 *
 * <p>Outbound, a connection just writes pre-encoded frames and waits a bounded time for each write to finish.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class GatewayConnection {

	private final Channel channel;
	private final String name;
	private final GatewayConnectionListener listener;

	private static final Logger log = LoggerFactory.getLogger(GatewayConnection.class);

	private class GatewayConnectionHandler extends SimpleChannelInboundHandler<RejectedNotification> {

		@Override
		protected void channelRead0(final ChannelHandlerContext context, final RejectedNotification rejectedNotification) {
			log.debug("Gateway rejected notification with sequence number {} from {} ({}).",
					rejectedNotification.getSequenceNumber(), GatewayConnection.this.name,
					rejectedNotification.getReason());

			GatewayConnection.this.listener.handleRejectedNotification(GatewayConnection.this, rejectedNotification);

			// The gateway sends at most one error frame per connection
			context.close();
		}

		@Override
		public void exceptionCaught(final ChannelHandlerContext context, final Throwable cause) {
			log.debug("{} caught an exception and will close.", GatewayConnection.this.name, cause);
			context.close();
		}

		@Override
		public void channelInactive(final ChannelHandlerContext context) throws Exception {
			super.channelInactive(context);

			log.debug("{} closed.", GatewayConnection.this.name);
			GatewayConnection.this.listener.handleConnectionClosure(GatewayConnection.this);
		}
	}

	/**
	 * Constructs a new gateway connection around the given channel. The channel should already be connected and, if
	 * it carries a TLS handler, should have completed its handshake.
	 *
	 * @param channel the connected channel to the gateway
	 * @param name a human-readable name for this connection; used in log messages
	 * @param listener the listener to notify of rejections and closure
	 */
	public GatewayConnection(final Channel channel, final String name, final GatewayConnectionListener listener) {
		if (channel == null) {
			throw new NullPointerException("Channel must not be null.");
		}

		if (listener == null) {
			throw new NullPointerException("Listener must not be null.");
		}

		this.channel = channel;
		this.name = name;
		this.listener = listener;

		final ChannelPipeline pipeline = channel.pipeline();
		pipeline.addLast("decoder", new RejectedNotificationDecoder());
		pipeline.addLast("handler", new GatewayConnectionHandler());
	}

	/**
	 * Writes an encoded notification frame to the gateway and waits for the write to finish. The frame is released
	 * by the channel once written.
	 *
	 * @param frame the encoded frame to write
	 * @param timeoutMillis the maximum time, in milliseconds, to wait for the write to finish
	 *
	 * @throws NotificationWriteException if the write failed or did not finish in time
	 * @throws InterruptedException if interrupted while waiting for the write to finish
	 */
	public void write(final ByteBuf frame, final long timeoutMillis) throws NotificationWriteException, InterruptedException {
		final ChannelFuture writeFuture = this.channel.writeAndFlush(frame);

		if (!writeFuture.await(timeoutMillis)) {
			log.debug("{} timed out while writing a notification.", this.name);
			throw new NotificationWriteException(String.format("%s timed out after %d ms while writing a notification.",
					this.name, timeoutMillis));
		}

		if (!writeFuture.isSuccess()) {
			log.debug("{} failed to write a notification.", this.name, writeFuture.cause());
			throw new NotificationWriteException(String.format("%s failed to write a notification.", this.name),
					writeFuture.cause());
		}
	}

	public boolean isActive() {
		return this.channel.isActive();
	}

	/**
	 * Closes this connection. The listener is notified of closure once the channel becomes inactive.
	 */
	public void close() {
		log.debug("{} closing.", this.name);
		this.channel.close();
	}

	public String getName() {
		return this.name;
	}

	@Override
	public String toString() {
		return "GatewayConnection [name=" + this.name + "]";
	}
}
