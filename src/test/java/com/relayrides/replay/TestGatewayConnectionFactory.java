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
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A connection factory that hands out connections backed by embedded channels. Frames written to any of its
 * connections are recorded in order; writes and connection attempts can be made to fail on demand.
 */
class TestGatewayConnectionFactory implements GatewayConnectionFactory {

	private final List<EmbeddedChannel> channels = new ArrayList<EmbeddedChannel>();
	private final List<byte[]> writtenFrames = new ArrayList<byte[]>();

	private int connectionAttempts = 0;
	private int writeFailuresRemaining = 0;
	private boolean failConnections = false;

	private class RecordingHandler extends ChannelOutboundHandlerAdapter {

		@Override
		public void write(final ChannelHandlerContext context, final Object message, final ChannelPromise promise) {
			final ByteBuf frame = (ByteBuf) message;

			try {
				if (shouldFailWrite()) {
					promise.setFailure(new IOException("Simulated write failure."));
				} else {
					final byte[] bytes = new byte[frame.readableBytes()];
					frame.readBytes(bytes);

					recordFrame(bytes);
					promise.setSuccess();
				}
			} finally {
				frame.release();
			}
		}
	}

	@Override
	public synchronized GatewayConnection connect(final GatewayConnectionListener listener)
			throws ClientCertificateException, GatewayConnectionException {

		this.connectionAttempts += 1;

		if (this.failConnections) {
			throw new GatewayConnectionException("Simulated connection failure.",
					new ConnectException("Connection refused"));
		}

		final EmbeddedChannel channel = new EmbeddedChannel(new RecordingHandler());
		this.channels.add(channel);

		return new GatewayConnection(channel, "test-connection-" + this.channels.size(), listener);
	}

	private synchronized boolean shouldFailWrite() {
		if (this.writeFailuresRemaining > 0) {
			this.writeFailuresRemaining -= 1;
			return true;
		}

		return false;
	}

	private synchronized void recordFrame(final byte[] frame) {
		this.writtenFrames.add(frame);
		this.notifyAll();
	}

	public synchronized void failNextWrites(final int count) {
		this.writeFailuresRemaining = count;
	}

	public synchronized void setFailConnections(final boolean failConnections) {
		this.failConnections = failConnections;
	}

	public synchronized int getConnectionAttempts() {
		return this.connectionAttempts;
	}

	public synchronized EmbeddedChannel getChannel(final int index) {
		return this.channels.get(index);
	}

	public synchronized int getChannelCount() {
		return this.channels.size();
	}

	public synchronized List<byte[]> getWrittenFrames() {
		return new ArrayList<byte[]>(this.writtenFrames);
	}

	/**
	 * Waits until at least the given number of frames have been written.
	 */
	public synchronized List<byte[]> waitForFrames(final int count, final long timeoutMillis) throws InterruptedException {
		final long deadline = System.currentTimeMillis() + timeoutMillis;

		while (this.writtenFrames.size() < count) {
			final long remaining = deadline - System.currentTimeMillis();

			if (remaining <= 0) {
				throw new AssertionError(String.format("Expected %d frames, but only %d were written.",
						count, this.writtenFrames.size()));
			}

			this.wait(remaining);
		}

		return new ArrayList<byte[]>(this.writtenFrames);
	}

	/**
	 * Delivers an error frame on the most recently opened connection, as a gateway would.
	 */
	public void reject(final int sequenceNumber, final RejectedNotificationReason reason) {
		final EmbeddedChannel channel;

		synchronized (this) {
			channel = this.channels.get(this.channels.size() - 1);
		}

		channel.writeInbound(RejectedNotificationDecoderTest.createErrorFrame(
				RejectedNotificationDecoder.ERROR_RESPONSE_COMMAND, reason.getErrorCode(), sequenceNumber));
	}

	public static int getSequenceNumber(final byte[] frame) {
		// command (1), frame length (4), item ID (1) and item length (2) precede the sequence number
		return ByteBuffer.wrap(frame, 8, 4).getInt();
	}

	public static String getPayload(final byte[] frame) {
		final ByteBuffer buffer = ByteBuffer.wrap(frame);

		// Skip the command, frame length and sequence number item
		buffer.position(12);

		// Skip the token item
		buffer.get();
		final int tokenLength = buffer.getShort() & 0xffff;
		buffer.position(buffer.position() + tokenLength);

		buffer.get();
		final int payloadLength = buffer.getShort() & 0xffff;

		return new String(frame, buffer.position(), payloadLength, StandardCharsets.UTF_8);
	}
}
