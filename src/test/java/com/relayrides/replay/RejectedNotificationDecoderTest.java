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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;

import org.junit.Test;

public class RejectedNotificationDecoderTest {

	@Test
	public void testDecodeRecognizedFrame() {
		final RejectedNotificationDecoder decoder = new RejectedNotificationDecoder();
		final EmbeddedChannel channel = new EmbeddedChannel(decoder);

		channel.writeInbound(createErrorFrame(8, 8, 12345));

		final RejectedNotification rejectedNotification = channel.readInbound();

		assertEquals(8, rejectedNotification.getCommand());
		assertEquals(12345, rejectedNotification.getSequenceNumber());
		assertEquals(RejectedNotificationReason.INVALID_TOKEN, rejectedNotification.getReason());
		assertEquals(RejectedNotificationDecoder.State.DONE, decoder.getState());

		assertNull(channel.readInbound());
	}

	@Test
	public void testDecodeNegativeSequenceNumber() {
		final EmbeddedChannel channel = new EmbeddedChannel(new RejectedNotificationDecoder());

		channel.writeInbound(createErrorFrame(8, 10, -2));

		final RejectedNotification rejectedNotification = channel.readInbound();

		assertEquals(-2, rejectedNotification.getSequenceNumber());
		assertEquals(RejectedNotificationReason.SHUTDOWN, rejectedNotification.getReason());
	}

	@Test
	public void testDecodeFragmentedFrame() {
		final RejectedNotificationDecoder decoder = new RejectedNotificationDecoder();
		final EmbeddedChannel channel = new EmbeddedChannel(decoder);

		final ByteBuf frame = createErrorFrame(8, 1, 7);

		channel.writeInbound(frame.readRetainedSlice(3));
		assertNull(channel.readInbound());
		assertEquals(RejectedNotificationDecoder.State.WAITING_FOR_FRAME, decoder.getState());

		channel.writeInbound(frame);

		final RejectedNotification rejectedNotification = channel.readInbound();
		assertEquals(7, rejectedNotification.getSequenceNumber());
		assertEquals(RejectedNotificationReason.PROCESSING_ERROR, rejectedNotification.getReason());
	}

	@Test
	public void testDecodeUnexpectedCommand() {
		final RejectedNotificationDecoder decoder = new RejectedNotificationDecoder();
		final EmbeddedChannel channel = new EmbeddedChannel(decoder);

		channel.writeInbound(createErrorFrame(7, 8, 1));

		assertNull(channel.readInbound());
		assertEquals(RejectedNotificationDecoder.State.DONE, decoder.getState());
		assertFalse(channel.isOpen());
	}

	@Test
	public void testDecodeUnknownStatus() {
		final EmbeddedChannel channel = new EmbeddedChannel(new RejectedNotificationDecoder());

		channel.writeInbound(createErrorFrame(8, 9, 1));

		assertNull(channel.readInbound());
		assertFalse(channel.isOpen());
	}

	@Test
	public void testBytesAfterFirstFrameAreIgnored() {
		final EmbeddedChannel channel = new EmbeddedChannel(new RejectedNotificationDecoder());

		final ByteBuf frames = Unpooled.buffer();
		frames.writeBytes(createErrorFrame(8, 8, 1));
		frames.writeBytes(createErrorFrame(8, 8, 2));

		channel.writeInbound(frames);

		final RejectedNotification rejectedNotification = channel.readInbound();
		assertEquals(1, rejectedNotification.getSequenceNumber());

		channel.writeInbound(createErrorFrame(8, 8, 3));
		assertNull(channel.readInbound());

		assertTrue(channel.isOpen());
	}

	static ByteBuf createErrorFrame(final int command, final int status, final int sequenceNumber) {
		final ByteBuf frame = Unpooled.buffer(RejectedNotificationDecoder.FRAME_LENGTH);
		frame.writeByte(command);
		frame.writeByte(status);
		frame.writeInt(sequenceNumber);

		return frame;
	}
}
