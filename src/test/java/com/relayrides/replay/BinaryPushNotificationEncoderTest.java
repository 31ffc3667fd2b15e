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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Date;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.relayrides.replay.util.SimplePushNotification;

public class BinaryPushNotificationEncoderTest {

	private BinaryPushNotificationEncoder encoder;
	private ByteBuf out;

	@Before
	public void setUp() {
		this.encoder = new BinaryPushNotificationEncoder();
		this.out = Unpooled.buffer();
	}

	@After
	public void tearDown() {
		this.out.release();
	}

	@Test
	public void testEncode() throws Exception {
		final String payload = "{\"aps\":{\"alert\":\"Héllo\"}}";
		final byte[] payloadBytes = payload.getBytes(StandardCharsets.UTF_8);

		final SimplePushNotification notification = new SimplePushNotification("<0a0b0c0d>", payload,
				new Date(1400000000000L), DeliveryPriority.CONSERVE_POWER);

		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(notification, 1234), this.out);

		assertEquals(2, this.out.readByte());
		assertEquals(15 + 4 + payloadBytes.length + 4 + 4 + 1, this.out.readInt());

		assertEquals(3, this.out.readByte());
		assertEquals(4, this.out.readShort());
		assertEquals(1234, this.out.readInt());

		assertEquals(1, this.out.readByte());
		assertEquals(4, this.out.readShort());

		final byte[] tokenBytes = new byte[4];
		this.out.readBytes(tokenBytes);
		assertArrayEquals(new byte[] { 0x0a, 0x0b, 0x0c, 0x0d }, tokenBytes);

		assertEquals(2, this.out.readByte());
		assertEquals(payloadBytes.length, this.out.readShort());

		final byte[] encodedPayload = new byte[payloadBytes.length];
		this.out.readBytes(encodedPayload);
		assertArrayEquals(payloadBytes, encodedPayload);

		assertEquals(4, this.out.readByte());
		assertEquals(4, this.out.readShort());
		assertEquals(1400000000, this.out.readInt());

		assertEquals(5, this.out.readByte());
		assertEquals(1, this.out.readShort());
		assertEquals(5, this.out.readByte());

		assertEquals(0, this.out.readableBytes());
	}

	@Test
	public void testEncodeDefaults() throws Exception {
		final SimplePushNotification notification = new SimplePushNotification("ff", "{}", null, null);

		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(notification, 0), this.out);

		// Invalidation time (1 + 2 + 4 bytes) and priority (1 + 2 + 1 bytes) items come last
		this.out.skipBytes(this.out.readableBytes() - 11);

		assertEquals(4, this.out.readByte());
		assertEquals(4, this.out.readShort());
		assertEquals(0, this.out.readInt());

		assertEquals(5, this.out.readByte());
		assertEquals(1, this.out.readShort());
		assertEquals(DeliveryPriority.IMMEDIATE.getCode(), this.out.readByte());
	}

	@Test
	public void testEncodeMaximumPayload() throws Exception {
		final char[] payload = new char[BinaryPushNotificationEncoder.MAX_PAYLOAD_SIZE];
		Arrays.fill(payload, 'a');

		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(
				new SimplePushNotification("ff", new String(payload)), 0), this.out);

		assertEquals(5 + 15 + 1 + BinaryPushNotificationEncoder.MAX_PAYLOAD_SIZE + 9, this.out.readableBytes());
	}

	@Test(expected = NotificationEncodingException.class)
	public void testEncodeOversizedPayload() throws Exception {
		// Each of these characters is two bytes long in UTF-8
		final char[] payload = new char[BinaryPushNotificationEncoder.MAX_PAYLOAD_SIZE / 2 + 1];
		Arrays.fill(payload, 'é');

		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(
				new SimplePushNotification("ff", new String(payload)), 0), this.out);
	}

	@Test(expected = NotificationEncodingException.class)
	public void testEncodeEmptyToken() throws Exception {
		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(
				new SimplePushNotification("", "{}"), 0), this.out);
	}

	@Test(expected = NotificationEncodingException.class)
	public void testEncodeNullToken() throws Exception {
		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(
				new SimplePushNotification(null, "{}"), 0), this.out);
	}

	@Test(expected = NotificationEncodingException.class)
	public void testEncodeMalformedToken() throws Exception {
		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(
				new SimplePushNotification("abc", "{}"), 0), this.out);
	}

	@Test(expected = NotificationEncodingException.class)
	public void testEncodeNullPayload() throws Exception {
		this.encoder.encode(new SendablePushNotification<SimplePushNotification>(
				new SimplePushNotification("ff", null), 0), this.out);
	}
}
