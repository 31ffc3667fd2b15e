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

import java.nio.charset.StandardCharsets;
import java.util.Date;

import com.relayrides.replay.util.MalformedTokenStringException;
import com.relayrides.replay.util.TokenUtil;

/**
 * <p>Encodes notifications as &quot;command 2&quot; binary frames. A frame starts with the command byte and a
 * four-byte frame length, followed by five items, each made of a one-byte item ID, a two-byte length and the item's
 * data:</p>
 *
 * <ol>
 *  <li>sequence number (ID 3, four bytes)</li>
 *  <li>device token (ID 1)</li>
 *  <li>payload (ID 2, UTF-8, at most {@value #MAX_PAYLOAD_SIZE} bytes)</li>
 *  <li>delivery invalidation time (ID 4, four bytes, seconds since the epoch, or zero for none)</li>
 *  <li>priority (ID 5, one byte)</li>
 * </ol>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class BinaryPushNotificationEncoder implements PushNotificationEncoder<PushNotification> {

	public static final int MAX_PAYLOAD_SIZE = 2048;

	static final byte BINARY_PUSH_NOTIFICATION_COMMAND = 2;

	static final byte DEVICE_TOKEN_ITEM_ID = 1;
	static final byte PAYLOAD_ITEM_ID = 2;
	static final byte SEQUENCE_NUMBER_ITEM_ID = 3;
	static final byte DELIVERY_INVALIDATION_TIME_ITEM_ID = 4;
	static final byte PRIORITY_ITEM_ID = 5;

	private static final int ITEM_COUNT = 5;
	private static final int INVALIDATE_IMMEDIATELY = 0;

	private static final int FRAME_ITEM_ID_SIZE = 1;
	private static final int FRAME_ITEM_LENGTH_SIZE = 2;

	private static final short SEQUENCE_NUMBER_SIZE = 4;
	private static final short DELIVERY_INVALIDATION_TIME_SIZE = 4;
	private static final short PRIORITY_SIZE = 1;

	@Override
	public void encode(final SendablePushNotification<? extends PushNotification> sendablePushNotification,
			final ByteBuf out) throws NotificationEncodingException {

		final PushNotification pushNotification = sendablePushNotification.getPushNotification();

		final byte[] tokenBytes = this.getTokenBytes(pushNotification.getToken());
		final byte[] payloadBytes = this.getPayloadBytes(pushNotification.getPayload());

		out.writeByte(BINARY_PUSH_NOTIFICATION_COMMAND);
		out.writeInt(getFrameLength(tokenBytes, payloadBytes));

		out.writeByte(SEQUENCE_NUMBER_ITEM_ID);
		out.writeShort(SEQUENCE_NUMBER_SIZE);
		out.writeInt(sendablePushNotification.getSequenceNumber());

		out.writeByte(DEVICE_TOKEN_ITEM_ID);
		out.writeShort(tokenBytes.length);
		out.writeBytes(tokenBytes);

		out.writeByte(PAYLOAD_ITEM_ID);
		out.writeShort(payloadBytes.length);
		out.writeBytes(payloadBytes);

		out.writeByte(DELIVERY_INVALIDATION_TIME_ITEM_ID);
		out.writeShort(DELIVERY_INVALIDATION_TIME_SIZE);

		final int deliveryInvalidationTime;

		if (pushNotification.getDeliveryInvalidationTime() != null) {
			deliveryInvalidationTime = getTimestampInSeconds(pushNotification.getDeliveryInvalidationTime());
		} else {
			deliveryInvalidationTime = INVALIDATE_IMMEDIATELY;
		}

		out.writeInt(deliveryInvalidationTime);

		final DeliveryPriority priority = pushNotification.getPriority() != null ?
				pushNotification.getPriority() : DeliveryPriority.IMMEDIATE;

		out.writeByte(PRIORITY_ITEM_ID);
		out.writeShort(PRIORITY_SIZE);
		out.writeByte(priority.getCode());
	}

	private byte[] getTokenBytes(final String token) throws NotificationEncodingException {
		if (token == null || token.isEmpty()) {
			throw new NotificationEncodingException("Device token must not be empty.");
		}

		try {
			return TokenUtil.tokenStringToByteArray(token);
		} catch (MalformedTokenStringException e) {
			throw new NotificationEncodingException(String.format("Malformed device token: %s", token), e);
		}
	}

	private byte[] getPayloadBytes(final String payload) throws NotificationEncodingException {
		if (payload == null) {
			throw new NotificationEncodingException("Payload must not be null.");
		}

		final byte[] payloadBytes = payload.getBytes(StandardCharsets.UTF_8);

		if (payloadBytes.length > MAX_PAYLOAD_SIZE) {
			throw new NotificationEncodingException(String.format(
					"Payload is %d bytes long, but must not be longer than %d bytes.",
					payloadBytes.length, MAX_PAYLOAD_SIZE));
		}

		return payloadBytes;
	}

	private static int getTimestampInSeconds(final Date date) {
		return (int) (date.getTime() / 1000);
	}

	private static int getFrameLength(final byte[] tokenBytes, final byte[] payloadBytes) {
		return ITEM_COUNT * (FRAME_ITEM_ID_SIZE + FRAME_ITEM_LENGTH_SIZE) +
				tokenBytes.length +
				payloadBytes.length +
				SEQUENCE_NUMBER_SIZE +
				DELIVERY_INVALIDATION_TIME_SIZE +
				PRIORITY_SIZE;
	}
}
