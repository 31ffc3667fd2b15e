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

/**
 * Turns push notifications into wire frames. Encoders are called while a client holds its send lock and must not
 * block.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 *
 * @param <T> the type of push notification this encoder can encode
 *
 * @see BinaryPushNotificationEncoder
 */
public interface PushNotificationEncoder<T extends PushNotification> {

	/**
	 * Writes a complete frame for the given notification and its sequence number to the given buffer.
	 *
	 * @param sendablePushNotification the notification to encode, with the sequence number assigned to it
	 * @param out the buffer to which to write the frame
	 *
	 * @throws NotificationEncodingException if the notification cannot be represented as a frame
	 */
	void encode(SendablePushNotification<? extends T> sendablePushNotification, ByteBuf out)
			throws NotificationEncodingException;
}
