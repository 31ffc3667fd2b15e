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

package com.relayrides.replay.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;

import java.util.Date;

import org.junit.Test;

import com.relayrides.replay.DeliveryPriority;

public class SimplePushNotificationTest {

	private static final String TOKEN = "1234abcd";
	private static final String PAYLOAD = "{\"aps\":{\"alert\":\"Hello\"}}";

	@Test
	public void testDefaults() {
		final SimplePushNotification notification = new SimplePushNotification(TOKEN, PAYLOAD);

		assertEquals(TOKEN, notification.getToken());
		assertEquals(PAYLOAD, notification.getPayload());
		assertNull(notification.getDeliveryInvalidationTime());
		assertEquals(DeliveryPriority.IMMEDIATE, notification.getPriority());
	}

	@Test
	public void testInvalidationTimeIsCopied() {
		final Date invalidationTime = new Date(1000000);
		final SimplePushNotification notification = new SimplePushNotification(TOKEN, PAYLOAD, invalidationTime);

		invalidationTime.setTime(2000000);
		assertEquals(new Date(1000000), notification.getDeliveryInvalidationTime());

		notification.getDeliveryInvalidationTime().setTime(3000000);
		assertEquals(new Date(1000000), notification.getDeliveryInvalidationTime());
	}

	@Test
	public void testEqualsAndHashCode() {
		final SimplePushNotification notification =
				new SimplePushNotification(TOKEN, PAYLOAD, new Date(1000), DeliveryPriority.CONSERVE_POWER);

		final SimplePushNotification equalNotification =
				new SimplePushNotification(TOKEN, PAYLOAD, new Date(1000), DeliveryPriority.CONSERVE_POWER);

		assertEquals(notification, equalNotification);
		assertEquals(notification.hashCode(), equalNotification.hashCode());

		assertNotEquals(notification, new SimplePushNotification(TOKEN, PAYLOAD, new Date(1000)));
	}
}
