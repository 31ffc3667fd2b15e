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

import java.util.Date;

/**
 * <p>A push notification that can be sent to a device through a legacy binary push gateway.</p>
 *
 * <p>Implementations do not carry a sequence number; the {@link PushClient} that sends a notification assigns one at
 * send time. Callers must not modify a notification after handing it to a client.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 *
 * @see com.relayrides.replay.util.SimplePushNotification
 */
public interface PushNotification {

	/**
	 * Returns the token of the device to which this push notification is to be sent.
	 *
	 * @return a string of hexadecimal digits representing the destination device's token
	 */
	String getToken();

	/**
	 * Returns the JSON-encoded payload of this push notification.
	 *
	 * @return the JSON-encoded payload of this push notification
	 */
	String getPayload();

	/**
	 * Returns the time at which the gateway should stop trying to deliver this push notification. If {@code null},
	 * the gateway will not store the notification for later delivery.
	 *
	 * @return the time at which this notification can be discarded, or {@code null}
	 */
	Date getDeliveryInvalidationTime();

	/**
	 * Returns the priority with which this push notification should be delivered. If {@code null}, an immediate
	 * delivery priority is assumed.
	 *
	 * @return the priority with which this push notification should be delivered, or {@code null}
	 */
	DeliveryPriority getPriority();
}
