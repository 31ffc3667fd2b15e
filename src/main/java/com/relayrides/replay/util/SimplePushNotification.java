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

import java.util.Date;

import com.relayrides.replay.DeliveryPriority;
import com.relayrides.replay.PushNotification;

/**
 * A simple and immutable implementation of the {@link PushNotification} interface.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class SimplePushNotification implements PushNotification {
	private final String token;
	private final String payload;
	private final Date invalidationTime;
	private final DeliveryPriority priority;

	/**
	 * Constructs a new push notification with the given token and payload. The gateway will not store the
	 * notification for later delivery, and it will be delivered with immediate priority.
	 *
	 * @param token the device token to which this push notification should be delivered
	 * @param payload the JSON payload of this push notification
	 */
	public SimplePushNotification(final String token, final String payload) {
		this(token, payload, null, DeliveryPriority.IMMEDIATE);
	}

	/**
	 * Constructs a new push notification with the given token, payload and delivery invalidation time, to be
	 * delivered with immediate priority.
	 *
	 * @param token the device token to which this push notification should be delivered
	 * @param payload the JSON payload of this push notification
	 * @param invalidationTime the time after which the gateway may discard this notification; may be {@code null}
	 */
	public SimplePushNotification(final String token, final String payload, final Date invalidationTime) {
		this(token, payload, invalidationTime, DeliveryPriority.IMMEDIATE);
	}

	/**
	 * Constructs a new push notification with the given token, payload, delivery invalidation time and delivery
	 * priority.
	 *
	 * @param token the device token to which this push notification should be delivered
	 * @param payload the JSON payload of this push notification
	 * @param invalidationTime the time after which the gateway may discard this notification; may be {@code null}
	 * @param priority the priority with which this notification should be delivered
	 */
	public SimplePushNotification(final String token, final String payload, final Date invalidationTime,
			final DeliveryPriority priority) {

		this.token = token;
		this.payload = payload;
		this.invalidationTime = invalidationTime != null ? new Date(invalidationTime.getTime()) : null;
		this.priority = priority;
	}

	@Override
	public String getToken() {
		return this.token;
	}

	@Override
	public String getPayload() {
		return this.payload;
	}

	@Override
	public Date getDeliveryInvalidationTime() {
		return this.invalidationTime != null ? new Date(this.invalidationTime.getTime()) : null;
	}

	@Override
	public DeliveryPriority getPriority() {
		return this.priority;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((invalidationTime == null) ? 0 : invalidationTime.hashCode());
		result = prime * result + ((payload == null) ? 0 : payload.hashCode());
		result = prime * result + ((priority == null) ? 0 : priority.hashCode());
		result = prime * result + ((token == null) ? 0 : token.hashCode());
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final SimplePushNotification other = (SimplePushNotification) obj;
		if (invalidationTime == null) {
			if (other.invalidationTime != null)
				return false;
		} else if (!invalidationTime.equals(other.invalidationTime))
			return false;
		if (payload == null) {
			if (other.payload != null)
				return false;
		} else if (!payload.equals(other.payload))
			return false;
		if (priority != other.priority)
			return false;
		if (token == null) {
			if (other.token != null)
				return false;
		} else if (!token.equals(other.token))
			return false;
		return true;
	}

	@Override
	public String toString() {
		return "SimplePushNotification [token=" + token + ", payload=" + payload
				+ ", invalidationTime=" + invalidationTime + ", priority=" + priority + "]";
	}
}
