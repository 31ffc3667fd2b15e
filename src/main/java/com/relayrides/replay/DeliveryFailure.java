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

/**
 * <p>Describes a notification that was not delivered. A delivery failure has one of two origins:</p>
 *
 * <ul>
 *  <li>the gateway rejected the notification, in which case {@link #getRejection()} describes the rejection and
 *  {@link #getCause()} is {@code null}, or</li>
 *  <li>the client could not connect to the gateway or write the notification, in which case {@link #getRejection()}
 *  is {@code null} and {@link #getCause()} is the local error.</li>
 * </ul>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 *
 * @param <T> the type of push notification
 */
public class DeliveryFailure<T extends PushNotification> {
	private final T pushNotification;
	private final RejectedNotification rejection;
	private final Throwable cause;

	public DeliveryFailure(final T pushNotification, final RejectedNotification rejection, final Throwable cause) {
		if (pushNotification == null) {
			throw new NullPointerException("Push notification must not be null.");
		}

		this.pushNotification = pushNotification;
		this.rejection = rejection;
		this.cause = cause;
	}

	/**
	 * Returns the notification that was not delivered.
	 *
	 * @return the notification that was not delivered
	 */
	public T getPushNotification() {
		return this.pushNotification;
	}

	/**
	 * Returns the gateway's report of the rejection, if the gateway rejected the notification.
	 *
	 * @return the gateway's rejection report, or {@code null} if the failure happened locally
	 */
	public RejectedNotification getRejection() {
		return this.rejection;
	}

	/**
	 * Returns the local error that prevented delivery, if any.
	 *
	 * @return the local error that prevented delivery, or {@code null} if the gateway rejected the notification
	 */
	public Throwable getCause() {
		return this.cause;
	}

	@Override
	public String toString() {
		return "DeliveryFailure [pushNotification=" + this.pushNotification + ", rejection=" + this.rejection
				+ ", cause=" + this.cause + "]";
	}
}
