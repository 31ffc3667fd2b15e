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
 * An enumeration of delivery priorities that may be requested for a push notification.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public enum DeliveryPriority {

	/**
	 * Indicates that the notification should be delivered immediately. Notifications sent with this priority must
	 * trigger an alert, sound, or badge on the receiving device.
	 */
	IMMEDIATE((byte) 10),

	/**
	 * Indicates that the notification should be delivered at a time that conserves power on the receiving device.
	 */
	CONSERVE_POWER((byte) 5);

	private final byte code;

	private DeliveryPriority(final byte code) {
		this.code = code;
	}

	/**
	 * Returns the one-byte code that identifies this priority on the wire.
	 *
	 * @return the one-byte code that identifies this priority on the wire
	 */
	public byte getCode() {
		return this.code;
	}

	/**
	 * Returns the delivery priority identified by the given code.
	 *
	 * @param code the code for which to find a delivery priority
	 *
	 * @return the delivery priority identified by {@code code}
	 *
	 * @throws IllegalArgumentException if no delivery priority has the given code
	 */
	public static DeliveryPriority getFromCode(final byte code) {
		for (final DeliveryPriority priority : DeliveryPriority.values()) {
			if (priority.code == code) {
				return priority;
			}
		}

		throw new IllegalArgumentException(String.format("No delivery priority found with code %d", code));
	}
}
