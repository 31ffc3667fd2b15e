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
 * An enumeration of status codes a push gateway may report to explain why it rejected a notification. Every reason,
 * {@code SHUTDOWN} included, is handled the same way by {@link PushClient}: the rejected notification is reported as a
 * delivery failure and everything sent after it is resent.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public enum RejectedNotificationReason {
	NO_ERROR((byte) 0, "No errors encountered"),
	PROCESSING_ERROR((byte) 1, "Processing error"),
	MISSING_TOKEN((byte) 2, "Missing device token"),
	MISSING_TOPIC((byte) 3, "Missing topic"),
	MISSING_PAYLOAD((byte) 4, "Missing payload"),
	INVALID_TOKEN_SIZE((byte) 5, "Invalid token size"),
	INVALID_TOPIC_SIZE((byte) 6, "Invalid topic size"),
	INVALID_PAYLOAD_SIZE((byte) 7, "Invalid payload size"),
	INVALID_TOKEN((byte) 8, "Invalid token"),

	/**
	 * Indicates that the gateway closed the connection, for example to perform maintenance. The sequence number in the
	 * error frame identifies the last notification the gateway processed; anything sent after it was discarded.
	 */
	SHUTDOWN((byte) 10, "Shutdown"),

	UNKNOWN((byte) 255, "None (unknown)");

	private final byte errorCode;
	private final String description;

	private RejectedNotificationReason(final byte errorCode, final String description) {
		this.errorCode = errorCode;
		this.description = description;
	}

	/**
	 * Returns the one-byte error code associated with this rejection reason.
	 *
	 * @return the one-byte error code associated with this rejection reason
	 */
	public byte getErrorCode() {
		return this.errorCode;
	}

	/**
	 * Returns a short human-readable description of this rejection reason.
	 *
	 * @return a short human-readable description of this rejection reason
	 */
	public String getDescription() {
		return this.description;
	}

	/**
	 * Gets the rejection reason associated with the given error code.
	 *
	 * @param errorCode the error code for which to retrieve a rejection reason
	 *
	 * @return the rejection reason associated with {@code errorCode}, or {@code null} if the code is not recognized
	 */
	public static RejectedNotificationReason getByErrorCode(final byte errorCode) {
		for (final RejectedNotificationReason reason : RejectedNotificationReason.values()) {
			if (reason.errorCode == errorCode) {
				return reason;
			}
		}

		return null;
	}
}
