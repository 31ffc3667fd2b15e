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
 * <p>A failure report read from a gateway's error frame: the sequence number of the first notification the gateway
 * rejected on a connection and the reason for its rejection.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class RejectedNotification {
	private final byte command;
	private final int sequenceNumber;
	private final RejectedNotificationReason rejectionReason;

	/**
	 * Constructs a new rejected notification tuple with the given command, sequence number and rejection reason.
	 *
	 * @param command the command byte of the error frame
	 * @param sequenceNumber the sequence number of the rejected notification
	 * @param rejectionReason the reason reported by the gateway for the rejection
	 */
	public RejectedNotification(final byte command, final int sequenceNumber,
			final RejectedNotificationReason rejectionReason) {

		if (rejectionReason == null) {
			throw new NullPointerException("Rejection reason must not be null.");
		}

		this.command = command;
		this.sequenceNumber = sequenceNumber;
		this.rejectionReason = rejectionReason;
	}

	/**
	 * Returns the command byte of the error frame this report was read from.
	 *
	 * @return the command byte of the error frame this report was read from
	 */
	public byte getCommand() {
		return this.command;
	}

	/**
	 * Returns the sequence number of the notification rejected by the gateway.
	 *
	 * @return the sequence number of the notification rejected by the gateway
	 */
	public int getSequenceNumber() {
		return this.sequenceNumber;
	}

	/**
	 * Returns the reason the notification was rejected by the gateway.
	 *
	 * @return the reason the notification was rejected by the gateway
	 */
	public RejectedNotificationReason getReason() {
		return this.rejectionReason;
	}

	@Override
	public String toString() {
		return String.format("RejectedNotification [sequenceNumber=%d, reason=%s (%s)]",
				this.sequenceNumber, this.rejectionReason, this.rejectionReason.getDescription());
	}
}
