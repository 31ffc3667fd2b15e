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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * <p>A bounded, insertion-ordered record of notifications that have been written to a gateway connection but whose
 * fate is still unknown. The gateway never acknowledges a successful delivery; it only reports the first notification
 * it rejected on a connection, and everything written after that notification must be presumed lost. This queue is
 * what lets a client reconstruct "everything after" a rejected notification.</p>
 *
 * <p>When the queue is full, appending a notification silently evicts the oldest entry.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 *
 * @param <T> the type of push notification held in the queue
 */
class ReplayQueue<T extends PushNotification> {

	private final int capacity;
	private final ArrayDeque<SendablePushNotification<T>> sentNotifications;

	/**
	 * Constructs a new replay queue with the given maximum capacity.
	 *
	 * @param capacity the capacity of the queue
	 */
	public ReplayQueue(final int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("Capacity must be positive.");
		}

		this.capacity = capacity;
		this.sentNotifications = new ArrayDeque<SendablePushNotification<T>>();
	}

	public int getCapacity() {
		return this.capacity;
	}

	/**
	 * Records a notification that has just been written to the gateway, evicting the oldest entry if the queue is at
	 * capacity.
	 *
	 * @param notification the notification to record
	 */
	public synchronized void append(final SendablePushNotification<T> notification) {
		this.sentNotifications.addLast(notification);

		while (this.sentNotifications.size() > this.capacity) {
			this.sentNotifications.removeFirst();
		}
	}

	/**
	 * <p>Removes and returns the notification with the given sequence number and every notification appended after
	 * it, in their original order. The matching notification is always the first element of the returned list.</p>
	 *
	 * <p>If a match is found, the whole queue is cleared; notifications appended before the match are treated as
	 * delivered. If no match is found, the queue is left untouched.</p>
	 *
	 * @param sequenceNumber the sequence number of the rejected notification
	 *
	 * @return the matching notification followed by everything sent after it, or {@code null} if no notification in
	 * the queue has the given sequence number
	 */
	public synchronized List<SendablePushNotification<T>> drainFrom(final int sequenceNumber) {
		final List<SendablePushNotification<T>> tail = new ArrayList<SendablePushNotification<T>>();

		for (final SendablePushNotification<T> sentNotification : this.sentNotifications) {
			if (tail.isEmpty() && sentNotification.getSequenceNumber() != sequenceNumber) {
				continue;
			}

			tail.add(sentNotification);
		}

		if (tail.isEmpty()) {
			return null;
		}

		this.sentNotifications.clear();

		return tail;
	}

	public synchronized void clear() {
		this.sentNotifications.clear();
	}

	public synchronized int size() {
		return this.sentNotifications.size();
	}

	public synchronized boolean isEmpty() {
		return this.sentNotifications.isEmpty();
	}

	/**
	 * Returns the sequence number of the oldest notification in the queue.
	 *
	 * @return the sequence number of the oldest notification in the queue, or {@code null} if the queue is empty
	 */
	public synchronized Integer getLowestSequenceNumber() {
		return this.sentNotifications.isEmpty() ? null : this.sentNotifications.getFirst().getSequenceNumber();
	}

	/**
	 * Returns the sequence number of the newest notification in the queue.
	 *
	 * @return the sequence number of the newest notification in the queue, or {@code null} if the queue is empty
	 */
	public synchronized Integer getHighestSequenceNumber() {
		return this.sentNotifications.isEmpty() ? null : this.sentNotifications.getLast().getSequenceNumber();
	}
}
