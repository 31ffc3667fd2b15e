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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.relayrides.replay.util.SimplePushNotification;

public class ReplayQueueTest {

	private SimplePushNotification testNotification;

	@Before
	public void setUp() {
		this.testNotification = new SimplePushNotification("12345678", "This is an invalid payload, but that's okay.");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testReplayQueueBadCapacity() {
		new ReplayQueue<SimplePushNotification>(0);
	}

	@Test
	public void testAppend() {
		final int capacity = 8;

		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(capacity);

		assertTrue(queue.isEmpty());
		assertNull(queue.getLowestSequenceNumber());
		assertNull(queue.getHighestSequenceNumber());

		for (final SendablePushNotification<SimplePushNotification> notification : this.generateSequentialNotifications(2 * capacity, 0)) {
			queue.append(notification);
		}

		assertEquals(capacity, queue.size());

		// The oldest entries are evicted first
		assertEquals(Integer.valueOf(capacity), queue.getLowestSequenceNumber());
		assertEquals(Integer.valueOf(2 * capacity - 1), queue.getHighestSequenceNumber());
	}

	@Test
	public void testAppendBelowCapacity() {
		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(10);

		for (final SendablePushNotification<SimplePushNotification> notification : this.generateSequentialNotifications(3, 0)) {
			queue.append(notification);
		}

		assertEquals(3, queue.size());
		assertEquals(10, queue.getCapacity());
	}

	@Test
	public void testDrainFrom() {
		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(10);
		final List<SendablePushNotification<SimplePushNotification>> notifications = this.generateSequentialNotifications(5, 0);

		for (final SendablePushNotification<SimplePushNotification> notification : notifications) {
			queue.append(notification);
		}

		final List<SendablePushNotification<SimplePushNotification>> tail = queue.drainFrom(2);

		assertEquals(3, tail.size());
		assertSame(notifications.get(2), tail.get(0));
		assertSame(notifications.get(3), tail.get(1));
		assertSame(notifications.get(4), tail.get(2));

		// Notifications before the match are treated as delivered, too
		assertTrue(queue.isEmpty());
		assertNull(queue.drainFrom(2));
	}

	@Test
	public void testDrainFromLastEntry() {
		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(10);

		for (final SendablePushNotification<SimplePushNotification> notification : this.generateSequentialNotifications(5, 0)) {
			queue.append(notification);
		}

		final List<SendablePushNotification<SimplePushNotification>> tail = queue.drainFrom(4);

		assertEquals(1, tail.size());
		assertEquals(4, tail.get(0).getSequenceNumber());
		assertTrue(queue.isEmpty());
	}

	@Test
	public void testDrainFromMissingSequenceNumber() {
		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(2);

		for (final SendablePushNotification<SimplePushNotification> notification : this.generateSequentialNotifications(3, 0)) {
			queue.append(notification);
		}

		assertNull(queue.drainFrom(0));

		assertEquals(2, queue.size());
		assertEquals(Integer.valueOf(1), queue.getLowestSequenceNumber());
		assertEquals(Integer.valueOf(2), queue.getHighestSequenceNumber());
	}

	@Test
	public void testDrainFromEmptyQueue() {
		assertNull(new ReplayQueue<SimplePushNotification>(4).drainFrom(0));
	}

	@Test
	public void testDrainFromAcrossWraparound() {
		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(10);

		for (final SendablePushNotification<SimplePushNotification> notification : this.generateSequentialNotifications(6, Integer.MAX_VALUE - 3)) {
			queue.append(notification);
		}

		final List<SendablePushNotification<SimplePushNotification>> tail = queue.drainFrom(Integer.MAX_VALUE - 1);

		assertEquals(4, tail.size());
		assertEquals(Integer.MAX_VALUE - 1, tail.get(0).getSequenceNumber());
		assertEquals(Integer.MAX_VALUE, tail.get(1).getSequenceNumber());
		assertEquals(Integer.MIN_VALUE, tail.get(2).getSequenceNumber());
	}

	@Test
	public void testClear() {
		final ReplayQueue<SimplePushNotification> queue = new ReplayQueue<SimplePushNotification>(10);

		for (final SendablePushNotification<SimplePushNotification> notification : this.generateSequentialNotifications(5, 0)) {
			queue.append(notification);
		}

		queue.clear();

		assertTrue(queue.isEmpty());
		assertEquals(0, queue.size());
	}

	private List<SendablePushNotification<SimplePushNotification>> generateSequentialNotifications(final int count, final int startingSequenceNumber) {
		final ArrayList<SendablePushNotification<SimplePushNotification>> sendableNotifications =
				new ArrayList<SendablePushNotification<SimplePushNotification>>(count);

		for (int i = 0; i < count; i++) {
			final int sequenceNumber = startingSequenceNumber + i;

			sendableNotifications.add(
					new SendablePushNotification<SimplePushNotification>(this.testNotification, sequenceNumber));
		}

		return sendableNotifications;
	}
}
