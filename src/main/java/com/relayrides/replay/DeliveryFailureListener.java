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
 * <p>Interface for objects that wish to be notified when a notification could not be delivered. Listeners are
 * registered when a {@link PushClient} is constructed.</p>
 *
 * <p>Listeners are called from the client's listener executor, never while the client holds its send lock, so they
 * may send notifications of their own.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 *
 * @param <T> the type of push notification handled by the listener
 */
public interface DeliveryFailureListener<T extends PushNotification> {

	/**
	 * Handles a notification that could not be delivered.
	 *
	 * @param client the client that sent the notification
	 * @param failure a description of the notification and of why it was not delivered
	 */
	void handleDeliveryFailure(PushClient<? extends T> client, DeliveryFailure<? extends T> failure);
}
