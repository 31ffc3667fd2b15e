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
 * <p>Receives the two events a {@link GatewayConnection} can report: the gateway rejected a notification, or the
 * connection closed.</p>
 *
 * <p>Both methods are called from a Netty event loop thread and must not block.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public interface GatewayConnectionListener {

	/**
	 * Indicates that the gateway reported a rejected notification on the given connection. The connection is closed
	 * immediately afterward.
	 *
	 * @param connection the connection on which the error frame arrived
	 * @param rejectedNotification the failure report read from the error frame
	 */
	void handleRejectedNotification(GatewayConnection connection, RejectedNotification rejectedNotification);

	/**
	 * Indicates that the given connection was closed, either by the gateway, because of a read failure, or locally.
	 *
	 * @param connection the connection that closed
	 */
	void handleConnectionClosure(GatewayConnection connection);
}
