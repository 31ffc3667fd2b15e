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
 * Opens new connections to a push gateway on behalf of a {@link GatewayConnectionManager}.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
interface GatewayConnectionFactory {

	/**
	 * Opens a new connection to the gateway, blocking until the connection is established and secured.
	 *
	 * @param listener the listener to be notified of rejections reported on, and closure of, the new connection
	 *
	 * @return a new, active connection to the gateway
	 *
	 * @throws ClientCertificateException if the client's certificate or private key could not be loaded
	 * @throws GatewayConnectionException if the connection or the TLS handshake failed or timed out
	 * @throws InterruptedException if interrupted while waiting for the connection to be established
	 */
	GatewayConnection connect(GatewayConnectionListener listener)
			throws ClientCertificateException, GatewayConnectionException, InterruptedException;
}
