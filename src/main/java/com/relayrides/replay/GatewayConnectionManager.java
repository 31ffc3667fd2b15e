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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Holds at most one live connection to the gateway. Connections are opened lazily, reused for as long as they stay
 * open, and replaced on demand.</p>
 *
 * <p>Connection managers are not thread-safe; callers must guard every call with a common lock. {@link PushClient}
 * uses its own monitor.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
class GatewayConnectionManager {

	private final GatewayConnectionFactory connectionFactory;
	private final GatewayConnectionListener listener;

	private GatewayConnection connection;

	private static final Logger log = LoggerFactory.getLogger(GatewayConnectionManager.class);

	public GatewayConnectionManager(final GatewayConnectionFactory connectionFactory,
			final GatewayConnectionListener listener) {

		if (connectionFactory == null) {
			throw new NullPointerException("Connection factory must not be null.");
		}

		if (listener == null) {
			throw new NullPointerException("Listener must not be null.");
		}

		this.connectionFactory = connectionFactory;
		this.listener = listener;
	}

	/**
	 * Returns the current connection, opening a new one if there is none or if the current one is no longer active.
	 * Nothing is cached if opening a connection fails.
	 *
	 * @return an active connection to the gateway
	 *
	 * @throws ClientCertificateException if the client's certificate or private key could not be loaded
	 * @throws GatewayConnectionException if the connection or the TLS handshake failed
	 * @throws InterruptedException if interrupted while waiting for a new connection
	 */
	public GatewayConnection ensureConnected()
			throws ClientCertificateException, GatewayConnectionException, InterruptedException {

		if (this.connection != null && !this.connection.isActive()) {
			log.debug("Discarding inactive connection {}.", this.connection.getName());
			this.discard();
		}

		if (this.connection == null) {
			this.connection = this.connectionFactory.connect(this.listener);
			log.debug("Opened new connection {}.", this.connection.getName());
		}

		return this.connection;
	}

	/**
	 * Forgets the given connection if, and only if, it is the current connection.
	 *
	 * @param staleConnection the connection that should no longer be used
	 *
	 * @return {@code true} if the given connection was the current connection or {@code false} otherwise
	 */
	public boolean invalidate(final GatewayConnection staleConnection) {
		if (staleConnection != null && this.connection == staleConnection) {
			this.connection = null;
			return true;
		}

		return false;
	}

	/**
	 * Closes and forgets the current connection, if any.
	 */
	public void discard() {
		if (this.connection != null) {
			final GatewayConnection discardedConnection = this.connection;
			this.connection = null;

			discardedConnection.close();
		}
	}

	public GatewayConnection getConnection() {
		return this.connection;
	}
}
