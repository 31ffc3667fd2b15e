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
 * <p>The address of a legacy binary push gateway. Apple operated two such gateways, one for production and one
 * &quot;sandbox&quot; gateway for development builds; custom gateways may be created for testing.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class PushGateway {
	private final String host;
	private final int port;

	/**
	 * Constructs a new gateway address with the given host name and port.
	 *
	 * @param host the host name of the gateway
	 * @param port the TCP port of the gateway
	 */
	public PushGateway(final String host, final int port) {
		if (host == null) {
			throw new NullPointerException("Host must not be null.");
		}

		if (host.isEmpty()) {
			throw new IllegalArgumentException("Host must not be empty.");
		}

		if (port <= 0 || port > 65535) {
			throw new IllegalArgumentException(String.format("Invalid port: %d", port));
		}

		this.host = host;
		this.port = port;
	}

	/**
	 * Parses a gateway address of the form {@code host:port}. The host is also the name against which the gateway's
	 * certificate is verified.
	 *
	 * @param address the address to parse
	 *
	 * @return a gateway with the host and port named in the given address
	 *
	 * @throws IllegalArgumentException if the address does not have the form {@code host:port}
	 */
	public static PushGateway fromAddress(final String address) {
		if (address == null) {
			throw new NullPointerException("Address must not be null.");
		}

		final int separatorIndex = address.lastIndexOf(':');

		if (separatorIndex <= 0 || separatorIndex == address.length() - 1) {
			throw new IllegalArgumentException(String.format("Address \"%s\" is not of the form host:port.", address));
		}

		final int port;

		try {
			port = Integer.parseInt(address.substring(separatorIndex + 1));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(String.format("Address \"%s\" has a malformed port.", address), e);
		}

		return new PushGateway(address.substring(0, separatorIndex), port);
	}

	/**
	 * Returns the host name of this gateway.
	 *
	 * @return the host name of this gateway
	 */
	public String getHost() {
		return this.host;
	}

	/**
	 * Returns the TCP port of this gateway.
	 *
	 * @return the TCP port of this gateway
	 */
	public int getPort() {
		return this.port;
	}

	/**
	 * Returns the address of Apple's production gateway.
	 *
	 * @return the address of Apple's production gateway
	 */
	public static PushGateway getProductionGateway() {
		return new PushGateway("gateway.push.apple.com", 2195);
	}

	/**
	 * Returns the address of Apple's sandbox gateway.
	 *
	 * @return the address of Apple's sandbox gateway
	 */
	public static PushGateway getSandboxGateway() {
		return new PushGateway("gateway.sandbox.push.apple.com", 2195);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + host.hashCode();
		result = prime * result + port;
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		final PushGateway other = (PushGateway) obj;
		if (!host.equals(other.host))
			return false;
		if (port != other.port)
			return false;
		return true;
	}

	@Override
	public String toString() {
		return this.host + ":" + this.port;
	}
}
