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

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A set of user-configurable options that affect the behavior of a {@link PushClient}. Clients copy their
 * configuration when constructed, so later changes to a configuration object do not affect existing clients.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class PushClientConfiguration {

	public static final int DEFAULT_REPLAY_QUEUE_CAPACITY = 10000;
	public static final int DEFAULT_SEQUENCE_NUMBER_LIMIT = Integer.MAX_VALUE;
	public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 60000;
	public static final long DEFAULT_WRITE_TIMEOUT_MILLIS = 60000;
	public static final int DEFAULT_FAILURE_QUEUE_CAPACITY = 10;
	public static final int DEFAULT_RESEND_THREAD_COUNT = 2;

	private int replayQueueCapacity = DEFAULT_REPLAY_QUEUE_CAPACITY;
	private int sequenceNumberLimit = DEFAULT_SEQUENCE_NUMBER_LIMIT;
	private long connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
	private long writeTimeoutMillis = DEFAULT_WRITE_TIMEOUT_MILLIS;
	private int failureQueueCapacity = DEFAULT_FAILURE_QUEUE_CAPACITY;
	private int resendThreadCount = DEFAULT_RESEND_THREAD_COUNT;
	private List<String> tlsProtocols = new ArrayList<String>(Arrays.asList("TLSv1.3", "TLSv1.2"));
	private File trustedCertificatesFile = null;

	/**
	 * Creates a new client configuration object with all options set to their default values.
	 */
	public PushClientConfiguration() {}

	/**
	 * Creates a new client configuration object with all options set to the values in the given client configuration
	 * object.
	 *
	 * @param configuration the configuration object to copy
	 */
	public PushClientConfiguration(final PushClientConfiguration configuration) {
		this.replayQueueCapacity = configuration.replayQueueCapacity;
		this.sequenceNumberLimit = configuration.sequenceNumberLimit;
		this.connectTimeoutMillis = configuration.connectTimeoutMillis;
		this.writeTimeoutMillis = configuration.writeTimeoutMillis;
		this.failureQueueCapacity = configuration.failureQueueCapacity;
		this.resendThreadCount = configuration.resendThreadCount;
		this.tlsProtocols = new ArrayList<String>(configuration.tlsProtocols);
		this.trustedCertificatesFile = configuration.trustedCertificatesFile;
	}

	/**
	 * Returns the maximum number of sent notifications a client remembers for replay.
	 *
	 * @return the maximum number of sent notifications a client remembers for replay
	 */
	public int getReplayQueueCapacity() {
		return this.replayQueueCapacity;
	}

	/**
	 * Sets the maximum number of sent notifications a client remembers for replay. The default capacity is
	 * {@value #DEFAULT_REPLAY_QUEUE_CAPACITY} notifications. If the gateway rejects a notification that has already
	 * been evicted from the queue, the rejection cannot be attributed and nothing is resent, so the capacity should
	 * comfortably exceed the number of notifications in flight at any time. The capacity must be less than the
	 * sequence number limit.
	 *
	 * @param replayQueueCapacity the replay queue capacity for clients created with this configuration
	 */
	public void setReplayQueueCapacity(final int replayQueueCapacity) {
		this.replayQueueCapacity = replayQueueCapacity;
	}

	/**
	 * Returns the exclusive upper bound of the sequence numbers a client assigns.
	 *
	 * @return the exclusive upper bound of the sequence numbers a client assigns
	 */
	public int getSequenceNumberLimit() {
		return this.sequenceNumberLimit;
	}

	/**
	 * Sets the exclusive upper bound of the sequence numbers a client assigns; once a client reaches it, sequence
	 * numbers start over at zero. Defaults to {@link Integer#MAX_VALUE}.
	 *
	 * @param sequenceNumberLimit the exclusive upper bound of assigned sequence numbers
	 */
	public void setSequenceNumberLimit(final int sequenceNumberLimit) {
		this.sequenceNumberLimit = sequenceNumberLimit;
	}

	public long getConnectTimeoutMillis() {
		return this.connectTimeoutMillis;
	}

	/**
	 * Sets the time, in milliseconds, a client waits for a TCP connection to the gateway and then again for the TLS
	 * handshake to finish. Defaults to {@value #DEFAULT_CONNECT_TIMEOUT_MILLIS} milliseconds.
	 *
	 * @param connectTimeoutMillis the connect and handshake timeout in milliseconds
	 */
	public void setConnectTimeoutMillis(final long connectTimeoutMillis) {
		this.connectTimeoutMillis = connectTimeoutMillis;
	}

	public long getWriteTimeoutMillis() {
		return this.writeTimeoutMillis;
	}

	/**
	 * Sets the time, in milliseconds, a client waits for a single notification to be written. Defaults to
	 * {@value #DEFAULT_WRITE_TIMEOUT_MILLIS} milliseconds.
	 *
	 * @param writeTimeoutMillis the write timeout in milliseconds
	 */
	public void setWriteTimeoutMillis(final long writeTimeoutMillis) {
		this.writeTimeoutMillis = writeTimeoutMillis;
	}

	public int getFailureQueueCapacity() {
		return this.failureQueueCapacity;
	}

	/**
	 * Sets the number of connection events (rejections and closures) that may wait to be handled by a client's
	 * failure-handling thread. Events that arrive while the queue is full are logged and dropped. Defaults to
	 * {@value #DEFAULT_FAILURE_QUEUE_CAPACITY}.
	 *
	 * @param failureQueueCapacity the capacity of the failure-handling queue
	 */
	public void setFailureQueueCapacity(final int failureQueueCapacity) {
		this.failureQueueCapacity = failureQueueCapacity;
	}

	public int getResendThreadCount() {
		return this.resendThreadCount;
	}

	/**
	 * Sets the number of threads a client uses to resend notifications after a rejection. Defaults to
	 * {@value #DEFAULT_RESEND_THREAD_COUNT}.
	 *
	 * @param resendThreadCount the number of resend threads
	 */
	public void setResendThreadCount(final int resendThreadCount) {
		this.resendThreadCount = resendThreadCount;
	}

	/**
	 * Returns the TLS protocol versions a client may negotiate with the gateway.
	 *
	 * @return the TLS protocol versions a client may negotiate with the gateway
	 */
	public List<String> getTlsProtocols() {
		return this.tlsProtocols;
	}

	/**
	 * Sets the TLS protocol versions a client may negotiate with the gateway. Defaults to {@code TLSv1.3} and
	 * {@code TLSv1.2}.
	 *
	 * @param tlsProtocols the permitted TLS protocol versions
	 */
	public void setTlsProtocols(final List<String> tlsProtocols) {
		if (tlsProtocols == null) {
			throw new NullPointerException("TLS protocols must not be null.");
		}

		this.tlsProtocols = new ArrayList<String>(tlsProtocols);
	}

	public File getTrustedCertificatesFile() {
		return this.trustedCertificatesFile;
	}

	/**
	 * Sets a PEM file of certificates to trust when verifying the gateway's certificate. If {@code null} (the
	 * default), the JDK's default trust store is used.
	 *
	 * @param trustedCertificatesFile a PEM file of trusted certificates, or {@code null}
	 */
	public void setTrustedCertificatesFile(final File trustedCertificatesFile) {
		this.trustedCertificatesFile = trustedCertificatesFile;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + replayQueueCapacity;
		result = prime * result + sequenceNumberLimit;
		result = prime * result + (int) (connectTimeoutMillis ^ (connectTimeoutMillis >>> 32));
		result = prime * result + (int) (writeTimeoutMillis ^ (writeTimeoutMillis >>> 32));
		result = prime * result + failureQueueCapacity;
		result = prime * result + resendThreadCount;
		result = prime * result + tlsProtocols.hashCode();
		result = prime
				* result
				+ ((trustedCertificatesFile == null) ? 0 : trustedCertificatesFile.hashCode());
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
		final PushClientConfiguration other = (PushClientConfiguration) obj;
		if (replayQueueCapacity != other.replayQueueCapacity)
			return false;
		if (sequenceNumberLimit != other.sequenceNumberLimit)
			return false;
		if (connectTimeoutMillis != other.connectTimeoutMillis)
			return false;
		if (writeTimeoutMillis != other.writeTimeoutMillis)
			return false;
		if (failureQueueCapacity != other.failureQueueCapacity)
			return false;
		if (resendThreadCount != other.resendThreadCount)
			return false;
		if (!tlsProtocols.equals(other.tlsProtocols))
			return false;
		if (trustedCertificatesFile == null) {
			if (other.trustedCertificatesFile != null)
				return false;
		} else if (!trustedCertificatesFile.equals(other.trustedCertificatesFile))
			return false;
		return true;
	}
}
