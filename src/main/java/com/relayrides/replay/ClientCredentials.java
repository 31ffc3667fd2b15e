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

import io.netty.handler.ssl.SslContextBuilder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

/**
 * <p>The certificate and private key with which a {@link PushClient} identifies itself to a gateway. Credentials
 * come either from a pair of files or from a pair of PEM blocks held in memory; in both cases the certificate must be
 * a PEM-formatted X.509 certificate and the key a PEM-formatted PKCS#8 private key.</p>
 *
 * <p>Credentials are not read until a client first connects.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class ClientCredentials {

	private final File certificateFile;
	private final File privateKeyFile;

	private final String certificatePem;
	private final String privateKeyPem;

	private final String privateKeyPassword;

	private ClientCredentials(final File certificateFile, final File privateKeyFile, final String certificatePem,
			final String privateKeyPem, final String privateKeyPassword) {

		this.certificateFile = certificateFile;
		this.privateKeyFile = privateKeyFile;
		this.certificatePem = certificatePem;
		this.privateKeyPem = privateKeyPem;
		this.privateKeyPassword = privateKeyPassword;
	}

	/**
	 * Creates credentials that will be loaded from the given unencrypted certificate and key files.
	 *
	 * @param certificatePemFile a PEM-formatted file containing an X.509 certificate
	 * @param privateKeyPkcs8File a PEM-formatted file containing a PKCS#8 private key for the certificate
	 *
	 * @return credentials backed by the given files
	 */
	public static ClientCredentials fromFiles(final File certificatePemFile, final File privateKeyPkcs8File) {
		return fromFiles(certificatePemFile, privateKeyPkcs8File, null);
	}

	/**
	 * Creates credentials that will be loaded from the given certificate and key files.
	 *
	 * @param certificatePemFile a PEM-formatted file containing an X.509 certificate
	 * @param privateKeyPkcs8File a PEM-formatted file containing a PKCS#8 private key for the certificate
	 * @param privateKeyPassword the password to be used to decrypt the private key; may be {@code null} if the private
	 * key does not require a password
	 *
	 * @return credentials backed by the given files
	 */
	public static ClientCredentials fromFiles(final File certificatePemFile, final File privateKeyPkcs8File,
			final String privateKeyPassword) {

		if (certificatePemFile == null) {
			throw new NullPointerException("Certificate file must not be null.");
		}

		if (privateKeyPkcs8File == null) {
			throw new NullPointerException("Private key file must not be null.");
		}

		return new ClientCredentials(certificatePemFile, privateKeyPkcs8File, null, null, privateKeyPassword);
	}

	/**
	 * Creates credentials from unencrypted PEM blocks held in memory.
	 *
	 * @param certificatePem a PEM block containing an X.509 certificate
	 * @param privateKeyPem a PEM block containing a PKCS#8 private key for the certificate
	 *
	 * @return credentials backed by the given PEM blocks
	 */
	public static ClientCredentials fromPemBlocks(final String certificatePem, final String privateKeyPem) {
		return fromPemBlocks(certificatePem, privateKeyPem, null);
	}

	/**
	 * Creates credentials from PEM blocks held in memory.
	 *
	 * @param certificatePem a PEM block containing an X.509 certificate
	 * @param privateKeyPem a PEM block containing a PKCS#8 private key for the certificate
	 * @param privateKeyPassword the password to be used to decrypt the private key; may be {@code null} if the private
	 * key does not require a password
	 *
	 * @return credentials backed by the given PEM blocks
	 */
	public static ClientCredentials fromPemBlocks(final String certificatePem, final String privateKeyPem,
			final String privateKeyPassword) {

		if (certificatePem == null) {
			throw new NullPointerException("Certificate PEM block must not be null.");
		}

		if (privateKeyPem == null) {
			throw new NullPointerException("Private key PEM block must not be null.");
		}

		return new ClientCredentials(null, null, certificatePem, privateKeyPem, privateKeyPassword);
	}

	boolean hasPemBlocks() {
		return (this.certificatePem != null && !this.certificatePem.isEmpty()) ||
				(this.privateKeyPem != null && !this.privateKeyPem.isEmpty());
	}

	/**
	 * Installs these credentials as the key manager of the given SSL context builder. PEM blocks take precedence;
	 * files are only read when no PEM blocks were given.
	 *
	 * @param sslContextBuilder the builder to configure
	 *
	 * @return the given builder
	 *
	 * @throws IllegalArgumentException if the certificate or key cannot be read or parsed
	 */
	SslContextBuilder configureKeyManager(final SslContextBuilder sslContextBuilder) {
		if (this.hasPemBlocks()) {
			final String certificate = this.certificatePem != null ? this.certificatePem : "";
			final String privateKey = this.privateKeyPem != null ? this.privateKeyPem : "";

			return sslContextBuilder.keyManager(
					new ByteArrayInputStream(certificate.getBytes(StandardCharsets.US_ASCII)),
					new ByteArrayInputStream(privateKey.getBytes(StandardCharsets.US_ASCII)),
					this.privateKeyPassword);
		}

		if (this.certificateFile == null || this.privateKeyFile == null) {
			throw new IllegalArgumentException("No certificate or private key was provided.");
		}

		return sslContextBuilder.keyManager(this.certificateFile, this.privateKeyFile, this.privateKeyPassword);
	}

	@Override
	public String toString() {
		if (this.hasPemBlocks()) {
			return "ClientCredentials [source=PEM blocks]";
		}

		return "ClientCredentials [certificateFile=" + this.certificateFile + ", privateKeyFile=" + this.privateKeyFile + "]";
	}
}
