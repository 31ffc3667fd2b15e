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

package com.relayrides.replay.util;

/**
 * A utility class for converting device tokens between their hexadecimal string form and the raw bytes sent to the
 * gateway.
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class TokenUtil {

	private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

	// Prevent instantiation
	private TokenUtil() {}

	/**
	 * Converts a string of hexadecimal digits into an array of bytes. Non-hexadecimal characters such as spaces and
	 * angle brackets are ignored, so strings copied from device logs can be used directly.
	 *
	 * @param tokenString the string to convert
	 *
	 * @return the bytes represented by the given string
	 *
	 * @throws MalformedTokenStringException if the string contains no hexadecimal digits or an odd number of them
	 * @throws NullPointerException if the given string is {@code null}
	 */
	public static byte[] tokenStringToByteArray(final String tokenString) throws MalformedTokenStringException {
		if (tokenString == null) {
			throw new NullPointerException("Token string must not be null.");
		}

		final String strippedTokenString = sanitizeTokenString(tokenString);

		if (strippedTokenString.isEmpty()) {
			throw new MalformedTokenStringException("Token string contains no hexadecimal digits.");
		}

		if (strippedTokenString.length() % 2 != 0) {
			throw new MalformedTokenStringException("Token strings must contain an even number of hexadecimal digits.");
		}

		final byte[] tokenBytes = new byte[strippedTokenString.length() / 2];

		for (int i = 0; i < tokenBytes.length; i++) {
			tokenBytes[i] = (byte) Integer.parseInt(strippedTokenString.substring(i * 2, i * 2 + 2), 16);
		}

		return tokenBytes;
	}

	/**
	 * Converts an array of bytes into a string of lower-case hexadecimal digits.
	 *
	 * @param tokenBytes the bytes to convert
	 *
	 * @return a string of hexadecimal digits representing the given bytes
	 *
	 * @throws NullPointerException if the given array is {@code null}
	 */
	public static String tokenBytesToString(final byte[] tokenBytes) {
		if (tokenBytes == null) {
			throw new NullPointerException("Token bytes must not be null.");
		}

		final StringBuilder builder = new StringBuilder(tokenBytes.length * 2);

		for (final byte b : tokenBytes) {
			builder.append(HEX_DIGITS[(b >> 4) & 0x0f]);
			builder.append(HEX_DIGITS[b & 0x0f]);
		}

		return builder.toString();
	}

	/**
	 * Returns a version of the given token string with all non-hexadecimal characters removed.
	 *
	 * @param tokenString the token string to sanitize
	 *
	 * @return the hexadecimal digits of the given string, in order
	 */
	public static String sanitizeTokenString(final String tokenString) {
		return tokenString.replaceAll("[^a-fA-F0-9]", "");
	}
}
