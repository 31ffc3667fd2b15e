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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * <p>A utility class for constructing JSON payloads for push notifications. Payload builders are reusable, but are
 * <em>not</em> thread-safe.</p>
 *
 * <p>Payloads longer than the gateway's limit are shortened by truncating the alert body, if there is one, and
 * marking the truncation with an ellipsis.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
public class PayloadBuilder {

	private String alertBody = null;
	private String localizedAlertKey = null;
	private String[] localizedAlertArguments = null;
	private Integer badgeNumber = null;
	private String soundFileName = null;
	private String categoryName = null;
	private boolean contentAvailable = false;

	private final Map<String, Object> customProperties = new LinkedHashMap<String, Object>();

	private static final String APS_KEY = "aps";
	private static final String ALERT_KEY = "alert";
	private static final String BADGE_KEY = "badge";
	private static final String SOUND_KEY = "sound";
	private static final String CATEGORY_KEY = "category";
	private static final String CONTENT_AVAILABLE_KEY = "content-available";

	private static final String ALERT_LOC_KEY = "loc-key";
	private static final String ALERT_ARGS_KEY = "loc-args";

	private static final String ELLIPSIS = "…";

	/**
	 * The maximum size, in UTF-8 bytes, of a payload accepted by the gateway.
	 */
	public static final int DEFAULT_MAXIMUM_PAYLOAD_SIZE = 2048;

	/**
	 * The name of the default push notification sound ({@value DEFAULT_SOUND_FILENAME}).
	 */
	public static final String DEFAULT_SOUND_FILENAME = "default";

	private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

	/**
	 * Sets the literal text of the alert message to be shown for the push notification. A literal alert message may
	 * not be set if a localized alert message key is already specified.
	 *
	 * @param alertBody the literal message to be shown for this push notification
	 *
	 * @return a reference to this payload builder
	 */
	public PayloadBuilder setAlertBody(final String alertBody) {
		if (alertBody != null && this.localizedAlertKey != null) {
			throw new IllegalStateException("Cannot set a literal alert body when a localized alert key has already been set.");
		}

		this.alertBody = alertBody;
		return this;
	}

	/**
	 * Sets the key of a message in the receiving app's localized string list to be shown for the push notification,
	 * and the arguments with which to fill in that message's placeholders.
	 *
	 * @param localizedAlertKey a key to a string in the receiving app's localized string list
	 * @param alertArguments arguments for the placeholders in the localized string; may be {@code null}
	 *
	 * @return a reference to this payload builder
	 */
	public PayloadBuilder setLocalizedAlertMessage(final String localizedAlertKey, final String... alertArguments) {
		if (localizedAlertKey != null && this.alertBody != null) {
			throw new IllegalStateException("Cannot set a localized alert key when a literal alert body has already been set.");
		}

		if (localizedAlertKey == null && alertArguments != null && alertArguments.length > 0) {
			throw new IllegalArgumentException("Cannot set localized alert arguments without a localized alert message key.");
		}

		this.localizedAlertKey = localizedAlertKey;
		this.localizedAlertArguments = alertArguments;

		return this;
	}

	/**
	 * Sets the number to display as the badge of the receiving app's icon. Zero removes the badge; {@code null} (the
	 * default) leaves it unchanged.
	 *
	 * @param badgeNumber the badge number, or {@code null}
	 *
	 * @return a reference to this payload builder
	 */
	public PayloadBuilder setBadgeNumber(final Integer badgeNumber) {
		this.badgeNumber = badgeNumber;
		return this;
	}

	/**
	 * Sets the name of the sound file to play when the notification is received. By default, no sound is played.
	 *
	 * @param soundFileName the name of a sound file in the receiving app's bundle, or {@code null}
	 *
	 * @return a reference to this payload builder
	 *
	 * @see PayloadBuilder#DEFAULT_SOUND_FILENAME
	 */
	public PayloadBuilder setSoundFileName(final String soundFileName) {
		this.soundFileName = soundFileName;
		return this;
	}

	public PayloadBuilder setCategoryName(final String categoryName) {
		this.categoryName = categoryName;
		return this;
	}

	/**
	 * Sets whether the payload should tell the receiving app that new content is available for background download.
	 *
	 * @param contentAvailable {@code true} to include the content availability flag
	 *
	 * @return a reference to this payload builder
	 */
	public PayloadBuilder setContentAvailable(final boolean contentAvailable) {
		this.contentAvailable = contentAvailable;
		return this;
	}

	/**
	 * Adds a custom property to the top level of the payload. The value must be serializable by Gson.
	 *
	 * @param key the name of the property
	 * @param value the value of the property
	 *
	 * @return a reference to this payload builder
	 *
	 * @throws IllegalArgumentException if the key is reserved for the {@code aps} dictionary
	 */
	public PayloadBuilder addCustomProperty(final String key, final Object value) {
		if (APS_KEY.equals(key)) {
			throw new IllegalArgumentException("The \"aps\" key is reserved.");
		}

		this.customProperties.put(key, value);
		return this;
	}

	/**
	 * Returns a JSON representation of the push notification payload under construction, shortened to at most
	 * {@value #DEFAULT_MAXIMUM_PAYLOAD_SIZE} bytes if necessary.
	 *
	 * @return a JSON representation of the payload under construction
	 *
	 * @see PayloadBuilder#buildWithMaximumLength(int)
	 */
	public String buildWithDefaultMaximumLength() {
		return this.buildWithMaximumLength(DEFAULT_MAXIMUM_PAYLOAD_SIZE);
	}

	/**
	 * Returns a JSON representation of the push notification payload under construction. If the payload would be
	 * longer than the given maximum size in UTF-8 bytes, the literal alert body is truncated (and ends with an
	 * ellipsis) so that the payload fits.
	 *
	 * @param maximumPayloadSize the maximum size of the payload in bytes
	 *
	 * @return a JSON representation of the payload under construction
	 *
	 * @throws IllegalArgumentException if the payload cannot be made to fit
	 */
	public String buildWithMaximumLength(final int maximumPayloadSize) {
		final String payload = this.buildPayload(this.alertBody);
		final int payloadSize = getSize(payload);

		if (payloadSize <= maximumPayloadSize) {
			return payload;
		}

		if (this.alertBody == null) {
			throw new IllegalArgumentException(String.format(
					"Payload is %d bytes long (with a maximum of %d bytes) and has no alert body to shorten.",
					payloadSize, maximumPayloadSize));
		}

		// Find the longest prefix of the body, in code points, that still fits
		int fitting = -1;
		int low = 0;
		int high = this.alertBody.codePointCount(0, this.alertBody.length()) - 1;

		while (low <= high) {
			final int middle = (low + high) >>> 1;

			if (getSize(this.buildPayload(this.abbreviateAlertBody(middle))) <= maximumPayloadSize) {
				fitting = middle;
				low = middle + 1;
			} else {
				high = middle - 1;
			}
		}

		if (fitting < 0) {
			throw new IllegalArgumentException(String.format(
					"Payload exceeds the maximum size of %d bytes even with an empty alert body.", maximumPayloadSize));
		}

		return this.buildPayload(this.abbreviateAlertBody(fitting));
	}

	private String abbreviateAlertBody(final int codePoints) {
		return this.alertBody.substring(0, this.alertBody.offsetByCodePoints(0, codePoints)) + ELLIPSIS;
	}

	private String buildPayload(final String body) {
		final Map<String, Object> payload = new LinkedHashMap<String, Object>();
		final Map<String, Object> aps = new LinkedHashMap<String, Object>();

		if (this.localizedAlertKey != null) {
			final Map<String, Object> alert = new LinkedHashMap<String, Object>();
			alert.put(ALERT_LOC_KEY, this.localizedAlertKey);

			if (this.localizedAlertArguments != null && this.localizedAlertArguments.length > 0) {
				alert.put(ALERT_ARGS_KEY, Arrays.asList(this.localizedAlertArguments));
			}

			aps.put(ALERT_KEY, alert);
		} else if (body != null) {
			aps.put(ALERT_KEY, body);
		}

		if (this.badgeNumber != null) {
			aps.put(BADGE_KEY, this.badgeNumber);
		}

		if (this.soundFileName != null) {
			aps.put(SOUND_KEY, this.soundFileName);
		}

		if (this.categoryName != null) {
			aps.put(CATEGORY_KEY, this.categoryName);
		}

		if (this.contentAvailable) {
			aps.put(CONTENT_AVAILABLE_KEY, 1);
		}

		payload.put(APS_KEY, aps);
		payload.putAll(this.customProperties);

		return gson.toJson(payload);
	}

	private static int getSize(final String payload) {
		return payload.getBytes(StandardCharsets.UTF_8).length;
	}
}
