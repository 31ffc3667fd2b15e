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

/**
 * <p>Contains classes and interfaces for sending push notifications through a legacy binary push gateway.</p>
 *
 * <p>Callers will primarily interact with the {@link com.relayrides.replay.PushClient} class. A {@code PushClient}
 * keeps a single TLS connection to the gateway, assigns a sequence number to every notification it sends and
 * remembers recently-sent notifications so it can resend the ones the gateway discarded after a rejection. Rejected
 * notifications and notifications that could not be written are reported to a
 * {@link com.relayrides.replay.DeliveryFailureListener}.</p>
 *
 * <p>A simple concrete implementation of the {@link com.relayrides.replay.PushNotification} interface
 * ({@link com.relayrides.replay.util.SimplePushNotification}) and tools for constructing payloads can be found in the
 * {@code com.relayrides.replay.util} package.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
package com.relayrides.replay;
