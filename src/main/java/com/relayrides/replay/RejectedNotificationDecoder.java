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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Reads the single error frame a gateway may send on a connection before closing it. An error frame is six bytes
 * long: a one-byte command (always {@value #ERROR_RESPONSE_COMMAND}), a one-byte status and a big-endian four-byte
 * sequence number.</p>
 *
 * <p>The decoder reads at most one frame. Frames with an unexpected command or an unknown status are logged and
 * discarded, and the connection is closed; anything received after the first frame is skipped.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 */
class RejectedNotificationDecoder extends ByteToMessageDecoder {

	static final int FRAME_LENGTH = 6;
	static final byte ERROR_RESPONSE_COMMAND = 8;

	enum State {
		WAITING_FOR_FRAME,
		DONE
	}

	private State state = State.WAITING_FOR_FRAME;

	private static final Logger log = LoggerFactory.getLogger(RejectedNotificationDecoder.class);

	@Override
	protected void decode(final ChannelHandlerContext context, final ByteBuf in, final List<Object> out) {
		switch (this.state) {
			case WAITING_FOR_FRAME: {
				if (in.readableBytes() < FRAME_LENGTH) {
					return;
				}

				final byte command = in.readByte();
				final byte status = in.readByte();
				final int sequenceNumber = in.readInt();

				this.state = State.DONE;

				if (command != ERROR_RESPONSE_COMMAND) {
					log.warn("Discarding error frame with unexpected command {} (sequence number {}).",
							command, sequenceNumber);

					context.close();
					return;
				}

				final RejectedNotificationReason reason = RejectedNotificationReason.getByErrorCode(status);

				if (reason == null) {
					log.warn("Discarding error frame with unknown status {} (sequence number {}).",
							status & 0xff, sequenceNumber);

					context.close();
					return;
				}

				out.add(new RejectedNotification(command, sequenceNumber, reason));
				break;
			}

			case DONE: {
				in.skipBytes(in.readableBytes());
				break;
			}
		}
	}

	State getState() {
		return this.state;
	}
}
