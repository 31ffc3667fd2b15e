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
import io.netty.buffer.Unpooled;
import io.netty.channel.nio.NioEventLoopGroup;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Sends push notifications to a legacy binary push gateway over a single persistent TLS connection and resends
 * notifications that may have been lost when the gateway rejects one.</p>
 *
 * <p>The gateway never acknowledges a notification. When it rejects one, it reports the rejected notification's
 * sequence number and closes the connection; every notification written after the rejected one is silently
 * discarded. A push client remembers the notifications it has written recently (see
 * {@link PushClientConfiguration#setReplayQueueCapacity(int)}), and when a rejection arrives it reports the rejected
 * notification to its {@link DeliveryFailureListener} and sends everything that followed it again on a new
 * connection. Notifications written before the rejected one are presumed delivered.</p>
 *
 * <p>Sending is synchronous up to the point at which a notification has been written to the connection: callers of
 * {@link PushClient#send(PushNotification)} learn immediately about encoding, connection and write problems, but learn
 * about rejections only through the failure listener. Push clients are thread-safe; sends from multiple threads (and
 * resends) are serialized.</p>
 *
 * <p>Push clients must be closed with {@link PushClient#close()} when no longer needed.</p>
 *
 * @author <a href="mailto:jon@relayrides.com">Jon Chambers</a>
 *
 * @param <T> the type of push notification sent by this client
 */
public class PushClient<T extends PushNotification> implements GatewayConnectionListener {

	private final GatewayConnectionManager connectionManager;
	private final PushNotificationEncoder<? super T> encoder;
	private final DeliveryFailureListener<? super T> failureListener;
	private final PushClientConfiguration configuration;
	private final String name;

	private final ReplayQueue<T> replayQueue;
	private int sequenceNumber = 0;

	private volatile boolean running;

	private final BlockingQueue<Runnable> failureQueue;
	private volatile Thread dispatchThread;
	private volatile boolean dispatchThreadShouldContinue = true;

	private final ExecutorService resendExecutorService;

	private final ExecutorService listenerExecutorService;
	private final boolean shouldShutDownListenerExecutorService;

	private final NioEventLoopGroup eventLoopGroupToShutDown;

	private static final AtomicInteger clientCounter = new AtomicInteger(0);

	private static final Logger log = LoggerFactory.getLogger(PushClient.class);

	private static class DispatchThreadExceptionHandler implements UncaughtExceptionHandler {
		private final Logger log = LoggerFactory.getLogger(DispatchThreadExceptionHandler.class);

		final PushClient<?> client;

		public DispatchThreadExceptionHandler(final PushClient<?> client) {
			this.client = client;
		}

		@Override
		public void uncaughtException(final Thread t, final Throwable e) {
			log.error("Failure-handling thread for {} died unexpectedly.", this.client.name, e);

			if (this.client.isRunning() && this.client.dispatchThreadShouldContinue) {
				this.client.createAndStartDispatchThread();
			}
		}
	}

	/**
	 * Constructs a new push client that sends notifications to the given gateway with the default binary encoder and
	 * the default configuration.
	 *
	 * @param gateway the gateway to which to send notifications; must not be {@code null}
	 * @param credentials the credentials with which to identify this client to the gateway; must not be {@code null}
	 * @param failureListener the listener to notify of notifications that could not be delivered; if {@code null},
	 * delivery failures are only logged
	 */
	public PushClient(final PushGateway gateway, final ClientCredentials credentials,
			final DeliveryFailureListener<? super T> failureListener) {

		this(gateway, credentials, new BinaryPushNotificationEncoder(), failureListener, null, null,
				new PushClientConfiguration(), null);
	}

	/**
	 * <p>Constructs a new push client that sends notifications to the given gateway.</p>
	 *
	 * <p>This constructor may take an event loop group as an argument; if one is provided, the caller is responsible
	 * for managing the lifecycle of the group and <strong>must</strong> shut it down after closing this client. The
	 * same holds for the listener executor service, which is used to deliver failures to the failure listener.</p>
	 *
	 * @param gateway the gateway to which to send notifications; must not be {@code null}
	 * @param credentials the credentials with which to identify this client to the gateway; must not be {@code null}
	 * @param encoder the encoder that turns notifications into wire frames; must not be {@code null}
	 * @param failureListener the listener to notify of notifications that could not be delivered; if {@code null},
	 * delivery failures are only logged
	 * @param eventLoopGroup the event loop group to use for gateway connections; if {@code null}, a new event loop
	 * group will be created and will be shut down automatically when the client is closed
	 * @param listenerExecutorService the executor service to use to notify the failure listener; if {@code null}, a
	 * new single-thread executor service will be created and will be shut down automatically when the client is closed
	 * @param configuration the set of configuration options to use for this client; the configuration object is
	 * copied. Must not be {@code null}.
	 * @param name a human-readable name for this client; if {@code null}, a default name will be used
	 */
	public PushClient(final PushGateway gateway, final ClientCredentials credentials,
			final PushNotificationEncoder<? super T> encoder, final DeliveryFailureListener<? super T> failureListener,
			final NioEventLoopGroup eventLoopGroup, final ExecutorService listenerExecutorService,
			final PushClientConfiguration configuration, final String name) {

		// Validated before an event loop group exists
		this(validateArguments(gateway, credentials, encoder, configuration), gateway, credentials, encoder,
				failureListener, eventLoopGroup != null ? eventLoopGroup : new NioEventLoopGroup(1),
				eventLoopGroup == null, listenerExecutorService,
				name != null ? name : String.format("PushClient-%d", PushClient.clientCounter.getAndIncrement()));
	}

	private PushClient(final PushClientConfiguration configuration, final PushGateway gateway,
			final ClientCredentials credentials, final PushNotificationEncoder<? super T> encoder,
			final DeliveryFailureListener<? super T> failureListener, final NioEventLoopGroup eventLoopGroup,
			final boolean shouldShutDownEventLoopGroup, final ExecutorService listenerExecutorService,
			final String name) {

		this(new DefaultGatewayConnectionFactory(gateway, credentials, eventLoopGroup, configuration, name),
				encoder, failureListener, shouldShutDownEventLoopGroup ? eventLoopGroup : null,
				listenerExecutorService, configuration, name);
	}

	PushClient(final GatewayConnectionFactory connectionFactory, final PushNotificationEncoder<? super T> encoder,
			final DeliveryFailureListener<? super T> failureListener, final NioEventLoopGroup eventLoopGroupToShutDown,
			final ExecutorService listenerExecutorService, final PushClientConfiguration configuration,
			final String name) {

		if (encoder == null) {
			throw new NullPointerException("Encoder must not be null.");
		}

		this.configuration = validateConfiguration(configuration);

		this.name = name != null ? name : String.format("PushClient-%d", PushClient.clientCounter.getAndIncrement());

		this.connectionManager = new GatewayConnectionManager(connectionFactory, this);
		this.encoder = encoder;
		this.failureListener = failureListener;

		this.replayQueue = new ReplayQueue<T>(this.configuration.getReplayQueueCapacity());
		this.failureQueue = new ArrayBlockingQueue<Runnable>(this.configuration.getFailureQueueCapacity());

		this.resendExecutorService = Executors.newFixedThreadPool(this.configuration.getResendThreadCount());

		if (listenerExecutorService != null) {
			this.listenerExecutorService = listenerExecutorService;
			this.shouldShutDownListenerExecutorService = false;
		} else {
			this.listenerExecutorService = Executors.newSingleThreadExecutor();
			this.shouldShutDownListenerExecutorService = true;
		}

		this.eventLoopGroupToShutDown = eventLoopGroupToShutDown;

		this.running = true;
		this.createAndStartDispatchThread();

		log.info("{} started.", this.name);
	}

	private static PushClientConfiguration validateArguments(final PushGateway gateway,
			final ClientCredentials credentials, final PushNotificationEncoder<?> encoder,
			final PushClientConfiguration configuration) {

		if (gateway == null) {
			throw new NullPointerException("Gateway must not be null.");
		}

		if (credentials == null) {
			throw new NullPointerException("Client credentials must not be null.");
		}

		if (encoder == null) {
			throw new NullPointerException("Encoder must not be null.");
		}

		return validateConfiguration(configuration);
	}

	/**
	 * Returns a copy of the given configuration after checking that a client can run with it.
	 */
	private static PushClientConfiguration validateConfiguration(final PushClientConfiguration configuration) {
		if (configuration == null) {
			throw new NullPointerException("Configuration object must not be null.");
		}

		final PushClientConfiguration copy = new PushClientConfiguration(configuration);

		if (copy.getReplayQueueCapacity() <= 0) {
			throw new IllegalArgumentException("Replay queue capacity must be positive.");
		}

		if (copy.getSequenceNumberLimit() <= 0) {
			throw new IllegalArgumentException("Sequence number limit must be positive.");
		}

		if (copy.getReplayQueueCapacity() >= copy.getSequenceNumberLimit()) {
			throw new IllegalArgumentException(String.format(
					"Replay queue capacity (%d) must be less than the sequence number limit (%d).",
					copy.getReplayQueueCapacity(), copy.getSequenceNumberLimit()));
		}

		if (copy.getFailureQueueCapacity() <= 0) {
			throw new IllegalArgumentException("Failure queue capacity must be positive.");
		}

		if (copy.getResendThreadCount() <= 0) {
			throw new IllegalArgumentException("Resend thread count must be positive.");
		}

		return copy;
	}

	private void createAndStartDispatchThread() {
		final Thread thread = new Thread(new Runnable() {

			@Override
			public void run() {
				while (dispatchThreadShouldContinue) {
					try {
						failureQueue.take().run();
					} catch (InterruptedException e) {
						continue;
					}
				}
			}
		}, this.name + "-failure-handler");

		thread.setUncaughtExceptionHandler(new DispatchThreadExceptionHandler(this));

		this.dispatchThread = thread;
		thread.start();
	}

	/**
	 * <p>Sends a push notification to the gateway. This method assigns the next sequence number to the notification,
	 * encodes it, connects to the gateway if there is no open connection, and writes the encoded notification. If the
	 * write fails, this method reconnects and tries once more.</p>
	 *
	 * <p>Returning normally means that the notification was written, not that it was delivered; if the gateway
	 * rejects it later, the client's failure listener is notified. If the notification could not be written because
	 * of a connection or write problem, the failure listener is notified and the problem is also thrown to the
	 * caller.</p>
	 *
	 * <p>Callers must not modify a notification after passing it to this method.</p>
	 *
	 * @param notification the notification to send
	 *
	 * @throws ClientNotRunningException if this client has been closed
	 * @throws NotificationEncodingException if the notification could not be encoded; nothing is written and the
	 * failure listener is not notified
	 * @throws ClientCertificateException if the client's credentials could not be loaded
	 * @throws GatewayConnectionException if no connection to the gateway could be established
	 * @throws NotificationWriteException if the notification could not be written, even after reconnecting
	 * @throws InterruptedException if interrupted while waiting for a connection or a write
	 */
	public synchronized void send(final T notification) throws DeliveryException, InterruptedException {
		if (notification == null) {
			throw new NullPointerException("Push notification must not be null.");
		}

		if (!this.running) {
			throw new ClientNotRunningException();
		}

		final SendablePushNotification<T> sendableNotification =
				new SendablePushNotification<T>(notification, this.sequenceNumber);

		this.sequenceNumber = (this.sequenceNumber + 1) % this.configuration.getSequenceNumberLimit();

		final ByteBuf frame = Unpooled.buffer();

		try {
			this.encoder.encode(sendableNotification, frame);

			try {
				this.connectAndWrite(frame);
			} catch (DeliveryException e) {
				this.connectionManager.discard();
				this.dispatchDeliveryFailure(new DeliveryFailure<T>(notification, null, e));

				throw e;
			} catch (InterruptedException e) {
				this.connectionManager.discard();
				throw e;
			}

			log.trace("{} sent {}.", this.name, sendableNotification);
			this.replayQueue.append(sendableNotification);
		} finally {
			frame.release();
		}
	}

	private void connectAndWrite(final ByteBuf frame) throws DeliveryException, InterruptedException {
		final GatewayConnection connection = this.connectionManager.ensureConnected();

		try {
			connection.write(frame.retainedDuplicate(), this.configuration.getWriteTimeoutMillis());
		} catch (NotificationWriteException e) {
			log.debug("{} failed to write to {}; will reconnect and try again.", this.name, connection.getName(), e);

			this.connectionManager.discard();
			this.connectionManager.ensureConnected().write(frame.retainedDuplicate(),
					this.configuration.getWriteTimeoutMillis());
		}
	}

	/**
	 * Connects to the gateway if this client does not already have an open connection. Calling this method is
	 * optional; {@link PushClient#send(PushNotification)} connects as needed.
	 *
	 * @throws ClientNotRunningException if this client has been closed
	 * @throws ClientCertificateException if the client's credentials could not be loaded
	 * @throws GatewayConnectionException if no connection to the gateway could be established
	 * @throws InterruptedException if interrupted while waiting for a connection
	 */
	public synchronized void connect() throws ClientNotRunningException, ClientCertificateException,
			GatewayConnectionException, InterruptedException {

		if (!this.running) {
			throw new ClientNotRunningException();
		}

		this.connectionManager.ensureConnected();
	}

	/**
	 * Handles a rejection reported by the gateway: reports the rejected notification as a delivery failure and
	 * resends every notification written after it.
	 */
	synchronized void reportFailure(final RejectedNotification rejectedNotification) {
		if (!this.running) {
			return;
		}

		final List<SendablePushNotification<T>> unconfirmedNotifications =
				this.replayQueue.drainFrom(rejectedNotification.getSequenceNumber());

		if (unconfirmedNotifications == null) {
			if (this.replayQueue.isEmpty()) {
				log.warn("{} failed to find rejected notification with sequence number {} (replay queue is empty); " +
						"this may mean the replay queue is too small.",
						this.name, rejectedNotification.getSequenceNumber());
			} else {
				log.warn("{} failed to find rejected notification with sequence number {} (replay queue has range " +
						"{} to {}); this may mean the replay queue capacity of {} is too small.",
						this.name, rejectedNotification.getSequenceNumber(),
						this.replayQueue.getLowestSequenceNumber(), this.replayQueue.getHighestSequenceNumber(),
						this.replayQueue.getCapacity());
			}

			return;
		}

		this.dispatchDeliveryFailure(new DeliveryFailure<T>(
				unconfirmedNotifications.get(0).getPushNotification(), rejectedNotification, null));

		this.replayQueue.clear();

		final List<SendablePushNotification<T>> notificationsToResend =
				unconfirmedNotifications.subList(1, unconfirmedNotifications.size());

		if (!notificationsToResend.isEmpty()) {
			log.debug("{} will resend {} notifications sent after rejected notification {}.",
					this.name, notificationsToResend.size(), rejectedNotification.getSequenceNumber());
		}

		for (final SendablePushNotification<T> sendableNotification : notificationsToResend) {
			final T notification = sendableNotification.getPushNotification();

			this.resendExecutorService.execute(new Runnable() {

				@Override
				public void run() {
					resend(notification);
				}
			});
		}
	}

	private void resend(final T notification) {
		try {
			this.send(notification);
		} catch (DeliveryException e) {
			log.warn("{} failed to resend {}.", this.name, notification, e);
		} catch (InterruptedException e) {
			log.warn("{} was interrupted while resending {}.", this.name, notification);
			Thread.currentThread().interrupt();
		}
	}

	synchronized void invalidateConnection(final GatewayConnection connection) {
		if (this.connectionManager.invalidate(connection)) {
			log.debug("{} will no longer use closed connection {}.", this.name, connection.getName());
		}
	}

	/*
	 * (non-Javadoc)
	 * @see com.relayrides.replay.GatewayConnectionListener#handleRejectedNotification(com.relayrides.replay.GatewayConnection, com.relayrides.replay.RejectedNotification)
	 */
	@Override
	public void handleRejectedNotification(final GatewayConnection connection,
			final RejectedNotification rejectedNotification) {

		if (!this.running) {
			log.debug("{} is not running and will ignore {} from {}.", this.name, rejectedNotification, connection);
			return;
		}

		final boolean accepted = this.failureQueue.offer(new Runnable() {

			@Override
			public void run() {
				reportFailure(rejectedNotification);
			}
		});

		if (!accepted) {
			log.warn("{} failure-handling queue is full; dropping {} from {}.",
					this.name, rejectedNotification, connection);
		}
	}

	/*
	 * (non-Javadoc)
	 * @see com.relayrides.replay.GatewayConnectionListener#handleConnectionClosure(com.relayrides.replay.GatewayConnection)
	 */
	@Override
	public void handleConnectionClosure(final GatewayConnection connection) {
		if (!this.running) {
			return;
		}

		final boolean accepted = this.failureQueue.offer(new Runnable() {

			@Override
			public void run() {
				invalidateConnection(connection);
			}
		});

		if (!accepted) {
			log.warn("{} failure-handling queue is full; dropping closure of {}.", this.name, connection);
		}
	}

	private void dispatchDeliveryFailure(final DeliveryFailure<T> failure) {
		if (this.failureListener == null) {
			log.warn("{} could not deliver a notification: {}", this.name, failure);
			return;
		}

		final PushClient<T> client = this;

		try {
			this.listenerExecutorService.execute(new Runnable() {

				@Override
				public void run() {
					failureListener.handleDeliveryFailure(client, failure);
				}
			});
		} catch (RejectedExecutionException e) {
			log.warn("{} could not notify its failure listener of {}.", this.name, failure, e);
		}
	}

	/**
	 * <p>Closes this client's connection and stops its threads. Notifications that were written but not yet
	 * confirmed are forgotten, and rejections that arrive after closing are ignored. Calling this method more than once
	 * has no further effect.</p>
	 *
	 * <p>If this client created its own event loop group and listener executor service, they are shut down too.</p>
	 *
	 * @throws InterruptedException if interrupted while waiting for this client's threads to stop
	 */
	public void close() throws InterruptedException {
		synchronized (this) {
			if (!this.running) {
				log.warn("{} has already been closed.", this.name);
				return;
			}

			log.info("{} closing.", this.name);

			this.running = false;
			this.connectionManager.discard();
		}

		this.dispatchThreadShouldContinue = false;

		final Thread thread = this.dispatchThread;
		thread.interrupt();

		if (Thread.currentThread() != thread) {
			thread.join();
		}

		this.failureQueue.clear();
		this.resendExecutorService.shutdown();

		if (this.shouldShutDownListenerExecutorService) {
			this.listenerExecutorService.shutdown();
		}

		if (this.eventLoopGroupToShutDown != null) {
			this.eventLoopGroupToShutDown.shutdownGracefully().await();
		}

		log.info("{} closed.", this.name);
	}

	/**
	 * Indicates whether this client is accepting notifications.
	 *
	 * @return {@code true} if this client has not been closed or {@code false} otherwise
	 */
	public boolean isRunning() {
		return this.running;
	}

	/**
	 * Returns the human-readable name of this client.
	 *
	 * @return the human-readable name of this client
	 */
	public String getName() {
		return this.name;
	}

	ReplayQueue<T> getReplayQueue() {
		return this.replayQueue;
	}

	synchronized GatewayConnection getConnection() {
		return this.connectionManager.getConnection();
	}
}
