/*
 * Copyright 2013 Adam Roughton
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.adamroughton.roomalloc.failover;

import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.messaging.MessengerClosedException;
import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.adamroughton.roomalloc.util.Util;
import com.esotericsoftware.minlog.Log;

/**
 * Publishes one message on a PUB socket every period, from its own thread.
 * Delivery is fire-and-forget.
 */
public abstract class PeriodicPublisher implements Closeable {

	private static final long MAX_SLEEP_MILLIS = 50;

	private final RoomAllocHandle _handle;
	private final SocketSettings _socketSettings;
	private final long _periodMillis;
	private final String _name;
	private final CountDownLatch _startedLatch = new CountDownLatch(1);
	
	private volatile boolean _isRunning = false;
	private volatile long _publishedCount = 0;
	private Thread _publisherThread;
	
	protected PeriodicPublisher(RoomAllocHandle handle, SocketSettings socketSettings, long periodMillis, String name) {
		_handle = Objects.requireNonNull(handle);
		_socketSettings = Objects.requireNonNull(socketSettings);
		if (periodMillis < 1)
			throw new IllegalArgumentException(String.format("The publishing period of %s must be positive.", name));
		_periodMillis = periodMillis;
		_name = Objects.requireNonNull(name);
	}
	
	/**
	 * Creates the payload of the next message. Called on the 
	 * publisher thread.
	 */
	protected abstract byte[] nextPayload();
	
	public synchronized void start() {
		if (_publisherThread != null)
			throw new IllegalStateException(String.format("%s has already been started.", _name));
		_isRunning = true;
		_publisherThread = new Thread(new Runnable() {

			@Override
			public void run() {
				runLoop();
			}
			
		}, _name);
		_publisherThread.start();
	}
	
	public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
		return _startedLatch.await(timeout, unit);
	}
	
	public long getPublishedCount() {
		return _publishedCount;
	}
	
	protected Clock getClock() {
		return _handle.getClock();
	}
	
	@Override
	public void close() {
		_isRunning = false;
		Thread publisherThread = _publisherThread;
		if (publisherThread != null) {
			try {
				publisherThread.join(TimeUnit.SECONDS.toMillis(10));
			} catch (InterruptedException eInterrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}
	
	private void runLoop() {
		SocketManager socketManager = _handle.getSocketManager();
		Clock clock = getClock();
		ZMQ.Socket socket = null;
		try {
			socket = socketManager.create(ZMQ.PUB, _socketSettings, _name);
			_startedLatch.countDown();
			long nextPublish = clock.currentMillis();
			while (_isRunning) {
				long waitMillis = Util.millisUntil(nextPublish, clock);
				if (waitMillis > 0) {
					Thread.sleep(Math.min(waitMillis, MAX_SLEEP_MILLIS));
					continue;
				}
				if (ZmqSocketOperations.sendFrames(socket, nextPayload())) {
					_publishedCount++;
				} else {
					Log.warn(String.format("%s could not publish", _name));
				}
				nextPublish = nextPublishAfter(nextPublish, _periodMillis, clock.currentMillis());
			}
		} catch (InterruptedException eInterrupted) {
			Log.debug(String.format("%s interrupted", _name));
		} catch (MessengerClosedException eClosed) {
			Log.info(String.format("%s stopping: messaging closed", _name));
		} catch (Throwable t) {
			_handle.signalFatalException(t);
		} finally {
			_isRunning = false;
			if (socket != null) {
				socketManager.destroySocket(socket);
			}
		}
	}
	
	/**
	 * Gets the time of the publish following the one scheduled at
	 * {@code scheduledMillis}. A publisher that has fallen more than a 
	 * period behind skips the missed publishes rather than sending them 
	 * back to back.
	 */
	static long nextPublishAfter(long scheduledMillis, long periodMillis, long nowMillis) {
		long next = scheduledMillis + periodMillis;
		return next > nowMillis? next : nowMillis + periodMillis;
	}
	
}
