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
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.messaging.MessengerClosedException;
import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.esotericsoftware.minlog.Log;

/**
 * Listens on a SUB socket and hands every message to a {@link FeedListener}
 * on the subscriber thread. Listener failures are logged and the message
 * is skipped.
 */
public final class FeedSubscriber implements Closeable {

	private static final int RECV_TIMEOUT_MILLIS = 100;

	private final RoomAllocHandle _handle;
	private final String _publisherAddress;
	private final FeedListener _listener;
	private final String _name;
	private final CountDownLatch _startedLatch = new CountDownLatch(1);
	
	private volatile boolean _isRunning = false;
	private Thread _subscriberThread;
	
	public FeedSubscriber(RoomAllocHandle handle, String publisherAddress, FeedListener listener, String name) {
		_handle = Objects.requireNonNull(handle);
		_publisherAddress = Objects.requireNonNull(publisherAddress);
		_listener = Objects.requireNonNull(listener);
		_name = Objects.requireNonNull(name);
	}
	
	public synchronized void start() {
		if (_subscriberThread != null)
			throw new IllegalStateException(String.format("%s has already been started.", _name));
		_isRunning = true;
		_subscriberThread = new Thread(new Runnable() {

			@Override
			public void run() {
				runLoop();
			}
			
		}, _name);
		_subscriberThread.start();
	}
	
	public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
		return _startedLatch.await(timeout, unit);
	}
	
	@Override
	public void close() {
		_isRunning = false;
		Thread subscriberThread = _subscriberThread;
		if (subscriberThread != null) {
			try {
				subscriberThread.join(TimeUnit.SECONDS.toMillis(10));
			} catch (InterruptedException eInterrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}
	
	private void runLoop() {
		SocketManager socketManager = _handle.getSocketManager();
		ZMQ.Socket socket = null;
		try {
			socket = socketManager.create(ZMQ.SUB, SocketSettings.create()
					.subscribeToAll()
					.setRecvTimeout(RECV_TIMEOUT_MILLIS), _name);
			socketManager.connectSocket(socket, _publisherAddress);
			_startedLatch.countDown();
			while (_isRunning) {
				// bounded by the socket receive timeout
				List<byte[]> frames = ZmqSocketOperations.recvFrames(socket, true);
				if (frames == null) continue;
				if (frames.size() != 1) {
					Log.warn(String.format("%s dropped a message of %d frames", _name, frames.size()));
					continue;
				}
				try {
					_listener.onMessage(frames.get(0));
				} catch (RuntimeException e) {
					Log.warn(String.format("%s failed to handle a message", _name), e);
				}
			}
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
	
}
