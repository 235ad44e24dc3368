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
package com.adamroughton.roomalloc.worker;

import java.io.Closeable;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.messaging.MessengerClosedException;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.util.Util;
import com.esotericsoftware.minlog.Log;
import com.lmax.disruptor.EventPoller;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.YieldingWaitStrategy;

/**
 * A pool member of the load-balancing broker. The worker registers with the
 * broker by sending {@link WireProtocol#READY}, then admits at most 
 * {@code maxConcurrentRequests} dispatched requests at a time. A request is
 * only read off the socket while a permit is held, and each admitted request
 * runs as its own task on the processing executor.
 * <p>
 * The socket is only ever touched by the loop thread. Processing tasks hand
 * their reply to the loop thread through a multi-producer ring buffer.
 * <p>
 * Dispatches arrive as {@code ["", client-id, "", payload]} and replies
 * are sent as {@code ["", client-id, "", reply]}.
 */
public class AllocatorWorker implements Closeable {

	public static final String TRACE_FLAG = "worker";
	public static final String INTERNAL_ERROR_MESSAGE = "Internal error while processing the request";
	
	private final RoomAllocHandle _handle;
	private final String _brokerAddress;
	private final InFlightTrackingRequestHandler _handler;
	private final JsonCodec _codec;
	private final String _name;
	private final int _maxConcurrentRequests;
	private final long _pollMillis;
	private final boolean _isTracing;
	private final byte[] _internalErrorReply;
	
	private final Semaphore _permits;
	private final ExecutorService _executor;
	private final RingBuffer<ReplyEvent> _replyBuffer;
	private final EventPoller<ReplyEvent> _replyPoller;
	private final AtomicLong _nextRequestId = new AtomicLong(0);
	private final CountDownLatch _registeredLatch = new CountDownLatch(1);
	
	private volatile boolean _isRunning = false;
	private volatile Thread _loopThread;
	
	// only accessed by the loop thread
	private ZMQ.Socket _socket;
	
	public AllocatorWorker(
			RoomAllocHandle handle,
			String brokerAddress,
			RequestHandler handler,
			JsonCodec codec,
			int maxConcurrentRequests,
			long pollMillis,
			String name) {
		_handle = Objects.requireNonNull(handle);
		_brokerAddress = Objects.requireNonNull(brokerAddress);
		_handler = RequestHandlers.track(Objects.requireNonNull(handler));
		_codec = Objects.requireNonNull(codec);
		_name = Objects.requireNonNull(name);
		if (maxConcurrentRequests < 1)
			throw new IllegalArgumentException(String.format("The maximum number of concurrent requests " +
					"must be 1 or greater (was %d).", maxConcurrentRequests));
		if (pollMillis < 1)
			throw new IllegalArgumentException("The poll period must be positive.");
		_maxConcurrentRequests = maxConcurrentRequests;
		_pollMillis = pollMillis;
		_isTracing = handle.shouldTrace(TRACE_FLAG);
		_internalErrorReply = codec.encodeError(INTERNAL_ERROR_MESSAGE);
		
		_permits = new Semaphore(maxConcurrentRequests);
		_executor = Executors.newFixedThreadPool(maxConcurrentRequests, Util.namedThreadFactory(name + "-request", true));
		_replyBuffer = RingBuffer.createMultiProducer(ReplyEvent.FACTORY, 
				Util.nextPowerOf2(2 * maxConcurrentRequests), new YieldingWaitStrategy());
		_replyPoller = _replyBuffer.newPoller();
		_replyBuffer.addGatingSequences(_replyPoller.getSequence());
	}
	
	public synchronized void start() {
		if (_loopThread != null)
			throw new IllegalStateException(String.format("Worker %s has already been started.", _name));
		_isRunning = true;
		_loopThread = new Thread(new Runnable() {

			@Override
			public void run() {
				runLoop();
			}
			
		}, _name);
		_loopThread.start();
	}
	
	/**
	 * Waits for the first registration with the broker to be sent.
	 * @return {@code true} if the worker registered within the timeout
	 */
	public boolean awaitRegistered(long timeout, TimeUnit unit) throws InterruptedException {
		return _registeredLatch.await(timeout, unit);
	}
	
	public boolean isRegistered() {
		return _registeredLatch.getCount() == 0;
	}
	
	public String getName() {
		return _name;
	}
	
	public int getMaxConcurrentRequests() {
		return _maxConcurrentRequests;
	}
	
	public int getAvailablePermits() {
		return _permits.availablePermits();
	}
	
	public int getActiveRequestCount() {
		return _handler.getActiveCount();
	}
	
	public int getPeakActiveRequestCount() {
		return _handler.getPeakCount();
	}
	
	@Override
	public void close() {
		_isRunning = false;
		Thread loopThread = _loopThread;
		if (loopThread != null) {
			LockSupport.unpark(loopThread);
			try {
				loopThread.join(TimeUnit.SECONDS.toMillis(10));
			} catch (InterruptedException eInterrupted) {
				Thread.currentThread().interrupt();
			}
		}
		_executor.shutdown();
		try {
			if (!_executor.awaitTermination(10, TimeUnit.SECONDS)) {
				Log.warn(String.format("Worker %s closed with requests still in progress", _name));
			}
		} catch (InterruptedException eInterrupted) {
			Thread.currentThread().interrupt();
		}
	}
	
	private void runLoop() {
		SocketManager socketManager = _handle.getSocketManager();
		ZMQ.Poller poller = null;
		boolean hasPermit = false;
		try {
			byte[] identity = WireProtocol.toBytes(String.format("%s-%s", _name, UUID.randomUUID().toString().substring(0, 8)));
			_socket = socketManager.create(ZMQ.DEALER, SocketSettings.create().setIdentity(identity), _name);
			socketManager.connectSocket(_socket, _brokerAddress);
			poller = socketManager.createPollInSet(_socket);
			
			while (_isRunning && !isRegistered()) {
				if (sendReady()) {
					Log.info(String.format("Worker %s registered with the broker at %s", _name, _brokerAddress));
					_registeredLatch.countDown();
				}
			}
			
			while (_isRunning) {
				sendPendingReplies();
				if (!hasPermit) {
					hasPermit = _permits.tryAcquire();
				}
				if (!hasPermit) {
					// wait for a task to hand back a reply
					LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(_pollMillis));
					continue;
				}
				if (ZmqSocketOperations.poll(poller, _pollMillis) > 0 && poller.pollin(0)) {
					List<byte[]> frames = ZmqSocketOperations.recvFrames(_socket, false);
					if (frames != null && admit(frames)) {
						hasPermit = false;
						if (_permits.availablePermits() > 0) {
							sendReady();
						}
					}
				}
			}
		} catch (MessengerClosedException eClosed) {
			Log.info(String.format("Worker %s stopping: messaging closed", _name));
		} catch (Throwable t) {
			_handle.signalFatalException(t);
		} finally {
			_isRunning = false;
			if (hasPermit) {
				_permits.release();
			}
			if (poller != null) {
				poller.close();
			}
			if (_socket != null && socketManager.isActive()) {
				socketManager.destroySocket(_socket);
			}
		}
	}
	
	private boolean sendReady() {
		return ZmqSocketOperations.sendFrames(_socket, WireProtocol.readyFrame());
	}
	
	private boolean admit(List<byte[]> frames) {
		if (frames.size() != 4 || !WireProtocol.isEmpty(frames.get(0)) || !WireProtocol.isEmpty(frames.get(2))) {
			Log.warn(String.format("Worker %s dropped a malformed dispatch of %d frames", _name, frames.size()));
			return false;
		}
		RequestTask task = new RequestTask(_nextRequestId.getAndIncrement(), frames.get(1), frames.get(3));
		try {
			_executor.execute(task);
		} catch (RejectedExecutionException eRejected) {
			Log.warn(String.format("Worker %s could not schedule request %d", _name, task.requestId), eRejected);
			ZmqSocketOperations.sendFrames(_socket, WireProtocol.EMPTY_FRAME, task.clientId, 
					WireProtocol.EMPTY_FRAME, _internalErrorReply);
			_permits.release();
		}
		return true;
	}
	
	private final EventPoller.Handler<ReplyEvent> _replySender = new EventPoller.Handler<ReplyEvent>() {

		@Override
		public boolean onEvent(ReplyEvent event, long sequence, boolean endOfBatch) {
			try {
				if (!ZmqSocketOperations.sendFrames(_socket, WireProtocol.EMPTY_FRAME, event.clientId, 
						WireProtocol.EMPTY_FRAME, event.payload)) {
					Log.warn(String.format("Worker %s timed out sending a reply to the broker", _name));
				}
			} finally {
				event.clear();
			}
			return true;
		}
	};
	
	private void sendPendingReplies() throws Exception {
		_replyPoller.poll(_replySender);
	}
	
	private void handOver(byte[] clientId, byte[] reply) {
		while (!_replyBuffer.tryPublishEvent(ReplyEvent.TRANSLATOR, clientId, reply)) {
			if (!_isRunning) {
				Log.warn(String.format("Worker %s stopped before a reply could be sent", _name));
				return;
			}
			Thread.yield();
		}
		Thread loopThread = _loopThread;
		if (loopThread != null) {
			LockSupport.unpark(loopThread);
		}
	}
	
	private class RequestTask implements Runnable {
		
		private final long requestId;
		private final byte[] clientId;
		private final byte[] payload;
		private RequestState _state = RequestState.RECEIVED;
		
		public RequestTask(long requestId, byte[] clientId, byte[] payload) {
			this.requestId = requestId;
			this.clientId = clientId;
			this.payload = payload;
		}

		@Override
		public void run() {
			byte[] reply = _internalErrorReply;
			try {
				transitionTo(RequestState.PROCESSING);
				AllocationResponse response = _handler.handle(requestId, payload);
				reply = _codec.encodeResponse(response);
			} catch (Throwable t) {
				transitionTo(RequestState.FAILED);
				Log.error(String.format("Worker %s failed to process request %d", _name, requestId), t);
				reply = _internalErrorReply;
			} finally {
				try {
					handOver(clientId, reply);
					transitionTo(RequestState.COMPLETED);
				} finally {
					_permits.release();
				}
			}
		}
		
		private void transitionTo(RequestState state) {
			if (_isTracing) {
				Log.trace(String.format("Request %d: %s -> %s", requestId, _state, state));
			}
			_state = state;
		}
		
	}
	
}
