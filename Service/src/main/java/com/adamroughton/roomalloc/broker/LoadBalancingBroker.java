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
package com.adamroughton.roomalloc.broker;

import java.io.Closeable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.messaging.MessengerClosedException;
import com.adamroughton.roomalloc.messaging.SocketIdentity;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.adamroughton.roomalloc.model.ErrorResponse;
import com.esotericsoftware.minlog.Log;

/**
 * Routes client requests to a pool of workers over two ROUTER sockets.
 * <p>
 * Frame layouts:
 * <ul>
 * <li>client to frontend: {@code [client-id, "", payload]}</li>
 * <li>backend to worker: {@code [worker-id, "", client-id, "", payload]}</li>
 * <li>worker reply: {@code [worker-id, "", client-id, "", payload]}</li>
 * <li>worker registration: {@code [worker-id, "READY"]}</li>
 * <li>frontend to client: {@code [client-id, "", payload]}</li>
 * </ul>
 * The frontend is only read while at least one worker is idle. Workers are
 * never health-checked or evicted.
 */
public final class LoadBalancingBroker implements Closeable {

	public static final String TRACE_FLAG = "broker";
	
	private final RoomAllocHandle _handle;
	private final SocketSettings _frontendSettings;
	private final SocketSettings _backendSettings;
	private final JsonCodec _codec;
	private final long _pollMillis;
	private final long _maintenanceMillis;
	private final boolean _isTracing;
	private final byte[] _invalidResponseReply;
	
	private final WorkerPool _workerPool;
	private final PendingDispatchTable _pendingDispatches;
	private final CountDownLatch _startedLatch = new CountDownLatch(1);
	
	private volatile boolean _isRunning = false;
	private volatile BrokerStatus _lastStatus = new BrokerStatus(0, 0, 0, 0, 0);
	private Thread _loopThread;
	
	// only accessed by the loop thread
	private ZMQ.Socket _frontend;
	private ZMQ.Socket _backend;
	private long _relayedCount = 0;
	private long _nextMaintenance;
	
	public LoadBalancingBroker(
			RoomAllocHandle handle,
			SocketSettings frontendSettings,
			SocketSettings backendSettings,
			JsonCodec codec,
			long pollMillis,
			long maintenanceMillis) {
		_handle = Objects.requireNonNull(handle);
		_frontendSettings = Objects.requireNonNull(frontendSettings);
		_backendSettings = Objects.requireNonNull(backendSettings);
		_codec = Objects.requireNonNull(codec);
		if (pollMillis < 1 || maintenanceMillis < 1)
			throw new IllegalArgumentException("The poll and maintenance periods must be positive.");
		_pollMillis = pollMillis;
		_maintenanceMillis = maintenanceMillis;
		_isTracing = handle.shouldTrace(TRACE_FLAG);
		_invalidResponseReply = codec.encodeError(ErrorResponse.INVALID_ALLOCATOR_RESPONSE);
		
		Clock clock = handle.getClock();
		_workerPool = new WorkerPool(clock);
		_pendingDispatches = new PendingDispatchTable(clock);
	}
	
	public synchronized void start() {
		if (_loopThread != null)
			throw new IllegalStateException("The broker has already been started.");
		_isRunning = true;
		_loopThread = new Thread(new Runnable() {

			@Override
			public void run() {
				runLoop();
			}
			
		}, "broker");
		_loopThread.start();
	}
	
	/**
	 * Waits for both sockets to be bound.
	 */
	public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
		return _startedLatch.await(timeout, unit);
	}
	
	/**
	 * Gets the counts captured at the last maintenance tick.
	 */
	public BrokerStatus getStatus() {
		return _lastStatus;
	}
	
	@Override
	public void close() {
		_isRunning = false;
		Thread loopThread = _loopThread;
		if (loopThread != null) {
			try {
				loopThread.join(TimeUnit.SECONDS.toMillis(10));
			} catch (InterruptedException eInterrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}
	
	private void runLoop() {
		SocketManager socketManager = _handle.getSocketManager();
		ZMQ.Poller backendOnly = null;
		ZMQ.Poller both = null;
		try {
			_frontend = socketManager.create(ZMQ.ROUTER, _frontendSettings, "frontend");
			_backend = socketManager.create(ZMQ.ROUTER, _backendSettings, "backend");
			backendOnly = socketManager.createPollInSet(_backend);
			both = socketManager.createPollInSet(_backend, _frontend);
			Log.info("Broker started");
			_startedLatch.countDown();
			
			_nextMaintenance = _handle.getClock().currentMillis() + _maintenanceMillis;
			while (_isRunning) {
				ZMQ.Poller poller = _workerPool.hasIdleWorker()? both : backendOnly;
				if (ZmqSocketOperations.poll(poller, _pollMillis) > 0) {
					if (poller.pollin(0)) {
						drainBackend();
					}
					if (poller == both && poller.pollin(1)) {
						drainFrontend();
					}
				}
				if (_handle.getClock().currentMillis() >= _nextMaintenance) {
					runMaintenance();
				}
			}
		} catch (MessengerClosedException eClosed) {
			Log.info("Broker stopping: messaging closed");
		} catch (Throwable t) {
			_handle.signalFatalException(t);
		} finally {
			_isRunning = false;
			if (backendOnly != null) backendOnly.close();
			if (both != null) both.close();
			if (_frontend != null) socketManager.destroySocket(_frontend);
			if (_backend != null) socketManager.destroySocket(_backend);
		}
	}
	
	private void drainBackend() {
		List<byte[]> frames;
		while ((frames = ZmqSocketOperations.recvFrames(_backend, false)) != null) {
			onWorkerMessage(frames);
		}
	}
	
	private void drainFrontend() {
		List<byte[]> frames;
		while (_workerPool.hasIdleWorker() && (frames = ZmqSocketOperations.recvFrames(_frontend, false)) != null) {
			onClientMessage(frames);
		}
	}
	
	void onWorkerMessage(List<byte[]> frames) {
		SocketIdentity workerId = new SocketIdentity(frames.get(0));
		if (frames.size() == 2 && WireProtocol.isReady(frames.get(1))) {
			boolean added = _workerPool.markIdle(workerId);
			if (_isTracing) {
				Log.trace(String.format("READY from %s (%s)", workerId, added? "now idle" : "already idle"));
			}
		} else if (frames.size() == 5 
				&& WireProtocol.isEmpty(frames.get(1)) 
				&& WireProtocol.isEmpty(frames.get(3))) {
			relayReply(workerId, frames.get(2), frames.get(4));
		} else {
			Log.warn(String.format("Dropped a malformed message of %d frames from worker %s", frames.size(), workerId));
		}
	}
	
	private void relayReply(SocketIdentity workerId, byte[] clientIdBytes, byte[] payload) {
		SocketIdentity clientId = new SocketIdentity(clientIdBytes);
		PendingDispatch dispatch = _pendingDispatches.remove(clientId, workerId);
		if (dispatch == null) {
			Log.warn(String.format("Reply from worker %s for client %s matched no pending dispatch", workerId, clientId));
		} else if (_isTracing) {
			Log.trace(String.format("Relaying reply for dispatch %d after %dms", dispatch.getDispatchId(), 
					_handle.getClock().currentMillis() - dispatch.getDispatchedAt()));
		}
		_workerPool.markIdle(workerId);
		
		byte[] reply = payload;
		if (!_codec.isJsonObject(payload)) {
			Log.warn(String.format("Worker %s sent an unparseable reply; substituting an error", workerId));
			reply = _invalidResponseReply;
		}
		if (ZmqSocketOperations.sendFrames(_frontend, clientIdBytes, WireProtocol.EMPTY_FRAME, reply)) {
			_relayedCount++;
		} else {
			Log.warn(String.format("Timed out relaying a reply to client %s", clientId));
		}
	}
	
	void onClientMessage(List<byte[]> frames) {
		if (frames.size() != 3 || !WireProtocol.isEmpty(frames.get(1))) {
			Log.warn(String.format("Dropped a malformed client message of %d frames", frames.size()));
			return;
		}
		byte[] clientIdBytes = frames.get(0);
		WorkerHandle worker = _workerPool.takeIdle();
		PendingDispatch dispatch = _pendingDispatches.record(new SocketIdentity(clientIdBytes), worker.getIdentity());
		if (_isTracing) {
			Log.trace(String.format("Dispatching %d from %s to %s", dispatch.getDispatchId(), 
					dispatch.getClientId(), worker.getIdentity()));
		}
		if (!ZmqSocketOperations.sendFrames(_backend, worker.getIdentity().toBytes(), WireProtocol.EMPTY_FRAME, 
				clientIdBytes, WireProtocol.EMPTY_FRAME, frames.get(2))) {
			Log.warn(String.format("Timed out dispatching to worker %s", worker.getIdentity()));
		}
	}
	
	private void runMaintenance() {
		_workerPool.deduplicate();
		BrokerStatus status = new BrokerStatus(
				_workerPool.getRegisteredCount(), 
				_workerPool.getIdleCount(), 
				_pendingDispatches.size(), 
				_pendingDispatches.getOldestAgeMillis(),
				_relayedCount);
		_lastStatus = status;
		Log.info("Broker status: " + status);
		_nextMaintenance = _handle.getClock().currentMillis() + _maintenanceMillis;
	}
	
	WorkerPool getWorkerPool() {
		return _workerPool;
	}
	
	PendingDispatchTable getPendingDispatches() {
		return _pendingDispatches;
	}
	
}
