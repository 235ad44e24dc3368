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
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.config.ConfigurationUtil;
import com.adamroughton.roomalloc.config.Timing;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.PersistenceException;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.data.ValidationException;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.StateSnapshot;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.util.Mutex.OwnerDelegate;
import com.adamroughton.roomalloc.util.Util;
import com.adamroughton.roomalloc.worker.AllocatorWorker;
import com.adamroughton.roomalloc.worker.ResourceTable;
import com.esotericsoftware.minlog.Log;

/**
 * Keeps a replica of the primary's resource table warm and takes over as a
 * worker when the primary's heartbeat goes silent.
 * <p>
 * Every received snapshot is merged into the replica table and saved to the
 * replica's own store, both before and after promotion. Promotion starts a
 * worker over the replica table; the replica is seeded from the store first
 * if no snapshot was ever received. There is no demotion: a primary that
 * resumes beaconing after promotion leaves both nodes registered.
 */
public final class StandbyReplica implements Closeable {

	public static final String TRACE_FLAG = "failover";
	
	public interface WorkerFactory {
		AllocatorWorker create(Mutex<ResourceTable> tableMutex);
	}
	
	private final RoomAllocHandle _handle;
	private final Clock _clock;
	private final Mutex<ResourceTable> _tableMutex;
	private final ResourceTableStore _store;
	private final JsonCodec _codec;
	private final WorkerFactory _workerFactory;
	private final long _heartbeatTimeoutMillis;
	private final long _heartbeatCheckMillis;
	private final long _statusReportMillis;
	private final long _registrationTimeoutMillis;
	private final boolean _isTracing;
	
	private final FeedSubscriber _heartbeatSubscriber;
	private final FeedSubscriber _syncSubscriber;
	private final ScheduledExecutorService _timer;
	
	private final AtomicReference<FailoverState> _state = new AtomicReference<>(FailoverState.STANDBY);
	private final AtomicLong _lastObserved = new AtomicLong();
	private final AtomicLong _appliedSnapshots = new AtomicLong(0);
	private final CountDownLatch _activeLatch = new CountDownLatch(1);
	private volatile boolean _hasReceivedSnapshot = false;
	private volatile AllocatorWorker _worker;
	
	public StandbyReplica(
			RoomAllocHandle handle,
			String heartbeatAddress,
			String syncAddress,
			Mutex<ResourceTable> tableMutex,
			ResourceTableStore store,
			JsonCodec codec,
			Timing timing,
			WorkerFactory workerFactory) {
		_handle = Objects.requireNonNull(handle);
		_clock = handle.getClock();
		_tableMutex = Objects.requireNonNull(tableMutex);
		_store = Objects.requireNonNull(store);
		_codec = Objects.requireNonNull(codec);
		_workerFactory = Objects.requireNonNull(workerFactory);
		ConfigurationUtil.assertTimingValid(timing);
		_heartbeatTimeoutMillis = timing.getHeartbeatTimeoutMillis();
		_heartbeatCheckMillis = timing.getHeartbeatCheckMillis();
		_statusReportMillis = timing.getStatusReportMillis();
		_registrationTimeoutMillis = Math.max(timing.getHeartbeatCheckMillis(), 1000);
		_isTracing = handle.shouldTrace(TRACE_FLAG);
		_lastObserved.set(_clock.currentMillis());
		
		_heartbeatSubscriber = new FeedSubscriber(handle, heartbeatAddress, new FeedListener() {
			
			@Override
			public void onMessage(byte[] payload) {
				onHeartbeat(payload);
			}
		}, "heartbeat-subscriber");
		_syncSubscriber = new FeedSubscriber(handle, syncAddress, new FeedListener() {
			
			@Override
			public void onMessage(byte[] payload) {
				onSnapshot(payload);
			}
		}, "sync-subscriber");
		_timer = Executors.newSingleThreadScheduledExecutor(Util.namedThreadFactory("standby-timer", true));
	}
	
	/**
	 * Seeds the replica from its store, starts both feed listeners and the
	 * heartbeat check timer. The silence window starts now.
	 */
	public void start() {
		try {
			loadFromStore();
		} catch (PersistenceException ePersist) {
			Log.warn(String.format("Could not load the replica table from '%s'", _store.getLocation()), ePersist);
		}
		_lastObserved.set(_clock.currentMillis());
		_heartbeatSubscriber.start();
		_syncSubscriber.start();
		_timer.scheduleWithFixedDelay(new Runnable() {

			@Override
			public void run() {
				try {
					checkHeartbeat();
				} catch (Throwable t) {
					_handle.signalFatalException(t);
				}
			}
			
		}, _heartbeatCheckMillis, _heartbeatCheckMillis, TimeUnit.MILLISECONDS);
		_timer.scheduleWithFixedDelay(new Runnable() {

			@Override
			public void run() {
				Log.info("Standby status: " + getStatus());
			}
			
		}, _statusReportMillis, _statusReportMillis, TimeUnit.MILLISECONDS);
		Log.info(String.format("Standby started (timeout %dms, check every %dms)", _heartbeatTimeoutMillis, _heartbeatCheckMillis));
	}
	
	public boolean awaitListening(long timeout, TimeUnit unit) throws InterruptedException {
		long deadline = System.nanoTime() + unit.toNanos(timeout);
		return _heartbeatSubscriber.awaitStarted(timeout, unit) 
				&& _syncSubscriber.awaitStarted(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
	}
	
	void onHeartbeat(byte[] payload) {
		String beacon = WireProtocol.fromBytes(payload);
		final long beaconInstant;
		try {
			beaconInstant = WireProtocol.parseHeartbeat(beacon);
		} catch (IllegalArgumentException eMalformed) {
			Log.warn(String.format("Ignored malformed heartbeat '%s'", beacon));
			return;
		}
		_lastObserved.set(_clock.currentMillis());
		if (_isTracing) {
			Log.trace(String.format("Heartbeat from %d", beaconInstant));
		}
	}
	
	void onSnapshot(byte[] payload) {
		final StateSnapshot snapshot;
		try {
			snapshot = _codec.decodeSnapshot(payload);
		} catch (ValidationException eInvalid) {
			Log.warn("Discarded an invalid state snapshot", eInvalid);
			return;
		}
		applySnapshot(snapshot);
	}
	
	/**
	 * Merges the snapshot into the replica table and saves the table.
	 */
	public void applySnapshot(final StateSnapshot snapshot) {
		_tableMutex.runAsOwner(new OwnerDelegate<ResourceTable>() {

			@Override
			public void asOwner(ResourceTable table) {
				int inserted = table.applySnapshot(snapshot);
				try {
					_store.save(table.getResources());
				} catch (PersistenceException ePersist) {
					Log.warn(String.format("Failed to save the replica table to '%s'", _store.getLocation()), ePersist);
				}
				if (_isTracing) {
					Log.trace(String.format("Applied snapshot of %d resources (%d new)", snapshot.size(), inserted));
				}
			}
			
		});
		_hasReceivedSnapshot = true;
		_appliedSnapshots.incrementAndGet();
	}
	
	/**
	 * Promotes the replica if the heartbeat has been silent for longer
	 * than the timeout. Only acts while in {@link FailoverState#STANDBY} and
	 * while the node is not shutting down.
	 */
	public void checkHeartbeat() {
		if (_handle.isShuttingDown()) return;
		long silence = _clock.currentMillis() - _lastObserved.get();
		if (silence <= _heartbeatTimeoutMillis) return;
		if (!_state.compareAndSet(FailoverState.STANDBY, FailoverState.ACTIVATING)) return;
		
		Log.warn(String.format("No heartbeat for %dms; activating", silence));
		try {
			promote();
			_state.set(FailoverState.ACTIVE);
			_activeLatch.countDown();
			Log.info("Standby is now ACTIVE");
		} catch (Exception e) {
			Log.error("Activation failed; returning to STANDBY", e);
			_state.set(FailoverState.STANDBY);
		}
	}
	
	private void promote() throws Exception {
		if (!_hasReceivedSnapshot) {
			Log.info(String.format("No snapshot received; seeding from '%s'", _store.getLocation()));
			loadFromStore();
		}
		AllocatorWorker worker = _workerFactory.create(_tableMutex);
		try {
			worker.start();
			if (!worker.awaitRegistered(_registrationTimeoutMillis, TimeUnit.MILLISECONDS)) 
				throw new TimeoutException(String.format("Worker %s did not register within %dms", 
						worker.getName(), _registrationTimeoutMillis));
		} catch (Exception e) {
			worker.close();
			throw e;
		}
		_worker = worker;
	}
	
	private void loadFromStore() throws PersistenceException {
		List<Resource> stored = _store.load();
		final StateSnapshot snapshot = new StateSnapshot(stored);
		_tableMutex.runAsOwner(new OwnerDelegate<ResourceTable>() {

			@Override
			public void asOwner(ResourceTable table) {
				table.applySnapshot(snapshot);
			}
			
		});
	}
	
	public FailoverState getState() {
		return _state.get();
	}
	
	public boolean awaitActive(long timeout, TimeUnit unit) throws InterruptedException {
		return _activeLatch.await(timeout, unit);
	}
	
	public boolean hasReceivedSnapshot() {
		return _hasReceivedSnapshot;
	}
	
	public StandbyStatus getStatus() {
		AllocatorWorker worker = _worker;
		int activeRequests = 0;
		int availablePermits = 0;
		int maxConcurrentRequests = 0;
		if (worker != null) {
			activeRequests = worker.getActiveRequestCount();
			availablePermits = worker.getAvailablePermits();
			maxConcurrentRequests = worker.getMaxConcurrentRequests();
		}
		return new StandbyStatus(_state.get(), activeRequests, availablePermits, maxConcurrentRequests, 
				_clock.currentMillis() - _lastObserved.get(), _appliedSnapshots.get());
	}
	
	@Override
	public void close() {
		_timer.shutdownNow();
		try {
			_timer.awaitTermination(5, TimeUnit.SECONDS);
		} catch (InterruptedException eInterrupted) {
			Thread.currentThread().interrupt();
		}
		_heartbeatSubscriber.close();
		_syncSubscriber.close();
		AllocatorWorker worker = _worker;
		if (worker != null) {
			worker.close();
		}
	}
	
}
