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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.messaging.SocketIdentity;
import com.esotericsoftware.minlog.Log;

/**
 * The registered workers and the FIFO queue of idle workers. Only accessed
 * by the broker loop thread.
 */
public final class WorkerPool {

	private final Clock _clock;
	private final Map<SocketIdentity, WorkerHandle> _registered = new LinkedHashMap<>();
	private final Deque<WorkerHandle> _idleQueue;
	
	public WorkerPool(Clock clock) {
		this(clock, new ArrayDeque<WorkerHandle>());
	}
	
	WorkerPool(Clock clock, Deque<WorkerHandle> idleQueue) {
		_clock = Objects.requireNonNull(clock);
		_idleQueue = Objects.requireNonNull(idleQueue);
	}
	
	/**
	 * Registers the worker if it is unknown and places it at the back of the
	 * idle queue unless it is already idle.
	 * 
	 * @return {@code true} if the worker was added to the idle queue
	 */
	public boolean markIdle(SocketIdentity workerId) {
		WorkerHandle handle = _registered.get(workerId);
		if (handle == null) {
			handle = new WorkerHandle(workerId.copyWithNewArray(), _clock.currentMillis());
			_registered.put(handle.getIdentity(), handle);
			Log.info(String.format("Registered worker %s (%d registered)", workerId, _registered.size()));
		}
		if (handle.getState() == WorkerState.IDLE) {
			return false;
		}
		handle.setState(WorkerState.IDLE);
		_idleQueue.addLast(handle);
		return true;
	}
	
	public boolean hasIdleWorker() {
		return !_idleQueue.isEmpty();
	}
	
	/**
	 * Takes the worker at the front of the idle queue and marks it busy.
	 * @return the worker, or {@code null} if no worker is idle
	 */
	public WorkerHandle takeIdle() {
		WorkerHandle handle = _idleQueue.pollFirst();
		if (handle != null) {
			handle.setState(WorkerState.BUSY);
			handle.incrementDispatchCount();
		}
		return handle;
	}
	
	public WorkerHandle get(SocketIdentity workerId) {
		return _registered.get(workerId);
	}
	
	/**
	 * Removes repeated and non-idle entries from the idle queue, keeping
	 * the first occurrence of each idle worker in place.
	 * 
	 * @return the number of entries removed
	 */
	public int deduplicate() {
		Set<WorkerHandle> seen = Collections.newSetFromMap(new IdentityHashMap<WorkerHandle, Boolean>());
		int removed = 0;
		Iterator<WorkerHandle> it = _idleQueue.iterator();
		while (it.hasNext()) {
			WorkerHandle handle = it.next();
			if (handle.getState() != WorkerState.IDLE || !seen.add(handle)) {
				it.remove();
				removed++;
			}
		}
		if (removed > 0) {
			Log.warn(String.format("Removed %d stale entries from the idle worker queue", removed));
		}
		return removed;
	}
	
	public int getRegisteredCount() {
		return _registered.size();
	}
	
	public int getIdleCount() {
		return _idleQueue.size();
	}
	
	public Collection<WorkerHandle> getWorkers() {
		return Collections.unmodifiableCollection(_registered.values());
	}
	
}
