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
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.javatuples.Pair;

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.messaging.SocketIdentity;

/**
 * In-flight requests keyed by (client, worker). A client may have several
 * requests in flight on the same worker; they are matched oldest first.
 */
public final class PendingDispatchTable {

	private final Clock _clock;
	private final Map<Pair<SocketIdentity, SocketIdentity>, Deque<PendingDispatch>> _pending = new HashMap<>();
	private long _nextDispatchId = 0;
	private int _size = 0;
	
	public PendingDispatchTable(Clock clock) {
		_clock = Objects.requireNonNull(clock);
	}
	
	public PendingDispatch record(SocketIdentity clientId, SocketIdentity workerId) {
		PendingDispatch dispatch = new PendingDispatch(_nextDispatchId++, clientId.copyWithNewArray(), 
				workerId, _clock.currentMillis());
		Pair<SocketIdentity, SocketIdentity> key = Pair.with(dispatch.getClientId(), workerId);
		Deque<PendingDispatch> dispatches = _pending.get(key);
		if (dispatches == null) {
			dispatches = new ArrayDeque<>(2);
			_pending.put(key, dispatches);
		}
		dispatches.addLast(dispatch);
		_size++;
		return dispatch;
	}
	
	/**
	 * Removes the oldest dispatch for the given client and worker.
	 * @return the removed dispatch, or {@code null} if there was none
	 */
	public PendingDispatch remove(SocketIdentity clientId, SocketIdentity workerId) {
		Pair<SocketIdentity, SocketIdentity> key = Pair.with(clientId, workerId);
		Deque<PendingDispatch> dispatches = _pending.get(key);
		if (dispatches == null) {
			return null;
		}
		PendingDispatch dispatch = dispatches.pollFirst();
		if (dispatches.isEmpty()) {
			_pending.remove(key);
		}
		if (dispatch != null) {
			_size--;
		}
		return dispatch;
	}
	
	public int size() {
		return _size;
	}
	
	/**
	 * Gets the age of the oldest in-flight request, or 0 if none are in flight.
	 */
	public long getOldestAgeMillis() {
		long now = _clock.currentMillis();
		long oldest = now;
		for (Deque<PendingDispatch> dispatches : _pending.values()) {
			PendingDispatch first = dispatches.peekFirst();
			if (first != null && first.getDispatchedAt() < oldest) {
				oldest = first.getDispatchedAt();
			}
		}
		return now - oldest;
	}
	
}
