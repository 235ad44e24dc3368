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

import java.util.Objects;

import com.adamroughton.roomalloc.messaging.SocketIdentity;

/**
 * Routing metadata for one registered worker. Handles are never removed
 * from the pool once created.
 */
public final class WorkerHandle {

	private final SocketIdentity _identity;
	private final long _registeredAt;
	private WorkerState _state = WorkerState.REGISTERED;
	private long _dispatchCount = 0;
	
	public WorkerHandle(SocketIdentity identity, long registeredAt) {
		_identity = Objects.requireNonNull(identity);
		_registeredAt = registeredAt;
	}
	
	public SocketIdentity getIdentity() {
		return _identity;
	}
	
	public long getRegisteredAt() {
		return _registeredAt;
	}
	
	public WorkerState getState() {
		return _state;
	}
	
	void setState(WorkerState state) {
		_state = Objects.requireNonNull(state);
	}
	
	public long getDispatchCount() {
		return _dispatchCount;
	}
	
	void incrementDispatchCount() {
		_dispatchCount++;
	}

	@Override
	public String toString() {
		return "WorkerHandle [identity=" + _identity + ", state=" + _state
				+ ", dispatchCount=" + _dispatchCount + "]";
	}
	
}
