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

public final class StandbyStatus {

	private final FailoverState _state;
	private final int _activeRequests;
	private final int _availablePermits;
	private final int _maxConcurrentRequests;
	private final long _millisSinceLastBeacon;
	private final long _appliedSnapshots;
	
	public StandbyStatus(FailoverState state, 
			int activeRequests,
			int availablePermits, 
			int maxConcurrentRequests,
			long millisSinceLastBeacon,
			long appliedSnapshots) {
		_state = state;
		_activeRequests = activeRequests;
		_availablePermits = availablePermits;
		_maxConcurrentRequests = maxConcurrentRequests;
		_millisSinceLastBeacon = millisSinceLastBeacon;
		_appliedSnapshots = appliedSnapshots;
	}

	public FailoverState getState() {
		return _state;
	}

	public int getActiveRequests() {
		return _activeRequests;
	}

	public int getAvailablePermits() {
		return _availablePermits;
	}

	public int getMaxConcurrentRequests() {
		return _maxConcurrentRequests;
	}

	public long getMillisSinceLastBeacon() {
		return _millisSinceLastBeacon;
	}
	
	public long getAppliedSnapshots() {
		return _appliedSnapshots;
	}

	@Override
	public String toString() {
		return String.format("state %s, %d active requests, %d/%d permits available, %dms since last heartbeat, %d snapshots applied", 
				_state, _activeRequests, _availablePermits, _maxConcurrentRequests, _millisSinceLastBeacon, _appliedSnapshots);
	}
	
}
