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

public final class BrokerStatus {

	private final int _registeredWorkers;
	private final int _idleWorkers;
	private final int _pendingDispatches;
	private final long _oldestPendingMillis;
	private final long _relayedReplies;
	
	public BrokerStatus(int registeredWorkers, 
			int idleWorkers,
			int pendingDispatches, 
			long oldestPendingMillis,
			long relayedReplies) {
		_registeredWorkers = registeredWorkers;
		_idleWorkers = idleWorkers;
		_pendingDispatches = pendingDispatches;
		_oldestPendingMillis = oldestPendingMillis;
		_relayedReplies = relayedReplies;
	}

	public int getRegisteredWorkers() {
		return _registeredWorkers;
	}

	public int getIdleWorkers() {
		return _idleWorkers;
	}

	public int getPendingDispatches() {
		return _pendingDispatches;
	}
	
	public long getOldestPendingMillis() {
		return _oldestPendingMillis;
	}

	public long getRelayedReplies() {
		return _relayedReplies;
	}

	@Override
	public String toString() {
		return String.format("%d registered workers, %d idle, %d pending dispatches (oldest %dms), %d replies relayed", 
				_registeredWorkers, _idleWorkers, _pendingDispatches, _oldestPendingMillis, _relayedReplies);
	}
	
}
