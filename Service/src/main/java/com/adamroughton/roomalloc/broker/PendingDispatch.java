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

public final class PendingDispatch {

	private final long _dispatchId;
	private final SocketIdentity _clientId;
	private final SocketIdentity _workerId;
	private final long _dispatchedAt;
	
	public PendingDispatch(long dispatchId, SocketIdentity clientId, SocketIdentity workerId, long dispatchedAt) {
		_dispatchId = dispatchId;
		_clientId = Objects.requireNonNull(clientId);
		_workerId = Objects.requireNonNull(workerId);
		_dispatchedAt = dispatchedAt;
	}
	
	public long getDispatchId() {
		return _dispatchId;
	}

	public SocketIdentity getClientId() {
		return _clientId;
	}

	public SocketIdentity getWorkerId() {
		return _workerId;
	}

	public long getDispatchedAt() {
		return _dispatchedAt;
	}

	@Override
	public String toString() {
		return "PendingDispatch [dispatchId=" + _dispatchId + ", clientId="
				+ _clientId + ", workerId=" + _workerId + ", dispatchedAt="
				+ _dispatchedAt + "]";
	}
	
}
