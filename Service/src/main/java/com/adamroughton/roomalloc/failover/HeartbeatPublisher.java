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

import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;

/**
 * Emits {@code HEARTBEAT <ISO-8601 instant>} every period while the
 * primary is alive.
 */
public final class HeartbeatPublisher extends PeriodicPublisher {

	public HeartbeatPublisher(RoomAllocHandle handle, SocketSettings socketSettings, long periodMillis) {
		super(handle, socketSettings, periodMillis, "heartbeat-publisher");
	}

	@Override
	protected byte[] nextPayload() {
		return WireProtocol.toBytes(WireProtocol.formatHeartbeat(getClock().currentMillis()));
	}

}
