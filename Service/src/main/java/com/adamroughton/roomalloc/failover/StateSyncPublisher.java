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

import java.util.Objects;

import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.model.StateSnapshot;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.util.Mutex.OwnerFunction;
import com.adamroughton.roomalloc.worker.ResourceTable;

/**
 * Publishes a full snapshot of the resource table every period.
 */
public final class StateSyncPublisher extends PeriodicPublisher {

	private final Mutex<ResourceTable> _tableMutex;
	private final JsonCodec _codec;
	
	public StateSyncPublisher(RoomAllocHandle handle, 
			SocketSettings socketSettings, 
			long periodMillis,
			Mutex<ResourceTable> tableMutex,
			JsonCodec codec) {
		super(handle, socketSettings, periodMillis, "state-sync-publisher");
		_tableMutex = Objects.requireNonNull(tableMutex);
		_codec = Objects.requireNonNull(codec);
	}

	@Override
	protected byte[] nextPayload() {
		StateSnapshot snapshot = _tableMutex.callAsOwner(new OwnerFunction<ResourceTable, StateSnapshot>() {

			@Override
			public StateSnapshot asOwner(ResourceTable table) {
				return table.toSnapshot();
			}
			
		});
		return _codec.encodeSnapshot(snapshot);
	}

}
