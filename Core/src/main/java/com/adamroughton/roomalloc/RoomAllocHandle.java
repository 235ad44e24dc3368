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
package com.adamroughton.roomalloc;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.esotericsoftware.minlog.Log;

/**
 * The per-process context handed to every component at construction. Holds
 * the clock, the socket manager and the fatal exception policy for the node.
 */
public class RoomAllocHandle implements FatalExceptionCallback {
	
	/**
	 * Fatal exception policy for node processes: log and exit.
	 */
	public static final FatalExceptionCallback EXIT_PROCESS = new FatalExceptionCallback() {
		
		@Override
		public void signalFatalException(Throwable exception) {
			System.exit(1);
		}
	};
	
	private final AtomicBoolean _isShuttingDown = new AtomicBoolean(false);
	
	private final Clock _clock;
	private final SocketManager _socketManager;
	private final Set<String> _traceFlagLookup;
	private final FatalExceptionCallback _fatalPolicy;
	
	public RoomAllocHandle(
			Clock clock, 
			SocketManager socketManager,
			Set<String> traceFlagLookup,
			FatalExceptionCallback fatalPolicy) {
		_clock = Objects.requireNonNull(clock);
		_socketManager = Objects.requireNonNull(socketManager);
		_traceFlagLookup = Objects.requireNonNull(traceFlagLookup);
		_fatalPolicy = Objects.requireNonNull(fatalPolicy);
	}
	
	public Clock getClock() {
		return _clock;
	}
	
	public SocketManager getSocketManager() {
		return _socketManager;
	}
	
	@Override
	public void signalFatalException(Throwable exception) {
		Log.error("Fatal exception:", exception);
		if (!_isShuttingDown.getAndSet(true)) {
			_fatalPolicy.signalFatalException(exception);
		}
	}
	
	public boolean shouldTrace(String componentType) {
		return _traceFlagLookup.contains(componentType);
	}
	
	public boolean isShuttingDown() {
		return _isShuttingDown.get();
	}

	public void shutdown() {
		_isShuttingDown.set(true);
		_socketManager.close();
	}

}
