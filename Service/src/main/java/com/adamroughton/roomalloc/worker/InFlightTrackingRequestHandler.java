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
package com.adamroughton.roomalloc.worker;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import com.adamroughton.roomalloc.model.AllocationResponse;

/**
 * Counts the requests currently inside the decorated handler and the
 * highest count seen.
 */
public final class InFlightTrackingRequestHandler implements RequestHandler {

	private final RequestHandler _decoratedHandler;
	private final AtomicInteger _activeCount = new AtomicInteger(0);
	private final AtomicInteger _peakCount = new AtomicInteger(0);
	
	public InFlightTrackingRequestHandler(RequestHandler decoratedHandler) {
		_decoratedHandler = Objects.requireNonNull(decoratedHandler);
	}
	
	@Override
	public AllocationResponse handle(long requestId, byte[] payload) {
		int active = _activeCount.incrementAndGet();
		int peak;
		do {
			peak = _peakCount.get();
		} while (active > peak && !_peakCount.compareAndSet(peak, active));
		try {
			return _decoratedHandler.handle(requestId, payload);
		} finally {
			_activeCount.decrementAndGet();
		}
	}
	
	public int getActiveCount() {
		return _activeCount.get();
	}
	
	public int getPeakCount() {
		return _peakCount.get();
	}

}
