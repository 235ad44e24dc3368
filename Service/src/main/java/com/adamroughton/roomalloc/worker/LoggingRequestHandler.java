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

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.esotericsoftware.minlog.Log;

public final class LoggingRequestHandler implements RequestHandler {

	private final RequestHandler _decoratedHandler;
	private final Clock _clock;
	
	public LoggingRequestHandler(RequestHandler decoratedHandler, Clock clock) {
		_decoratedHandler = Objects.requireNonNull(decoratedHandler);
		_clock = Objects.requireNonNull(clock);
	}
	
	@Override
	public AllocationResponse handle(long requestId, byte[] payload) {
		long startTime = _clock.nanoTime();
		try {
			AllocationResponse response = _decoratedHandler.handle(requestId, payload);
			Log.info(String.format("Request %d completed as %s in %.3fms", requestId, response.getType(), 
					elapsedMillis(startTime)));
			return response;
		} catch (RuntimeException e) {
			Log.warn(String.format("Request %d failed after %.3fms", requestId, elapsedMillis(startTime)), e);
			throw e;
		}
	}
	
	private double elapsedMillis(long startTime) {
		return (_clock.nanoTime() - startTime) / 1000000d;
	}

}
