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

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.data.JsonCodec;

public final class RequestHandlers {

	private RequestHandlers() {
	}
	
	/**
	 * The handler chain used by allocator nodes: request decoding and
	 * allocation, wrapped with logging.
	 */
	public static RequestHandler forAllocator(JsonCodec codec, ResourceAllocator allocator, Clock clock) {
		return log(new AllocationRequestHandler(codec, allocator), clock);
	}
	
	public static RequestHandler log(RequestHandler handler, Clock clock) {
		return new LoggingRequestHandler(handler, clock);
	}
	
	public static InFlightTrackingRequestHandler track(RequestHandler handler) {
		return new InFlightTrackingRequestHandler(handler);
	}
	
}
