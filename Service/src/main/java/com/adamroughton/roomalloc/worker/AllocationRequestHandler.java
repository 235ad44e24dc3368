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

import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.ValidationException;
import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.ErrorResponse;

public final class AllocationRequestHandler implements RequestHandler {

	private final JsonCodec _codec;
	private final ResourceAllocator _allocator;
	
	public AllocationRequestHandler(JsonCodec codec, ResourceAllocator allocator) {
		_codec = Objects.requireNonNull(codec);
		_allocator = Objects.requireNonNull(allocator);
	}
	
	@Override
	public AllocationResponse handle(long requestId, byte[] payload) {
		AllocationRequest request;
		try {
			request = _codec.decodeRequest(payload);
		} catch (ValidationException eInvalid) {
			return new ErrorResponse(eInvalid.getMessage());
		}
		return _allocator.allocate(request);
	}

}
