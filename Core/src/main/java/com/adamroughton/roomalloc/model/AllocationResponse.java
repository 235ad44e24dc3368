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
package com.adamroughton.roomalloc.model;

/**
 * The reply to an {@link AllocationRequest}: exactly one of 
 * {@link SuccessResponse}, {@link UnavailableResponse} or 
 * {@link ErrorResponse}, discriminated by {@link #getType()}.
 */
public abstract class AllocationResponse {

	private final ResponseType _type;
	
	protected AllocationResponse(ResponseType type) {
		_type = type;
	}
	
	public final ResponseType getType() {
		return _type;
	}
	
	public final boolean isSuccess() {
		return _type == ResponseType.SUCCESS;
	}
	
	public <TResponse extends AllocationResponse> TResponse as(Class<TResponse> responseClass) {
		if (!responseClass.isInstance(this))
			throw new IllegalStateException(String.format("The response is %s, not %s.", _type, responseClass.getSimpleName()));
		return responseClass.cast(this);
	}
	
}
