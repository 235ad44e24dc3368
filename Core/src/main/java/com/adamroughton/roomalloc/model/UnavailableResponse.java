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

import java.util.Objects;

public final class UnavailableResponse extends AllocationResponse {

	private final String _message;
	
	public UnavailableResponse(String message) {
		super(ResponseType.UNAVAILABLE);
		_message = Objects.requireNonNull(message);
	}
	
	public String getMessage() {
		return _message;
	}

	@Override
	public String toString() {
		return "UnavailableResponse [message=" + _message + "]";
	}
	
}
