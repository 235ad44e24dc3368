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
package com.adamroughton.roomalloc.messaging;

public class CommunicationException extends Exception {

	private static final long serialVersionUID = 1L;
	
	private final boolean _isRetryable;
	
	public CommunicationException(String message, boolean isRetryable) {
		super(message);
		_isRetryable = isRetryable;
	}
	
	public CommunicationException(String message, boolean isRetryable, Throwable cause) {
		super(message, cause);
		_isRetryable = isRetryable;
	}
	
	public static CommunicationException timedOut(String operation, long timeoutMillis) {
		return new CommunicationException(String.format("Timed out after %dms while trying to %s.", 
				timeoutMillis, operation), true);
	}
	
	/**
	 * Indicates whether the same request may be sent again; timeouts
	 * are retryable, malformed exchanges are not.
	 */
	public boolean isRetryable() {
		return _isRetryable;
	}
	
}
