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

/**
 * Signals that the messaging context backing a socket has been
 * terminated. Loops treat this as a request to shut down.
 */
public final class MessengerClosedException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	
	public static final MessengerClosedException INSTANCE = new MessengerClosedException();
	
	private MessengerClosedException() {
		super("The messaging context has been terminated.", null, false, false);
	}
	
}
