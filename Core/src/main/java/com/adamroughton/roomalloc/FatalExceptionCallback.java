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

public interface FatalExceptionCallback {
	
	/**
	 * Signals that a component has failed in a way it cannot
	 * recover from. Implementations decide whether the process
	 * should exit.
	 * @param exception the cause of the failure
	 */
	void signalFatalException(Throwable exception);
	
}
