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
package com.adamroughton.roomalloc.util;

public interface Mutex<TObject> {
	
	/**
	 * Executes the provided delegate with exclusive
	 * access to the object, releasing access when the delegate
	 * completes. Blocks while another thread owns the object.
	 * 
	 * @param delegate the delegate to execute
	 */
	void runAsOwner(OwnerDelegate<TObject> delegate);
	
	/**
	 * As {@link #runAsOwner(OwnerDelegate)}, returning the
	 * value computed by the delegate.
	 */
	<TResult> TResult callAsOwner(OwnerFunction<TObject, TResult> function);
	
	boolean isOwned();
	
	public interface OwnerDelegate<TObject> {
		void asOwner(TObject item);
	}
	
	public interface OwnerFunction<TObject, TResult> {
		TResult asOwner(TObject item);
	}
}
