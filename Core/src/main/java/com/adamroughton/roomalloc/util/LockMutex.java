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

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link Mutex} that guards a single object with one re-entrant lock.
 * Callers wait for ownership rather than failing fast.
 *
 * @param <TObject> the type of the guarded object
 */
public final class LockMutex<TObject> implements Mutex<TObject> {

	private final TObject _object;
	
	private final Lock _lock = new ReentrantLock();
	private final Condition _released = _lock.newCondition();
	private Thread _owningThread = null;
	private int _reentrantCount = 0;
	
	public LockMutex(TObject object) {
		_object = Objects.requireNonNull(object);
	}
	
	@Override
	public void runAsOwner(OwnerDelegate<TObject> delegate) {
		takeOwnership();
		try {
			delegate.asOwner(_object);
		} finally {
			releaseOwnership();
		}
	}

	@Override
	public <TResult> TResult callAsOwner(OwnerFunction<TObject, TResult> function) {
		takeOwnership();
		try {
			return function.asOwner(_object);
		} finally {
			releaseOwnership();
		}
	}

	@Override
	public boolean isOwned() {
		_lock.lock();
		try {
			return _owningThread != null;
		} finally {
			_lock.unlock();
		}
	}

	private void takeOwnership() {
		Thread current = Thread.currentThread();
		_lock.lock();
		try {
			if (_owningThread == current) {
				_reentrantCount++;
				return;
			}
			while (_owningThread != null) {
				_released.awaitUninterruptibly();
			}
			_owningThread = current;
			_reentrantCount = 0;
		} finally {
			_lock.unlock();
		}
	}
	
	private void releaseOwnership() {
		Thread current = Thread.currentThread();
		_lock.lock();
		try {
			if (_owningThread == current) {
				if (_reentrantCount > 0) {
					_reentrantCount--;
				} else {
					_owningThread = null;
					_released.signalAll();
				}
			}
		} finally {
			_lock.unlock();
		}
	}
	
}
