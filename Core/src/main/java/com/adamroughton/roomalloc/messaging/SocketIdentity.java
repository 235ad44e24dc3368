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

import java.util.Arrays;
import java.util.Objects;

import com.adamroughton.roomalloc.util.Util;

/**
 * The routing identity the transport assigns to a peer. Identities
 * are compared by content.
 */
public final class SocketIdentity {
	
	public final byte[] buffer;
	public final int offset;
	public final int length;
	private int _hashCodeCache = 0;
	private boolean _isHashCached = false;
	
	public SocketIdentity(byte[] identityBytes) {
		this(identityBytes, 0, identityBytes.length);
	}
	
	public SocketIdentity(byte[] buffer, int offset, int length) {
		this.buffer = Objects.requireNonNull(buffer);
		if (offset < 0 || length < 0 || offset + length > buffer.length)
			throw new IllegalArgumentException(String.format("The range [%d, %d) is outside of the buffer (length %d).", 
					offset, offset + length, buffer.length));
		this.offset = offset;
		this.length = length;
	}
	
	public byte[] toBytes() {
		return Arrays.copyOfRange(buffer, offset, offset + length);
	}

	@Override
	public int hashCode() {
		if (!_isHashCached) {
			int result = 1;
			for (int i = offset; i < offset + length; i++) {
				result = 31 * result + buffer[i];
			}
			_hashCodeCache = result;
			_isHashCached = true;
		}
		return _hashCodeCache;
	}
	
	public SocketIdentity copyWithNewArray() {
		return new SocketIdentity(toBytes());
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof SocketIdentity) {
			SocketIdentity that = (SocketIdentity) obj;
			if (this.length != that.length)
				return false;
			for (int i = 0; i < this.length; i++) {
				if (this.buffer[this.offset + i] != that.buffer[that.offset + i])
					return false;
			}
			return true;
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		return "SocketIdentity [" + Util.toHexString(buffer, offset, length) + "]";
	}
	
}
