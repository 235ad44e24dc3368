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

public final class AllocationRequest {

	private final String _requester;
	private final String _program;
	private final String _term;
	private final int _roomsRequested;
	private final int _labsRequested;
	private final Integer _minCapacity;
	
	/**
	 * @param minCapacity the smallest acceptable room capacity, or 
	 * {@code null} to accept any room
	 */
	public AllocationRequest(String requester, 
			String program, 
			String term, 
			int roomsRequested,
			int labsRequested, 
			Integer minCapacity) {
		_requester = Objects.requireNonNull(requester);
		_program = Objects.requireNonNull(program);
		_term = Objects.requireNonNull(term);
		_roomsRequested = roomsRequested;
		_labsRequested = labsRequested;
		_minCapacity = minCapacity;
	}

	public String getRequester() {
		return _requester;
	}

	public String getProgram() {
		return _program;
	}

	public String getTerm() {
		return _term;
	}

	public int getRoomsRequested() {
		return _roomsRequested;
	}

	public int getLabsRequested() {
		return _labsRequested;
	}
	
	public boolean hasMinCapacity() {
		return _minCapacity != null;
	}

	public Integer getMinCapacity() {
		return _minCapacity;
	}

	@Override
	public String toString() {
		return "AllocationRequest [requester=" + _requester + ", program="
				+ _program + ", term=" + _term + ", roomsRequested="
				+ _roomsRequested + ", labsRequested=" + _labsRequested
				+ ", minCapacity=" + _minCapacity + "]";
	}
	
}
