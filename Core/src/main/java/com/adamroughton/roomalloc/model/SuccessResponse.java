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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class SuccessResponse extends AllocationResponse {

	private final String _requester;
	private final String _program;
	private final String _term;
	private final List<String> _roomsAssigned;
	private final List<String> _labsAssigned;
	private final String _notice;
	
	/**
	 * @param labsAssigned the assigned labs followed by any rooms converted
	 * to mobile rooms
	 * @param notice set when rooms were converted, {@code null} otherwise
	 */
	public SuccessResponse(String requester, 
			String program, 
			String term,
			List<String> roomsAssigned, 
			List<String> labsAssigned, 
			String notice) {
		super(ResponseType.SUCCESS);
		_requester = Objects.requireNonNull(requester);
		_program = Objects.requireNonNull(program);
		_term = Objects.requireNonNull(term);
		_roomsAssigned = Collections.unmodifiableList(new ArrayList<>(roomsAssigned));
		_labsAssigned = Collections.unmodifiableList(new ArrayList<>(labsAssigned));
		_notice = notice;
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

	public List<String> getRoomsAssigned() {
		return _roomsAssigned;
	}

	public List<String> getLabsAssigned() {
		return _labsAssigned;
	}
	
	public boolean hasNotice() {
		return _notice != null;
	}

	public String getNotice() {
		return _notice;
	}

	@Override
	public String toString() {
		return "SuccessResponse [requester=" + _requester + ", program="
				+ _program + ", term=" + _term + ", roomsAssigned="
				+ _roomsAssigned + ", labsAssigned=" + _labsAssigned
				+ ", notice=" + _notice + "]";
	}
	
}
