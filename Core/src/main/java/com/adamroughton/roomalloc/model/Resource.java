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

/**
 * An allocatable room or lab. The assignment context (requester, program 
 * and the two timestamps) is non-empty exactly when the resource is
 * {@link ResourceStatus#ASSIGNED}.
 * <p>
 * Instances are mutable and are only changed by the owner of the
 * table that holds them.
 */
public final class Resource {

	private final String _id;
	private ResourceKind _kind;
	private ResourceStatus _status;
	private int _capacity;
	private String _requester;
	private String _program;
	private String _requestedAt;
	private String _assignedAt;
	
	public static Resource available(String id, ResourceKind kind, int capacity) {
		return new Resource(id, kind, ResourceStatus.AVAILABLE, capacity, "", "", "", "");
	}
	
	public Resource(String id, 
			ResourceKind kind, 
			ResourceStatus status, 
			int capacity,
			String requester, 
			String program, 
			String requestedAt, 
			String assignedAt) {
		_id = Objects.requireNonNull(id);
		if (id.isEmpty())
			throw new IllegalArgumentException("The resource id cannot be empty.");
		if (capacity < 1)
			throw new IllegalArgumentException(String.format("The capacity of resource '%s' must be positive (was %d).", id, capacity));
		_kind = Objects.requireNonNull(kind);
		_status = Objects.requireNonNull(status);
		_capacity = capacity;
		_requester = nullToEmpty(requester);
		_program = nullToEmpty(program);
		_requestedAt = nullToEmpty(requestedAt);
		_assignedAt = nullToEmpty(assignedAt);
		assertContextMatchesStatus();
	}
	
	public String getId() {
		return _id;
	}
	
	public ResourceKind getKind() {
		return _kind;
	}
	
	public ResourceStatus getStatus() {
		return _status;
	}
	
	public int getCapacity() {
		return _capacity;
	}
	
	public String getRequester() {
		return _requester;
	}
	
	public String getProgram() {
		return _program;
	}
	
	public String getRequestedAt() {
		return _requestedAt;
	}
	
	public String getAssignedAt() {
		return _assignedAt;
	}
	
	public boolean isAvailable() {
		return _status == ResourceStatus.AVAILABLE;
	}
	
	public boolean isAvailable(ResourceKind kind) {
		return _kind == kind && isAvailable();
	}
	
	public void assign(String requester, String program, String requestedAt, String assignedAt) {
		if (!isAvailable())
			throw new IllegalStateException(String.format("Resource '%s' is already assigned to '%s'.", _id, _requester));
		if (isNullOrEmpty(requester) || isNullOrEmpty(program) || isNullOrEmpty(requestedAt) || isNullOrEmpty(assignedAt))
			throw new IllegalArgumentException(String.format("An assignment of resource '%s' needs a full context.", _id));
		_status = ResourceStatus.ASSIGNED;
		_requester = requester;
		_program = program;
		_requestedAt = requestedAt;
		_assignedAt = assignedAt;
	}
	
	/**
	 * Repurposes a fixed room as a lab substitute.
	 */
	public void convertToMobileRoom() {
		if (_kind != ResourceKind.FIXED_ROOM)
			throw new IllegalStateException(String.format("Only fixed rooms can be converted (resource '%s' is %s).", _id, _kind));
		_kind = ResourceKind.MOBILE_ROOM;
	}
	
	/**
	 * Returns the resource to the available state with an empty context,
	 * turning a mobile room back into a fixed room.
	 */
	public void reset() {
		_status = ResourceStatus.AVAILABLE;
		_requester = "";
		_program = "";
		_requestedAt = "";
		_assignedAt = "";
		if (_kind == ResourceKind.MOBILE_ROOM) {
			_kind = ResourceKind.FIXED_ROOM;
		}
	}
	
	/**
	 * Overwrites every field of this resource with those of {@code other}.
	 */
	public void overwriteWith(Resource other) {
		if (!_id.equals(other._id))
			throw new IllegalArgumentException(String.format("Cannot overwrite resource '%s' with resource '%s'.", _id, other._id));
		_kind = other._kind;
		_status = other._status;
		_capacity = other._capacity;
		_requester = other._requester;
		_program = other._program;
		_requestedAt = other._requestedAt;
		_assignedAt = other._assignedAt;
	}
	
	public Resource copy() {
		return new Resource(_id, _kind, _status, _capacity, _requester, _program, _requestedAt, _assignedAt);
	}
	
	private void assertContextMatchesStatus() {
		boolean hasContext = !_requester.isEmpty() && !_program.isEmpty() 
				&& !_requestedAt.isEmpty() && !_assignedAt.isEmpty();
		boolean hasAnyContext = !_requester.isEmpty() || !_program.isEmpty() 
				|| !_requestedAt.isEmpty() || !_assignedAt.isEmpty();
		if (_status == ResourceStatus.ASSIGNED && !hasContext)
			throw new IllegalArgumentException(String.format("Assigned resource '%s' has an incomplete assignment context.", _id));
		if (_status == ResourceStatus.AVAILABLE && hasAnyContext)
			throw new IllegalArgumentException(String.format("Available resource '%s' has an assignment context.", _id));
	}
	
	private static String nullToEmpty(String value) {
		return value == null? "" : value;
	}
	
	private static boolean isNullOrEmpty(String value) {
		return value == null || value.isEmpty();
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + _id.hashCode();
		result = prime * result + _kind.hashCode();
		result = prime * result + _status.hashCode();
		result = prime * result + _capacity;
		result = prime * result + _requester.hashCode();
		result = prime * result + _program.hashCode();
		result = prime * result + _requestedAt.hashCode();
		result = prime * result + _assignedAt.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Resource other = (Resource) obj;
		return _id.equals(other._id)
				&& _kind == other._kind
				&& _status == other._status
				&& _capacity == other._capacity
				&& _requester.equals(other._requester)
				&& _program.equals(other._program)
				&& _requestedAt.equals(other._requestedAt)
				&& _assignedAt.equals(other._assignedAt);
	}

	@Override
	public String toString() {
		return "Resource [id=" + _id + ", kind=" + _kind + ", status="
				+ _status + ", capacity=" + _capacity + ", requester="
				+ _requester + ", program=" + _program + "]";
	}
	
}
