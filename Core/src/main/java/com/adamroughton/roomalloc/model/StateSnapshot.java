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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A full copy of a resource table at a point in time. Every snapshot 
 * is self-sufficient; there are no deltas.
 */
public final class StateSnapshot {

	private final Map<String, Resource> _resources;
	
	public StateSnapshot(Collection<Resource> resources) {
		Objects.requireNonNull(resources);
		Map<String, Resource> copy = new LinkedHashMap<>(resources.size());
		for (Resource resource : resources) {
			if (copy.put(resource.getId(), resource.copy()) != null)
				throw new IllegalArgumentException(String.format("Duplicate resource id '%s' in snapshot.", resource.getId()));
		}
		_resources = Collections.unmodifiableMap(copy);
	}
	
	/**
	 * Gets the resources of the snapshot, in table order. The
	 * returned resources must not be mutated.
	 */
	public Collection<Resource> getResources() {
		return _resources.values();
	}
	
	public Resource get(String id) {
		return _resources.get(id);
	}
	
	public int size() {
		return _resources.size();
	}

	@Override
	public int hashCode() {
		return _resources.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		StateSnapshot other = (StateSnapshot) obj;
		return _resources.equals(other._resources);
	}
	
}
