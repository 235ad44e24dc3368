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
package com.adamroughton.roomalloc.worker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.StateSnapshot;
import com.adamroughton.roomalloc.model.TableStatistics;

/**
 * The in-memory resource table, in load order. Not thread safe: every
 * access goes through the {@link com.adamroughton.roomalloc.util.Mutex} 
 * of the owning worker.
 */
public final class ResourceTable {

	private final Map<String, Resource> _resources = new LinkedHashMap<>();
	
	public ResourceTable() {
	}
	
	public ResourceTable(Collection<Resource> resources) {
		for (Resource resource : resources) {
			if (_resources.put(resource.getId(), resource.copy()) != null)
				throw new IllegalArgumentException(String.format("Duplicate resource id '%s'.", resource.getId()));
		}
	}
	
	public Resource get(String id) {
		return _resources.get(id);
	}
	
	public Collection<Resource> getResources() {
		return Collections.unmodifiableCollection(_resources.values());
	}
	
	public int size() {
		return _resources.size();
	}
	
	/**
	 * Collects up to {@code limit} available resources of the given kind, 
	 * in table order.
	 * 
	 * @param minCapacity the smallest acceptable capacity
	 * @param excludedIds ids that must not be returned
	 */
	public List<Resource> findAvailable(ResourceKind kind, int minCapacity, Set<String> excludedIds, int limit) {
		if (limit <= 0) return new ArrayList<>(0);
		// the limit comes from the request, so it is not trusted as a capacity
		List<Resource> matches = new ArrayList<>(Math.min(limit, _resources.size()));
		for (Resource resource : _resources.values()) {
			if (resource.isAvailable(kind) 
					&& resource.getCapacity() >= minCapacity 
					&& !excludedIds.contains(resource.getId())) {
				matches.add(resource);
				if (matches.size() == limit) break;
			}
		}
		return matches;
	}
	
	/**
	 * Merges the snapshot into this table. Known resources have every field
	 * overwritten, unknown resources are appended, and resources missing 
	 * from the snapshot are kept as they are.
	 * 
	 * @return the number of resources that were inserted
	 */
	public int applySnapshot(StateSnapshot snapshot) {
		Objects.requireNonNull(snapshot);
		int inserted = 0;
		for (Resource incoming : snapshot.getResources()) {
			Resource existing = _resources.get(incoming.getId());
			if (existing == null) {
				_resources.put(incoming.getId(), incoming.copy());
				inserted++;
			} else {
				existing.overwriteWith(incoming);
			}
		}
		return inserted;
	}
	
	public StateSnapshot toSnapshot() {
		return new StateSnapshot(_resources.values());
	}
	
	/**
	 * Makes every resource available again, reverting mobile rooms.
	 */
	public void reset() {
		for (Resource resource : _resources.values()) {
			resource.reset();
		}
	}
	
	public TableStatistics getStatistics() {
		return TableStatistics.of(_resources.values());
	}
	
}
