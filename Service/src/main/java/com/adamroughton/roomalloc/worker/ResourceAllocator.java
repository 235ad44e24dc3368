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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.adamroughton.roomalloc.Clock;
import com.adamroughton.roomalloc.data.PersistenceException;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.ErrorResponse;
import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.SuccessResponse;
import com.adamroughton.roomalloc.model.TableStatistics;
import com.adamroughton.roomalloc.model.UnavailableResponse;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.util.Mutex.OwnerDelegate;
import com.adamroughton.roomalloc.util.Mutex.OwnerFunction;
import com.esotericsoftware.minlog.Log;

/**
 * Applies allocation requests to a resource table. The scan, the mutation,
 * the durable rewrite and the reply are all produced while owning the table.
 * A failed rewrite restores the affected resources before replying with
 * an error.
 */
public final class ResourceAllocator {

	public static final String PERSISTENCE_FAILED_MESSAGE = "The allocation could not be saved; no resources were assigned.";
	
	private final Mutex<ResourceTable> _tableMutex;
	private final ResourceTableStore _store;
	private final Clock _clock;
	
	public ResourceAllocator(Mutex<ResourceTable> tableMutex, ResourceTableStore store, Clock clock) {
		_tableMutex = Objects.requireNonNull(tableMutex);
		_store = Objects.requireNonNull(store);
		_clock = Objects.requireNonNull(clock);
	}
	
	public AllocationResponse allocate(final AllocationRequest request) {
		Objects.requireNonNull(request);
		return _tableMutex.callAsOwner(new OwnerFunction<ResourceTable, AllocationResponse>() {

			@Override
			public AllocationResponse asOwner(ResourceTable table) {
				return allocateAsOwner(table, request);
			}
			
		});
	}
	
	private AllocationResponse allocateAsOwner(ResourceTable table, AllocationRequest request) {
		int minCapacity = request.hasMinCapacity()? request.getMinCapacity() : 0;
		Set<String> noExclusions = Collections.emptySet();
		
		List<Resource> rooms = table.findAvailable(ResourceKind.FIXED_ROOM, minCapacity, noExclusions, request.getRoomsRequested());
		if (rooms.size() < request.getRoomsRequested()) {
			return new UnavailableResponse(String.format("Only %d of the %d requested rooms are available.", 
					rooms.size(), request.getRoomsRequested()));
		}
		
		List<Resource> labs = table.findAvailable(ResourceKind.LAB, 0, noExclusions, request.getLabsRequested());
		int shortfall = request.getLabsRequested() - labs.size();
		
		Set<String> roomIds = idsOf(rooms);
		List<Resource> conversions = table.findAvailable(ResourceKind.FIXED_ROOM, 0, roomIds, shortfall);
		if (conversions.size() < shortfall) {
			return new UnavailableResponse(String.format("Only %d of the %d requested labs are available, " +
					"and only %d rooms can be converted into mobile rooms.", 
					labs.size(), request.getLabsRequested(), conversions.size()));
		}
		
		List<Resource> affected = new ArrayList<>(rooms.size() + labs.size() + conversions.size());
		affected.addAll(rooms);
		affected.addAll(labs);
		affected.addAll(conversions);
		List<Resource> previousState = copyOf(affected);
		
		String timestamp = Instant.ofEpochMilli(_clock.currentMillis()).toString();
		for (Resource resource : affected) {
			resource.assign(request.getRequester(), request.getProgram(), timestamp, timestamp);
		}
		for (Resource resource : conversions) {
			resource.convertToMobileRoom();
			Log.info(String.format("Room %s converted into a mobile room", resource.getId()));
		}
		
		try {
			_store.save(table.getResources());
		} catch (PersistenceException ePersist) {
			Log.error(String.format("Failed to persist the allocation for %s; rolling back", request.getRequester()), ePersist);
			restore(table, previousState);
			return new ErrorResponse(PERSISTENCE_FAILED_MESSAGE);
		}
		
		List<String> labIds = new ArrayList<>(labs.size() + conversions.size());
		labIds.addAll(idsInOrder(labs));
		labIds.addAll(idsInOrder(conversions));
		String notice = null;
		if (!conversions.isEmpty()) {
			notice = String.format("%d rooms were converted into mobile rooms because not enough labs were available.", 
					conversions.size());
		}
		SuccessResponse response = new SuccessResponse(request.getRequester(), request.getProgram(), request.getTerm(), 
				idsInOrder(rooms), labIds, notice);
		Log.info(String.format("Allocated to %s/%s: rooms %s, labs %s, mobile rooms %s", 
				request.getRequester(), request.getProgram(), 
				idsInOrder(rooms), idsInOrder(labs), idsInOrder(conversions)));
		Log.info("Table statistics: " + table.getStatistics());
		return response;
	}
	
	/**
	 * Makes every resource available again and saves the table.
	 */
	public void reset() throws PersistenceException {
		final PersistenceException[] failure = new PersistenceException[1];
		_tableMutex.runAsOwner(new OwnerDelegate<ResourceTable>() {

			@Override
			public void asOwner(ResourceTable table) {
				List<Resource> previousState = copyOf(table.getResources());
				table.reset();
				try {
					_store.save(table.getResources());
					Log.info("Resource table reset: " + table.getStatistics());
				} catch (PersistenceException ePersist) {
					restore(table, previousState);
					failure[0] = ePersist;
				}
			}
			
		});
		if (failure[0] != null) {
			throw failure[0];
		}
	}
	
	public TableStatistics getStatistics() {
		return _tableMutex.callAsOwner(new OwnerFunction<ResourceTable, TableStatistics>() {

			@Override
			public TableStatistics asOwner(ResourceTable table) {
				return table.getStatistics();
			}
			
		});
	}
	
	private static List<Resource> copyOf(Iterable<Resource> resources) {
		List<Resource> copies = new ArrayList<>();
		for (Resource resource : resources) {
			copies.add(resource.copy());
		}
		return copies;
	}
	
	private static void restore(ResourceTable table, List<Resource> previousState) {
		for (Resource previous : previousState) {
			table.get(previous.getId()).overwriteWith(previous);
		}
	}
	
	private static Set<String> idsOf(List<Resource> resources) {
		Set<String> ids = new HashSet<>(resources.size());
		for (Resource resource : resources) {
			ids.add(resource.getId());
		}
		return ids;
	}
	
	private static List<String> idsInOrder(List<Resource> resources) {
		List<String> ids = new ArrayList<>(resources.size());
		for (Resource resource : resources) {
			ids.add(resource.getId());
		}
		return ids;
	}
	
}
