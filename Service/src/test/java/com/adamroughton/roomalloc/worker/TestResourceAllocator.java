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

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Before;
import org.junit.Test;

import com.adamroughton.roomalloc.DrivableClock;
import com.adamroughton.roomalloc.data.PersistenceException;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.ErrorResponse;
import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.ResourceStatus;
import com.adamroughton.roomalloc.model.ResponseType;
import com.adamroughton.roomalloc.model.StateSnapshot;
import com.adamroughton.roomalloc.model.SuccessResponse;
import com.adamroughton.roomalloc.util.LockMutex;

public class TestResourceAllocator {

	private DrivableClock _clock;
	private ResourceTableStore _store;
	private ResourceTable _table;
	private ResourceAllocator _allocator;
	
	@Before
	public void setUp() {
		_clock = new DrivableClock();
		_clock.setTime(1709287200000L, TimeUnit.MILLISECONDS);
		_store = mock(ResourceTableStore.class);
	}
	
	private void useTable(Resource... resources) {
		_table = new ResourceTable(Arrays.asList(resources));
		_allocator = new ResourceAllocator(new LockMutex<>(_table), _store, _clock);
	}
	
	private static Resource room(String id, int capacity) {
		return Resource.available(id, ResourceKind.FIXED_ROOM, capacity);
	}
	
	private static Resource lab(String id) {
		return Resource.available(id, ResourceKind.LAB, 25);
	}
	
	private static AllocationRequest request(int rooms, int labs) {
		return new AllocationRequest("Engineering", "Systems", "2024-1", rooms, labs, null);
	}
	
	@Test
	public void labShortfallConvertsRooms() throws Exception {
		useTable(room("S1", 40), room("S2", 40), room("S3", 40), room("S4", 40), room("S5", 40));
		
		AllocationResponse response = _allocator.allocate(request(3, 2));
		
		assertEquals(ResponseType.SUCCESS, response.getType());
		SuccessResponse success = response.as(SuccessResponse.class);
		assertEquals(Arrays.asList("S1", "S2", "S3"), success.getRoomsAssigned());
		assertEquals(Arrays.asList("S4", "S5"), success.getLabsAssigned());
		assertTrue(success.hasNotice());
		
		for (String id : Arrays.asList("S1", "S2", "S3")) {
			assertEquals(ResourceKind.FIXED_ROOM, _table.get(id).getKind());
			assertEquals(ResourceStatus.ASSIGNED, _table.get(id).getStatus());
		}
		for (String id : Arrays.asList("S4", "S5")) {
			assertEquals(ResourceKind.MOBILE_ROOM, _table.get(id).getKind());
			assertEquals(ResourceStatus.ASSIGNED, _table.get(id).getStatus());
		}
		assertEquals(2, _table.getStatistics().getMobileRoomsInUseCount());
		verify(_store, times(1)).save(any());
	}
	
	@Test
	public void labsUsedBeforeConversion() throws Exception {
		useTable(room("S1", 40), lab("L1"), room("S2", 40), lab("L2"));
		
		SuccessResponse success = _allocator.allocate(request(1, 2)).as(SuccessResponse.class);
		
		assertEquals(Arrays.asList("S1"), success.getRoomsAssigned());
		assertEquals(Arrays.asList("L1", "L2"), success.getLabsAssigned());
		assertFalse(success.hasNotice());
		assertTrue(_table.get("S2").isAvailable());
	}
	
	@Test
	public void assignmentContextRecorded() throws Exception {
		useTable(room("S1", 40));
		
		_allocator.allocate(request(1, 0));
		
		Resource assigned = _table.get("S1");
		assertEquals("Engineering", assigned.getRequester());
		assertEquals("Systems", assigned.getProgram());
		assertEquals("2024-03-01T10:00:00Z", assigned.getRequestedAt());
		assertEquals(assigned.getRequestedAt(), assigned.getAssignedAt());
	}
	
	@Test
	public void minCapacityFiltersRooms() throws Exception {
		useTable(room("S1", 20), room("S2", 40), room("S3", 30));
		
		AllocationRequest request = new AllocationRequest("Engineering", "Systems", "2024-1", 1, 0, 35);
		SuccessResponse success = _allocator.allocate(request).as(SuccessResponse.class);
		
		assertEquals(Arrays.asList("S2"), success.getRoomsAssigned());
	}
	
	@Test
	public void tooFewRoomsChangesNothing() throws Exception {
		useTable(room("S1", 40), room("S2", 40), lab("L1"));
		StateSnapshot before = _table.toSnapshot();
		
		AllocationResponse response = _allocator.allocate(request(3, 1));
		
		assertEquals(ResponseType.UNAVAILABLE, response.getType());
		assertEquals(before, _table.toSnapshot());
		verify(_store, never()).save(any());
	}
	
	@Test
	public void tooFewConvertibleRoomsChangesNothing() throws Exception {
		useTable(room("S1", 40), room("S2", 40), room("S3", 40));
		StateSnapshot before = _table.toSnapshot();
		
		AllocationResponse response = _allocator.allocate(request(2, 2));
		
		assertEquals(ResponseType.UNAVAILABLE, response.getType());
		assertEquals(before, _table.toSnapshot());
		verify(_store, never()).save(any());
	}
	
	@Test
	public void hugeRoomRequestIsUnavailable() throws Exception {
		useTable(room("S1", 40), room("S2", 40), lab("L1"));
		StateSnapshot before = _table.toSnapshot();
		
		AllocationResponse response = _allocator.allocate(request(Integer.MAX_VALUE, 0));
		
		assertEquals(ResponseType.UNAVAILABLE, response.getType());
		assertEquals(before, _table.toSnapshot());
		verify(_store, never()).save(any());
	}
	
	@Test
	public void hugeLabRequestIsUnavailable() throws Exception {
		useTable(room("S1", 40), room("S2", 40), room("S3", 40), lab("L1"));
		StateSnapshot before = _table.toSnapshot();
		
		AllocationResponse response = _allocator.allocate(request(1, Integer.MAX_VALUE));
		
		assertEquals(ResponseType.UNAVAILABLE, response.getType());
		assertEquals(before, _table.toSnapshot());
		verify(_store, never()).save(any());
	}
	
	@Test
	public void persistenceFailureRollsBack() throws Exception {
		useTable(room("S1", 40), room("S2", 40), room("S3", 40));
		StateSnapshot before = _table.toSnapshot();
		doThrow(new PersistenceException("disk full")).when(_store).save(any());
		
		AllocationResponse response = _allocator.allocate(request(1, 2));
		
		assertEquals(ResponseType.ERROR, response.getType());
		assertEquals(ResourceAllocator.PERSISTENCE_FAILED_MESSAGE, response.as(ErrorResponse.class).getMessage());
		assertEquals(before, _table.toSnapshot());
	}
	
	@Test
	public void resetRevertsEverything() throws Exception {
		useTable(room("S1", 40), room("S2", 40), lab("L1"));
		_allocator.allocate(request(1, 2));
		assertEquals(ResourceKind.MOBILE_ROOM, _table.get("S2").getKind());
		
		_allocator.reset();
		
		assertEquals(new StateSnapshot(Arrays.asList(room("S1", 40), room("S2", 40), lab("L1"))), _table.toSnapshot());
		verify(_store, times(2)).save(any());
	}
	
	@Test
	public void failedResetRollsBack() throws Exception {
		useTable(room("S1", 40));
		_allocator.allocate(request(1, 0));
		StateSnapshot before = _table.toSnapshot();
		doThrow(new PersistenceException("disk full")).when(_store).save(any());
		
		try {
			_allocator.reset();
			fail();
		} catch (PersistenceException eExpected) {
		}
		assertEquals(before, _table.toSnapshot());
	}
	
	@Test(timeout=20000)
	public void concurrentRequestsNeverShareARoom() throws Exception {
		List<Resource> rooms = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			rooms.add(room("S" + i, 40));
		}
		useTable(rooms.toArray(new Resource[rooms.size()]));
		
		final CountDownLatch startLatch = new CountDownLatch(1);
		ExecutorService executor = Executors.newFixedThreadPool(16);
		List<Future<AllocationResponse>> futures = new ArrayList<>();
		for (int i = 0; i < 32; i++) {
			futures.add(executor.submit(new Callable<AllocationResponse>() {

				@Override
				public AllocationResponse call() throws Exception {
					startLatch.await();
					return _allocator.allocate(request(1, 0));
				}
			}));
		}
		startLatch.countDown();
		
		Set<String> assignedIds = new HashSet<>();
		int successCount = 0;
		for (Future<AllocationResponse> future : futures) {
			AllocationResponse response = future.get(10, TimeUnit.SECONDS);
			if (response.isSuccess()) {
				successCount++;
				for (String id : response.as(SuccessResponse.class).getRoomsAssigned()) {
					assertTrue("room " + id + " assigned twice", assignedIds.add(id));
				}
			} else {
				assertEquals(ResponseType.UNAVAILABLE, response.getType());
			}
		}
		executor.shutdown();
		assertEquals(10, successCount);
		assertEquals(0, _table.getStatistics().getAvailableFixedRoomCount());
		assertEquals(Collections.<String>emptySet(), difference(_table, assignedIds));
	}
	
	private static Set<String> difference(ResourceTable table, Set<String> ids) {
		Set<String> remaining = new HashSet<>();
		for (Resource resource : table.getResources()) {
			remaining.add(resource.getId());
		}
		remaining.removeAll(ids);
		return remaining;
	}
	
}
