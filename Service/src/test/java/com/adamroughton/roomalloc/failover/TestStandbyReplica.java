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
package com.adamroughton.roomalloc.failover;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.adamroughton.roomalloc.DrivableClock;
import com.adamroughton.roomalloc.TestNodeContext;
import com.adamroughton.roomalloc.config.Timing;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.PersistenceException;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.ResourceStatus;
import com.adamroughton.roomalloc.model.StateSnapshot;
import com.adamroughton.roomalloc.util.LockMutex;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.util.Mutex.OwnerFunction;
import com.adamroughton.roomalloc.worker.AllocatorWorker;
import com.adamroughton.roomalloc.worker.ResourceTable;

public class TestStandbyReplica {

	private static final long TIMEOUT_MILLIS = 500;
	
	private DrivableClock _clock;
	private TestNodeContext _context;
	private ResourceTableStore _store;
	private AllocatorWorker _worker;
	private Mutex<ResourceTable> _tableMutex;
	private int _createCount;
	private boolean _factoryFails;
	private StandbyReplica _replica;
	
	@Before
	public void setUp() throws Exception {
		_clock = new DrivableClock();
		_clock.setTime(1000, TimeUnit.SECONDS);
		_context = new TestNodeContext(_clock);
		_store = mock(ResourceTableStore.class);
		when(_store.load()).thenReturn(Collections.<Resource>emptyList());
		when(_store.getLocation()).thenReturn("standby.csv");
		_worker = mock(AllocatorWorker.class);
		when(_worker.awaitRegistered(anyLong(), any(TimeUnit.class))).thenReturn(true);
		when(_worker.getName()).thenReturn("standby");
		_tableMutex = new LockMutex<>(new ResourceTable());
		_createCount = 0;
		_factoryFails = false;
		
		Timing timing = new Timing();
		timing.setHeartbeatPeriodMillis(100);
		timing.setHeartbeatTimeoutMillis(TIMEOUT_MILLIS);
		timing.setHeartbeatCheckMillis(100);
		_replica = new StandbyReplica(_context.getHandle(), 
				"inproc://heartbeat", 
				"inproc://sync", 
				_tableMutex, 
				_store, 
				new JsonCodec(), 
				timing, 
				new StandbyReplica.WorkerFactory() {
					
					@Override
					public AllocatorWorker create(Mutex<ResourceTable> tableMutex) {
						_createCount++;
						if (_factoryFails) 
							throw new IllegalStateException("Could not connect");
						return _worker;
					}
				});
	}
	
	@After
	public void tearDown() {
		_replica.close();
		_context.close();
	}
	
	private void heartbeat() {
		_replica.onHeartbeat(WireProtocol.toBytes(WireProtocol.formatHeartbeat(_clock.currentMillis())));
	}
	
	private Resource tableEntry(final String id) {
		return _tableMutex.callAsOwner(new OwnerFunction<ResourceTable, Resource>() {

			@Override
			public Resource asOwner(ResourceTable table) {
				Resource resource = table.get(id);
				return resource == null? null : resource.copy();
			}
		});
	}
	
	@Test
	public void staysInStandbyWithinTimeout() {
		_clock.advance(TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.STANDBY, _replica.getState());
		assertEquals(0, _createCount);
	}
	
	@Test
	public void promotesAfterTimeout() throws Exception {
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
		assertTrue(_replica.awaitActive(0, TimeUnit.MILLISECONDS));
		verify(_worker).start();
	}
	
	@Test
	public void heartbeatResetsSilenceWindow() {
		_clock.advance(400, TimeUnit.MILLISECONDS);
		heartbeat();
		_clock.advance(400, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.STANDBY, _replica.getState());
		
		_clock.advance(200, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
	}
	
	@Test
	public void malformedHeartbeatIgnored() {
		_clock.advance(400, TimeUnit.MILLISECONDS);
		_replica.onHeartbeat(WireProtocol.toBytes("HEARTBEAT yesterday"));
		_replica.onHeartbeat(WireProtocol.toBytes("PING"));
		_clock.advance(200, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
	}
	
	@Test
	public void failedRegistrationReturnsToStandby() throws Exception {
		when(_worker.awaitRegistered(anyLong(), any(TimeUnit.class))).thenReturn(false, true);
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.STANDBY, _replica.getState());
		verify(_worker).close();
		
		_clock.advance(100, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
		assertEquals(2, _createCount);
	}
	
	@Test
	public void failedWorkerCreationReturnsToStandby() {
		_factoryFails = true;
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.STANDBY, _replica.getState());
		assertTrue(_context.getFatalExceptions().isEmpty());
	}
	
	@Test
	public void activeIsTerminal() {
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		_clock.advance(10, TimeUnit.SECONDS);
		_replica.checkHeartbeat();
		heartbeat();
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
		assertEquals(1, _createCount);
	}
	
	@Test
	public void noPromotionWhileShuttingDown() {
		_context.close();
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.STANDBY, _replica.getState());
		assertEquals(0, _createCount);
	}
	
	@Test
	public void seedsFromStoreWithoutSnapshot() throws Exception {
		when(_store.load()).thenReturn(Arrays.asList(Resource.available("S101", ResourceKind.FIXED_ROOM, 30)));
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
		assertNotNull(tableEntry("S101"));
		verify(_store).load();
	}
	
	@Test
	public void appliedSnapshotIsSavedAndPreferredOverStore() throws Exception {
		_replica.applySnapshot(new StateSnapshot(Arrays.asList(
				new Resource("S101", ResourceKind.MOBILE_ROOM, ResourceStatus.ASSIGNED, 30, 
						"Engineering", "Systems", "2024-1", "2024-03-01T10:00:00Z"),
				Resource.available("L101", ResourceKind.LAB, 20))));
		assertTrue(_replica.hasReceivedSnapshot());
		verify(_store).save(any());
		
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
		verify(_store, never()).load();
		assertEquals(ResourceStatus.ASSIGNED, tableEntry("S101").getStatus());
		assertEquals(1, _replica.getStatus().getAppliedSnapshots());
	}
	
	@Test
	public void saveFailureKeepsAppliedSnapshot() throws Exception {
		doThrow(new PersistenceException("disk full")).when(_store).save(any());
		_replica.applySnapshot(new StateSnapshot(Arrays.asList(Resource.available("L101", ResourceKind.LAB, 20))));
		assertNotNull(tableEntry("L101"));
		assertTrue(_replica.hasReceivedSnapshot());
	}
	
	@Test
	public void invalidSnapshotDiscarded() {
		_replica.onSnapshot(WireProtocol.toBytes("{\"resources\":[1,2]}"));
		_replica.onSnapshot(WireProtocol.toBytes("not json"));
		assertFalse(_replica.hasReceivedSnapshot());
	}
	
	@Test
	public void snapshotsStillApplyWhenActive() {
		_clock.advance(TIMEOUT_MILLIS + 1, TimeUnit.MILLISECONDS);
		_replica.checkHeartbeat();
		assertEquals(FailoverState.ACTIVE, _replica.getState());
		_replica.applySnapshot(new StateSnapshot(Arrays.asList(Resource.available("L102", ResourceKind.LAB, 24))));
		assertNotNull(tableEntry("L102"));
	}
	
}
