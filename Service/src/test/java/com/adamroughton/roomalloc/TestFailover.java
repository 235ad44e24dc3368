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
package com.adamroughton.roomalloc;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.adamroughton.roomalloc.broker.LoadBalancingBroker;
import com.adamroughton.roomalloc.client.AllocationClient;
import com.adamroughton.roomalloc.config.Timing;
import com.adamroughton.roomalloc.data.FlatFileResourceTableStore;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.failover.FailoverState;
import com.adamroughton.roomalloc.failover.HeartbeatPublisher;
import com.adamroughton.roomalloc.failover.StandbyReplica;
import com.adamroughton.roomalloc.failover.StateSyncPublisher;
import com.adamroughton.roomalloc.messaging.CommunicationException;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.ResourceStatus;
import com.adamroughton.roomalloc.model.SuccessResponse;
import com.adamroughton.roomalloc.util.LockMutex;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.util.Mutex.OwnerFunction;
import com.adamroughton.roomalloc.worker.AllocatorWorker;
import com.adamroughton.roomalloc.worker.RequestHandlers;
import com.adamroughton.roomalloc.worker.ResourceAllocator;
import com.adamroughton.roomalloc.worker.ResourceTable;

/**
 * Stops a primary that has been replicating to a standby and checks that the
 * standby takes over the broker's traffic with the replicated table.
 */
public class TestFailover {

	@Rule
	public TemporaryFolder _tempFolder = new TemporaryFolder();
	
	private TestNodeContext _context;
	private JsonCodec _codec;
	private String _backendAddress;
	private LoadBalancingBroker _broker;
	private AllocatorWorker _primaryWorker;
	private HeartbeatPublisher _heartbeatPublisher;
	private StateSyncPublisher _syncPublisher;
	private Mutex<ResourceTable> _standbyTable;
	private StandbyReplica _standby;
	private AllocationClient _client;
	
	private AllocatorWorker createWorker(Mutex<ResourceTable> tableMutex, ResourceTableStore store, String name) {
		ResourceAllocator allocator = new ResourceAllocator(tableMutex, store, _context.getHandle().getClock());
		return new AllocatorWorker(_context.getHandle(), 
				_backendAddress, 
				RequestHandlers.forAllocator(_codec, allocator, _context.getHandle().getClock()), 
				_codec, 
				2, 
				10, 
				name);
	}
	
	@Before
	public void setUp() throws Exception {
		_context = new TestNodeContext(new DefaultClock());
		_codec = new JsonCodec();
		String suffix = UUID.randomUUID().toString();
		_backendAddress = SocketSettings.getInprocAddress("backend-" + suffix);
		
		Timing timing = new Timing();
		timing.setHeartbeatPeriodMillis(50);
		timing.setHeartbeatTimeoutMillis(300);
		timing.setHeartbeatCheckMillis(50);
		timing.setSyncPeriodMillis(50);
		
		_broker = new LoadBalancingBroker(_context.getHandle(), 
				SocketSettings.create().bindToInprocName("frontend-" + suffix), 
				SocketSettings.create().bindToInprocName("backend-" + suffix), 
				_codec, 
				10, 
				50);
		_broker.start();
		assertTrue(_broker.awaitStarted(5, TimeUnit.SECONDS));
		
		ResourceTableStore primaryStore = new FlatFileResourceTableStore(_tempFolder.getRoot().toPath().resolve("primary.csv"));
		primaryStore.save(Arrays.asList(
				Resource.available("S101", ResourceKind.FIXED_ROOM, 40),
				Resource.available("S102", ResourceKind.FIXED_ROOM, 40),
				Resource.available("S103", ResourceKind.FIXED_ROOM, 40)));
		Mutex<ResourceTable> primaryTable = new LockMutex<>(new ResourceTable(primaryStore.load()));
		_primaryWorker = createWorker(primaryTable, primaryStore, "primary");
		_primaryWorker.start();
		assertTrue(_primaryWorker.awaitRegistered(5, TimeUnit.SECONDS));
		
		_heartbeatPublisher = new HeartbeatPublisher(_context.getHandle(), 
				SocketSettings.create().bindToInprocName("heartbeat-" + suffix), 
				timing.getHeartbeatPeriodMillis());
		_syncPublisher = new StateSyncPublisher(_context.getHandle(), 
				SocketSettings.create().bindToInprocName("sync-" + suffix), 
				timing.getSyncPeriodMillis(), 
				primaryTable, 
				_codec);
		_heartbeatPublisher.start();
		_syncPublisher.start();
		assertTrue(_heartbeatPublisher.awaitStarted(5, TimeUnit.SECONDS));
		assertTrue(_syncPublisher.awaitStarted(5, TimeUnit.SECONDS));
		
		final ResourceTableStore standbyStore = new FlatFileResourceTableStore(_tempFolder.getRoot().toPath().resolve("standby.csv"));
		_standbyTable = new LockMutex<>(new ResourceTable());
		_standby = new StandbyReplica(_context.getHandle(), 
				SocketSettings.getInprocAddress("heartbeat-" + suffix), 
				SocketSettings.getInprocAddress("sync-" + suffix), 
				_standbyTable, 
				standbyStore, 
				_codec, 
				timing, 
				new StandbyReplica.WorkerFactory() {
					
					@Override
					public AllocatorWorker create(Mutex<ResourceTable> tableMutex) {
						return createWorker(tableMutex, standbyStore, "standby");
					}
				});
		_standby.start();
		assertTrue(_standby.awaitListening(5, TimeUnit.SECONDS));
		
		_client = new AllocationClient(_context.getHandle(), 
				SocketSettings.getInprocAddress("frontend-" + suffix), _codec, 1000, 1000);
	}
	
	@After
	public void tearDown() {
		_client.close();
		_standby.close();
		_heartbeatPublisher.close();
		_syncPublisher.close();
		_primaryWorker.close();
		_broker.close();
		_context.getHandle().getSocketManager().destroyAllSockets();
		_context.close();
		assertTrue(_context.getFatalExceptions().isEmpty());
	}
	
	private AllocationResponse requestWithRetry(AllocationRequest request) throws Exception {
		CommunicationException lastException = null;
		for (int attempt = 0; attempt < 3; attempt++) {
			try {
				return _client.request(request);
			} catch (CommunicationException eComms) {
				if (!eComms.isRetryable()) throw eComms;
				lastException = eComms;
			}
		}
		throw lastException;
	}
	
	private ResourceStatus standbyStatusOf(final String id) {
		return _standbyTable.callAsOwner(new OwnerFunction<ResourceTable, ResourceStatus>() {

			@Override
			public ResourceStatus asOwner(ResourceTable table) {
				Resource resource = table.get(id);
				return resource == null? null : resource.getStatus();
			}
		});
	}
	
	@Test(timeout=30000)
	public void standbyTakesOverWithReplicatedTable() throws Exception {
		AllocationRequest request = new AllocationRequest("Engineering", "Systems", "2024-1", 1, 0, null);
		SuccessResponse first = requestWithRetry(request).as(SuccessResponse.class);
		assertEquals(Arrays.asList("S101"), first.getRoomsAssigned());
		
		long deadline = System.currentTimeMillis() + 5000;
		while (standbyStatusOf("S101") != ResourceStatus.ASSIGNED && System.currentTimeMillis() < deadline) {
			Thread.sleep(20);
		}
		assertEquals(ResourceStatus.ASSIGNED, standbyStatusOf("S101"));
		assertEquals(FailoverState.STANDBY, _standby.getState());
		assertTrue(_heartbeatPublisher.getPublishedCount() > 0);
		
		_heartbeatPublisher.close();
		_syncPublisher.close();
		_primaryWorker.close();
		
		assertTrue(_standby.awaitActive(5, TimeUnit.SECONDS));
		assertEquals(FailoverState.ACTIVE, _standby.getState());
		
		SuccessResponse second = requestWithRetry(request).as(SuccessResponse.class);
		assertEquals(Arrays.asList("S102"), second.getRoomsAssigned());
	}
	
}
