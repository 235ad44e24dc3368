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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.DefaultClock;
import com.adamroughton.roomalloc.TestNodeContext;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.ErrorResponse;
import com.adamroughton.roomalloc.model.ResponseType;
import com.adamroughton.roomalloc.model.UnavailableResponse;

/**
 * Drives a worker from a bare ROUTER socket standing in for the broker.
 */
public class TestAllocatorWorker {

	private static final int MAX_CONCURRENT = 2;
	
	private TestNodeContext _context;
	private JsonCodec _codec;
	private ZMQ.Socket _backend;
	private String _backendAddress;
	private AllocatorWorker _worker;
	
	@Before
	public void setUp() {
		_context = new TestNodeContext(new DefaultClock());
		_codec = new JsonCodec();
		String inprocName = "backend-" + UUID.randomUUID();
		_backend = _context.getHandle().getSocketManager().create(ZMQ.ROUTER, 
				SocketSettings.create().bindToInprocName(inprocName).setRecvTimeout(5000), "test-backend");
		_backendAddress = SocketSettings.getInprocAddress(inprocName);
	}
	
	@After
	public void tearDown() {
		if (_worker != null) {
			_worker.close();
		}
		SocketManager socketManager = _context.getHandle().getSocketManager();
		socketManager.destroySocket(_backend);
		_context.close();
		assertTrue(_context.getFatalExceptions().isEmpty());
	}
	
	private byte[] awaitReady() {
		List<byte[]> frames = ZmqSocketOperations.recvFrames(_backend, true);
		assertNotNull("no READY from the worker", frames);
		assertEquals(2, frames.size());
		assertTrue(WireProtocol.isReady(frames.get(1)));
		return frames.get(0);
	}
	
	private void dispatch(byte[] workerId, String clientId, String payload) {
		assertTrue(ZmqSocketOperations.sendFrames(_backend, workerId, WireProtocol.EMPTY_FRAME, 
				WireProtocol.toBytes(clientId), WireProtocol.EMPTY_FRAME, WireProtocol.toBytes(payload)));
	}
	
	/**
	 * Collects replies, skipping any READY re-advertisements.
	 */
	private List<List<byte[]>> collectReplies(int count) {
		List<List<byte[]>> replies = new ArrayList<>();
		while (replies.size() < count) {
			List<byte[]> frames = ZmqSocketOperations.recvFrames(_backend, true);
			assertNotNull(String.format("only %d of %d replies arrived", replies.size(), count), frames);
			if (frames.size() == 2 && WireProtocol.isReady(frames.get(1))) continue;
			assertEquals(5, frames.size());
			assertTrue(WireProtocol.isEmpty(frames.get(1)));
			assertTrue(WireProtocol.isEmpty(frames.get(3)));
			replies.add(frames);
		}
		return replies;
	}
	
	@Test(timeout=30000)
	public void admissionNeverExceedsBound() throws Exception {
		final CountDownLatch releaseLatch = new CountDownLatch(1);
		final CountDownLatch saturatedLatch = new CountDownLatch(MAX_CONCURRENT);
		RequestHandler blockingHandler = new RequestHandler() {
			
			@Override
			public AllocationResponse handle(long requestId, byte[] payload) {
				saturatedLatch.countDown();
				try {
					releaseLatch.await();
				} catch (InterruptedException eInterrupted) {
					Thread.currentThread().interrupt();
				}
				return new UnavailableResponse("busy " + WireProtocol.fromBytes(payload));
			}
		};
		_worker = new AllocatorWorker(_context.getHandle(), _backendAddress, blockingHandler, _codec, 
				MAX_CONCURRENT, 5, "worker-under-test");
		_worker.start();
		byte[] workerId = awaitReady();
		assertTrue(_worker.awaitRegistered(5, TimeUnit.SECONDS));
		
		int offered = MAX_CONCURRENT + 5;
		for (int i = 0; i < offered; i++) {
			dispatch(workerId, "client-" + i, "request-" + i);
		}
		assertTrue(saturatedLatch.await(10, TimeUnit.SECONDS));
		// give the worker a chance to over-admit
		Thread.sleep(200);
		assertEquals(MAX_CONCURRENT, _worker.getActiveRequestCount());
		assertEquals(0, _worker.getAvailablePermits());
		
		releaseLatch.countDown();
		List<List<byte[]>> replies = collectReplies(offered);
		
		Set<String> clients = new HashSet<>();
		for (List<byte[]> reply : replies) {
			String clientId = WireProtocol.fromBytes(reply.get(2));
			assertTrue(clients.add(clientId));
			AllocationResponse response = _codec.decodeResponse(reply.get(4));
			assertEquals(ResponseType.UNAVAILABLE, response.getType());
			assertEquals("busy request-" + clientId.substring("client-".length()), 
					response.as(UnavailableResponse.class).getMessage());
		}
		assertTrue(_worker.getPeakActiveRequestCount() <= MAX_CONCURRENT);
		assertEquals(MAX_CONCURRENT, _worker.getAvailablePermits());
	}
	
	@Test(timeout=30000)
	public void failingHandlerStillReplies() throws Exception {
		RequestHandler failingHandler = new RequestHandler() {
			
			@Override
			public AllocationResponse handle(long requestId, byte[] payload) {
				throw new IllegalStateException("handler failure");
			}
		};
		_worker = new AllocatorWorker(_context.getHandle(), _backendAddress, failingHandler, _codec, 
				1, 5, "failing-worker");
		_worker.start();
		byte[] workerId = awaitReady();
		
		dispatch(workerId, "client-a", "{}");
		dispatch(workerId, "client-b", "{}");
		
		for (List<byte[]> reply : collectReplies(2)) {
			AllocationResponse response = _codec.decodeResponse(reply.get(4));
			assertEquals(ResponseType.ERROR, response.getType());
			assertEquals(AllocatorWorker.INTERNAL_ERROR_MESSAGE, response.as(ErrorResponse.class).getMessage());
		}
		assertEquals(1, _worker.getAvailablePermits());
	}
	
	@Test(timeout=30000)
	public void malformedDispatchDropped() throws Exception {
		RequestHandler echoHandler = new RequestHandler() {
			
			@Override
			public AllocationResponse handle(long requestId, byte[] payload) {
				return new UnavailableResponse(WireProtocol.fromBytes(payload));
			}
		};
		_worker = new AllocatorWorker(_context.getHandle(), _backendAddress, echoHandler, _codec, 
				1, 5, "echo-worker");
		_worker.start();
		byte[] workerId = awaitReady();
		
		assertTrue(ZmqSocketOperations.sendFrames(_backend, workerId, WireProtocol.toBytes("garbage")));
		dispatch(workerId, "client-a", "hello");
		
		List<byte[]> reply = collectReplies(1).get(0);
		assertEquals("client-a", WireProtocol.fromBytes(reply.get(2)));
		assertEquals("hello", _codec.decodeResponse(reply.get(4)).as(UnavailableResponse.class).getMessage());
	}
	
	@Test
	public void trackingHandlerCountsPeak() {
		final InFlightTrackingRequestHandler[] tracker = new InFlightTrackingRequestHandler[1];
		tracker[0] = RequestHandlers.track(new RequestHandler() {
			
			@Override
			public AllocationResponse handle(long requestId, byte[] payload) {
				assertEquals(1, tracker[0].getActiveCount());
				return new UnavailableResponse("none");
			}
		});
		tracker[0].handle(1, new byte[0]);
		assertEquals(0, tracker[0].getActiveCount());
		assertEquals(1, tracker[0].getPeakCount());
	}
	
}
