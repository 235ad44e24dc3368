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
package com.adamroughton.roomalloc.client;

import static org.junit.Assert.*;

import java.util.List;
import java.util.UUID;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.DefaultClock;
import com.adamroughton.roomalloc.TestNodeContext;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.messaging.CommunicationException;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.ResponseType;

public class TestAllocationClient {

	private TestNodeContext _context;
	private ZMQ.Socket _frontend;
	private AllocationClient _client;
	private JsonCodec _codec;
	
	@Before
	public void setUp() {
		_context = new TestNodeContext(new DefaultClock());
		_codec = new JsonCodec();
		String inprocName = "frontend-" + UUID.randomUUID();
		_frontend = _context.getHandle().getSocketManager().create(ZMQ.ROUTER, 
				SocketSettings.create().bindToInprocName(inprocName).setRecvTimeout(3000), "test-frontend");
		_client = new AllocationClient(_context.getHandle(), SocketSettings.getInprocAddress(inprocName), _codec, 1000, 150);
	}
	
	@After
	public void tearDown() {
		_client.close();
		_context.getHandle().getSocketManager().destroySocket(_frontend);
		_context.close();
	}
	
	private static AllocationRequest request() {
		return new AllocationRequest("Engineering", "Systems", "2024-1", 1, 0, null);
	}
	
	private List<byte[]> receiveRequest() {
		List<byte[]> frames = ZmqSocketOperations.recvFrames(_frontend, true);
		assertNotNull(frames);
		assertEquals(3, frames.size());
		assertTrue(WireProtocol.isEmpty(frames.get(1)));
		return frames;
	}
	
	@Test(timeout=10000)
	public void timeoutIsRetryable() throws Exception {
		try {
			_client.request(request());
			fail();
		} catch (CommunicationException eTimeout) {
			assertTrue(eTimeout.isRetryable());
		}
		receiveRequest();
	}
	
	@Test(timeout=10000)
	public void lateReplyNotMistakenForNext() throws Exception {
		try {
			_client.request(request());
			fail();
		} catch (CommunicationException eTimeout) {
			assertTrue(eTimeout.isRetryable());
		}
		final List<byte[]> abandoned = receiveRequest();
		assertTrue(ZmqSocketOperations.sendFrames(_frontend, abandoned.get(0), WireProtocol.EMPTY_FRAME, 
				WireProtocol.toBytes("{\"error\":\"stale\"}")));
		
		Thread responder = new Thread(new Runnable() {
			
			@Override
			public void run() {
				List<byte[]> frames = ZmqSocketOperations.recvFrames(_frontend, true);
				ZmqSocketOperations.sendFrames(_frontend, frames.get(0), WireProtocol.EMPTY_FRAME, 
						WireProtocol.toBytes("{\"unavailable\":\"fresh\"}"));
			}
		});
		responder.start();
		AllocationResponse response;
		try {
			response = _client.request(request());
		} finally {
			responder.join();
		}
		assertEquals(ResponseType.UNAVAILABLE, response.getType());
	}
	
	@Test(timeout=10000)
	public void malformedReplyNotRetryable() throws Exception {
		Thread responder = new Thread(new Runnable() {
			
			@Override
			public void run() {
				List<byte[]> frames = ZmqSocketOperations.recvFrames(_frontend, true);
				ZmqSocketOperations.sendFrames(_frontend, frames.get(0), WireProtocol.EMPTY_FRAME, 
						WireProtocol.toBytes("<html/>"));
			}
		});
		responder.start();
		try {
			_client.request(request());
			fail();
		} catch (CommunicationException eMalformed) {
			assertFalse(eMalformed.isRetryable());
		} finally {
			responder.join();
		}
	}
	
}
