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

import java.io.Closeable;
import java.util.List;
import java.util.Objects;

import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.Constants;
import com.adamroughton.roomalloc.RoomAllocHandle;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.ValidationException;
import com.adamroughton.roomalloc.messaging.CommunicationException;
import com.adamroughton.roomalloc.messaging.WireProtocol;
import com.adamroughton.roomalloc.messaging.zmq.SocketManager;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.messaging.zmq.ZmqSocketOperations;
import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.esotericsoftware.minlog.Log;

/**
 * Sends one allocation request at a time to the broker frontend and waits
 * for the matching reply. After a timeout the socket is discarded, so a
 * late reply to an abandoned request is never mistaken for the next one.
 * <p>
 * Not thread safe.
 */
public final class AllocationClient implements Closeable {

	private final RoomAllocHandle _handle;
	private final String _frontendAddress;
	private final JsonCodec _codec;
	private final int _sendTimeoutMillis;
	private final int _recvTimeoutMillis;
	
	private ZMQ.Socket _socket = null;
	
	public AllocationClient(RoomAllocHandle handle, String frontendAddress, JsonCodec codec) {
		this(handle, frontendAddress, codec, Constants.CLIENT_SEND_TIMEOUT_MILLIS, Constants.CLIENT_RECV_TIMEOUT_MILLIS);
	}
	
	public AllocationClient(RoomAllocHandle handle, 
			String frontendAddress, 
			JsonCodec codec, 
			int sendTimeoutMillis, 
			int recvTimeoutMillis) {
		_handle = Objects.requireNonNull(handle);
		_frontendAddress = Objects.requireNonNull(frontendAddress);
		_codec = Objects.requireNonNull(codec);
		if (sendTimeoutMillis < 0 || recvTimeoutMillis < 0)
			throw new IllegalArgumentException(String.format("Timeouts must be non-negative (send %d, recv %d)", 
					sendTimeoutMillis, recvTimeoutMillis));
		_sendTimeoutMillis = sendTimeoutMillis;
		_recvTimeoutMillis = recvTimeoutMillis;
	}
	
	/**
	 * Sends the request and waits for its reply.
	 * 
	 * @param request the request to send
	 * @return the decoded reply
	 * @throws CommunicationException if the send or the receive timed out
	 * (retryable), or if the reply could not be decoded (not retryable)
	 */
	public AllocationResponse request(AllocationRequest request) throws CommunicationException {
		byte[] reply = requestRaw(_codec.encodeRequest(request));
		try {
			return _codec.decodeResponse(reply);
		} catch (ValidationException eInvalid) {
			throw new CommunicationException("Received a malformed reply: " + eInvalid.getMessage(), false, eInvalid);
		}
	}
	
	/**
	 * Sends an already encoded payload and returns the raw reply payload.
	 */
	public byte[] requestRaw(byte[] payload) throws CommunicationException {
		ZMQ.Socket socket = getSocket();
		if (!ZmqSocketOperations.sendFrames(socket, WireProtocol.EMPTY_FRAME, payload)) {
			resetSocket();
			throw CommunicationException.timedOut("send the request", _sendTimeoutMillis);
		}
		List<byte[]> frames = ZmqSocketOperations.recvFrames(socket, true);
		if (frames == null) {
			resetSocket();
			throw CommunicationException.timedOut("receive the reply", _recvTimeoutMillis);
		}
		if (frames.size() != 2 || !WireProtocol.isEmpty(frames.get(0))) {
			resetSocket();
			throw new CommunicationException(String.format("Expected a reply of 2 frames, got %d", frames.size()), false);
		}
		return frames.get(1);
	}
	
	private ZMQ.Socket getSocket() {
		if (_socket == null) {
			SocketManager socketManager = _handle.getSocketManager();
			SocketSettings settings = SocketSettings.create()
					.setSendTimeout(_sendTimeoutMillis)
					.setRecvTimeout(_recvTimeoutMillis);
			_socket = socketManager.create(ZMQ.DEALER, settings, "allocation-client");
			socketManager.connectSocket(_socket, _frontendAddress);
			Log.debug(String.format("Client connected to %s", _frontendAddress));
		}
		return _socket;
	}
	
	private void resetSocket() {
		if (_socket != null) {
			SocketManager socketManager = _handle.getSocketManager();
			if (socketManager.isActive()) {
				socketManager.destroySocket(_socket);
			}
			_socket = null;
		}
	}

	@Override
	public void close() {
		resetSocket();
	}
	
}
