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
package com.adamroughton.roomalloc.messaging.zmq;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.zeromq.ZMQ;

import com.adamroughton.roomalloc.Constants;
import com.esotericsoftware.minlog.Log;

public final class SocketManagerImpl implements SocketManager {

	private final ZMQ.Context _zmqContext;
	private final int _defaultTimeoutMillis;
	private final Map<ZMQ.Socket, SocketRecord> _socketLookup = new IdentityHashMap<>();
	private boolean _isActive = true;
	
	public SocketManagerImpl() {
		this(1, Constants.SOCKET_TIMEOUT_MILLIS);
	}
	
	public SocketManagerImpl(int ioThreads, int defaultTimeoutMillis) {
		if (defaultTimeoutMillis < -1)
			throw new IllegalArgumentException("The default timeout must be -1 or greater.");
		_zmqContext = ZMQ.context(ioThreads);
		_defaultTimeoutMillis = defaultTimeoutMillis;
	}
	
	@Override
	public synchronized ZMQ.Socket create(int socketType, String name) {
		return create(socketType, SocketSettings.create(), name);
	}
	
	@Override
	public synchronized ZMQ.Socket create(int socketType, SocketSettings socketSettings, String name) {
		assertManagerActive();
		Objects.requireNonNull(socketSettings);
		ZMQ.Socket socket = _zmqContext.socket(socketType);
		try {
			int sendTimeout = socketSettings.getSendTimeout();
			int recvTimeout = socketSettings.getRecvTimeout();
			socket.setSendTimeOut(sendTimeout == -1? _defaultTimeoutMillis : sendTimeout);
			socket.setReceiveTimeOut(recvTimeout == -1? _defaultTimeoutMillis : recvTimeout);
			socket.setLinger(0);
			int[] boundPorts = configureSocket(socket, socketSettings);
			_socketLookup.put(socket, new SocketRecord(name, socketSettings, boundPorts));
			Log.debug(String.format("Created socket '%s' (type %d)", name, socketType));
			return socket;
		} catch (RuntimeException e) {
			socket.close();
			throw e;
		}
	}
	
	private int[] configureSocket(ZMQ.Socket socket, SocketSettings settings) {
		int hwm = settings.getHWM();
		if (hwm != -1) {
			socket.setHWM(hwm);
		}
		byte[] identity = settings.getIdentity();
		if (identity != null) {
			socket.setIdentity(identity);
		}
		for (byte[] subscription : settings.getSubscriptions()) {
			socket.subscribe(subscription);
		}
		for (String inprocName : settings.getInprocNamesToBindTo()) {
			socket.bind(SocketSettings.getInprocAddress(inprocName));
		}
		for (String address : settings.getAddressesToBindTo()) {
			socket.bind(address);
		}
		int[] ports = settings.getPortsToBindTo();
		for (int i = 0; i < ports.length; i++) {
			if (ports[i] == -1) {
				ports[i] = socket.bindToRandomPort("tcp://*");
			} else {
				socket.bind("tcp://*:" + ports[i]);
			}
		}
		return ports;
	}
	
	@Override
	public synchronized SocketSettings getSettings(ZMQ.Socket socket) {
		return getRecord(socket).settings;
	}
	
	@Override
	public synchronized int[] getBoundPorts(ZMQ.Socket socket) {
		int[] boundPorts = getRecord(socket).boundPorts;
		int[] copy = new int[boundPorts.length];
		System.arraycopy(boundPorts, 0, copy, 0, boundPorts.length);
		return copy;
	}
	
	@Override
	public synchronized void connectSocket(ZMQ.Socket socket, String address) {
		SocketRecord record = getRecord(socket);
		socket.connect(address);
		record.connections.add(address);
	}
	
	@Override
	public synchronized ZMQ.Poller createPollInSet(ZMQ.Socket... sockets) {
		Objects.requireNonNull(sockets);
		if (sockets.length < 1) 
			throw new IllegalArgumentException("There must be at least one socket in the poll set.");
		ZMQ.Poller poller = _zmqContext.poller(sockets.length);
		for (ZMQ.Socket socket : sockets) {
			getRecord(socket);
			poller.register(socket, ZMQ.Poller.POLLIN);
		}
		return poller;
	}
	
	@Override
	public synchronized void destroySocket(ZMQ.Socket socket) {
		SocketRecord record = _socketLookup.remove(socket);
		if (record != null) {
			socket.close();
			Log.debug(String.format("Destroyed socket '%s'", record.name));
		}
	}
	
	@Override
	public synchronized void destroyAllSockets() {
		List<ZMQ.Socket> sockets = new ArrayList<>(_socketLookup.keySet());
		for (ZMQ.Socket socket : sockets) {
			Log.warn(String.format("Socket '%s' was still open when the socket manager closed.", 
					_socketLookup.get(socket).name));
			destroySocket(socket);
		}
	}
	
	@Override
	public synchronized boolean isActive() {
		return _isActive;
	}
	
	@Override
	public synchronized void close() {
		if (!_isActive) return;
		destroyAllSockets();
		_zmqContext.term();
		_isActive = false;
	}
	
	private SocketRecord getRecord(ZMQ.Socket socket) {
		assertManagerActive();
		SocketRecord record = _socketLookup.get(Objects.requireNonNull(socket));
		if (record == null)
			throw new IllegalArgumentException("The socket is not managed by this socket manager.");
		return record;
	}
	
	private void assertManagerActive() {
		if (!_isActive) throw new IllegalStateException("The socket manager has been closed.");
	}
	
	private static class SocketRecord {
		public final String name;
		public final SocketSettings settings;
		public final int[] boundPorts;
		public final List<String> connections = new ArrayList<>();
		
		public SocketRecord(String name, SocketSettings settings, int[] boundPorts) {
			this.name = name;
			this.settings = settings;
			this.boundPorts = boundPorts;
		}
	}
	
}
