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

import java.io.Closeable;

import org.zeromq.ZMQ;

/**
 * Creates and tracks the sockets of a node. Every socket is created with
 * the manager's uniform send and receive timeouts and zero linger. A socket
 * must only be used by one thread at a time; the creating component is
 * responsible for handing it to the thread that will own it.
 */
public interface SocketManager extends Closeable {
	
	/**
	 * Creates a new managed socket with default settings. The socket is
	 * not bound to any endpoint until connected through 
	 * {@link SocketManager#connectSocket(ZMQ.Socket, String)}.
	 * @param socketType the ZMQ socket type
	 * @param name a name for the socket
	 * @return the created socket
	 */
	ZMQ.Socket create(int socketType, String name);
	
	/**
	 * Creates a new managed socket. The socket is bound to every endpoint
	 * the {@link SocketSettings} object includes before this call returns.
	 * @param socketType the ZMQ socket type
	 * @param socketSettings the settings to apply
	 * @param name a name for the socket
	 * @return the created socket
	 */
	ZMQ.Socket create(int socketType, SocketSettings socketSettings, String name);
	
	/**
	 * Get the settings associated with the given socket.
	 * @param socket the managed socket
	 * @return the socket settings
	 */
	SocketSettings getSettings(ZMQ.Socket socket);
	
	/**
	 * Gets the ports the socket was bound to, including any
	 * port chosen for a {@code -1} port request.
	 */
	int[] getBoundPorts(ZMQ.Socket socket);
	
	void connectSocket(ZMQ.Socket socket, String address);
	
	/**
	 * Creates a poller with POLLIN registered for each socket, 
	 * in the order given.
	 */
	ZMQ.Poller createPollInSet(ZMQ.Socket... sockets);
	
	void destroySocket(ZMQ.Socket socket);
	
	void destroyAllSockets();
	
	boolean isActive();
	
	/**
	 * Closes the socket manager, releasing all resources.
	 */
	@Override
	void close();
	
}
