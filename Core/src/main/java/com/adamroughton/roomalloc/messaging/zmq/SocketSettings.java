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

import java.util.Arrays;
import java.util.Objects;

import com.adamroughton.roomalloc.util.Util;

public final class SocketSettings {

	private final String[] _inprocNamesToBindTo;
	private final String[] _addressesToBindTo;
	private final int[] _portsToBindTo;
	private final int _hwm;
	private final byte[][] _subscriptions;
	private final byte[] _identity;
	private final int _sendTimeoutMillis;
	private final int _recvTimeoutMillis;
	
	public static SocketSettings create() {
		return new SocketSettings(new String[0], new String[0], new int[0], -1, new byte[0][], null, -1, -1);
	}
	
	private SocketSettings(
			String[] inprocNamesToBindTo,
			String[] addressesToBindTo,
			int[] portsToBindTo, 
			int hwm, 
			byte[][] subscriptions,
			byte[] identity,
			int sendTimeoutMillis,
			int recvTimeoutMillis) {
		_inprocNamesToBindTo = inprocNamesToBindTo;
		_addressesToBindTo = addressesToBindTo;
		_portsToBindTo = portsToBindTo;
		_hwm = hwm;
		_subscriptions = subscriptions;
		_identity = identity;
		_sendTimeoutMillis = sendTimeoutMillis;
		_recvTimeoutMillis = recvTimeoutMillis;
	}
	
	/**
	 * Binds the socket to {@code tcp://*:(port)}. A port of {@code -1}
	 * binds to any free port.
	 * @param port the port to bind to
	 * @return the new settings
	 */
	public SocketSettings bindToPort(int port) {
		Util.assertPortValid(port);
		int[] portsToBindTo = Arrays.copyOf(_portsToBindTo, _portsToBindTo.length + 1);
		portsToBindTo[_portsToBindTo.length] = port;
		return new SocketSettings(_inprocNamesToBindTo, _addressesToBindTo, portsToBindTo, _hwm, _subscriptions, 
				_identity, _sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	/**
	 * Binds the socket to {@code inproc://(name)}
	 * @param name the unique name to bind to
	 * @return the new settings
	 */
	public SocketSettings bindToInprocName(String name) {
		Objects.requireNonNull(name);
		if (name.length() > 256) 
			throw new IllegalArgumentException(
				String.format("The name must be 256 characters or less (%s).", name));
		String[] inprocNamesToBindTo = Arrays.copyOf(_inprocNamesToBindTo, _inprocNamesToBindTo.length + 1);
		inprocNamesToBindTo[_inprocNamesToBindTo.length] = name;
		return new SocketSettings(inprocNamesToBindTo, _addressesToBindTo, _portsToBindTo, _hwm, _subscriptions, 
				_identity, _sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	/**
	 * Binds the socket to a fully qualified endpoint, e.g. {@code tcp://*:5555}.
	 * @param address the endpoint to bind to
	 * @return the new settings
	 */
	public SocketSettings bindToAddress(String address) {
		Objects.requireNonNull(address);
		if (!address.contains("://"))
			throw new IllegalArgumentException(String.format("The address '%s' has no transport.", address));
		String[] addressesToBindTo = Arrays.copyOf(_addressesToBindTo, _addressesToBindTo.length + 1);
		addressesToBindTo[_addressesToBindTo.length] = address;
		return new SocketSettings(_inprocNamesToBindTo, addressesToBindTo, _portsToBindTo, _hwm, _subscriptions, 
				_identity, _sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	public SocketSettings setHWM(int hwm) {
		if (hwm < 0)
			throw new IllegalArgumentException("The HWM must be 0 or greater.");
		return new SocketSettings(_inprocNamesToBindTo, _addressesToBindTo, _portsToBindTo, hwm, _subscriptions, 
				_identity, _sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	public SocketSettings setIdentity(byte[] identity) {
		Objects.requireNonNull(identity);
		if (identity.length == 0 || identity.length > 255)
			throw new IllegalArgumentException("The identity must be between 1 and 255 bytes long.");
		if (identity[0] == 0)
			throw new IllegalArgumentException("Identities starting with a zero byte are reserved.");
		return new SocketSettings(_inprocNamesToBindTo, _addressesToBindTo, _portsToBindTo, _hwm, _subscriptions, 
				Arrays.copyOf(identity, identity.length), _sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	/**
	 * Overrides the default send timeout of the socket manager.
	 */
	public SocketSettings setSendTimeout(int sendTimeoutMillis) {
		if (sendTimeoutMillis < -1)
			throw new IllegalArgumentException("The send timeout must be -1 or greater.");
		return new SocketSettings(_inprocNamesToBindTo, _addressesToBindTo, _portsToBindTo, _hwm, _subscriptions, 
				_identity, sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	/**
	 * Overrides the default receive timeout of the socket manager.
	 */
	public SocketSettings setRecvTimeout(int recvTimeoutMillis) {
		if (recvTimeoutMillis < -1)
			throw new IllegalArgumentException("The receive timeout must be -1 or greater.");
		return new SocketSettings(_inprocNamesToBindTo, _addressesToBindTo, _portsToBindTo, _hwm, _subscriptions, 
				_identity, _sendTimeoutMillis, recvTimeoutMillis);
	}
	
	public SocketSettings subscribeToAll() {
		return subscribeTo(new byte[0]);
	}
	
	public SocketSettings subscribeTo(byte[] subscription) {
		Objects.requireNonNull(subscription);
		byte[][] subscriptions = new byte[_subscriptions.length + 1][];
		for (int i = 0; i < subscriptions.length; i++) {
			byte[] sub;
			if (i == 0) {
				sub = subscription;
			} else {
				sub = _subscriptions[i - 1];
			}
			subscriptions[i] = Arrays.copyOf(sub, sub.length);
		}
		return new SocketSettings(_inprocNamesToBindTo, _addressesToBindTo, _portsToBindTo, _hwm, subscriptions, 
				_identity, _sendTimeoutMillis, _recvTimeoutMillis);
	}
	
	public String[] getInprocNamesToBindTo() {
		return Arrays.copyOf(_inprocNamesToBindTo, _inprocNamesToBindTo.length);
	}
	
	public String[] getAddressesToBindTo() {
		return Arrays.copyOf(_addressesToBindTo, _addressesToBindTo.length);
	}
	
	public int[] getPortsToBindTo() {
		return Arrays.copyOf(_portsToBindTo, _portsToBindTo.length);
	}
	
	public boolean isBound() {
		return _portsToBindTo.length != 0 || _inprocNamesToBindTo.length != 0 || _addressesToBindTo.length != 0;
	}
	
	public int getHWM() {
		return _hwm;
	}
	
	public byte[] getIdentity() {
		return _identity == null? null : Arrays.copyOf(_identity, _identity.length);
	}
	
	public int getSendTimeout() {
		return _sendTimeoutMillis;
	}
	
	public int getRecvTimeout() {
		return _recvTimeoutMillis;
	}
	
	public byte[][] getSubscriptions() {
		byte[][] subscriptions = new byte[_subscriptions.length][];
		for (int i = 0; i < subscriptions.length; i++) {
			byte[] sub = _subscriptions[i];
			subscriptions[i] = Arrays.copyOf(sub, sub.length);
		}
		return subscriptions;
	}
	
	public static String getInprocAddress(String inprocName) {
		return String.format("inproc://%s", inprocName);
	}

}
