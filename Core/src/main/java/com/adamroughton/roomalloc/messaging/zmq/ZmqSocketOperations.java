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
import java.util.List;

import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

import com.adamroughton.roomalloc.messaging.MessengerClosedException;

public final class ZmqSocketOperations {

	private ZmqSocketOperations() {
	}
	
	/**
	 * Sends the given frames as a single multi-part message. The socket's
	 * send timeout bounds how long the call may wait for the first frame
	 * to be accepted; the remaining frames follow atomically.
	 * 
	 * @param socket the socket to send on
	 * @param frames the frames of the message, in order
	 * @return {@code true} if the message was sent, {@code false} if the
	 * send timed out (EAGAIN)
	 * @throws MessengerClosedException if the context was terminated
	 */
	public static boolean sendFrames(ZMQ.Socket socket, byte[]... frames) {
		if (frames.length == 0) 
			throw new IllegalArgumentException("A message must have at least one frame.");
		try {
			for (int i = 0; i < frames.length; i++) {
				int flags = (i < frames.length - 1)? ZMQ.SNDMORE : 0;
				if (!socket.send(frames[i], flags)) {
					if (i == 0) {
						return false;
					} else {
						throw new IllegalStateException(String.format("Frame %d of a multi-part message was rejected.", i));
					}
				}
			}
			return true;
		} catch (ZMQException eZmq) {
			throw translate(eZmq);
		}
	}
	
	public static boolean sendFrames(ZMQ.Socket socket, List<byte[]> frames) {
		return sendFrames(socket, frames.toArray(new byte[frames.size()][]));
	}
	
	/**
	 * Receives all frames of the next message.
	 * 
	 * @param socket the socket to receive on
	 * @param isBlocking whether to wait up to the socket's receive timeout
	 * for a message
	 * @return the frames, or {@code null} if no message was available
	 * @throws MessengerClosedException if the context was terminated
	 */
	public static List<byte[]> recvFrames(ZMQ.Socket socket, boolean isBlocking) {
		try {
			byte[] frame = socket.recv(isBlocking? 0 : ZMQ.DONTWAIT);
			if (frame == null) {
				return null;
			}
			List<byte[]> frames = new ArrayList<>(4);
			frames.add(frame);
			while (socket.hasReceiveMore()) {
				frames.add(socket.recv(0));
			}
			return frames;
		} catch (ZMQException eZmq) {
			throw translate(eZmq);
		}
	}
	
	/**
	 * Polls with the given timeout, translating a terminated context into
	 * {@link MessengerClosedException}.
	 */
	public static int poll(ZMQ.Poller poller, long timeoutMillis) {
		try {
			return poller.poll(timeoutMillis);
		} catch (ZMQException eZmq) {
			throw translate(eZmq);
		}
	}
	
	public static boolean isContextTerminated(ZMQException eZmq) {
		return eZmq.getErrorCode() == ZMQ.Error.ETERM.getCode();
	}
	
	private static RuntimeException translate(ZMQException eZmq) {
		// check that the socket hasn't just been closed
		if (isContextTerminated(eZmq)) {
			return MessengerClosedException.INSTANCE;
		} else {
			return eZmq;
		}
	}

}
