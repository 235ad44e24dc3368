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
package com.adamroughton.roomalloc.messaging;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;

/**
 * Frame constants and text encodings shared by the broker, the workers
 * and the liveness feed.
 */
public final class WireProtocol {

	public static final byte[] EMPTY_FRAME = new byte[0];
	
	public static final String READY = "READY";
	private static final byte[] READY_BYTES = toBytes(READY);
	
	public static final String HEARTBEAT_PREFIX = "HEARTBEAT ";
	
	private WireProtocol() {
	}
	
	public static byte[] toBytes(String value) {
		return value.getBytes(StandardCharsets.UTF_8);
	}
	
	public static String fromBytes(byte[] bytes) {
		return new String(bytes, StandardCharsets.UTF_8);
	}
	
	public static byte[] readyFrame() {
		return Arrays.copyOf(READY_BYTES, READY_BYTES.length);
	}
	
	public static boolean isReady(byte[] frame) {
		return Arrays.equals(READY_BYTES, frame);
	}
	
	public static boolean isEmpty(byte[] frame) {
		return frame != null && frame.length == 0;
	}
	
	public static String formatHeartbeat(long epochMillis) {
		return HEARTBEAT_PREFIX + Instant.ofEpochMilli(epochMillis).toString();
	}
	
	/**
	 * Parses a beacon of the form {@code HEARTBEAT <ISO-8601 instant>}.
	 * @return the beacon instant in epoch millis
	 * @throws IllegalArgumentException if the payload is not a beacon
	 */
	public static long parseHeartbeat(String payload) {
		if (payload == null || !payload.startsWith(HEARTBEAT_PREFIX))
			throw new IllegalArgumentException(String.format("Not a heartbeat: '%s'", payload));
		try {
			return Instant.parse(payload.substring(HEARTBEAT_PREFIX.length()).trim()).toEpochMilli();
		} catch (DateTimeParseException eParse) {
			throw new IllegalArgumentException(String.format("Bad heartbeat instant: '%s'", payload), eParse);
		}
	}
	
}
