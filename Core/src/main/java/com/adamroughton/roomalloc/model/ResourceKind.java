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
package com.adamroughton.roomalloc.model;

public enum ResourceKind {
	FIXED_ROOM("fixed_room"),
	LAB("lab"),
	
	/**
	 * A fixed room repurposed as a lab substitute. Reverts to
	 * {@link #FIXED_ROOM} when the table is reset.
	 */
	MOBILE_ROOM("mobile_room");
	
	private final String _wireName;
	
	private ResourceKind(String wireName) {
		_wireName = wireName;
	}
	
	public String getWireName() {
		return _wireName;
	}
	
	public static ResourceKind fromWireName(String wireName) {
		for (ResourceKind kind : values()) {
			if (kind._wireName.equals(wireName)) {
				return kind;
			}
		}
		throw new IllegalArgumentException(String.format("Unknown resource kind '%s'", wireName));
	}
}
