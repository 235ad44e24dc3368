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

public final class TableStatistics {

	private final int _fixedRoomCount;
	private final int _labCount;
	private final int _mobileRoomCount;
	private final int _availableFixedRoomCount;
	private final int _availableLabCount;
	private final int _mobileRoomsInUseCount;
	
	public static TableStatistics of(Iterable<Resource> resources) {
		int fixedRooms = 0;
		int labs = 0;
		int mobileRooms = 0;
		int availableFixedRooms = 0;
		int availableLabs = 0;
		int mobileRoomsInUse = 0;
		for (Resource resource : resources) {
			switch (resource.getKind()) {
				case FIXED_ROOM:
					fixedRooms++;
					if (resource.isAvailable()) availableFixedRooms++;
					break;
				case LAB:
					labs++;
					if (resource.isAvailable()) availableLabs++;
					break;
				case MOBILE_ROOM:
					mobileRooms++;
					if (!resource.isAvailable()) mobileRoomsInUse++;
					break;
			}
		}
		return new TableStatistics(fixedRooms, labs, mobileRooms, availableFixedRooms, availableLabs, mobileRoomsInUse);
	}
	
	public TableStatistics(int fixedRoomCount, 
			int labCount, 
			int mobileRoomCount,
			int availableFixedRoomCount, 
			int availableLabCount,
			int mobileRoomsInUseCount) {
		_fixedRoomCount = fixedRoomCount;
		_labCount = labCount;
		_mobileRoomCount = mobileRoomCount;
		_availableFixedRoomCount = availableFixedRoomCount;
		_availableLabCount = availableLabCount;
		_mobileRoomsInUseCount = mobileRoomsInUseCount;
	}

	public int getFixedRoomCount() {
		return _fixedRoomCount;
	}

	public int getLabCount() {
		return _labCount;
	}

	public int getMobileRoomCount() {
		return _mobileRoomCount;
	}

	public int getAvailableFixedRoomCount() {
		return _availableFixedRoomCount;
	}

	public int getAvailableLabCount() {
		return _availableLabCount;
	}

	public int getMobileRoomsInUseCount() {
		return _mobileRoomsInUseCount;
	}

	@Override
	public String toString() {
		return String.format("fixed rooms: %d (%d available), labs: %d (%d available), mobile rooms: %d (%d in use)", 
				_fixedRoomCount, _availableFixedRoomCount, 
				_labCount, _availableLabCount, 
				_mobileRoomCount, _mobileRoomsInUseCount);
	}
	
}
