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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.ResourceStatus;
import com.adamroughton.roomalloc.model.StateSnapshot;

public class TestResourceTable {

	private static final String NOW = "2024-03-01T10:00:00Z";
	
	private static Resource assigned(String id, ResourceKind kind) {
		return new Resource(id, kind, ResourceStatus.ASSIGNED, 40, "Engineering", "Systems", NOW, NOW);
	}
	
	@Test
	public void snapshotUpsertsWithoutDeleting() {
		ResourceTable table = new ResourceTable(Arrays.asList(
				Resource.available("S1", ResourceKind.FIXED_ROOM, 40),
				Resource.available("S9", ResourceKind.FIXED_ROOM, 40)));
		StateSnapshot snapshot = new StateSnapshot(Arrays.asList(
				assigned("S1", ResourceKind.MOBILE_ROOM),
				Resource.available("L1", ResourceKind.LAB, 25)));
		
		assertEquals(1, table.applySnapshot(snapshot));
		
		assertEquals(3, table.size());
		assertEquals(assigned("S1", ResourceKind.MOBILE_ROOM), table.get("S1"));
		assertEquals(Resource.available("L1", ResourceKind.LAB, 25), table.get("L1"));
		assertEquals(Resource.available("S9", ResourceKind.FIXED_ROOM, 40), table.get("S9"));
	}
	
	@Test
	public void applyingTwiceEqualsApplyingOnce() {
		StateSnapshot snapshot = new StateSnapshot(Arrays.asList(
				assigned("S1", ResourceKind.FIXED_ROOM),
				Resource.available("S2", ResourceKind.FIXED_ROOM, 40),
				Resource.available("L1", ResourceKind.LAB, 25)));
		ResourceTable once = new ResourceTable(Arrays.asList(Resource.available("S0", ResourceKind.FIXED_ROOM, 30)));
		ResourceTable twice = new ResourceTable(Arrays.asList(Resource.available("S0", ResourceKind.FIXED_ROOM, 30)));
		
		once.applySnapshot(snapshot);
		twice.applySnapshot(snapshot);
		assertEquals(0, twice.applySnapshot(snapshot));
		
		assertEquals(once.toSnapshot(), twice.toSnapshot());
	}
	
	@Test
	public void tableDoesNotAliasSnapshotResources() {
		Resource incoming = Resource.available("S1", ResourceKind.FIXED_ROOM, 40);
		ResourceTable table = new ResourceTable();
		table.applySnapshot(new StateSnapshot(Arrays.asList(incoming)));
		
		table.get("S1").assign("Engineering", "Systems", NOW, NOW);
		assertTrue(incoming.isAvailable());
	}
	
	@Test
	public void findAvailableKeepsTableOrder() {
		ResourceTable table = new ResourceTable(Arrays.asList(
				Resource.available("S3", ResourceKind.FIXED_ROOM, 40),
				Resource.available("L1", ResourceKind.LAB, 25),
				assigned("S1", ResourceKind.FIXED_ROOM),
				Resource.available("S2", ResourceKind.FIXED_ROOM, 20),
				Resource.available("S4", ResourceKind.FIXED_ROOM, 40)));
		
		assertEquals(Arrays.asList("S3", "S2"), ids(table.findAvailable(ResourceKind.FIXED_ROOM, 0, 
				Collections.<String>emptySet(), 2)));
		assertEquals(Arrays.asList("S3", "S4"), ids(table.findAvailable(ResourceKind.FIXED_ROOM, 30, 
				Collections.<String>emptySet(), 5)));
		assertEquals(Arrays.asList("S2", "S4"), ids(table.findAvailable(ResourceKind.FIXED_ROOM, 0, 
				Collections.singleton("S3"), 5)));
		assertTrue(table.findAvailable(ResourceKind.LAB, 0, Collections.<String>emptySet(), 0).isEmpty());
	}
	
	@Test
	public void findAvailableWithLimitFarAboveTableSize() {
		ResourceTable table = new ResourceTable(Arrays.asList(
				Resource.available("S1", ResourceKind.FIXED_ROOM, 40),
				Resource.available("S2", ResourceKind.FIXED_ROOM, 20)));
		
		assertEquals(Arrays.asList("S1", "S2"), ids(table.findAvailable(ResourceKind.FIXED_ROOM, 0, 
				Collections.<String>emptySet(), Integer.MAX_VALUE)));
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void duplicateIdsRejected() {
		new ResourceTable(Arrays.asList(
				Resource.available("S1", ResourceKind.FIXED_ROOM, 40),
				Resource.available("S1", ResourceKind.LAB, 25)));
	}
	
	private static List<String> ids(List<Resource> resources) {
		List<String> ids = new ArrayList<>();
		for (Resource resource : resources) {
			ids.add(resource.getId());
		}
		return ids;
	}
	
}
