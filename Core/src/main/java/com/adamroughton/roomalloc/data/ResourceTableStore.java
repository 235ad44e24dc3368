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
package com.adamroughton.roomalloc.data;

import java.util.List;

import com.adamroughton.roomalloc.model.Resource;

/**
 * Durable backing for a resource table. The table is always
 * loaded and saved in full.
 */
public interface ResourceTableStore {

	/**
	 * Loads every resource, in stored order. A store that has never been
	 * written loads as an empty table.
	 */
	List<Resource> load() throws PersistenceException;
	
	/**
	 * Replaces the stored table with the given resources.
	 */
	void save(Iterable<Resource> resources) throws PersistenceException;
	
	String getLocation();
	
}
