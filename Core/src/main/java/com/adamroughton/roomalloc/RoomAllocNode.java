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
package com.adamroughton.roomalloc;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.Option;

import com.adamroughton.roomalloc.config.Configuration;

public interface RoomAllocNode {

	String getProcessName();
	
	Iterable<Option> getCommandLineOptions();
	
	/**
	 * Creates and starts the components of the node. The components are
	 * closed in the order returned when the process shuts down.
	 */
	List<Closeable> start(Map<String, String> commandLineOptions, Configuration config, RoomAllocHandle handle) throws Exception;
	
}
