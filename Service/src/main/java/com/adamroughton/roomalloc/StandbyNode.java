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
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.Option;

import com.adamroughton.roomalloc.config.Configuration;
import com.adamroughton.roomalloc.config.ConfigurationUtil;
import com.adamroughton.roomalloc.data.FlatFileResourceTableStore;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.failover.StandbyReplica;
import com.adamroughton.roomalloc.failover.StandbyReplica.WorkerFactory;
import com.adamroughton.roomalloc.util.LockMutex;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.worker.AllocatorWorker;
import com.adamroughton.roomalloc.worker.ResourceTable;

/**
 * Follows the primary's feeds and takes over as a worker when the
 * primary's heartbeat goes silent.
 */
public class StandbyNode implements RoomAllocNode {

	public static void main(String[] args) {
		RoomAllocExecutableOperations.executeNode(args, new StandbyNode());
	}
	
	@Override
	public String getProcessName() {
		return "StandbyNode";
	}

	@Override
	public Iterable<Option> getCommandLineOptions() {
		return Collections.emptyList();
	}

	@Override
	public List<Closeable> start(Map<String, String> commandLineOptions, final Configuration config, 
			final RoomAllocHandle handle) throws Exception {
		final JsonCodec codec = new JsonCodec();
		Path tablePath = ConfigurationUtil.resolvePath(config, 
				ConfigurationUtil.getWorkerSettings(config).getStandbyTableFile());
		final ResourceTableStore store = new FlatFileResourceTableStore(tablePath);
		Mutex<ResourceTable> tableMutex = new LockMutex<>(new ResourceTable());
		
		StandbyReplica replica = new StandbyReplica(handle, 
				ConfigurationUtil.getConnectAddress(config, Constants.PRIMARY_SERVICE, Constants.HEARTBEAT_PORT), 
				ConfigurationUtil.getConnectAddress(config, Constants.PRIMARY_SERVICE, Constants.STATE_SYNC_PORT), 
				tableMutex, 
				store, 
				codec, 
				ConfigurationUtil.getTiming(config), 
				new WorkerFactory() {
					
					@Override
					public AllocatorWorker create(Mutex<ResourceTable> tableMutex) {
						return PrimaryNode.createWorker(handle, config, tableMutex, store, codec, "standby");
					}
				});
		replica.start();
		return Collections.<Closeable>singletonList(replica);
	}
	
}
