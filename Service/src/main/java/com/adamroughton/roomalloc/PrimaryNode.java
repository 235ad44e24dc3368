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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;

import com.adamroughton.roomalloc.config.Configuration;
import com.adamroughton.roomalloc.config.ConfigurationUtil;
import com.adamroughton.roomalloc.config.Timing;
import com.adamroughton.roomalloc.config.WorkerSettings;
import com.adamroughton.roomalloc.data.FlatFileResourceTableStore;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.data.ResourceTableStore;
import com.adamroughton.roomalloc.failover.HeartbeatPublisher;
import com.adamroughton.roomalloc.failover.StateSyncPublisher;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.adamroughton.roomalloc.util.LockMutex;
import com.adamroughton.roomalloc.util.Mutex;
import com.adamroughton.roomalloc.worker.AllocatorWorker;
import com.adamroughton.roomalloc.worker.RequestHandlers;
import com.adamroughton.roomalloc.worker.ResourceAllocator;
import com.adamroughton.roomalloc.worker.ResourceTable;
import com.esotericsoftware.minlog.Log;

/**
 * The active allocator: a worker registered with the broker, plus the
 * heartbeat and state-sync feeds the standby listens to.
 */
public class PrimaryNode implements RoomAllocNode {

	public static final String RESET_OPTION = "reset";
	public static final String NAME_OPTION = "name";
	
	public static void main(String[] args) {
		RoomAllocExecutableOperations.executeNode(args, new PrimaryNode());
	}
	
	@Override
	public String getProcessName() {
		return "PrimaryNode";
	}

	@SuppressWarnings("static-access")
	@Override
	public Iterable<Option> getCommandLineOptions() {
		return Arrays.asList(
				OptionBuilder.withDescription("make every resource available again before starting")
					.isRequired(false)
					.create(RESET_OPTION),
				OptionBuilder.withArgName("worker name")
					.hasArg()
					.isRequired(false)
					.withDescription("the name the worker registers under (default: primary)")
					.create(NAME_OPTION)
			);
	}

	@Override
	public List<Closeable> start(Map<String, String> commandLineOptions, Configuration config, 
			RoomAllocHandle handle) throws Exception {
		WorkerSettings workerSettings = ConfigurationUtil.getWorkerSettings(config);
		Timing timing = ConfigurationUtil.getTiming(config);
		JsonCodec codec = new JsonCodec();
		
		Path tablePath = ConfigurationUtil.resolvePath(config, workerSettings.getTableFile());
		ResourceTableStore store = new FlatFileResourceTableStore(tablePath);
		ResourceTable table = new ResourceTable(store.load());
		Log.info(String.format("Loaded %d resources from '%s'", table.size(), tablePath));
		Mutex<ResourceTable> tableMutex = new LockMutex<>(table);
		
		if (commandLineOptions.containsKey(RESET_OPTION)) {
			new ResourceAllocator(tableMutex, store, handle.getClock()).reset();
			Log.info("Every resource was made available");
		}
		
		String name = commandLineOptions.containsKey(NAME_OPTION)? commandLineOptions.get(NAME_OPTION) : "primary";
		AllocatorWorker worker = createWorker(handle, config, tableMutex, store, codec, name);
		
		HeartbeatPublisher heartbeatPublisher = new HeartbeatPublisher(handle, 
				SocketSettings.create().bindToAddress(ConfigurationUtil.getBindAddress(config, Constants.PRIMARY_SERVICE, Constants.HEARTBEAT_PORT)), 
				timing.getHeartbeatPeriodMillis());
		StateSyncPublisher syncPublisher = new StateSyncPublisher(handle, 
				SocketSettings.create().bindToAddress(ConfigurationUtil.getBindAddress(config, Constants.PRIMARY_SERVICE, Constants.STATE_SYNC_PORT)), 
				timing.getSyncPeriodMillis(), 
				tableMutex, 
				codec);
		
		worker.start();
		heartbeatPublisher.start();
		syncPublisher.start();
		return Arrays.<Closeable>asList(heartbeatPublisher, syncPublisher, worker);
	}
	
	/**
	 * Creates an allocator worker over the given table that connects to the
	 * broker backend named in the configuration.
	 */
	public static AllocatorWorker createWorker(RoomAllocHandle handle, 
			Configuration config, 
			Mutex<ResourceTable> tableMutex, 
			ResourceTableStore store, 
			JsonCodec codec,
			String name) {
		WorkerSettings workerSettings = ConfigurationUtil.getWorkerSettings(config);
		ResourceAllocator allocator = new ResourceAllocator(tableMutex, store, handle.getClock());
		return new AllocatorWorker(handle, 
				ConfigurationUtil.getConnectAddress(config, Constants.BROKER_SERVICE, Constants.BACKEND_PORT), 
				RequestHandlers.forAllocator(codec, allocator, handle.getClock()), 
				codec, 
				workerSettings.getMaxConcurrentRequests(), 
				Constants.WORKER_POLL_MILLIS, 
				name);
	}
	
}
