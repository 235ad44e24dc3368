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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.Option;

import com.adamroughton.roomalloc.broker.LoadBalancingBroker;
import com.adamroughton.roomalloc.config.Configuration;
import com.adamroughton.roomalloc.config.ConfigurationUtil;
import com.adamroughton.roomalloc.config.Timing;
import com.adamroughton.roomalloc.data.JsonCodec;
import com.adamroughton.roomalloc.messaging.zmq.SocketSettings;
import com.esotericsoftware.minlog.Log;

public class BrokerNode implements RoomAllocNode {

	public static void main(String[] args) {
		RoomAllocExecutableOperations.executeNode(args, new BrokerNode());
	}
	
	@Override
	public String getProcessName() {
		return "BrokerNode";
	}

	@Override
	public Iterable<Option> getCommandLineOptions() {
		return Collections.emptyList();
	}

	@Override
	public List<Closeable> start(Map<String, String> commandLineOptions, Configuration config, 
			RoomAllocHandle handle) throws Exception {
		String frontendAddress = ConfigurationUtil.getBindAddress(config, Constants.BROKER_SERVICE, Constants.FRONTEND_PORT);
		String backendAddress = ConfigurationUtil.getBindAddress(config, Constants.BROKER_SERVICE, Constants.BACKEND_PORT);
		Timing timing = ConfigurationUtil.getTiming(config);
		
		LoadBalancingBroker broker = new LoadBalancingBroker(handle, 
				SocketSettings.create().bindToAddress(frontendAddress), 
				SocketSettings.create().bindToAddress(backendAddress), 
				new JsonCodec(), 
				timing.getBrokerPollMillis(), 
				timing.getMaintenanceMillis());
		broker.start();
		Log.info(String.format("Broker listening for clients on %s and workers on %s", frontendAddress, backendAddress));
		return Collections.<Closeable>singletonList(broker);
	}
	
}
