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
package com.adamroughton.roomalloc.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import com.esotericsoftware.minlog.Log;

public class ConfigurationUtil {
	
	public static final String DEFAULT_HOST = "localhost";
	
	public static int getPort(Configuration config, String serviceType, String portName) {
		Service service = getService(config, serviceType, true);
		Map<String, Integer> portAssignments = service.getPorts();
		if (portAssignments == null || !portAssignments.containsKey(portName)) {
			Log.info(String.format("Allowing any port for port ID '%s' of service '%s'.", portName, serviceType));
			return -1;
		}
		return portAssignments.get(portName);
	}
	
	public static String getHost(Configuration config, String serviceType) {
		Service service = getService(config, serviceType, true);
		String host = service.getHost();
		return host == null? DEFAULT_HOST : host;
	}
	
	public static String getConnectAddress(Configuration config, String serviceType, String portName) {
		int port = getRequiredPort(config, serviceType, portName);
		return String.format("tcp://%s:%d", getHost(config, serviceType), port);
	}
	
	public static String getBindAddress(Configuration config, String serviceType, String portName) {
		int port = getRequiredPort(config, serviceType, portName);
		return String.format("tcp://*:%d", port);
	}
	
	public static Timing getTiming(Configuration config) {
		Timing timing = config.getTiming();
		if (timing == null) {
			timing = new Timing();
		}
		assertTimingValid(timing);
		return timing;
	}
	
	public static WorkerSettings getWorkerSettings(Configuration config) {
		WorkerSettings settings = config.getWorker();
		if (settings == null) {
			settings = new WorkerSettings();
		}
		if (settings.getMaxConcurrentRequests() < 1) 
			throw new IllegalArgumentException(String.format("The maximum number of concurrent requests " +
					"must be 1 or greater (was %d).", settings.getMaxConcurrentRequests()));
		return settings;
	}
	
	/**
	 * Resolves the given file name against the configured working directory.
	 */
	public static Path resolvePath(Configuration config, String fileName) {
		String workingDir = config.getWorkingDir();
		if (workingDir == null) {
			return Paths.get(fileName);
		} else {
			return Paths.get(workingDir).resolve(fileName);
		}
	}
	
	public static void assertTimingValid(Timing timing) {
		if (timing.getHeartbeatPeriodMillis() <= 0)
			throw new IllegalArgumentException("The heartbeat period must be positive.");
		if (timing.getHeartbeatCheckMillis() <= 0)
			throw new IllegalArgumentException("The heartbeat check interval must be positive.");
		if (timing.getSyncPeriodMillis() <= 0)
			throw new IllegalArgumentException("The state sync period must be positive.");
		if (timing.getHeartbeatTimeoutMillis() <= timing.getHeartbeatPeriodMillis())
			throw new IllegalArgumentException(String.format("The heartbeat timeout (%dms) must be greater " +
					"than the heartbeat period (%dms).", timing.getHeartbeatTimeoutMillis(), timing.getHeartbeatPeriodMillis()));
	}
	
	private static int getRequiredPort(Configuration config, String serviceType, String portName) {
		int port = getPort(config, serviceType, portName);
		if (port == -1)
			throw new RuntimeException(String.format("No port '%s' configured for service '%s'", portName, serviceType));
		return port;
	}
	
	private static Service getService(Configuration config, String serviceType, boolean assertExists) {
		Map<String, Service> services = config.getServices();
		Service service = services == null? null : services.get(serviceType);
		if (assertExists && service == null)
			throw new RuntimeException(String.format("No such service '%s'", serviceType));
		return service;
	}
	
}
