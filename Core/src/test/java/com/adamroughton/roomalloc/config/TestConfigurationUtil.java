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

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import org.junit.Before;
import org.junit.Test;

import com.adamroughton.roomalloc.Constants;
import com.adamroughton.roomalloc.util.Util;

public class TestConfigurationUtil {

	private static final String YAML = 
			"workingDir: /var/roomalloc\n" +
			"services:\n" +
			"  broker:\n" +
			"    name: broker\n" +
			"    host: broker.local\n" +
			"    ports:\n" +
			"      frontend: 5555\n" +
			"      backend: 5556\n" +
			"  primary:\n" +
			"    name: primary\n" +
			"    ports:\n" +
			"      heartbeat: 5557\n" +
			"timing:\n" +
			"  heartbeatPeriodMillis: 500\n" +
			"  heartbeatTimeoutMillis: 1500\n" +
			"worker:\n" +
			"  maxConcurrentRequests: 4\n" +
			"  tableFile: table.csv\n";
	
	private Configuration _config;
	
	@Before
	public void setUp() {
		_config = Util.readYaml(Configuration.class, new ByteArrayInputStream(YAML.getBytes(StandardCharsets.UTF_8)));
	}
	
	@Test
	public void addresses() {
		assertEquals("tcp://broker.local:5555", ConfigurationUtil.getConnectAddress(_config, Constants.BROKER_SERVICE, Constants.FRONTEND_PORT));
		assertEquals("tcp://*:5556", ConfigurationUtil.getBindAddress(_config, Constants.BROKER_SERVICE, Constants.BACKEND_PORT));
		assertEquals("tcp://localhost:5557", ConfigurationUtil.getConnectAddress(_config, Constants.PRIMARY_SERVICE, Constants.HEARTBEAT_PORT));
	}
	
	@Test
	public void missingPortAllowsAny() {
		assertEquals(-1, ConfigurationUtil.getPort(_config, Constants.PRIMARY_SERVICE, Constants.STATE_SYNC_PORT));
	}
	
	@Test(expected=RuntimeException.class)
	public void missingPortHasNoConnectAddress() {
		ConfigurationUtil.getConnectAddress(_config, Constants.PRIMARY_SERVICE, Constants.STATE_SYNC_PORT);
	}
	
	@Test
	public void timingOverridesKeepDefaults() {
		Timing timing = ConfigurationUtil.getTiming(_config);
		assertEquals(500, timing.getHeartbeatPeriodMillis());
		assertEquals(1500, timing.getHeartbeatTimeoutMillis());
		assertEquals(Constants.HEARTBEAT_CHECK_MILLIS, timing.getHeartbeatCheckMillis());
		assertEquals(Constants.STATE_SYNC_PERIOD_MILLIS, timing.getSyncPeriodMillis());
	}
	
	@Test
	public void defaultTimingWhenAbsent() {
		Configuration config = new Configuration();
		Timing timing = ConfigurationUtil.getTiming(config);
		assertEquals(Constants.HEARTBEAT_PERIOD_MILLIS, timing.getHeartbeatPeriodMillis());
		assertEquals(Constants.HEARTBEAT_TIMEOUT_MILLIS, timing.getHeartbeatTimeoutMillis());
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void timeoutMustExceedPeriod() {
		Timing timing = new Timing();
		timing.setHeartbeatPeriodMillis(2000);
		timing.setHeartbeatTimeoutMillis(2000);
		ConfigurationUtil.assertTimingValid(timing);
	}
	
	@Test
	public void workerSettings() {
		WorkerSettings settings = ConfigurationUtil.getWorkerSettings(_config);
		assertEquals(4, settings.getMaxConcurrentRequests());
		assertEquals("table.csv", settings.getTableFile());
		assertEquals(Constants.DEFAULT_STANDBY_TABLE_FILE, settings.getStandbyTableFile());
	}
	
	@Test(expected=IllegalArgumentException.class)
	public void zeroConcurrencyRejected() {
		_config.getWorker().setMaxConcurrentRequests(0);
		ConfigurationUtil.getWorkerSettings(_config);
	}
	
	@Test
	public void pathsResolveAgainstWorkingDir() {
		assertEquals(Paths.get("/var/roomalloc", "table.csv"), ConfigurationUtil.resolvePath(_config, "table.csv"));
	}
	
}
