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

public final class Constants {

	/**
	 * The period between liveness beacons published
	 * by the primary allocator.
	 */
	public static final long HEARTBEAT_PERIOD_MILLIS = 2000L;
	
	/**
	 * The beacon silence after which a standby considers the
	 * primary failed. Must be greater than {@link #HEARTBEAT_PERIOD_MILLIS}.
	 */
	public static final long HEARTBEAT_TIMEOUT_MILLIS = 5000L;
	
	public static final long HEARTBEAT_CHECK_MILLIS = 1000L;
	
	/**
	 * The period between full resource table snapshots
	 * published by the primary allocator.
	 */
	public static final long STATE_SYNC_PERIOD_MILLIS = 10000L;
	
	public static final long BROKER_POLL_MILLIS = 100L;
	
	public static final long BROKER_MAINTENANCE_MILLIS = 5000L;
	
	public static final long WORKER_POLL_MILLIS = 10L;
	
	public static final int CLIENT_SEND_TIMEOUT_MILLIS = 5000;
	
	public static final int CLIENT_RECV_TIMEOUT_MILLIS = 10000;
	
	public static final long STATUS_REPORT_MILLIS = 5000L;
	
	public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 10;
	
	public static final int SOCKET_TIMEOUT_MILLIS = 1000;
	
	public static final String BROKER_SERVICE = "broker";
	public static final String PRIMARY_SERVICE = "primary";
	
	public static final String FRONTEND_PORT = "frontend";
	public static final String BACKEND_PORT = "backend";
	public static final String HEARTBEAT_PORT = "heartbeat";
	public static final String STATE_SYNC_PORT = "sync";
	
	public static final String DEFAULT_TABLE_FILE = "resources.csv";
	public static final String DEFAULT_STANDBY_TABLE_FILE = "resources-standby.csv";
	
}
