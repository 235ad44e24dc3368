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

import com.adamroughton.roomalloc.Constants;

/**
 * Periods and deadlines for the liveness, replication and maintenance
 * loops. Any value left out of the configuration file keeps its default.
 */
public class Timing {

	private long _heartbeatPeriodMillis = Constants.HEARTBEAT_PERIOD_MILLIS;
	private long _heartbeatTimeoutMillis = Constants.HEARTBEAT_TIMEOUT_MILLIS;
	private long _heartbeatCheckMillis = Constants.HEARTBEAT_CHECK_MILLIS;
	private long _syncPeriodMillis = Constants.STATE_SYNC_PERIOD_MILLIS;
	private long _brokerPollMillis = Constants.BROKER_POLL_MILLIS;
	private long _maintenanceMillis = Constants.BROKER_MAINTENANCE_MILLIS;
	private long _statusReportMillis = Constants.STATUS_REPORT_MILLIS;
	
	public long getHeartbeatPeriodMillis() {
		return _heartbeatPeriodMillis;
	}
	
	public void setHeartbeatPeriodMillis(long heartbeatPeriodMillis) {
		_heartbeatPeriodMillis = heartbeatPeriodMillis;
	}
	
	public long getHeartbeatTimeoutMillis() {
		return _heartbeatTimeoutMillis;
	}
	
	public void setHeartbeatTimeoutMillis(long heartbeatTimeoutMillis) {
		_heartbeatTimeoutMillis = heartbeatTimeoutMillis;
	}
	
	public long getHeartbeatCheckMillis() {
		return _heartbeatCheckMillis;
	}
	
	public void setHeartbeatCheckMillis(long heartbeatCheckMillis) {
		_heartbeatCheckMillis = heartbeatCheckMillis;
	}
	
	public long getSyncPeriodMillis() {
		return _syncPeriodMillis;
	}
	
	public void setSyncPeriodMillis(long syncPeriodMillis) {
		_syncPeriodMillis = syncPeriodMillis;
	}
	
	public long getBrokerPollMillis() {
		return _brokerPollMillis;
	}
	
	public void setBrokerPollMillis(long brokerPollMillis) {
		_brokerPollMillis = brokerPollMillis;
	}
	
	public long getMaintenanceMillis() {
		return _maintenanceMillis;
	}
	
	public void setMaintenanceMillis(long maintenanceMillis) {
		_maintenanceMillis = maintenanceMillis;
	}
	
	public long getStatusReportMillis() {
		return _statusReportMillis;
	}
	
	public void setStatusReportMillis(long statusReportMillis) {
		_statusReportMillis = statusReportMillis;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + (int) (_brokerPollMillis ^ (_brokerPollMillis >>> 32));
		result = prime * result + (int) (_heartbeatCheckMillis ^ (_heartbeatCheckMillis >>> 32));
		result = prime * result + (int) (_heartbeatPeriodMillis ^ (_heartbeatPeriodMillis >>> 32));
		result = prime * result + (int) (_heartbeatTimeoutMillis ^ (_heartbeatTimeoutMillis >>> 32));
		result = prime * result + (int) (_maintenanceMillis ^ (_maintenanceMillis >>> 32));
		result = prime * result + (int) (_statusReportMillis ^ (_statusReportMillis >>> 32));
		result = prime * result + (int) (_syncPeriodMillis ^ (_syncPeriodMillis >>> 32));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Timing other = (Timing) obj;
		return _brokerPollMillis == other._brokerPollMillis
				&& _heartbeatCheckMillis == other._heartbeatCheckMillis
				&& _heartbeatPeriodMillis == other._heartbeatPeriodMillis
				&& _heartbeatTimeoutMillis == other._heartbeatTimeoutMillis
				&& _maintenanceMillis == other._maintenanceMillis
				&& _statusReportMillis == other._statusReportMillis
				&& _syncPeriodMillis == other._syncPeriodMillis;
	}
	
}
