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

public class WorkerSettings {

	private int _maxConcurrentRequests = Constants.DEFAULT_MAX_CONCURRENT_REQUESTS;
	private String _tableFile = Constants.DEFAULT_TABLE_FILE;
	private String _standbyTableFile = Constants.DEFAULT_STANDBY_TABLE_FILE;
	
	public int getMaxConcurrentRequests() {
		return _maxConcurrentRequests;
	}
	
	public void setMaxConcurrentRequests(int maxConcurrentRequests) {
		_maxConcurrentRequests = maxConcurrentRequests;
	}
	
	public String getTableFile() {
		return _tableFile;
	}
	
	public void setTableFile(String tableFile) {
		_tableFile = tableFile;
	}
	
	public String getStandbyTableFile() {
		return _standbyTableFile;
	}
	
	public void setStandbyTableFile(String standbyTableFile) {
		_standbyTableFile = standbyTableFile;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + _maxConcurrentRequests;
		result = prime * result + ((_standbyTableFile == null) ? 0 : _standbyTableFile.hashCode());
		result = prime * result + ((_tableFile == null) ? 0 : _tableFile.hashCode());
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
		WorkerSettings other = (WorkerSettings) obj;
		if (_maxConcurrentRequests != other._maxConcurrentRequests)
			return false;
		if (_standbyTableFile == null) {
			if (other._standbyTableFile != null)
				return false;
		} else if (!_standbyTableFile.equals(other._standbyTableFile))
			return false;
		if (_tableFile == null) {
			if (other._tableFile != null)
				return false;
		} else if (!_tableFile.equals(other._tableFile))
			return false;
		return true;
	}
	
}
