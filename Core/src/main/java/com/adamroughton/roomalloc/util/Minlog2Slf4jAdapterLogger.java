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
package com.adamroughton.roomalloc.util;

import org.slf4j.LoggerFactory;
import com.esotericsoftware.minlog.Log;

import static com.esotericsoftware.minlog.Log.*;

public class Minlog2Slf4jAdapterLogger extends Log.Logger {

	public static final String DEFAULT_LOGGER_NAME = "roomalloc";
	
	private final org.slf4j.Logger _slf4jLogger;
	
	public Minlog2Slf4jAdapterLogger(String name) {
		_slf4jLogger = LoggerFactory.getLogger(name);
	}
	
	/**
	 * Routes all minlog output for the process through SLF4J.
	 * @param isTrace whether minlog should emit trace level messages
	 */
	public static void install(String name, boolean isTrace) {
		Log.setLogger(new Minlog2Slf4jAdapterLogger(name));
		Log.set(isTrace? LEVEL_TRACE : LEVEL_INFO);
	}
			
	@Override
	public void log(int level, String category, String message, Throwable ex) {
		if (category != null) {
			message = String.format("[%s] %s", category, message);
		}
		switch (level) {
			case LEVEL_TRACE:
				_slf4jLogger.trace(message, ex);
				break;
			case LEVEL_DEBUG:
				_slf4jLogger.debug(message, ex);
				break;
			case LEVEL_INFO:
				_slf4jLogger.info(message, ex);
				break;
			case LEVEL_WARN:
				_slf4jLogger.warn(message, ex);
				break;
			case LEVEL_ERROR:
				_slf4jLogger.error(message, ex);
				break;
		}
	}
	
}
