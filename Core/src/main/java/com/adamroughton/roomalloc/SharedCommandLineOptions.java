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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;

import com.adamroughton.roomalloc.config.Configuration;
import com.adamroughton.roomalloc.util.Util;

public class SharedCommandLineOptions {

	public final static String CONFIG_OPTION = "config";
	public final static String TRACE_OPTION = "trace";
	
	@SuppressWarnings("static-access")
	public static Iterable<Option> getCommandLineOptions() {
		return Arrays.asList(
				OptionBuilder.withArgName("config file")
					.hasArg()
					.isRequired(true)
					.withDescription("the YAML configuration file of the deployment")
					.create(CONFIG_OPTION),
				OptionBuilder.withArgName("trace")
					.hasArgs()
					.withValueSeparator(' ')
					.isRequired(false)
					.withDescription("trace selected components: -trace <component1> <component2> (available: broker, worker, failover)")
					.create(TRACE_OPTION)
			);
	}
	
	public static Configuration readConfiguration(Map<String, String> cmdLineValues) {
		String configPath = cmdLineValues.get(CONFIG_OPTION);
		Configuration config = Util.readYamlFile(Configuration.class, configPath);
		if (config == null) 
			throw new RuntimeException(String.format("The configuration file '%s' was empty.", configPath));
		return config;
	}
	
	public static Set<String> readTraceOption(Map<String, String> cmdLineValues) {
		String traceArrayString = cmdLineValues.get(TRACE_OPTION);
		Set<String> traceFlagSet = new HashSet<>();
		if (traceArrayString == null || traceArrayString.isEmpty()) {
			return traceFlagSet;
		}
		for (String traceOption : traceArrayString.split(",")) {
			traceFlagSet.add(traceOption);
		}
		return traceFlagSet;
	}

}
