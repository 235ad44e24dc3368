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
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.adamroughton.roomalloc.config.Configuration;
import com.adamroughton.roomalloc.messaging.zmq.SocketManagerImpl;
import com.adamroughton.roomalloc.util.Minlog2Slf4jAdapterLogger;
import com.esotericsoftware.minlog.Log;

public class RoomAllocExecutableOperations {
	
	/**
	 * Runs the node as this process: parses the command line, reads the
	 * configuration, starts the node's components and blocks until shutdown.
	 */
	public static void executeNode(String[] args, RoomAllocNode node) {
		String processName = node.getProcessName();
		Map<String, String> commandLineArgs = parseCommandLineForNode(processName, node.getCommandLineOptions(), args);
		RoomAllocHandle handle = createHandle(processName, commandLineArgs);
		try {
			Configuration config = SharedCommandLineOptions.readConfiguration(commandLineArgs);
			List<Closeable> components = node.start(commandLineArgs, config, handle);
			Log.info(String.format("%s started", processName));
			runUntilShutdown(handle, components.toArray(new Closeable[components.size()]));
		} catch (Exception e) {
			handle.signalFatalException(e);
		}
	}
	
	/**
	 * Builds the node context for a process: installs logging, then creates
	 * the clock and socket manager. Fatal exceptions exit the process.
	 */
	public static RoomAllocHandle createHandle(String processName, Map<String, String> commandLineArgs) {
		Set<String> traceFlagSet = SharedCommandLineOptions.readTraceOption(commandLineArgs);
		Minlog2Slf4jAdapterLogger.install(processName, !traceFlagSet.isEmpty());
		return new RoomAllocHandle(new DefaultClock(), new SocketManagerImpl(), traceFlagSet, RoomAllocHandle.EXIT_PROCESS);
	}
	
	public static Map<String, String> parseCommandLineForNode(String processName, Iterable<Option> nodeOptions, String[] args) {
		Options cliOptions = new Options();
		addTo(cliOptions, SharedCommandLineOptions.getCommandLineOptions());
		addTo(cliOptions, nodeOptions);
		return parseCommandLine(processName, cliOptions, args);
	}
	
	public static void addTo(Options options, Iterable<Option> optionSet) {
		for (Option option : optionSet) {
			options.addOption(option);
		}
	}
	
	public static Map<String, String> parseCommandLine(String processName, Options cliOptions, String[] args) { 
		Map<String, String> parsedCommandLine = new HashMap<>();
		GnuParser parser = new GnuParser();
		try {
			CommandLine commandLine = parser.parse(cliOptions, args);
			for (Object optionObjRef : cliOptions.getOptions()) {
				Option option = (Option) optionObjRef;
				String opt = option.getOpt();
				if (commandLine.hasOption(opt)) {
					if (option.hasArgs()) {
						String[] arguments = commandLine.getOptionValues(opt);
						StringBuilder builder = new StringBuilder();
						for (int i = 0; i < arguments.length; i++) {
							if (i > 0) {
								builder.append(",");
							}
							builder.append(arguments[i].trim());
						}
						parsedCommandLine.put(opt, builder.toString());
					} else if (option.hasArg()) {
						parsedCommandLine.put(opt, commandLine.getOptionValue(opt).trim());
					} else {
						parsedCommandLine.put(opt, "");
					}
				}
			}
		} catch (ParseException eParse) {
			HelpFormatter helpFormatter = new HelpFormatter();
			helpFormatter.printHelp(String.format("%s [options]", processName), cliOptions);
			System.exit(1);
		}
		return parsedCommandLine;
	}
	
	/**
	 * Blocks the calling thread until the process is asked to stop, then closes
	 * the given components in order before shutting down the node context.
	 */
	public static void runUntilShutdown(final RoomAllocHandle handle, final Closeable... components) throws InterruptedException {
		final CountDownLatch exitLatch = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {

			@Override
			public void run() {
				Log.info("Shutting down");
				for (Closeable component : components) {
					try {
						component.close();
					} catch (IOException | RuntimeException e) {
						Log.warn("Error closing component", e);
					}
				}
				handle.shutdown();
				exitLatch.countDown();
			}
			
		}, "shutdown"));
		exitLatch.await();
	}
	
}
