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

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import com.adamroughton.roomalloc.Clock;

public class Util {
	
	public static void assertPortValid(int port) {
		if (port == -1) return; // we reserve -1 to signal random port
		if (port < 1024 || port > 65535)
			throw new RuntimeException(String.format("Bad port number: %d", port));
	}
	
	public static String toHexString(byte[] array) {
	   return toHexString(array, 0, array.length);
	}
			
	public static String toHexString(byte[] array, int offset, int length) {
	   StringBuilder sb = new StringBuilder();
	   for (int i = offset; i < offset + length; i++) {
		   sb.append(String.format("%02x", array[i] & 0xff));
	   }
	   return sb.toString();
	}
	
	/**
	 * Gets the next power of 2 for v.
	 * Used from http://graphics.stanford.edu/~seander/bithacks.html#RoundUpPowerOf2.
	 * @param v
	 * @return the next highest power of 2 for v
	 */
	public static int nextPowerOf2(int v) {
		if (v == 0) return 1;
		v--;
		v |= v >>> 1;
		v |= v >>> 2;
		v |= v >>> 4;
		v |= v >>> 8;
		v |= v >>> 16;
		v++;
		return v;
	}
	
	public static <T> T readYamlFile(Class<T> type, String path) {
		return readYamlFile(type, Paths.get(path));
	}
	
	public static <T> T readYamlFile(Class<T> type, Path path) {
		try (InputStream yamlStream = Files.newInputStream(path, StandardOpenOption.READ)) {
			return readYaml(type, yamlStream);
		} catch (Exception e) {
			throw new RuntimeException("Error reading yaml file", e);
		}
	}
	
	public static <T> T readYaml(Class<T> type, InputStream yamlStream) {
		Constructor constructor = new Constructor(type, new LoaderOptions());
		constructor.getPropertyUtils().setSkipMissingProperties(true);
		Yaml yaml = new Yaml(constructor);
		return yaml.loadAs(yamlStream, type);
	}
	
	public static long millisUntil(long deadline, Clock clock) {
		long remainingTime = deadline - clock.currentMillis();
		if (remainingTime < 0)
			remainingTime = 0;
		return remainingTime;
	}
	
	/**
	 * Creates a thread factory that names each thread {@code (prefix)-(n)}.
	 */
	public static ThreadFactory namedThreadFactory(final String prefix, final boolean isDaemon) {
		return new ThreadFactory() {
			
			private final AtomicInteger _count = new AtomicInteger(0);
			
			@Override
			public Thread newThread(Runnable r) {
				Thread thread = new Thread(r, String.format("%s-%d", prefix, _count.getAndIncrement()));
				thread.setDaemon(isDaemon);
				return thread;
			}
		};
	}
	
}
