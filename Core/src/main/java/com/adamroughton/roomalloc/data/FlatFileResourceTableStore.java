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
package com.adamroughton.roomalloc.data;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.ResourceStatus;
import com.esotericsoftware.minlog.Log;

/**
 * Stores the resource table as a comma separated file with a header row.
 * Fields containing a comma, a quote or a line break are quoted, with 
 * embedded quotes doubled. Every save rewrites the whole file through a 
 * temporary file that is then moved over the original.
 */
public final class FlatFileResourceTableStore implements ResourceTableStore {

	public static final List<String> HEADER = Arrays.asList(
			"id", "kind", "status", "capacity", "requester", "program", "requested_at", "assigned_at");
	
	private final Path _path;
	
	public FlatFileResourceTableStore(Path path) {
		_path = Objects.requireNonNull(path).toAbsolutePath();
	}
	
	@Override
	public String getLocation() {
		return _path.toString();
	}

	@Override
	public List<Resource> load() throws PersistenceException {
		if (!Files.exists(_path)) {
			Log.warn(String.format("No resource table found at '%s'; starting with an empty table.", _path));
			return new ArrayList<>();
		}
		String content;
		try {
			content = new String(Files.readAllBytes(_path), StandardCharsets.UTF_8);
		} catch (IOException eIO) {
			throw new PersistenceException(String.format("Failed to read the resource table '%s'", _path), eIO);
		}
		List<List<String>> records = parse(content);
		if (records.isEmpty()) {
			return new ArrayList<>();
		}
		List<String> header = records.get(0);
		if (!HEADER.equals(header))
			throw new PersistenceException(String.format("Unexpected header %s in '%s' (expected %s).", header, _path, HEADER));
		
		List<Resource> resources = new ArrayList<>(records.size() - 1);
		Set<String> ids = new HashSet<>();
		for (int i = 1; i < records.size(); i++) {
			List<String> record = records.get(i);
			if (record.size() != HEADER.size())
				throw new PersistenceException(String.format("Record %d of '%s' has %d fields (expected %d).", 
						i, _path, record.size(), HEADER.size()));
			Resource resource;
			try {
				resource = new Resource(record.get(0), 
						ResourceKind.fromWireName(record.get(1)), 
						ResourceStatus.fromWireName(record.get(2)), 
						Integer.parseInt(record.get(3)), 
						record.get(4), 
						record.get(5), 
						record.get(6), 
						record.get(7));
			} catch (IllegalArgumentException eInvalid) {
				throw new PersistenceException(String.format("Record %d of '%s' is invalid: %s", 
						i, _path, eInvalid.getMessage()), eInvalid);
			}
			if (!ids.add(resource.getId()))
				throw new PersistenceException(String.format("Duplicate resource id '%s' in '%s'.", resource.getId(), _path));
			resources.add(resource);
		}
		return resources;
	}

	@Override
	public void save(Iterable<Resource> resources) throws PersistenceException {
		Path tempFile = null;
		try {
			Path directory = _path.getParent();
			Files.createDirectories(directory);
			tempFile = Files.createTempFile(directory, _path.getFileName().toString(), ".tmp");
			try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
				writeRecord(writer, HEADER);
				for (Resource resource : resources) {
					writeRecord(writer, Arrays.asList(
							resource.getId(),
							resource.getKind().getWireName(),
							resource.getStatus().getWireName(),
							Integer.toString(resource.getCapacity()),
							resource.getRequester(),
							resource.getProgram(),
							resource.getRequestedAt(),
							resource.getAssignedAt()));
				}
			}
			try {
				Files.move(tempFile, _path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException eNotAtomic) {
				Files.move(tempFile, _path, StandardCopyOption.REPLACE_EXISTING);
			}
			tempFile = null;
		} catch (IOException eIO) {
			throw new PersistenceException(String.format("Failed to write the resource table '%s'", _path), eIO);
		} finally {
			if (tempFile != null) {
				try {
					Files.deleteIfExists(tempFile);
				} catch (IOException eDelete) {
					Log.warn(String.format("Failed to remove the temporary file '%s'", tempFile), eDelete);
				}
			}
		}
	}
	
	private static void writeRecord(BufferedWriter writer, List<String> fields) throws IOException {
		for (int i = 0; i < fields.size(); i++) {
			if (i > 0) {
				writer.write(',');
			}
			writer.write(quote(fields.get(i)));
		}
		writer.write('\n');
	}
	
	static String quote(String field) {
		if (field.indexOf(',') == -1 && field.indexOf('"') == -1 
				&& field.indexOf('\n') == -1 && field.indexOf('\r') == -1) {
			return field;
		}
		return "\"" + field.replace("\"", "\"\"") + "\"";
	}
	
	static List<List<String>> parse(String content) throws PersistenceException {
		List<List<String>> records = new ArrayList<>();
		List<String> record = new ArrayList<>();
		StringBuilder field = new StringBuilder();
		boolean inQuotes = false;
		boolean recordHasContent = false;
		int i = 0;
		while (i < content.length()) {
			char c = content.charAt(i);
			if (inQuotes) {
				if (c == '"') {
					if (i + 1 < content.length() && content.charAt(i + 1) == '"') {
						field.append('"');
						i++;
					} else {
						inQuotes = false;
					}
				} else {
					field.append(c);
				}
			} else if (c == '"') {
				inQuotes = true;
				recordHasContent = true;
			} else if (c == ',') {
				record.add(field.toString());
				field.setLength(0);
				recordHasContent = true;
			} else if (c == '\n' || c == '\r') {
				if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
					i++;
				}
				if (recordHasContent || field.length() > 0) {
					record.add(field.toString());
					records.add(record);
				}
				record = new ArrayList<>();
				field.setLength(0);
				recordHasContent = false;
			} else {
				field.append(c);
				recordHasContent = true;
			}
			i++;
		}
		if (inQuotes)
			throw new PersistenceException("Unterminated quoted field in resource table.");
		if (recordHasContent || field.length() > 0) {
			record.add(field.toString());
			records.add(record);
		}
		return records;
	}
	
}
