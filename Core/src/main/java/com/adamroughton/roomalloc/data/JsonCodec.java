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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

import com.adamroughton.roomalloc.model.AllocationRequest;
import com.adamroughton.roomalloc.model.AllocationResponse;
import com.adamroughton.roomalloc.model.ErrorResponse;
import com.adamroughton.roomalloc.model.Resource;
import com.adamroughton.roomalloc.model.ResourceKind;
import com.adamroughton.roomalloc.model.ResourceStatus;
import com.adamroughton.roomalloc.model.StateSnapshot;
import com.adamroughton.roomalloc.model.SuccessResponse;
import com.adamroughton.roomalloc.model.UnavailableResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Encodes and decodes the UTF-8 JSON payloads carried on the request,
 * reply and state-sync channels. Instances are thread safe.
 */
public final class JsonCodec {

	public static final String REQUESTER = "requester";
	public static final String PROGRAM = "program";
	public static final String TERM = "term";
	public static final String ROOMS_REQUESTED = "rooms_requested";
	public static final String LABS_REQUESTED = "labs_requested";
	public static final String MIN_CAPACITY = "min_capacity";
	public static final String ROOMS_ASSIGNED = "rooms_assigned";
	public static final String LABS_ASSIGNED = "labs_assigned";
	public static final String NOTICE = "notice";
	public static final String UNAVAILABLE = "unavailable";
	public static final String ERROR = "error";
	
	public static final String RESOURCES = "resources";
	public static final String ID = "id";
	public static final String KIND = "kind";
	public static final String STATUS = "status";
	public static final String CAPACITY = "capacity";
	public static final String REQUESTED_AT = "requested_at";
	public static final String ASSIGNED_AT = "assigned_at";
	
	private final ObjectMapper _mapper;
	
	public JsonCodec() {
		_mapper = new ObjectMapper();
	}
	
	/**
	 * Checks whether the payload is a well formed JSON object.
	 */
	public boolean isJsonObject(byte[] payload) {
		try {
			JsonNode node = _mapper.readTree(payload);
			return node != null && node.isObject();
		} catch (IOException eParse) {
			return false;
		}
	}
	
	public AllocationRequest decodeRequest(byte[] payload) throws ValidationException {
		JsonNode root = readObject(payload, "request");
		String requester = requireText(root, REQUESTER);
		String program = requireText(root, PROGRAM);
		String term = requireText(root, TERM);
		int roomsRequested = requireInt(root, ROOMS_REQUESTED);
		int labsRequested = requireInt(root, LABS_REQUESTED);
		if (roomsRequested < 0 || labsRequested < 0)
			throw new ValidationException(String.format("'%s' and '%s' cannot be negative.", ROOMS_REQUESTED, LABS_REQUESTED));
		if (roomsRequested == 0 && labsRequested == 0)
			throw new ValidationException("The request does not ask for any rooms or labs.");
		Integer minCapacity = null;
		JsonNode minCapacityNode = root.get(MIN_CAPACITY);
		if (minCapacityNode != null && !minCapacityNode.isNull()) {
			minCapacity = requireInt(root, MIN_CAPACITY);
			if (minCapacity < 1)
				throw new ValidationException(String.format("'%s' must be positive.", MIN_CAPACITY));
		}
		return new AllocationRequest(requester, program, term, roomsRequested, labsRequested, minCapacity);
	}
	
	public byte[] encodeRequest(AllocationRequest request) {
		ObjectNode root = _mapper.createObjectNode();
		root.put(REQUESTER, request.getRequester());
		root.put(PROGRAM, request.getProgram());
		root.put(TERM, request.getTerm());
		root.put(ROOMS_REQUESTED, request.getRoomsRequested());
		root.put(LABS_REQUESTED, request.getLabsRequested());
		if (request.hasMinCapacity()) {
			root.put(MIN_CAPACITY, request.getMinCapacity().intValue());
		}
		return write(root);
	}
	
	public byte[] encodeResponse(AllocationResponse response) {
		ObjectNode root = _mapper.createObjectNode();
		switch (response.getType()) {
			case SUCCESS:
				SuccessResponse success = response.as(SuccessResponse.class);
				root.put(REQUESTER, success.getRequester());
				root.put(PROGRAM, success.getProgram());
				root.put(TERM, success.getTerm());
				writeIds(root.putArray(ROOMS_ASSIGNED), success.getRoomsAssigned());
				writeIds(root.putArray(LABS_ASSIGNED), success.getLabsAssigned());
				if (success.hasNotice()) {
					root.put(NOTICE, success.getNotice());
				}
				break;
			case UNAVAILABLE:
				root.put(UNAVAILABLE, response.as(UnavailableResponse.class).getMessage());
				break;
			case ERROR:
				root.put(ERROR, response.as(ErrorResponse.class).getMessage());
				break;
			default:
				throw new IllegalArgumentException(String.format("Unknown response type %s", response.getType()));
		}
		return write(root);
	}
	
	public AllocationResponse decodeResponse(byte[] payload) throws ValidationException {
		JsonNode root = readObject(payload, "response");
		if (root.has(ERROR)) {
			return new ErrorResponse(requireText(root, ERROR));
		} else if (root.has(UNAVAILABLE)) {
			return new UnavailableResponse(requireText(root, UNAVAILABLE));
		} else {
			String notice = null;
			JsonNode noticeNode = root.get(NOTICE);
			if (noticeNode != null && !noticeNode.isNull()) {
				notice = requireText(root, NOTICE);
			}
			return new SuccessResponse(
					requireText(root, REQUESTER), 
					requireText(root, PROGRAM), 
					requireText(root, TERM), 
					readIds(root, ROOMS_ASSIGNED), 
					readIds(root, LABS_ASSIGNED), 
					notice);
		}
	}
	
	public byte[] encodeError(String message) {
		return encodeResponse(new ErrorResponse(message));
	}
	
	public byte[] encodeSnapshot(StateSnapshot snapshot) {
		ObjectNode root = _mapper.createObjectNode();
		ObjectNode resources = root.putObject(RESOURCES);
		for (Resource resource : snapshot.getResources()) {
			ObjectNode entry = resources.putObject(resource.getId());
			entry.put(ID, resource.getId());
			entry.put(KIND, resource.getKind().getWireName());
			entry.put(STATUS, resource.getStatus().getWireName());
			entry.put(CAPACITY, resource.getCapacity());
			entry.put(REQUESTER, resource.getRequester());
			entry.put(PROGRAM, resource.getProgram());
			entry.put(REQUESTED_AT, resource.getRequestedAt());
			entry.put(ASSIGNED_AT, resource.getAssignedAt());
		}
		return write(root);
	}
	
	public StateSnapshot decodeSnapshot(byte[] payload) throws ValidationException {
		JsonNode root = readObject(payload, "snapshot");
		JsonNode resourcesNode = root.get(RESOURCES);
		if (resourcesNode == null || !resourcesNode.isObject())
			throw new ValidationException(String.format("The snapshot has no '%s' object.", RESOURCES));
		List<Resource> resources = new ArrayList<>(resourcesNode.size());
		Iterator<Entry<String, JsonNode>> it = resourcesNode.fields();
		while (it.hasNext()) {
			Entry<String, JsonNode> entry = it.next();
			JsonNode resourceNode = entry.getValue();
			if (!resourceNode.isObject())
				throw new ValidationException(String.format("Snapshot entry '%s' is not an object.", entry.getKey()));
			String id = requireText(resourceNode, ID);
			if (!id.equals(entry.getKey()))
				throw new ValidationException(String.format("Snapshot entry '%s' carries the id '%s'.", entry.getKey(), id));
			try {
				resources.add(new Resource(id, 
						ResourceKind.fromWireName(requireText(resourceNode, KIND)), 
						ResourceStatus.fromWireName(requireText(resourceNode, STATUS)), 
						requireInt(resourceNode, CAPACITY), 
						optionalText(resourceNode, REQUESTER), 
						optionalText(resourceNode, PROGRAM), 
						optionalText(resourceNode, REQUESTED_AT), 
						optionalText(resourceNode, ASSIGNED_AT)));
			} catch (IllegalArgumentException eInvalid) {
				throw new ValidationException(String.format("Snapshot entry '%s' is invalid: %s", id, eInvalid.getMessage()), eInvalid);
			}
		}
		return new StateSnapshot(resources);
	}
	
	private JsonNode readObject(byte[] payload, String payloadName) throws ValidationException {
		JsonNode root;
		try {
			root = _mapper.readTree(payload);
		} catch (IOException eParse) {
			throw new ValidationException(String.format("The %s is not valid JSON: %s", payloadName, eParse.getMessage()), eParse);
		}
		if (root == null || !root.isObject())
			throw new ValidationException(String.format("The %s must be a JSON object.", payloadName));
		return root;
	}
	
	private byte[] write(JsonNode node) {
		try {
			return _mapper.writeValueAsBytes(node);
		} catch (JsonProcessingException eWrite) {
			throw new RuntimeException("Failed to write JSON tree", eWrite);
		}
	}
	
	private static void writeIds(ArrayNode array, List<String> ids) {
		for (String id : ids) {
			array.add(id);
		}
	}
	
	private static List<String> readIds(JsonNode root, String field) throws ValidationException {
		JsonNode node = root.get(field);
		if (node == null || !node.isArray())
			throw new ValidationException(String.format("'%s' must be an array.", field));
		List<String> ids = new ArrayList<>(node.size());
		for (JsonNode idNode : node) {
			if (!idNode.isTextual())
				throw new ValidationException(String.format("'%s' must only contain strings.", field));
			ids.add(idNode.asText());
		}
		return ids;
	}
	
	private static String requireText(JsonNode root, String field) throws ValidationException {
		JsonNode node = root.get(field);
		if (node == null || node.isNull())
			throw new ValidationException(String.format("Missing field '%s'.", field));
		if (!node.isTextual())
			throw new ValidationException(String.format("Field '%s' must be a string.", field));
		String value = node.asText();
		if (value.trim().isEmpty())
			throw new ValidationException(String.format("Field '%s' cannot be empty.", field));
		return value;
	}
	
	private static String optionalText(JsonNode root, String field) throws ValidationException {
		JsonNode node = root.get(field);
		if (node == null || node.isNull()) 
			return "";
		if (!node.isTextual())
			throw new ValidationException(String.format("Field '%s' must be a string.", field));
		return node.asText();
	}
	
	private static int requireInt(JsonNode root, String field) throws ValidationException {
		JsonNode node = root.get(field);
		if (node == null || node.isNull())
			throw new ValidationException(String.format("Missing field '%s'.", field));
		if (!node.isIntegralNumber() || !node.canConvertToInt())
			throw new ValidationException(String.format("Field '%s' must be an integer.", field));
		return node.intValue();
	}
	
}
