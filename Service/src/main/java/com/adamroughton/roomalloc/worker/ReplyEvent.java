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
package com.adamroughton.roomalloc.worker;

import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.EventTranslatorTwoArg;

/**
 * A reply waiting to be sent on the worker socket by the loop thread.
 */
public final class ReplyEvent {

	public static final EventFactory<ReplyEvent> FACTORY = new EventFactory<ReplyEvent>() {

		@Override
		public ReplyEvent newInstance() {
			return new ReplyEvent();
		}
	};
	
	public static final EventTranslatorTwoArg<ReplyEvent, byte[], byte[]> TRANSLATOR = 
			new EventTranslatorTwoArg<ReplyEvent, byte[], byte[]>() {

		@Override
		public void translateTo(ReplyEvent event, long sequence, byte[] clientId, byte[] payload) {
			event.clientId = clientId;
			event.payload = payload;
		}
	};
	
	public byte[] clientId;
	public byte[] payload;
	
	public void clear() {
		clientId = null;
		payload = null;
	}
	
}
