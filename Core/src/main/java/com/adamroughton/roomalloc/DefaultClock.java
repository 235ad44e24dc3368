package com.adamroughton.roomalloc;

public class DefaultClock implements Clock {

	@Override
	public long currentMillis() {
		return System.currentTimeMillis();
	}

	@Override
	public long nanoTime() {
		return System.nanoTime();
	}

}
