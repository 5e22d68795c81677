// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

/*
 * Resolving handle that is foreign to the arena, stale after reset, or out of range.
 * This is always a programming error.
 */
public class InvalidHandleException extends IllegalStateException {
	private static final long serialVersionUID = 1L;
	public InvalidHandleException(String message) {
		super(message);
	}
}
