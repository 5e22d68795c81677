// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

/*
 * Returns the arena to its pool when closed, so that try-with-resources releases the arena even if page building fails.
 */
public class ArenaLease implements AutoCloseable {
	private final ArenaPool pool;
	private final HtmlArena arena;
	public HtmlArena arena() {
		return arena;
	}
	private HtmlBuilder builder;
	public HtmlBuilder builder() {
		if (builder == null)
			builder = new HtmlBuilder(arena);
		return builder;
	}
	private boolean closed;
	ArenaLease(ArenaPool pool, HtmlArena arena) {
		this.pool = pool;
		this.arena = arena;
	}
	@Override public void close() {
		if (!closed) {
			closed = true;
			pool.release(arena);
		}
	}
}
