// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;

/**
 * Reference to one node in one generation of an {@link HtmlArena}.
 * Handles own nothing. They become invalid when the issuing arena is reset.
 */
public final class NodeHandle {
	private final HtmlArena arena;
	public HtmlArena arena() {
		return arena;
	}
	private final int generation;
	int generation() {
		return generation;
	}
	private final int slot;
	public int slot() {
		return slot;
	}
	NodeHandle(HtmlArena arena, int generation, int slot) {
		this.arena = arena;
		this.generation = generation;
		this.slot = slot;
	}
	/*
	 * Handles are always resolved against the arena that issued them, even when referenced from another arena.
	 */
	public HtmlNode node() {
		return arena.resolve(this);
	}
	public boolean live() {
		return arena.live(this);
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof NodeHandle))
			return false;
		NodeHandle other = (NodeHandle)obj;
		return arena == other.arena && generation == other.generation && slot == other.slot;
	}
	@Override public int hashCode() {
		return Objects.hash(System.identityHashCode(arena), generation, slot);
	}
	@Override public String toString() {
		return "#" + arena.id() + "." + generation + ":" + slot;
	}
}
