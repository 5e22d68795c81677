// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import java.util.concurrent.atomic.*;
import com.machinezoo.arenahtml.schema.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/**
 * Append-only region of immutable HTML nodes.
 * Nodes are never freed individually. All nodes are discarded at once by {@link #reset()},
 * which also invalidates all handles issued by the arena.
 * <p>
 * Arenas are not thread-safe. Every arena has a single owner at a time.
 * Frozen arenas can be read from any thread.
 */
@DraftApi("pinning of arenas referenced by live grafts")
public class HtmlArena {
	public static final int DEFAULT_CAPACITY = 1_000_000;
	private static final AtomicInteger ids = new AtomicInteger();
	/*
	 * Process-unique, used only to make handles readable in logs.
	 */
	private final int id = ids.incrementAndGet();
	public int id() {
		return id;
	}
	private final HtmlSchema schema;
	public HtmlSchema schema() {
		return schema;
	}
	private final boolean validating;
	public boolean validating() {
		return validating;
	}
	private final int capacity;
	public int capacity() {
		return capacity;
	}
	private final ObjectArrayList<HtmlNode> nodes = new ObjectArrayList<>();
	public int size() {
		return nodes.size();
	}
	private int generation;
	public int generation() {
		return generation;
	}
	/*
	 * Arenas whose handles are referenced from this arena.
	 * Holding them here keeps them reachable for as long as this arena exists.
	 */
	private final ReferenceOpenHashSet<HtmlArena> dependencies = new ReferenceOpenHashSet<>();
	public Set<HtmlArena> dependencies() {
		return Collections.unmodifiableSet(dependencies);
	}
	/*
	 * Volatile to ensure freezing is observed by other threads together with all nodes allocated before it.
	 */
	private volatile boolean frozen;
	public boolean frozen() {
		return frozen;
	}
	public HtmlArena(HtmlSchema schema, int capacity, boolean validating) {
		Objects.requireNonNull(schema);
		if (capacity <= 0)
			throw new IllegalArgumentException("Arena capacity must be positive.");
		this.schema = schema;
		this.capacity = capacity;
		this.validating = validating;
	}
	public HtmlArena(HtmlSchema schema) {
		this(schema, DEFAULT_CAPACITY, true);
	}
	public HtmlArena() {
		this(HtmlSchema.standard());
	}
	public NodeHandle allocate(HtmlNode node) {
		Objects.requireNonNull(node);
		if (frozen)
			throw new IllegalStateException("Cannot allocate in frozen arena #" + id + ".");
		if (nodes.size() >= capacity)
			throw new IllegalStateException("Arena #" + id + " is full (" + capacity + " nodes).");
		for (NodeHandle child : node.children())
			check(child);
		if (validating && node instanceof HtmlElement)
			schema.validate((HtmlElement)node);
		for (NodeHandle child : node.children())
			if (child.arena() != this)
				dependencies.add(child.arena());
		nodes.add(node);
		return new NodeHandle(this, generation, nodes.size() - 1);
	}
	/*
	 * Same-arena children always have lower slot than their parent, which keeps the graph acyclic.
	 * Since the new node's slot is the current size, it is enough to check the child is live.
	 */
	private void check(NodeHandle child) {
		Objects.requireNonNull(child, "Null child handle.");
		if (child.arena() == this)
			resolve(child);
		else if (!child.arena().live(child))
			throw new InvalidHandleException("Foreign handle " + child + " is no longer valid.");
	}
	public HtmlNode resolve(NodeHandle handle) {
		if (handle.arena() != this)
			throw new InvalidHandleException("Handle " + handle + " does not belong to arena #" + id + ".");
		if (handle.generation() != generation)
			throw new InvalidHandleException("Handle " + handle + " is stale. Arena #" + id + " is in generation " + generation + ".");
		if (handle.slot() < 0 || handle.slot() >= nodes.size())
			throw new InvalidHandleException("Handle " + handle + " is out of range.");
		return nodes.get(handle.slot());
	}
	public boolean live(NodeHandle handle) {
		return handle.arena() == this && handle.generation() == generation && handle.slot() >= 0 && handle.slot() < nodes.size();
	}
	/*
	 * Makes the dependency on foreign arena explicit. Allocation of nodes with foreign children does this automatically.
	 */
	public NodeHandle graft(NodeHandle handle) {
		check(handle);
		if (frozen)
			throw new IllegalStateException("Cannot graft into frozen arena #" + id + ".");
		if (handle.arena() != this)
			dependencies.add(handle.arena());
		return handle;
	}
	public void reset() {
		if (frozen)
			throw new IllegalStateException("Cannot reset frozen arena #" + id + ".");
		nodes.clear();
		dependencies.clear();
		++generation;
	}
	/*
	 * Frozen arenas cannot be allocated in or reset. Their handles stay valid forever.
	 */
	public void freeze() {
		frozen = true;
	}
	@Override public String toString() {
		return "HtmlArena #" + id + " (generation " + generation + ", " + nodes.size() + " nodes)";
	}
}
