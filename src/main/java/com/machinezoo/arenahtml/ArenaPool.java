// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.arenahtml.schema.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/**
 * Pool of reusable arenas.
 * Arenas keep their allocated capacity across resets, so reusing them avoids repeated growth of node storage.
 * Arenas that were reused many times are retired to keep their memory from growing without bound.
 * <p>
 * Pool is thread-safe. Arenas obtained from it are owned by the caller until released.
 */
@DraftApi("shrink idle pool over time")
public class ArenaPool {
	private static final Logger logger = LoggerFactory.getLogger(ArenaPool.class);
	private final String name;
	public String name() {
		return name;
	}
	private volatile HtmlSchema schema;
	public ArenaPool schema(HtmlSchema schema) {
		Objects.requireNonNull(schema);
		this.schema = schema;
		return this;
	}
	private volatile int capacity = HtmlArena.DEFAULT_CAPACITY;
	public ArenaPool capacity(int capacity) {
		if (capacity <= 0)
			throw new IllegalArgumentException("Arena capacity must be positive.");
		this.capacity = capacity;
		return this;
	}
	private volatile boolean validating = true;
	public ArenaPool validating(boolean validating) {
		this.validating = validating;
		return this;
	}
	/*
	 * Arena is discarded instead of being pooled once it has been reset this many times.
	 */
	private volatile int retirement = 20;
	public ArenaPool retirement(int retirement) {
		if (retirement <= 0)
			throw new IllegalArgumentException("Retirement threshold must be positive.");
		this.retirement = retirement;
		return this;
	}
	/*
	 * Maximum number of idle arenas. Arenas released into full pool are discarded.
	 */
	private volatile int limit = 64;
	public ArenaPool limit(int limit) {
		if (limit < 0)
			throw new IllegalArgumentException("Pool limit must not be negative.");
		this.limit = limit;
		return this;
	}
	private final ArrayDeque<HtmlArena> idle = new ArrayDeque<>();
	private final Counter created;
	private final Counter reused;
	private final Counter retired;
	public ArenaPool(String name) {
		Objects.requireNonNull(name);
		this.name = name;
		List<Tag> tags = Arrays.asList(Tag.of("pool", name));
		created = Metrics.counter("arenahtml.pool.created", tags);
		reused = Metrics.counter("arenahtml.pool.reused", tags);
		retired = Metrics.counter("arenahtml.pool.retired", tags);
		Metrics.gauge("arenahtml.pool.idle", tags, this, ArenaPool::idle);
	}
	public ArenaPool() {
		this("default");
	}
	public synchronized int idle() {
		return idle.size();
	}
	/*
	 * Returns an empty arena, preferably a pooled one.
	 */
	public HtmlArena acquire() {
		HtmlArena arena;
		synchronized (this) {
			arena = idle.pollFirst();
		}
		if (arena != null) {
			reused.increment();
			return arena;
		}
		HtmlSchema schema = this.schema;
		arena = new HtmlArena(schema != null ? schema : HtmlSchema.standard(), capacity, validating);
		created.increment();
		logger.debug("Created {} in pool {}.", arena, name);
		return arena;
	}
	/*
	 * All handles issued by the arena become invalid. Arenas from other pools are accepted.
	 */
	public void release(HtmlArena arena) {
		Objects.requireNonNull(arena);
		if (arena.frozen())
			throw new IllegalStateException("Cannot pool frozen arena #" + arena.id() + ".");
		synchronized (this) {
			checkNotIdle(arena);
		}
		arena.reset();
		if (arena.generation() >= retirement) {
			retired.increment();
			logger.debug("Retired {} from pool {}.", arena, name);
			return;
		}
		synchronized (this) {
			checkNotIdle(arena);
			if (idle.size() < limit) {
				idle.addFirst(arena);
				return;
			}
		}
		logger.debug("Discarded {}, because pool {} is full.", arena, name);
	}
	/*
	 * Arena released twice would be handed out to two owners. Idle arenas are compared by identity.
	 */
	private void checkNotIdle(HtmlArena arena) {
		for (HtmlArena pooled : idle)
			if (pooled == arena)
				throw new IllegalStateException("Arena #" + arena.id() + " was already released to pool " + name + ".");
	}
	public ArenaLease lease() {
		return new ArenaLease(this, acquire());
	}
	@Override public String toString() {
		return "ArenaPool " + name;
	}
}
