// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.cache.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/**
 * Cache of pre-serialized HTML fragments that are expensive to render, for example blog posts.
 * Cached fragments can be inserted into any arena.
 * Misses are rendered in a temporary arena from the pool, which is released as soon as the fragment is serialized.
 */
public class HtmlFragmentCache<K> {
	private static final Logger logger = LoggerFactory.getLogger(HtmlFragmentCache.class);
	private static final Timer timer = Metrics.timer("arenahtml.cache.render");
	private final ArenaPool pool;
	private final Cache<K, HtmlPreserialized> cache;
	public HtmlFragmentCache(ArenaPool pool, long capacity) {
		Objects.requireNonNull(pool);
		this.pool = pool;
		cache = CacheBuilder.newBuilder()
			.maximumSize(capacity)
			.build();
	}
	/*
	 * Renderer must return an element and the same content for the same key.
	 */
	public HtmlPreserialized get(K key, Function<HtmlBuilder, NodeHandle> renderer) {
		Objects.requireNonNull(key);
		return cache.asMap().computeIfAbsent(key, k -> {
			Supplier<HtmlPreserialized> render = () -> {
				logger.debug("Rendering fragment {}.", k);
				try (ArenaLease lease = pool.lease()) {
					return new HtmlSerializer().preserialize(renderer.apply(lease.builder()));
				}
			};
			return timer.record(render);
		});
	}
	public NodeHandle insert(HtmlBuilder builder, K key, Function<HtmlBuilder, NodeHandle> renderer) {
		return builder.preserialized(get(key, renderer));
	}
	public void invalidate(K key) {
		cache.invalidate(key);
	}
	public void invalidateAll() {
		cache.invalidateAll();
	}
	public long size() {
		return cache.size();
	}
}
