// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import com.google.common.collect.*;

/**
 * Result of mapping one node in {@link HtmlTransform#map(NodeHandle, java.util.function.BiFunction)}.
 */
public final class NodeMapping {
	enum Kind {
		KEEP,
		REPLACE,
		SPLICE
	}
	private final Kind kind;
	Kind kind() {
		return kind;
	}
	private final HtmlNode replacement;
	HtmlNode replacement() {
		return replacement;
	}
	private final ImmutableList<NodeHandle> handles;
	ImmutableList<NodeHandle> handles() {
		return handles;
	}
	private NodeMapping(Kind kind, HtmlNode replacement, List<NodeHandle> handles) {
		this.kind = kind;
		this.replacement = replacement;
		this.handles = ImmutableList.copyOf(handles);
	}
	private static final NodeMapping KEEP = new NodeMapping(Kind.KEEP, null, Collections.emptyList());
	private static final NodeMapping REMOVE = new NodeMapping(Kind.SPLICE, null, Collections.emptyList());
	/*
	 * Keeps the node and descends into its children.
	 */
	public static NodeMapping keep() {
		return KEEP;
	}
	/*
	 * Replacement is allocated in the target arena. Its children are not visited.
	 */
	public static NodeMapping replace(HtmlNode replacement) {
		Objects.requireNonNull(replacement);
		return new NodeMapping(Kind.REPLACE, replacement, Collections.emptyList());
	}
	public static NodeMapping splice(List<NodeHandle> handles) {
		return new NodeMapping(Kind.SPLICE, null, handles);
	}
	public static NodeMapping splice(NodeHandle... handles) {
		return splice(Arrays.asList(handles));
	}
	public static NodeMapping remove() {
		return REMOVE;
	}
}
