// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;

/**
 * Immutable node stored in {@link HtmlArena}.
 * Subclasses are {@link HtmlElement}, {@link HtmlText}, {@link HtmlFragment}, and {@link HtmlPreserialized}.
 */
public abstract class HtmlNode {
	HtmlNode() {
	}
	public List<NodeHandle> children() {
		return Collections.emptyList();
	}
}
