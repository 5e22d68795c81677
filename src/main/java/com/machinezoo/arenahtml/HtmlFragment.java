// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import com.google.common.collect.*;

/*
 * Sequence of siblings that stands in for a single node. Empty fragment renders nothing.
 */
public final class HtmlFragment extends HtmlNode {
	private final ImmutableList<NodeHandle> children;
	@Override public ImmutableList<NodeHandle> children() {
		return children;
	}
	public HtmlFragment(List<NodeHandle> children) {
		this.children = ImmutableList.copyOf(children);
	}
	public HtmlFragment withChildren(List<NodeHandle> children) {
		return new HtmlFragment(children);
	}
}
