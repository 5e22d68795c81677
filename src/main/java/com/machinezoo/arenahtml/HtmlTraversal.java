// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import java.util.function.*;
import one.util.streamex.*;

/*
 * Read-only queries over HTML trees. Nothing is allocated.
 */
public class HtmlTraversal {
	private HtmlTraversal() {
	}
	/*
	 * Depth-first pre-order. Shared subtrees are visited once per occurrence.
	 */
	public static StreamEx<NodeHandle> descendantsAndSelf(NodeHandle root) {
		return StreamEx.ofTree(root, h -> {
			List<NodeHandle> children = h.node().children();
			return children.isEmpty() ? null : StreamEx.of(children);
		});
	}
	public static StreamEx<NodeHandle> descendants(NodeHandle root) {
		return descendantsAndSelf(root).skip(1);
	}
	public static StreamEx<NodeHandle> elements(NodeHandle root, String tagname) {
		return descendantsAndSelf(root).filter(h -> {
			HtmlNode node = h.node();
			return node instanceof HtmlElement && ((HtmlElement)node).tagname().equals(tagname);
		});
	}
	public static Optional<NodeHandle> find(NodeHandle root, Predicate<HtmlNode> predicate) {
		return descendantsAndSelf(root).findFirst(h -> predicate.test(h.node()));
	}
	public static long count(NodeHandle root) {
		return descendantsAndSelf(root).count();
	}
	private static List<NodeHandle> unwrapped(NodeHandle handle, String tagname, boolean strict) {
		HtmlNode node = handle.node();
		if (!(node instanceof HtmlElement))
			return null;
		HtmlElement element = (HtmlElement)node;
		if (!element.tagname().equals(tagname))
			return null;
		if (strict && !element.attributes().isEmpty())
			return null;
		return element.children();
	}
	/*
	 * If the list consists of a single element with the given tag name, its children are returned instead.
	 * This is useful to strip a lone paragraph around rendered Markdown.
	 * In strict mode, only elements without attributes are unwrapped.
	 */
	public static List<NodeHandle> unwrap(List<NodeHandle> children, String tagname, boolean strict) {
		if (children.size() == 1) {
			List<NodeHandle> inner = unwrapped(children.get(0), tagname, strict);
			if (inner != null)
				return inner;
		}
		return children;
	}
	/*
	 * Like unwrap(), but every matching element in the list is replaced by its children.
	 */
	public static List<NodeHandle> unwrapAll(List<NodeHandle> children, String tagname, boolean strict) {
		List<NodeHandle> result = new ArrayList<>();
		for (NodeHandle child : children) {
			List<NodeHandle> inner = unwrapped(child, tagname, strict);
			if (inner != null)
				result.addAll(inner);
			else
				result.add(child);
		}
		return result;
	}
}
