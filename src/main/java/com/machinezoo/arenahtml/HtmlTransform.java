// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/**
 * Purely functional rewriting of HTML trees.
 * Source trees are never modified. New nodes are allocated in the target arena,
 * which may be the source arena or a fresh one. Unchanged subtrees are shared with the source tree.
 */
@StubDocs
public class HtmlTransform {
	private final HtmlArena target;
	public HtmlArena target() {
		return target;
	}
	public HtmlTransform(HtmlArena target) {
		Objects.requireNonNull(target);
		this.target = target;
	}
	/*
	 * Mapper must be a pure function, because results for shared subtrees are reused.
	 * Null mapping is the same as keep().
	 */
	public NodeHandle map(NodeHandle root, BiFunction<NodeHandle, HtmlNode, NodeMapping> mapper) {
		List<NodeHandle> mapped = new Visitor(mapper).visit(root);
		if (mapped.size() == 1) {
			NodeHandle result = mapped.get(0);
			return result.arena() == target ? result : target.graft(result);
		}
		return target.allocate(new HtmlFragment(mapped));
	}
	private class Visitor {
		final BiFunction<NodeHandle, HtmlNode, NodeMapping> mapper;
		final Map<NodeHandle, List<NodeHandle>> done = new HashMap<>();
		Visitor(BiFunction<NodeHandle, HtmlNode, NodeMapping> mapper) {
			this.mapper = mapper;
		}
		List<NodeHandle> visit(NodeHandle handle) {
			List<NodeHandle> cached = done.get(handle);
			if (cached != null)
				return cached;
			List<NodeHandle> result = compute(handle);
			done.put(handle, result);
			return result;
		}
		List<NodeHandle> compute(NodeHandle handle) {
			HtmlNode node = handle.node();
			NodeMapping mapping = mapper.apply(handle, node);
			if (mapping == null)
				mapping = NodeMapping.keep();
			switch (mapping.kind()) {
			case REPLACE:
				return Collections.singletonList(target.allocate(mapping.replacement()));
			case SPLICE:
				return mapping.handles();
			default:
				break;
			}
			List<NodeHandle> children = node.children();
			if (children.isEmpty())
				return Collections.singletonList(handle);
			List<NodeHandle> rebuilt = new ArrayList<>(children.size());
			boolean changed = false;
			for (NodeHandle child : children) {
				List<NodeHandle> mapped = visit(child);
				if (mapped.size() != 1 || !mapped.get(0).equals(child))
					changed = true;
				rebuilt.addAll(mapped);
			}
			if (!changed)
				return Collections.singletonList(handle);
			if (node instanceof HtmlElement)
				return Collections.singletonList(target.allocate(((HtmlElement)node).withChildren(rebuilt)));
			return Collections.singletonList(target.allocate(((HtmlFragment)node).withChildren(rebuilt)));
		}
	}
	/*
	 * Removes all descendants rejected by the predicate together with their subtrees. Root is always kept.
	 */
	public NodeHandle filter(NodeHandle root, Predicate<HtmlNode> predicate) {
		/*
		 * Reference comparison, because descendants are always distinct handle objects even if equal to the root.
		 */
		return map(root, (handle, node) -> handle == root || predicate.test(node) ? NodeMapping.keep() : NodeMapping.remove());
	}
	public NodeHandle identity(NodeHandle root) {
		return map(root, (handle, node) -> NodeMapping.keep());
	}
	public NodeHandle replace(NodeHandle root, NodeHandle original, NodeHandle replacement) {
		return map(root, (handle, node) -> handle.equals(original) ? NodeMapping.splice(replacement) : NodeMapping.keep());
	}
}
