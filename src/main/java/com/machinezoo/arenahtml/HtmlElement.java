// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import com.google.common.collect.*;
import com.machinezoo.arenahtml.schema.*;

/**
 * Element node. It is validated against the schema when allocated in a validating arena.
 */
public final class HtmlElement extends HtmlNode {
	private final TagMeta tag;
	public TagMeta tag() {
		return tag;
	}
	public String tagname() {
		return tag.name();
	}
	private final ImmutableList<HtmlAttribute> attributes;
	public ImmutableList<HtmlAttribute> attributes() {
		return attributes;
	}
	private final ImmutableList<NodeHandle> children;
	@Override public ImmutableList<NodeHandle> children() {
		return children;
	}
	public HtmlElement(TagMeta tag, List<HtmlAttribute> attributes, List<NodeHandle> children) {
		Objects.requireNonNull(tag);
		Set<String> names = new HashSet<>();
		for (HtmlAttribute attribute : attributes)
			if (!names.add(attribute.name()))
				throw new IllegalArgumentException("Duplicate attribute '" + attribute.name() + "' on <" + tag.name() + ">.");
		this.tag = tag;
		this.attributes = ImmutableList.copyOf(attributes);
		this.children = ImmutableList.copyOf(children);
	}
	public String attribute(String name) {
		for (HtmlAttribute attribute : attributes)
			if (attribute.name().equals(name))
				return attribute.value();
		return null;
	}
	public HtmlElement withChildren(List<NodeHandle> children) {
		return new HtmlElement(tag, attributes, children);
	}
	/*
	 * Replaces attribute with the same name if there is one.
	 */
	public HtmlElement withAttribute(HtmlAttribute replacement) {
		List<HtmlAttribute> list = new ArrayList<>();
		boolean replaced = false;
		for (HtmlAttribute attribute : attributes) {
			if (attribute.name().equals(replacement.name())) {
				list.add(replacement);
				replaced = true;
			} else
				list.add(attribute);
		}
		if (!replaced)
			list.add(replacement);
		return new HtmlElement(tag, list, children);
	}
	public HtmlElement withAttribute(String name, String value) {
		return withAttribute(HtmlAttribute.of(name, value));
	}
	public HtmlElement withoutAttribute(String name) {
		List<HtmlAttribute> list = new ArrayList<>();
		for (HtmlAttribute attribute : attributes)
			if (!attribute.name().equals(name))
				list.add(attribute);
		return new HtmlElement(tag, list, children);
	}
	@Override public String toString() {
		return tag.toString();
	}
}
