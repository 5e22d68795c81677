// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import java.util.*;
import com.google.common.collect.*;
import com.machinezoo.stagean.*;

/**
 * Schema entry describing one HTML tag.
 * Instances are created only by schema loading and they are immutable.
 */
@StubDocs
public class TagMeta {
	private final String name;
	public String name() {
		return name;
	}
	/*
	 * Identifier-style name used in schema data to reference permitted children.
	 */
	private final String struct;
	public String struct() {
		return struct;
	}
	private final ImmutableMap<String, AttributeMeta> attributes;
	public ImmutableMap<String, AttributeMeta> attributes() {
		return attributes;
	}
	private final ImmutableSet<ContentCategory> categories;
	public ImmutableSet<ContentCategory> categories() {
		return categories;
	}
	private final ImmutableSet<ContentCategory> permittedContent;
	public ImmutableSet<ContentCategory> permittedContent() {
		return permittedContent;
	}
	private final ImmutableSet<String> permittedChildren;
	public ImmutableSet<String> permittedChildren() {
		return permittedChildren;
	}
	private final boolean allowsText;
	public boolean allowsText() {
		return allowsText;
	}
	private final boolean hasClosingTag;
	public boolean hasClosingTag() {
		return hasClosingTag;
	}
	private final boolean globalAttributes;
	public boolean globalAttributes() {
		return globalAttributes;
	}
	TagMeta(
		String name,
		String struct,
		Collection<AttributeMeta> attributes,
		Collection<ContentCategory> categories,
		Collection<ContentCategory> permittedContent,
		Collection<String> permittedChildren,
		boolean allowsText,
		boolean hasClosingTag,
		boolean globalAttributes) {
		Objects.requireNonNull(name);
		this.name = name;
		this.struct = struct;
		var map = ImmutableMap.<String, AttributeMeta>builder();
		for (AttributeMeta attribute : attributes)
			map.put(attribute.name(), attribute);
		this.attributes = map.buildOrThrow();
		this.categories = Sets.immutableEnumSet(categories);
		this.permittedContent = Sets.immutableEnumSet(permittedContent);
		this.permittedChildren = ImmutableSet.copyOf(permittedChildren);
		this.allowsText = allowsText;
		this.hasClosingTag = hasClosingTag;
		this.globalAttributes = globalAttributes;
	}
	public boolean permits(ContentCategory category) {
		return permittedContent.contains(category);
	}
	public boolean permits(TagMeta child) {
		if (permittedChildren.contains(child.name))
			return true;
		for (ContentCategory category : child.categories)
			if (permittedContent.contains(category))
				return true;
		return false;
	}
	@Override public String toString() {
		return "<" + name + ">";
	}
}
