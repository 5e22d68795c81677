// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import java.util.*;
import com.google.common.collect.*;

public class AttributeMeta {
	private final String name;
	public String name() {
		return name;
	}
	private final String description;
	public String description() {
		return description;
	}
	private final AttributeKind kind;
	public AttributeKind kind() {
		return kind;
	}
	/*
	 * Empty unless the kind is ENUMERABLE.
	 */
	private final ImmutableList<String> values;
	public ImmutableList<String> values() {
		return values;
	}
	public AttributeMeta(String name, String description, AttributeKind kind, List<String> values) {
		Objects.requireNonNull(name);
		this.name = name;
		this.description = description != null ? description : "";
		this.kind = kind != null ? kind : AttributeKind.STRING;
		this.values = values != null ? ImmutableList.copyOf(values) : ImmutableList.of();
	}
	@Override public String toString() {
		return name;
	}
}
