// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;

public final class HtmlAttribute {
	private final String name;
	public String name() {
		return name;
	}
	private final String value;
	public String value() {
		return value;
	}
	private HtmlAttribute(String name, String value) {
		this.name = name;
		this.value = value;
	}
	public static HtmlAttribute of(String name, String value) {
		Objects.requireNonNull(name);
		Objects.requireNonNull(value);
		return new HtmlAttribute(name, value);
	}
	/*
	 * Returns null for null value. Null attributes are skipped by HtmlBuilder.
	 */
	public static HtmlAttribute optional(String name, String value) {
		return value != null ? of(name, value) : null;
	}
	/*
	 * Alternating names and values. Pairs with null value are left out.
	 */
	public static List<HtmlAttribute> list(String... pairs) {
		if (pairs.length % 2 != 0)
			throw new IllegalArgumentException("Attribute list must consist of name-value pairs.");
		List<HtmlAttribute> list = new ArrayList<>();
		for (int i = 0; i < pairs.length; i += 2)
			if (pairs[i + 1] != null)
				list.add(of(pairs[i], pairs[i + 1]));
		return list;
	}
	@Override public boolean equals(Object obj) {
		if (!(obj instanceof HtmlAttribute))
			return false;
		HtmlAttribute other = (HtmlAttribute)obj;
		return name.equals(other.name) && value.equals(other.value);
	}
	@Override public int hashCode() {
		return Objects.hash(name, value);
	}
	@Override public String toString() {
		return name + "=\"" + value + "\"";
	}
}
