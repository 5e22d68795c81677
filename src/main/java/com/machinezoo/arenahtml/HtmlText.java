// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;

public final class HtmlText extends HtmlNode {
	private final String text;
	public String text() {
		return text;
	}
	public HtmlText(String text) {
		Objects.requireNonNull(text);
		this.text = text;
	}
	@Override public String toString() {
		return text;
	}
}
