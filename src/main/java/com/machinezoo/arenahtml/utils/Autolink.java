// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.utils;

import java.util.*;
import java.util.regex.*;
import com.machinezoo.arenahtml.*;

/*
 * Turns http:// and https:// URLs in plain text into links.
 */
public class Autolink {
	private static final Pattern url = Pattern.compile("https?://[^\\s\\u00A0<>\"]+");
	/*
	 * Sentence punctuation right after the URL is most likely not part of it.
	 */
	private static final String trailing = ".,;:!?)]}'";
	private Autolink() {
	}
	public static List<NodeHandle> autolink(HtmlBuilder html, String text) {
		List<NodeHandle> nodes = new ArrayList<>();
		Matcher matcher = url.matcher(text);
		int position = 0;
		while (matcher.find()) {
			int end = matcher.end();
			while (end > matcher.start() && trailing.indexOf(text.charAt(end - 1)) >= 0)
				--end;
			String link = text.substring(matcher.start(), end);
			if (link.endsWith("://"))
				continue;
			if (matcher.start() > position)
				nodes.add(html.text(text.substring(position, matcher.start())));
			nodes.add(html.a(HtmlAttribute.list("href", link), html.text(link)));
			position = end;
		}
		if (position < text.length() || nodes.isEmpty())
			nodes.add(html.text(text.substring(position)));
		return nodes;
	}
}
