// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.utils;

import java.util.*;
import java.util.regex.*;
import org.apache.commons.lang3.*;
import com.machinezoo.arenahtml.*;
import com.machinezoo.stagean.*;

/**
 * Formats plain text to look like {@code <pre>} while still allowing the browser to wrap long lines.
 * Every line is followed by {@code <br>} and tabs are replaced with non-breaking spaces.
 */
@DraftApi("alternate spaces and non-breaking spaces in runs of spaces")
public class SoftPre {
	private static final String NBSP = "\u00A0";
	private int tabs = 8;
	/*
	 * Number of non-breaking spaces per tab. Zero leaves tabs as they are.
	 */
	public SoftPre tabs(int tabs) {
		if (tabs < 0)
			throw new IllegalArgumentException("Tab width must not be negative.");
		this.tabs = tabs;
		return this;
	}
	private boolean autolink = true;
	public SoftPre autolink(boolean autolink) {
		this.autolink = autolink;
		return this;
	}
	private String separator = "\n";
	public SoftPre separator(String separator) {
		if (StringUtils.isEmpty(separator))
			throw new IllegalArgumentException("Line separator must not be empty.");
		this.separator = separator;
		return this;
	}
	public NodeHandle format(HtmlBuilder html, String text) {
		List<NodeHandle> body = new ArrayList<>();
		for (String line : text.split(Pattern.quote(separator), -1)) {
			String expanded = tabs > 0 ? line.replace("\t", StringUtils.repeat(NBSP, tabs)) : line;
			if (autolink)
				body.addAll(Autolink.autolink(html, expanded));
			else
				body.add(html.text(expanded));
			body.add(html.br());
		}
		return html.div(HtmlAttribute.list("class", "soft_pre"), body.toArray(new NodeHandle[0]));
	}
}
