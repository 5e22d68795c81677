// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.io.*;
import java.nio.charset.*;
import java.util.*;
import com.machinezoo.arenahtml.schema.*;

/**
 * Already rendered HTML that is inserted verbatim during serialization.
 * It is immutable and it can be shared across arenas and threads.
 */
public final class HtmlPreserialized extends HtmlNode {
	private final byte[] bytes;
	/*
	 * Outermost element of the captured subtree. Used to validate placement of the content.
	 */
	private final TagMeta tag;
	public TagMeta tag() {
		return tag;
	}
	HtmlPreserialized(TagMeta tag, byte[] bytes) {
		Objects.requireNonNull(tag, "Pre-serialized HTML must have an outermost element.");
		Objects.requireNonNull(bytes);
		this.tag = tag;
		this.bytes = bytes;
	}
	public static HtmlPreserialized of(TagMeta tag, String html) {
		return new HtmlPreserialized(tag, html.getBytes(StandardCharsets.UTF_8));
	}
	public int size() {
		return bytes.length;
	}
	public byte[] bytes() {
		return bytes.clone();
	}
	public void write(OutputStream stream) throws IOException {
		stream.write(bytes);
	}
	@Override public String toString() {
		return new String(bytes, StandardCharsets.UTF_8);
	}
}
