// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.io.*;
import java.nio.charset.*;
import com.machinezoo.noexception.*;

/**
 * Renders HTML trees as UTF-8 bytes.
 * Handles are followed into whatever arena issued them.
 */
public class HtmlSerializer {
	private static final byte[] DOCTYPE = "<!DOCTYPE html>\n".getBytes(StandardCharsets.UTF_8);
	private boolean doctype;
	public HtmlSerializer doctype(boolean doctype) {
		this.doctype = doctype;
		return this;
	}
	public byte[] serialize(NodeHandle root) {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		write(root, buffer);
		return buffer.toByteArray();
	}
	public String html(NodeHandle root) {
		return new String(serialize(root), StandardCharsets.UTF_8);
	}
	/*
	 * I/O exceptions from the stream are rethrown sneakily.
	 */
	public void write(NodeHandle root, OutputStream stream) {
		Exceptions.sneak().run(() -> {
			if (doctype)
				stream.write(DOCTYPE);
			render(root, stream);
		});
	}
	private static void render(NodeHandle handle, OutputStream stream) throws IOException {
		HtmlNode node = handle.node();
		if (node instanceof HtmlText)
			print(stream, escape(((HtmlText)node).text()));
		else if (node instanceof HtmlPreserialized)
			((HtmlPreserialized)node).write(stream);
		else if (node instanceof HtmlFragment) {
			for (NodeHandle child : node.children())
				render(child, stream);
		} else {
			HtmlElement element = (HtmlElement)node;
			StringBuilder open = new StringBuilder();
			open.append('<').append(element.tagname());
			for (HtmlAttribute attribute : element.attributes())
				open.append(' ').append(attribute.name()).append("=\"").append(escape(attribute.value())).append('"');
			open.append('>');
			print(stream, open.toString());
			for (NodeHandle child : element.children())
				render(child, stream);
			if (element.tag().hasClosingTag())
				print(stream, "</" + element.tagname() + ">");
		}
	}
	private static void print(OutputStream stream, String text) throws IOException {
		stream.write(text.getBytes(StandardCharsets.UTF_8));
	}
	public static String escape(String text) {
		StringBuilder escaped = null;
		for (int i = 0; i < text.length(); ++i) {
			char c = text.charAt(i);
			String replacement;
			switch (c) {
			case '&':
				replacement = "&amp;";
				break;
			case '<':
				replacement = "&lt;";
				break;
			case '>':
				replacement = "&gt;";
				break;
			case '"':
				replacement = "&quot;";
				break;
			case '\'':
				replacement = "&#39;";
				break;
			default:
				replacement = null;
				break;
			}
			if (replacement != null) {
				if (escaped == null)
					escaped = new StringBuilder(text.length() + 16).append(text, 0, i);
				escaped.append(replacement);
			} else if (escaped != null)
				escaped.append(c);
		}
		return escaped != null ? escaped.toString() : text;
	}
	/*
	 * Result serializes to exactly the same bytes as the subtree, regardless of where it is inserted.
	 * Doctype is never included. Only elements can be captured, because placement is validated by the outermost tag.
	 */
	public HtmlPreserialized preserialize(NodeHandle root) {
		HtmlNode node = root.node();
		if (node instanceof HtmlPreserialized)
			return (HtmlPreserialized)node;
		if (!(node instanceof HtmlElement))
			throw new IllegalArgumentException("Only element nodes can be pre-serialized, not " + node.getClass().getSimpleName() + ".");
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		Exceptions.sneak().run(() -> render(root, buffer));
		return new HtmlPreserialized(((HtmlElement)node).tag(), buffer.toByteArray());
	}
	/*
	 * Text content without markup. Pre-serialized content cannot be converted back to text.
	 */
	public String plain(NodeHandle root) {
		StringBuilder text = new StringBuilder();
		plain(root, text);
		return text.toString();
	}
	private static void plain(NodeHandle handle, StringBuilder text) {
		HtmlNode node = handle.node();
		if (node instanceof HtmlText)
			text.append(((HtmlText)node).text());
		else if (node instanceof HtmlPreserialized)
			throw new IllegalStateException("Cannot extract plain text from pre-serialized HTML.");
		else {
			for (NodeHandle child : node.children())
				plain(child, text);
		}
	}
}
