// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.util.*;
import org.apache.commons.lang3.*;
import org.slf4j.*;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.*;
import com.machinezoo.arenahtml.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;

/**
 * Immutable database of HTML tags, their attributes, and permitted children.
 * Schema is loaded once and then shared by all arenas and threads.
 */
@DraftApi("validation of attribute values against their kind")
public class HtmlSchema {
	private static final Logger logger = LoggerFactory.getLogger(HtmlSchema.class);
	/*
	 * Path to schema JSON that replaces the bundled one. System property takes precedence over environment variable.
	 */
	public static final String OVERRIDE_PROPERTY = "arenahtml.schema";
	public static final String OVERRIDE_VARIABLE = "ARENAHTML_SCHEMA";
	private static final String RESOURCE = "html-schema.json";
	private static final Supplier<HtmlSchema> standard = Suppliers.memoize(() -> {
		String override = System.getProperty(OVERRIDE_PROPERTY);
		if (StringUtils.isBlank(override))
			override = System.getenv(OVERRIDE_VARIABLE);
		if (!StringUtils.isBlank(override))
			return load(Paths.get(override));
		return Exceptions.sneak().get(() -> {
			try (InputStream stream = HtmlSchema.class.getResourceAsStream(RESOURCE)) {
				if (stream == null)
					throw new IllegalStateException("Missing bundled schema resource: " + RESOURCE);
				return read(new InputStreamReader(stream, StandardCharsets.UTF_8), "classpath:" + RESOURCE);
			}
		});
	});
	public static HtmlSchema standard() {
		return standard.get();
	}
	public static HtmlSchema parse(Reader reader) {
		return read(reader, "reader");
	}
	public static HtmlSchema load(Path path) {
		return Exceptions.sneak().get(() -> {
			try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
				return read(reader, path.toString());
			}
		});
	}
	private static HtmlSchema read(Reader reader, String source) {
		HtmlSchema schema = HtmlSchemaReader.read(reader, source);
		logger.info("Loaded HTML schema with {} tags from {}.", schema.tags.size(), source);
		return schema;
	}
	private final ImmutableMap<String, TagMeta> tags;
	private final ImmutableSet<String> globalAttributes;
	private final ImmutableList<String> globalPrefixes;
	HtmlSchema(Collection<TagMeta> tags, Collection<String> globalAttributes, Collection<String> globalPrefixes) {
		var map = ImmutableMap.<String, TagMeta>builder();
		for (TagMeta tag : tags)
			map.put(tag.name(), tag);
		this.tags = map.buildOrThrow();
		this.globalAttributes = ImmutableSet.copyOf(globalAttributes);
		this.globalPrefixes = ImmutableList.copyOf(globalPrefixes);
	}
	public ImmutableCollection<TagMeta> tags() {
		return tags.values();
	}
	public ImmutableSet<String> globalAttributes() {
		return globalAttributes;
	}
	public ImmutableList<String> globalPrefixes() {
		return globalPrefixes;
	}
	public Optional<TagMeta> find(String tagname) {
		return Optional.ofNullable(tags.get(tagname));
	}
	public TagMeta lookup(String tagname) {
		TagMeta tag = tags.get(tagname);
		if (tag == null)
			throw HtmlSchemaException.unknownTag(tagname);
		return tag;
	}
	public boolean isGlobalAttribute(String name) {
		if (globalAttributes.contains(name))
			return true;
		for (String prefix : globalPrefixes)
			if (name.startsWith(prefix) && name.length() > prefix.length())
				return true;
		return false;
	}
	public boolean permitsAttribute(TagMeta tag, String name) {
		return tag.attributes().containsKey(name) || tag.globalAttributes() && isGlobalAttribute(name);
	}
	public void validateAttribute(String tagname, String name) {
		validateAttribute(lookup(tagname), name);
	}
	public void validateAttribute(TagMeta tag, String name) {
		if (!permitsAttribute(tag, name))
			throw HtmlSchemaException.attribute(tag, name);
	}
	public void validateChild(String tagname, ContentCategory category) {
		TagMeta tag = lookup(tagname);
		if (!tag.permits(category))
			throw HtmlSchemaException.child(tag, category.name());
	}
	public void validateChild(TagMeta parent, TagMeta child) {
		if (!parent.permits(child))
			throw HtmlSchemaException.child(parent, child.name());
	}
	public void validateText(TagMeta parent, String text) {
		if (!parent.allowsText() && !StringUtils.isWhitespace(text))
			throw HtmlSchemaException.child(parent, HtmlSchemaException.TEXT);
	}
	/*
	 * Children are resolved through their handles, so they must be live.
	 * Fragments are spliced into the parent, so their children are validated as children of the parent.
	 * Pre-serialized content is validated by its outermost element.
	 */
	public void validate(HtmlElement element) {
		TagMeta tag = element.tag();
		for (HtmlAttribute attribute : element.attributes())
			validateAttribute(tag, attribute.name());
		for (NodeHandle child : element.children())
			validateChild(tag, child.node());
	}
	private void validateChild(TagMeta parent, HtmlNode child) {
		if (child instanceof HtmlElement)
			validateChild(parent, ((HtmlElement)child).tag());
		else if (child instanceof HtmlText)
			validateText(parent, ((HtmlText)child).text());
		else if (child instanceof HtmlFragment) {
			for (NodeHandle nested : child.children())
				validateChild(parent, nested.node());
		} else if (child instanceof HtmlPreserialized)
			validateChild(parent, ((HtmlPreserialized)child).tag());
	}
}
