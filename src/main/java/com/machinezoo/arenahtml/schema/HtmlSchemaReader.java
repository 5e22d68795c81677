// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import java.io.*;
import java.util.*;
import com.google.gson.*;

/*
 * Schema data refers to permitted children by struct name. These are resolved to tag names here,
 * so that the rest of the code works with tag names only.
 */
class HtmlSchemaReader {
	/*
	 * Pseudo-child that allows text content.
	 */
	static final String TEXT_STRUCT = "Text";
	static class SchemaData {
		List<String> globalAttributes;
		List<String> globalAttributePrefixes;
		List<ElementData> elements;
	}
	static class ElementData {
		String tag;
		String struct;
		Boolean closingTag;
		Boolean globalAttributes;
		List<ContentCategory> categories;
		List<ContentCategory> permittedContent;
		List<String> permittedChildren;
		List<AttributeData> attributes;
	}
	static class AttributeData {
		String name;
		String description;
		AttributeKind kind;
		List<String> values;
	}
	private static <T> List<T> orEmpty(List<T> list) {
		return list != null ? list : Collections.emptyList();
	}
	private static List<ContentCategory> categories(ElementData element, List<ContentCategory> list) {
		for (ContentCategory category : orEmpty(list))
			if (category == null)
				throw new IllegalStateException("Unknown content category in element: " + element.tag);
		return orEmpty(list);
	}
	static HtmlSchema read(Reader reader, String source) {
		SchemaData data;
		try {
			data = new Gson().fromJson(reader, SchemaData.class);
		} catch (JsonParseException ex) {
			throw new IllegalStateException("Malformed schema data: " + source, ex);
		}
		if (data == null || data.elements == null)
			throw new IllegalStateException("Schema data has no elements: " + source);
		Map<String, String> structs = new HashMap<>();
		for (ElementData element : data.elements) {
			if (element.tag == null || element.tag.isEmpty())
				throw new IllegalStateException("Element without tag name: " + source);
			String struct = element.struct != null ? element.struct : element.tag;
			if (structs.containsValue(element.tag))
				throw new IllegalStateException("Duplicate tag: " + element.tag);
			if (structs.put(struct, element.tag) != null)
				throw new IllegalStateException("Duplicate struct name: " + struct);
		}
		List<TagMeta> tags = new ArrayList<>();
		for (ElementData element : data.elements) {
			boolean text = false;
			List<String> children = new ArrayList<>();
			for (String struct : orEmpty(element.permittedChildren)) {
				if (TEXT_STRUCT.equals(struct))
					text = true;
				else {
					String tag = structs.get(struct);
					if (tag == null)
						throw new IllegalStateException("Element <" + element.tag + "> references unknown struct: " + struct);
					children.add(tag);
				}
			}
			List<AttributeMeta> attributes = new ArrayList<>();
			Set<String> names = new HashSet<>();
			for (AttributeData attribute : orEmpty(element.attributes)) {
				if (attribute.name == null)
					throw new IllegalStateException("Attribute without name in element: " + element.tag);
				if (!names.add(attribute.name))
					throw new IllegalStateException("Duplicate attribute '" + attribute.name + "' in element: " + element.tag);
				attributes.add(new AttributeMeta(attribute.name, attribute.description, attribute.kind, attribute.values));
			}
			tags.add(new TagMeta(
				element.tag,
				element.struct != null ? element.struct : element.tag,
				attributes,
				categories(element, element.categories),
				categories(element, element.permittedContent),
				children,
				text,
				element.closingTag == null || element.closingTag,
				element.globalAttributes == null || element.globalAttributes));
		}
		return new HtmlSchema(tags, orEmpty(data.globalAttributes), orEmpty(data.globalAttributePrefixes));
	}
}
