// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import java.util.*;

/**
 * Thrown when element construction violates the schema.
 * Nothing is allocated when this exception is thrown.
 */
public class HtmlSchemaException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;
	/*
	 * Text children are reported with this pseudo-name as their subject.
	 */
	public static final String TEXT = "#text";
	private final SchemaViolation violation;
	public SchemaViolation violation() {
		return violation;
	}
	private final String tagname;
	public String tagname() {
		return tagname;
	}
	private final String subject;
	public String subject() {
		return subject;
	}
	public HtmlSchemaException(SchemaViolation violation, String tagname, String subject, String message) {
		super(message);
		Objects.requireNonNull(violation);
		this.violation = violation;
		this.tagname = tagname;
		this.subject = subject;
	}
	static HtmlSchemaException unknownTag(String tagname) {
		return new HtmlSchemaException(SchemaViolation.UNKNOWN_TAG, tagname, tagname, "Unknown HTML tag: " + tagname);
	}
	static HtmlSchemaException attribute(TagMeta tag, String name) {
		return new HtmlSchemaException(SchemaViolation.DISALLOWED_ATTRIBUTE, tag.name(), name,
			"Attribute '" + name + "' is not allowed on <" + tag.name() + ">. Valid attributes are: "
				+ String.join(", ", tag.attributes().keySet())
				+ (tag.globalAttributes() ? " and global attributes." : "."));
	}
	static HtmlSchemaException child(TagMeta parent, String child) {
		String label = TEXT.equals(child) ? "Text" : "<" + child + ">";
		return new HtmlSchemaException(SchemaViolation.DISALLOWED_CHILD, parent.name(), child,
			label + " is not allowed as a child of <" + parent.name() + ">.");
	}
}
