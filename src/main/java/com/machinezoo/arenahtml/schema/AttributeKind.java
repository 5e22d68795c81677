// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import com.google.gson.annotations.*;

/*
 * Informational only. Attribute values are never checked against their kind.
 */
public enum AttributeKind {
	@SerializedName("Bool") BOOL,
	@SerializedName("String") STRING,
	@SerializedName("Integer") INTEGER,
	@SerializedName("Float") FLOAT,
	@SerializedName("Identifier") IDENTIFIER,
	@SerializedName("Enumerable") ENUMERABLE;
}
