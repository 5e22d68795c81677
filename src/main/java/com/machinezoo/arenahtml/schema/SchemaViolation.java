// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

public enum SchemaViolation {
	UNKNOWN_TAG,
	DISALLOWED_ATTRIBUTE,
	DISALLOWED_CHILD;
}
