// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.schema;

import com.google.gson.annotations.*;

/**
 * HTML content categories, which determine where elements may appear.
 */
public enum ContentCategory {
	@SerializedName("Metadata") METADATA,
	@SerializedName("Flow") FLOW,
	@SerializedName("Sectioning") SECTIONING,
	@SerializedName("Heading") HEADING,
	@SerializedName("Phrasing") PHRASING,
	@SerializedName("Embedded") EMBEDDED,
	@SerializedName("Interactive") INTERACTIVE,
	@SerializedName("Palpable") PALPABLE,
	@SerializedName("ScriptSupporting") SCRIPT_SUPPORTING,
	@SerializedName("Transparent") TRANSPARENT;
}
