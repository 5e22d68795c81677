// Part of ArenaHTML: https://arenahtml.machinezoo.com
/**
 * HTML schema database used to validate element construction.
 * The standard schema is available from {@link com.machinezoo.arenahtml.schema.HtmlSchema#standard()}.
 */
package com.machinezoo.arenahtml.schema;
