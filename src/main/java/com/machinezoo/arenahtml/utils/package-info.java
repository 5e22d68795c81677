// Part of ArenaHTML: https://arenahtml.machinezoo.com
/**
 * Text formatting helpers built on top of {@link com.machinezoo.arenahtml.HtmlBuilder}.
 */
package com.machinezoo.arenahtml.utils;
