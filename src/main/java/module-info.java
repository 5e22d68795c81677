// Part of ArenaHTML: https://arenahtml.machinezoo.com
module com.machinezoo.arenahtml {
	exports com.machinezoo.arenahtml;
	exports com.machinezoo.arenahtml.schema;
	exports com.machinezoo.arenahtml.utils;
	requires com.machinezoo.stagean;
	/*
	 * Transitive, because guard() and cache renderers accept noexception-style functional code.
	 */
	requires transitive com.machinezoo.noexception;
	requires org.slf4j;
	requires micrometer.core;
	requires org.apache.commons.lang3;
	requires one.util.streamex;
	/*
	 * Transitive, because ImmutableMap and ImmutableSet are returned from schema API.
	 */
	requires transitive com.google.common;
	requires com.google.gson;
	requires it.unimi.dsi.fastutil;
	/*
	 * Schema DTOs are filled in by Gson via reflection.
	 */
	opens com.machinezoo.arenahtml.schema to com.google.gson;
}
