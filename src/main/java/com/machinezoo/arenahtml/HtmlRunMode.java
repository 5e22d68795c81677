// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import com.machinezoo.stagean.*;

/*
 * Development and production differ in how much diagnostic information ends up in generated HTML.
 * Development mode enables construction tracing and full stack traces in error content.
 * Production mode keeps generated HTML free of internal details.
 * The mode is set from main() as early as possible, because code running earlier uses the default.
 */
/**
 * Global run mode (production, development, test).
 */
@StubDocs
@DraftApi("configuration via system properties")
public enum HtmlRunMode {
	/*
	 * Unit tests don't run main() and thus cannot configure the mode explicitly, so this is the default.
	 */
	TESTS,
	DEVELOPMENT,
	PRODUCTION;
	private static volatile HtmlRunMode current = TESTS;
	public static HtmlRunMode get() {
		return current;
	}
	public static void set(HtmlRunMode mode) {
		current = mode;
	}
}
