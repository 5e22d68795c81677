// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class HtmlTraceTest {
	private final HtmlBuilder b = new HtmlBuilder(new HtmlArena());
	@AfterEach public void restore() {
		HtmlTrace.reset();
		HtmlRunMode.set(HtmlRunMode.TESTS);
	}
	private static HtmlElement element(NodeHandle handle) {
		return (HtmlElement)handle.node();
	}
	@Test public void disabled() {
		HtmlTrace.enable(false);
		assertNull(element(b.div()).attribute("title"));
	}
	@Test public void enabled() {
		HtmlTrace.enable(true);
		String title = element(b.div(b.text("x"))).attribute("title");
		assertNotNull(title);
		assertTrue(title.startsWith("Generated at:\n"));
		assertTrue(title.contains(HtmlTraceTest.class.getName() + ".enabled"));
		assertFalse(title.contains(HtmlBuilder.class.getName()));
		assertNotNull(element(b.span()).attribute("title"));
	}
	@Test public void existingTitle() {
		HtmlTrace.enable(true);
		HtmlElement element = element(b.abbr(HtmlAttribute.list("title", "Hypertext Markup Language"), b.text("HTML")));
		assertEquals("Hypertext Markup Language", element.attribute("title"));
		assertEquals(1, element.attributes().size());
	}
	@Test public void runMode() {
		HtmlRunMode.set(HtmlRunMode.DEVELOPMENT);
		assertTrue(HtmlTrace.enabled());
		HtmlRunMode.set(HtmlRunMode.PRODUCTION);
		assertFalse(HtmlTrace.enabled());
		HtmlTrace.enable(true);
		assertTrue(HtmlTrace.enabled());
	}
	@Test public void serialization() {
		HtmlTrace.enable(true);
		String html = new HtmlSerializer().html(b.p());
		assertTrue(html.startsWith("<p title=\"Generated at:\n"));
	}
}
