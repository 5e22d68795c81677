// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.arenahtml.schema.*;

public class HtmlBuilderTest {
	private final HtmlArena arena = new HtmlArena();
	private final HtmlBuilder b = new HtmlBuilder(arena);
	private String html(NodeHandle root) {
		return new HtmlSerializer().html(root);
	}
	@Test public void anchor() {
		NodeHandle a = b.a(HtmlAttribute.list("href", "/x"), b.text("text"));
		assertEquals("<a href=\"/x\">text</a>", html(a));
		HtmlElement element = (HtmlElement)a.node();
		assertEquals("a", element.tagname());
		assertEquals("/x", element.attribute("href"));
	}
	@Test public void areaInsideAnchor() {
		NodeHandle area = b.area();
		int size = arena.size();
		var ex = assertThrows(HtmlSchemaException.class, () -> b.a(HtmlAttribute.list("href", "/x"), area));
		assertEquals(SchemaViolation.DISALLOWED_CHILD, ex.violation());
		assertEquals("area", ex.subject());
		assertEquals(size, arena.size());
		assertEquals("<map><area></map>", html(b.map(area)));
	}
	@Test public void disallowedAttribute() {
		var ex = assertThrows(HtmlSchemaException.class, () -> b.div(HtmlAttribute.list("href", "/x")));
		assertEquals(SchemaViolation.DISALLOWED_ATTRIBUTE, ex.violation());
		assertEquals("div", ex.tagname());
	}
	@Test public void unknownTag() {
		var ex = assertThrows(HtmlSchemaException.class, () -> b.element("blink", null));
		assertEquals(SchemaViolation.UNKNOWN_TAG, ex.violation());
	}
	@Test public void nulls() {
		boolean hidden = true;
		NodeHandle div = b.div(Arrays.asList(HtmlAttribute.optional("id", null), HtmlAttribute.of("class", "c")),
			hidden ? null : b.text("secret"),
			b.text("shown"),
			null);
		assertEquals("<div class=\"c\">shown</div>", html(div));
		assertEquals("", html(b.text(null)));
		assertEquals("<p></p>", html(b.p()));
	}
	@Test public void fragments() {
		NodeHandle items = b.fragment(b.li(b.text("one")), b.li(b.text("two")));
		assertEquals("<ul><li>one</li><li>two</li></ul>", html(b.ul(items)));
		assertEquals("<ul></ul>", html(b.ul(b.empty())));
		assertEquals("ab", html(b.fragment(List.of(b.text("a"), b.text("b")).stream())));
	}
	@Test public void nbsp() {
		assertEquals("a\u00A0b", html(b.fragment(b.text("a"), b.nbsp(), b.text("b"))));
	}
	@Test public void everyTag() {
		for (TagMeta tag : arena.schema().tags()) {
			NodeHandle element = b.element(tag, null);
			assertEquals(tag, ((HtmlElement)element.node()).tag());
		}
	}
	@Test public void childPairs() {
		var lenient = new HtmlArena(arena.schema(), HtmlArena.DEFAULT_CAPACITY, false);
		var builder = new HtmlBuilder(lenient);
		for (TagMeta parent : arena.schema().tags()) {
			for (TagMeta child : arena.schema().tags()) {
				NodeHandle handle = builder.element(child, null);
				if (parent.permits(child))
					b.element(parent, null, handle);
				else
					assertThrows(HtmlSchemaException.class, () -> b.element(parent, null, handle), parent + " " + child);
			}
			lenient.reset();
		}
	}
	@Test public void guard() {
		HtmlRunMode.set(HtmlRunMode.TESTS);
		NodeHandle ok = b.guard(() -> b.p(b.text("fine")));
		assertEquals("<p>fine</p>", html(ok));
		NodeHandle failed = b.guard(() -> {
			throw new IllegalArgumentException("broken");
		});
		assertEquals("<pre class=\"site-error\">This content failed to load.</pre>", html(failed));
		NodeHandle invalid = b.text("x");
		arena.reset();
		assertThrows(InvalidHandleException.class, () -> b.guard(() -> b.p(invalid)));
	}
	@Test public void guardInDevelopment() {
		try {
			HtmlRunMode.set(HtmlRunMode.DEVELOPMENT);
			HtmlTrace.enable(false);
			NodeHandle failed = b.guard(() -> {
				throw new IllegalArgumentException("broken");
			});
			String html = html(failed);
			assertTrue(html.startsWith("<pre class=\"site-error\">"));
			assertTrue(html.contains("broken"));
		} finally {
			HtmlRunMode.set(HtmlRunMode.TESTS);
			HtmlTrace.reset();
		}
	}
	@Test public void graft() {
		var shared = new HtmlArena();
		NodeHandle footer = new HtmlBuilder(shared).footer();
		NodeHandle page = b.div(b.graft(footer));
		assertEquals("<div><footer></footer></div>", html(page));
		assertTrue(arena.dependencies().contains(shared));
	}
}
