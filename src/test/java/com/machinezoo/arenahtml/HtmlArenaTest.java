// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.arenahtml.schema.*;

public class HtmlArenaTest {
	private final HtmlSchema schema = HtmlSchema.standard();
	@Test public void allocate() {
		var arena = new HtmlArena();
		NodeHandle text = arena.allocate(new HtmlText("hello"));
		NodeHandle p = arena.allocate(new HtmlElement(schema.lookup("p"), Collections.emptyList(), List.of(text)));
		assertEquals(2, arena.size());
		assertEquals(0, text.slot());
		assertEquals(1, p.slot());
		assertSame(arena, p.arena());
		assertEquals("hello", ((HtmlText)arena.resolve(text)).text());
		assertEquals(List.of(text), arena.resolve(p).children());
		assertTrue(arena.live(p));
		assertEquals(new NodeHandle(arena, 0, 1), p);
	}
	@Test public void reset() {
		var arena = new HtmlArena();
		NodeHandle text = arena.allocate(new HtmlText("hello"));
		arena.reset();
		assertEquals(0, arena.size());
		assertEquals(1, arena.generation());
		assertFalse(arena.live(text));
		assertThrows(InvalidHandleException.class, () -> arena.resolve(text));
		NodeHandle reused = arena.allocate(new HtmlText("again"));
		assertEquals(text.slot(), reused.slot());
		assertNotEquals(text, reused);
		assertThrows(InvalidHandleException.class, () -> arena.allocate(new HtmlFragment(List.of(text))));
	}
	@Test public void foreignHandle() {
		var first = new HtmlArena();
		var second = new HtmlArena();
		NodeHandle text = first.allocate(new HtmlText("hello"));
		assertThrows(InvalidHandleException.class, () -> second.resolve(text));
		assertFalse(second.live(text));
		assertEquals("hello", ((HtmlText)text.node()).text());
	}
	@Test public void outOfRange() {
		var arena = new HtmlArena();
		assertThrows(InvalidHandleException.class, () -> arena.resolve(new NodeHandle(arena, 0, 0)));
		assertThrows(InvalidHandleException.class, () -> arena.resolve(new NodeHandle(arena, 0, -1)));
	}
	@Test public void dependencies() {
		var shared = new HtmlArena();
		var request = new HtmlArena();
		NodeHandle footer = shared.allocate(new HtmlText("footer"));
		assertTrue(request.dependencies().isEmpty());
		NodeHandle div = request.allocate(new HtmlElement(schema.lookup("div"), Collections.emptyList(), List.of(footer)));
		assertEquals(Set.of(shared), request.dependencies());
		assertEquals(footer, div.node().children().get(0));
		request.reset();
		assertTrue(request.dependencies().isEmpty());
		assertSame(footer, request.graft(footer));
		assertEquals(Set.of(shared), request.dependencies());
		shared.reset();
		assertThrows(InvalidHandleException.class, () -> request.allocate(new HtmlFragment(List.of(footer))));
	}
	@Test public void capacity() {
		var arena = new HtmlArena(schema, 2, true);
		arena.allocate(new HtmlText("a"));
		arena.allocate(new HtmlText("b"));
		assertThrows(IllegalStateException.class, () -> arena.allocate(new HtmlText("c")));
		assertEquals(2, arena.size());
		arena.reset();
		arena.allocate(new HtmlText("c"));
	}
	@Test public void freeze() {
		var arena = new HtmlArena();
		NodeHandle text = arena.allocate(new HtmlText("site-wide"));
		arena.freeze();
		assertTrue(arena.frozen());
		assertThrows(IllegalStateException.class, () -> arena.allocate(new HtmlText("more")));
		assertThrows(IllegalStateException.class, arena::reset);
		assertTrue(text.live());
	}
	@Test public void validation() {
		var arena = new HtmlArena();
		NodeHandle text = arena.allocate(new HtmlText("item"));
		var ul = schema.lookup("ul");
		var ex = assertThrows(HtmlSchemaException.class, () -> arena.allocate(new HtmlElement(ul, Collections.emptyList(), List.of(text))));
		assertEquals(SchemaViolation.DISALLOWED_CHILD, ex.violation());
		assertEquals(1, arena.size());
		var lenient = new HtmlArena(schema, HtmlArena.DEFAULT_CAPACITY, false);
		NodeHandle loose = lenient.allocate(new HtmlText("item"));
		lenient.allocate(new HtmlElement(ul, Collections.emptyList(), List.of(loose)));
		assertEquals(2, lenient.size());
	}
	@Test public void fragmentChildrenValidated() {
		var arena = new HtmlArena();
		NodeHandle li = arena.allocate(new HtmlElement(schema.lookup("li"), Collections.emptyList(), Collections.emptyList()));
		NodeHandle div = arena.allocate(new HtmlElement(schema.lookup("div"), Collections.emptyList(), Collections.emptyList()));
		NodeHandle good = arena.allocate(new HtmlFragment(List.of(li, li)));
		NodeHandle bad = arena.allocate(new HtmlFragment(List.of(li, div)));
		var ul = schema.lookup("ul");
		arena.allocate(new HtmlElement(ul, Collections.emptyList(), List.of(good)));
		assertThrows(HtmlSchemaException.class, () -> arena.allocate(new HtmlElement(ul, Collections.emptyList(), List.of(bad))));
	}
	@Test public void duplicateAttributes() {
		var attributes = HtmlAttribute.list("id", "a", "id", "b");
		assertThrows(IllegalArgumentException.class, () -> new HtmlElement(schema.lookup("div"), attributes, Collections.emptyList()));
	}
	@Test public void elementCopies() {
		var div = new HtmlElement(schema.lookup("div"), HtmlAttribute.list("id", "main", "class", "box"), Collections.emptyList());
		assertEquals("wide", div.withAttribute("class", "wide").attribute("class"));
		assertEquals("box", div.attribute("class"));
		assertEquals(2, div.withAttribute("class", "wide").attributes().size());
		assertEquals(3, div.withAttribute("title", "x").attributes().size());
		assertNull(div.withoutAttribute("id").attribute("id"));
	}
}
