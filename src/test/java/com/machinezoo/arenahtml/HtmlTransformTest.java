// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import com.machinezoo.arenahtml.schema.*;

public class HtmlTransformTest {
	private final HtmlArena arena = new HtmlArena();
	private final HtmlBuilder b = new HtmlBuilder(arena);
	private String html(NodeHandle root) {
		return new HtmlSerializer().html(root);
	}
	private NodeHandle article() {
		return b.article(
			b.h1(b.text("Title")),
			b.p(b.text("First "), b.em(b.text("point"))),
			b.p(b.text("Second")));
	}
	@Test public void identity() {
		NodeHandle root = article();
		int size = arena.size();
		assertSame(root, new HtmlTransform(arena).identity(root));
		assertEquals(size, arena.size());
	}
	@Test public void identityIntoOtherArena() {
		NodeHandle root = article();
		var target = new HtmlArena();
		assertEquals(root, new HtmlTransform(target).identity(root));
		assertEquals(0, target.size());
		assertTrue(target.dependencies().contains(arena));
	}
	@Test public void sharing() {
		NodeHandle left = b.p(b.text("left"));
		NodeHandle old = b.text("old");
		NodeHandle right = b.p(old);
		NodeHandle root = b.div(left, right);
		NodeHandle replacement = b.text("new");
		int size = arena.size();
		NodeHandle result = new HtmlTransform(arena).replace(root, old, replacement);
		assertEquals(size + 2, arena.size());
		assertEquals("<div><p>left</p><p>new</p></div>", html(result));
		assertEquals("<div><p>left</p><p>old</p></div>", html(root));
		List<NodeHandle> children = result.node().children();
		assertEquals(left, children.get(0));
		assertNotEquals(right, children.get(1));
	}
	@Test public void map() {
		NodeHandle root = article();
		TagMeta strong = arena.schema().lookup("strong");
		NodeHandle result = new HtmlTransform(arena).map(root, (handle, node) -> {
			if (node instanceof HtmlElement && ((HtmlElement)node).tagname().equals("em"))
				return NodeMapping.replace(new HtmlElement(strong, Collections.emptyList(), node.children()));
			return null;
		});
		assertEquals("<article><h1>Title</h1><p>First <strong>point</strong></p><p>Second</p></article>", html(result));
	}
	@Test public void splice() {
		NodeHandle root = b.div(b.p(b.span(b.text("a")), b.text("b")));
		NodeHandle result = new HtmlTransform(arena).map(root, (handle, node) -> {
			if (node instanceof HtmlElement && ((HtmlElement)node).tagname().equals("span"))
				return NodeMapping.splice(node.children());
			return NodeMapping.keep();
		});
		assertEquals("<div><p>ab</p></div>", html(result));
	}
	@Test public void rootSplice() {
		NodeHandle one = b.p(b.text("1"));
		NodeHandle two = b.p(b.text("2"));
		NodeHandle root = b.div(one, two);
		var transform = new HtmlTransform(arena);
		NodeHandle both = transform.map(root, (handle, node) -> handle == root ? NodeMapping.splice(node.children()) : NodeMapping.keep());
		assertTrue(both.node() instanceof HtmlFragment);
		assertEquals("<p>1</p><p>2</p>", html(both));
		NodeHandle none = transform.map(root, (handle, node) -> NodeMapping.remove());
		assertEquals("", html(none));
		assertEquals(one, transform.map(root, (handle, node) -> handle == root ? NodeMapping.splice(one) : NodeMapping.keep()));
	}
	@Test public void filter() {
		NodeHandle root = b.div(b.p(b.text("keep")), b.script(b.text("drop()")), b.p(b.script(), b.text("x")));
		NodeHandle result = new HtmlTransform(arena).filter(root, node -> !(node instanceof HtmlElement && ((HtmlElement)node).tagname().equals("script")));
		assertEquals("<div><p>keep</p><p>x</p></div>", html(result));
		NodeHandle script = b.script();
		assertSame(script, new HtmlTransform(arena).filter(script, node -> false));
	}
	@Test public void freshArena() {
		NodeHandle root = article();
		var target = new HtmlArena();
		NodeHandle result = new HtmlTransform(target).map(root, (handle, node) -> {
			if (node instanceof HtmlText && ((HtmlText)node).text().equals("Second"))
				return NodeMapping.replace(new HtmlText("Third"));
			return NodeMapping.keep();
		});
		assertSame(target, result.arena());
		assertEquals(3, target.size());
		assertTrue(html(result).contains("<p>Third</p>"));
		assertTrue(html(root).contains("<p>Second</p>"));
	}
	@Test public void validatesRebuilt() {
		NodeHandle root = b.ul(b.li(b.text("x")));
		var transform = new HtmlTransform(arena);
		assertThrows(HtmlSchemaException.class, () -> transform.map(root, (handle, node) -> node instanceof HtmlElement && ((HtmlElement)node).tagname().equals("li")
			? NodeMapping.replace(new HtmlElement(arena.schema().lookup("div"), Collections.emptyList(), Collections.emptyList()))
			: NodeMapping.keep()));
	}
	@Test public void sharedSubtree() {
		NodeHandle item = b.li(b.text("same"));
		NodeHandle root = b.ul(item, item);
		int[] calls = new int[1];
		new HtmlTransform(arena).map(root, (handle, node) -> {
			if (handle.equals(item))
				++calls[0];
			return NodeMapping.keep();
		});
		assertEquals(1, calls[0]);
	}
}
