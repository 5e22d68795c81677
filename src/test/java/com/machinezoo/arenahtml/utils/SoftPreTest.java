// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml.utils;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;
import com.machinezoo.arenahtml.*;

public class SoftPreTest {
	private final HtmlBuilder b = new HtmlBuilder(new HtmlArena());
	private String format(SoftPre softpre, String text) {
		return new HtmlSerializer().html(softpre.format(b, text));
	}
	@Test public void lines() {
		assertEquals("<div class=\"soft_pre\">foo bar<br></div>", format(new SoftPre(), "foo bar"));
		assertEquals("<div class=\"soft_pre\">a<br>b<br><br></div>", format(new SoftPre(), "a\nb\n"));
		assertEquals("<div class=\"soft_pre\"><br></div>", format(new SoftPre(), ""));
	}
	@Test public void tabs() {
		String nbsp8 = "\u00A0".repeat(8);
		assertEquals("<div class=\"soft_pre\">foo bar<br>" + nbsp8 + "baz<br></div>", format(new SoftPre(), "foo bar\n\tbaz"));
		assertEquals("<div class=\"soft_pre\">\u00A0\u00A0x<br></div>", format(new SoftPre().tabs(2), "\tx"));
		assertEquals("<div class=\"soft_pre\">\tx<br></div>", format(new SoftPre().tabs(0), "\tx"));
	}
	@Test public void links() {
		assertEquals("<div class=\"soft_pre\">see <a href=\"https://example.com/a\">https://example.com/a</a>.<br></div>",
			format(new SoftPre(), "see https://example.com/a."));
		assertEquals("<div class=\"soft_pre\">see https://example.com/a.<br></div>",
			format(new SoftPre().autolink(false), "see https://example.com/a."));
		assertEquals("<div class=\"soft_pre\"><a href=\"http://x.org\">http://x.org</a>" + "\u00A0".repeat(8) + "y<br></div>",
			format(new SoftPre(), "http://x.org\ty"));
	}
	@Test public void separator() {
		assertEquals("<div class=\"soft_pre\">a<br>b<br></div>", format(new SoftPre().separator("\r\n"), "a\r\nb"));
		assertThrows(IllegalArgumentException.class, () -> new SoftPre().separator(""));
	}
	@Test public void escaping() {
		assertEquals("<div class=\"soft_pre\">&lt;b&gt;<br></div>", format(new SoftPre(), "<b>"));
	}
}
