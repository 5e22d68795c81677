// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.io.*;
import java.util.*;
import java.util.function.*;
import java.util.stream.*;
import org.apache.commons.lang3.exception.*;
import com.machinezoo.arenahtml.schema.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;

/**
 * Fluent construction of HTML trees in one {@link HtmlArena}.
 * Null children and null attributes are skipped, so that conditional content can be written inline,
 * for example {@code b.div(condition ? null : b.text("..."))}.
 * Schema violations throw {@link HtmlSchemaException} before anything is allocated.
 */
@DraftApi("typed attribute setters")
public class HtmlBuilder {
	private final HtmlArena arena;
	public HtmlArena arena() {
		return arena;
	}
	public HtmlSchema schema() {
		return arena.schema();
	}
	public HtmlBuilder(HtmlArena arena) {
		Objects.requireNonNull(arena);
		this.arena = arena;
	}
	private static List<HtmlAttribute> attributes(List<HtmlAttribute> attributes) {
		if (attributes == null)
			return Collections.emptyList();
		List<HtmlAttribute> list = new ArrayList<>(attributes.size());
		for (HtmlAttribute attribute : attributes)
			if (attribute != null)
				list.add(attribute);
		return list;
	}
	private static List<NodeHandle> children(Collection<NodeHandle> children) {
		if (children == null)
			return Collections.emptyList();
		List<NodeHandle> list = new ArrayList<>(children.size());
		for (NodeHandle child : children)
			if (child != null)
				list.add(child);
		return list;
	}
	public NodeHandle element(TagMeta tag, List<HtmlAttribute> attributes, Collection<NodeHandle> children) {
		return arena.allocate(new HtmlElement(tag, HtmlTrace.annotate(arena.schema(), tag, attributes(attributes)), children(children)));
	}
	public NodeHandle element(TagMeta tag, List<HtmlAttribute> attributes, NodeHandle... children) {
		return element(tag, attributes, Arrays.asList(children));
	}
	public NodeHandle element(String tagname, List<HtmlAttribute> attributes, Collection<NodeHandle> children) {
		return element(arena.schema().lookup(tagname), attributes, children);
	}
	public NodeHandle element(String tagname, List<HtmlAttribute> attributes, NodeHandle... children) {
		return element(tagname, attributes, Arrays.asList(children));
	}
	/*
	 * Null text is treated as empty text.
	 */
	public NodeHandle text(String text) {
		return arena.allocate(new HtmlText(text != null ? text : ""));
	}
	public NodeHandle nbsp() {
		return text("\u00A0");
	}
	public NodeHandle empty() {
		return arena.allocate(new HtmlFragment(Collections.emptyList()));
	}
	public NodeHandle fragment(Collection<NodeHandle> children) {
		return arena.allocate(new HtmlFragment(children(children)));
	}
	public NodeHandle fragment(NodeHandle... children) {
		return fragment(Arrays.asList(children));
	}
	public NodeHandle fragment(Stream<NodeHandle> children) {
		return fragment(children.collect(Collectors.toList()));
	}
	public NodeHandle preserialized(HtmlPreserialized content) {
		return arena.allocate(content);
	}
	public NodeHandle graft(NodeHandle foreign) {
		return arena.graft(foreign);
	}
	/*
	 * Failure in one part of the page should not take down the whole page.
	 * Invalid handles are programming errors in arena management, so they are always propagated.
	 */
	public NodeHandle guard(Supplier<NodeHandle> supplier) {
		try {
			return supplier.get();
		} catch (InvalidHandleException ex) {
			throw ex;
		} catch (RuntimeException ex) {
			return error(ex);
		}
	}
	public NodeHandle error(Throwable ex) {
		Exceptions.log().handle(ex);
		List<HtmlAttribute> attributes = HtmlAttribute.list("class", "site-error");
		if (HtmlRunMode.get() != HtmlRunMode.DEVELOPMENT)
			return pre(attributes, text("This content failed to load."));
		StringWriter writer = new StringWriter();
		ExceptionUtils.printRootCauseStackTrace(ex, new PrintWriter(writer));
		return pre(attributes, text(writer.toString()));
	}
	public NodeHandle html(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("html", attributes, children);
	}
	public NodeHandle html(NodeHandle... children) {
		return element("html", null, children);
	}
	public NodeHandle head(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("head", attributes, children);
	}
	public NodeHandle head(NodeHandle... children) {
		return element("head", null, children);
	}
	public NodeHandle body(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("body", attributes, children);
	}
	public NodeHandle body(NodeHandle... children) {
		return element("body", null, children);
	}
	public NodeHandle title(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("title", attributes, children);
	}
	public NodeHandle title(NodeHandle... children) {
		return element("title", null, children);
	}
	public NodeHandle base(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("base", attributes, children);
	}
	public NodeHandle base(NodeHandle... children) {
		return element("base", null, children);
	}
	public NodeHandle link(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("link", attributes, children);
	}
	public NodeHandle link(NodeHandle... children) {
		return element("link", null, children);
	}
	public NodeHandle meta(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("meta", attributes, children);
	}
	public NodeHandle meta(NodeHandle... children) {
		return element("meta", null, children);
	}
	public NodeHandle style(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("style", attributes, children);
	}
	public NodeHandle style(NodeHandle... children) {
		return element("style", null, children);
	}
	public NodeHandle script(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("script", attributes, children);
	}
	public NodeHandle script(NodeHandle... children) {
		return element("script", null, children);
	}
	public NodeHandle noscript(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("noscript", attributes, children);
	}
	public NodeHandle noscript(NodeHandle... children) {
		return element("noscript", null, children);
	}
	public NodeHandle template(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("template", attributes, children);
	}
	public NodeHandle template(NodeHandle... children) {
		return element("template", null, children);
	}
	public NodeHandle article(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("article", attributes, children);
	}
	public NodeHandle article(NodeHandle... children) {
		return element("article", null, children);
	}
	public NodeHandle aside(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("aside", attributes, children);
	}
	public NodeHandle aside(NodeHandle... children) {
		return element("aside", null, children);
	}
	public NodeHandle nav(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("nav", attributes, children);
	}
	public NodeHandle nav(NodeHandle... children) {
		return element("nav", null, children);
	}
	public NodeHandle section(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("section", attributes, children);
	}
	public NodeHandle section(NodeHandle... children) {
		return element("section", null, children);
	}
	public NodeHandle header(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("header", attributes, children);
	}
	public NodeHandle header(NodeHandle... children) {
		return element("header", null, children);
	}
	public NodeHandle footer(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("footer", attributes, children);
	}
	public NodeHandle footer(NodeHandle... children) {
		return element("footer", null, children);
	}
	public NodeHandle main(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("main", attributes, children);
	}
	public NodeHandle main(NodeHandle... children) {
		return element("main", null, children);
	}
	public NodeHandle address(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("address", attributes, children);
	}
	public NodeHandle address(NodeHandle... children) {
		return element("address", null, children);
	}
	public NodeHandle h1(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("h1", attributes, children);
	}
	public NodeHandle h1(NodeHandle... children) {
		return element("h1", null, children);
	}
	public NodeHandle h2(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("h2", attributes, children);
	}
	public NodeHandle h2(NodeHandle... children) {
		return element("h2", null, children);
	}
	public NodeHandle h3(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("h3", attributes, children);
	}
	public NodeHandle h3(NodeHandle... children) {
		return element("h3", null, children);
	}
	public NodeHandle h4(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("h4", attributes, children);
	}
	public NodeHandle h4(NodeHandle... children) {
		return element("h4", null, children);
	}
	public NodeHandle h5(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("h5", attributes, children);
	}
	public NodeHandle h5(NodeHandle... children) {
		return element("h5", null, children);
	}
	public NodeHandle h6(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("h6", attributes, children);
	}
	public NodeHandle h6(NodeHandle... children) {
		return element("h6", null, children);
	}
	public NodeHandle p(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("p", attributes, children);
	}
	public NodeHandle p(NodeHandle... children) {
		return element("p", null, children);
	}
	public NodeHandle hr(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("hr", attributes, children);
	}
	public NodeHandle hr(NodeHandle... children) {
		return element("hr", null, children);
	}
	public NodeHandle pre(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("pre", attributes, children);
	}
	public NodeHandle pre(NodeHandle... children) {
		return element("pre", null, children);
	}
	public NodeHandle blockquote(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("blockquote", attributes, children);
	}
	public NodeHandle blockquote(NodeHandle... children) {
		return element("blockquote", null, children);
	}
	public NodeHandle ol(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("ol", attributes, children);
	}
	public NodeHandle ol(NodeHandle... children) {
		return element("ol", null, children);
	}
	public NodeHandle ul(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("ul", attributes, children);
	}
	public NodeHandle ul(NodeHandle... children) {
		return element("ul", null, children);
	}
	public NodeHandle li(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("li", attributes, children);
	}
	public NodeHandle li(NodeHandle... children) {
		return element("li", null, children);
	}
	public NodeHandle dl(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("dl", attributes, children);
	}
	public NodeHandle dl(NodeHandle... children) {
		return element("dl", null, children);
	}
	public NodeHandle dt(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("dt", attributes, children);
	}
	public NodeHandle dt(NodeHandle... children) {
		return element("dt", null, children);
	}
	public NodeHandle dd(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("dd", attributes, children);
	}
	public NodeHandle dd(NodeHandle... children) {
		return element("dd", null, children);
	}
	public NodeHandle figure(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("figure", attributes, children);
	}
	public NodeHandle figure(NodeHandle... children) {
		return element("figure", null, children);
	}
	public NodeHandle figcaption(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("figcaption", attributes, children);
	}
	public NodeHandle figcaption(NodeHandle... children) {
		return element("figcaption", null, children);
	}
	public NodeHandle div(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("div", attributes, children);
	}
	public NodeHandle div(NodeHandle... children) {
		return element("div", null, children);
	}
	public NodeHandle a(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("a", attributes, children);
	}
	public NodeHandle a(NodeHandle... children) {
		return element("a", null, children);
	}
	public NodeHandle em(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("em", attributes, children);
	}
	public NodeHandle em(NodeHandle... children) {
		return element("em", null, children);
	}
	public NodeHandle strong(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("strong", attributes, children);
	}
	public NodeHandle strong(NodeHandle... children) {
		return element("strong", null, children);
	}
	public NodeHandle small(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("small", attributes, children);
	}
	public NodeHandle small(NodeHandle... children) {
		return element("small", null, children);
	}
	public NodeHandle s(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("s", attributes, children);
	}
	public NodeHandle s(NodeHandle... children) {
		return element("s", null, children);
	}
	public NodeHandle cite(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("cite", attributes, children);
	}
	public NodeHandle cite(NodeHandle... children) {
		return element("cite", null, children);
	}
	public NodeHandle dfn(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("dfn", attributes, children);
	}
	public NodeHandle dfn(NodeHandle... children) {
		return element("dfn", null, children);
	}
	public NodeHandle abbr(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("abbr", attributes, children);
	}
	public NodeHandle abbr(NodeHandle... children) {
		return element("abbr", null, children);
	}
	public NodeHandle code(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("code", attributes, children);
	}
	public NodeHandle code(NodeHandle... children) {
		return element("code", null, children);
	}
	public NodeHandle samp(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("samp", attributes, children);
	}
	public NodeHandle samp(NodeHandle... children) {
		return element("samp", null, children);
	}
	public NodeHandle kbd(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("kbd", attributes, children);
	}
	public NodeHandle kbd(NodeHandle... children) {
		return element("kbd", null, children);
	}
	public NodeHandle sub(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("sub", attributes, children);
	}
	public NodeHandle sub(NodeHandle... children) {
		return element("sub", null, children);
	}
	public NodeHandle sup(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("sup", attributes, children);
	}
	public NodeHandle sup(NodeHandle... children) {
		return element("sup", null, children);
	}
	public NodeHandle i(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("i", attributes, children);
	}
	public NodeHandle i(NodeHandle... children) {
		return element("i", null, children);
	}
	public NodeHandle b(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("b", attributes, children);
	}
	public NodeHandle b(NodeHandle... children) {
		return element("b", null, children);
	}
	public NodeHandle u(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("u", attributes, children);
	}
	public NodeHandle u(NodeHandle... children) {
		return element("u", null, children);
	}
	public NodeHandle mark(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("mark", attributes, children);
	}
	public NodeHandle mark(NodeHandle... children) {
		return element("mark", null, children);
	}
	public NodeHandle span(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("span", attributes, children);
	}
	public NodeHandle span(NodeHandle... children) {
		return element("span", null, children);
	}
	public NodeHandle q(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("q", attributes, children);
	}
	public NodeHandle q(NodeHandle... children) {
		return element("q", null, children);
	}
	public NodeHandle time(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("time", attributes, children);
	}
	public NodeHandle time(NodeHandle... children) {
		return element("time", null, children);
	}
	public NodeHandle del(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("del", attributes, children);
	}
	public NodeHandle del(NodeHandle... children) {
		return element("del", null, children);
	}
	public NodeHandle ins(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("ins", attributes, children);
	}
	public NodeHandle ins(NodeHandle... children) {
		return element("ins", null, children);
	}
	public NodeHandle br(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("br", attributes, children);
	}
	public NodeHandle br(NodeHandle... children) {
		return element("br", null, children);
	}
	public NodeHandle wbr(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("wbr", attributes, children);
	}
	public NodeHandle wbr(NodeHandle... children) {
		return element("wbr", null, children);
	}
	public NodeHandle img(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("img", attributes, children);
	}
	public NodeHandle img(NodeHandle... children) {
		return element("img", null, children);
	}
	public NodeHandle iframe(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("iframe", attributes, children);
	}
	public NodeHandle iframe(NodeHandle... children) {
		return element("iframe", null, children);
	}
	public NodeHandle video(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("video", attributes, children);
	}
	public NodeHandle video(NodeHandle... children) {
		return element("video", null, children);
	}
	public NodeHandle audio(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("audio", attributes, children);
	}
	public NodeHandle audio(NodeHandle... children) {
		return element("audio", null, children);
	}
	public NodeHandle source(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("source", attributes, children);
	}
	public NodeHandle source(NodeHandle... children) {
		return element("source", null, children);
	}
	public NodeHandle picture(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("picture", attributes, children);
	}
	public NodeHandle picture(NodeHandle... children) {
		return element("picture", null, children);
	}
	public NodeHandle map(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("map", attributes, children);
	}
	public NodeHandle map(NodeHandle... children) {
		return element("map", null, children);
	}
	public NodeHandle area(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("area", attributes, children);
	}
	public NodeHandle area(NodeHandle... children) {
		return element("area", null, children);
	}
	public NodeHandle table(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("table", attributes, children);
	}
	public NodeHandle table(NodeHandle... children) {
		return element("table", null, children);
	}
	public NodeHandle caption(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("caption", attributes, children);
	}
	public NodeHandle caption(NodeHandle... children) {
		return element("caption", null, children);
	}
	public NodeHandle colgroup(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("colgroup", attributes, children);
	}
	public NodeHandle colgroup(NodeHandle... children) {
		return element("colgroup", null, children);
	}
	public NodeHandle col(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("col", attributes, children);
	}
	public NodeHandle col(NodeHandle... children) {
		return element("col", null, children);
	}
	public NodeHandle thead(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("thead", attributes, children);
	}
	public NodeHandle thead(NodeHandle... children) {
		return element("thead", null, children);
	}
	public NodeHandle tbody(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("tbody", attributes, children);
	}
	public NodeHandle tbody(NodeHandle... children) {
		return element("tbody", null, children);
	}
	public NodeHandle tfoot(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("tfoot", attributes, children);
	}
	public NodeHandle tfoot(NodeHandle... children) {
		return element("tfoot", null, children);
	}
	public NodeHandle tr(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("tr", attributes, children);
	}
	public NodeHandle tr(NodeHandle... children) {
		return element("tr", null, children);
	}
	public NodeHandle td(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("td", attributes, children);
	}
	public NodeHandle td(NodeHandle... children) {
		return element("td", null, children);
	}
	public NodeHandle th(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("th", attributes, children);
	}
	public NodeHandle th(NodeHandle... children) {
		return element("th", null, children);
	}
	public NodeHandle form(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("form", attributes, children);
	}
	public NodeHandle form(NodeHandle... children) {
		return element("form", null, children);
	}
	public NodeHandle label(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("label", attributes, children);
	}
	public NodeHandle label(NodeHandle... children) {
		return element("label", null, children);
	}
	public NodeHandle input(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("input", attributes, children);
	}
	public NodeHandle input(NodeHandle... children) {
		return element("input", null, children);
	}
	public NodeHandle button(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("button", attributes, children);
	}
	public NodeHandle button(NodeHandle... children) {
		return element("button", null, children);
	}
	public NodeHandle select(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("select", attributes, children);
	}
	public NodeHandle select(NodeHandle... children) {
		return element("select", null, children);
	}
	public NodeHandle option(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("option", attributes, children);
	}
	public NodeHandle option(NodeHandle... children) {
		return element("option", null, children);
	}
	public NodeHandle textarea(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("textarea", attributes, children);
	}
	public NodeHandle textarea(NodeHandle... children) {
		return element("textarea", null, children);
	}
	public NodeHandle fieldset(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("fieldset", attributes, children);
	}
	public NodeHandle fieldset(NodeHandle... children) {
		return element("fieldset", null, children);
	}
	public NodeHandle legend(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("legend", attributes, children);
	}
	public NodeHandle legend(NodeHandle... children) {
		return element("legend", null, children);
	}
	public NodeHandle details(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("details", attributes, children);
	}
	public NodeHandle details(NodeHandle... children) {
		return element("details", null, children);
	}
	public NodeHandle summary(List<HtmlAttribute> attributes, NodeHandle... children) {
		return element("summary", attributes, children);
	}
	public NodeHandle summary(NodeHandle... children) {
		return element("summary", null, children);
	}
}
