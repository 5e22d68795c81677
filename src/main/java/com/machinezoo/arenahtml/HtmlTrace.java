// Part of ArenaHTML: https://arenahtml.machinezoo.com
package com.machinezoo.arenahtml;

import java.util.*;
import java.util.stream.*;
import org.slf4j.*;
import com.machinezoo.arenahtml.schema.*;

/**
 * Debugging aid that records where every element was constructed.
 * When enabled, elements built via {@link HtmlBuilder} get {@code title} attribute listing the construction call site,
 * which shows up as a tooltip in the browser.
 */
public class HtmlTrace {
	private static final Logger logger = LoggerFactory.getLogger(HtmlTrace.class);
	public static final String PROPERTY = "arenahtml.trace";
	static final String PREFIX = "Generated at:\n";
	private static final int DEPTH = 8;
	private HtmlTrace() {
	}
	/*
	 * Explicit setting overrides system property, which in turn overrides run mode default.
	 */
	private static volatile Boolean enabled;
	public static boolean enabled() {
		Boolean explicit = enabled;
		if (explicit != null)
			return explicit;
		String property = System.getProperty(PROPERTY);
		if (property != null)
			return Boolean.parseBoolean(property);
		return HtmlRunMode.get() == HtmlRunMode.DEVELOPMENT;
	}
	public static void enable(boolean enabled) {
		HtmlTrace.enabled = enabled;
	}
	/*
	 * Reverts to configuration via system property and run mode.
	 */
	public static void reset() {
		enabled = null;
	}
	static List<HtmlAttribute> annotate(HtmlSchema schema, TagMeta tag, List<HtmlAttribute> attributes) {
		if (!enabled())
			return attributes;
		/*
		 * Tracing must never make construction fail.
		 */
		if (!schema.permitsAttribute(tag, "title"))
			return attributes;
		for (HtmlAttribute attribute : attributes) {
			if (attribute.name().equals("title")) {
				logger.warn("Cannot trace construction of {}, because it already has title attribute.", tag);
				return attributes;
			}
		}
		List<HtmlAttribute> annotated = new ArrayList<>(attributes);
		annotated.add(HtmlAttribute.of("title", PREFIX + callsite()));
		return annotated;
	}
	private static String callsite() {
		return StackWalker.getInstance().walk(frames -> frames
			.filter(f -> !f.getClassName().equals(HtmlTrace.class.getName()) && !f.getClassName().equals(HtmlBuilder.class.getName()))
			.limit(DEPTH)
			.map(f -> f.getClassName() + "." + f.getMethodName() + "(" + f.getFileName() + ":" + f.getLineNumber() + ")")
			.collect(Collectors.joining("\n")));
	}
}
