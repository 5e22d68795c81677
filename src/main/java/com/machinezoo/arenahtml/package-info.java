// Part of ArenaHTML: https://arenahtml.machinezoo.com
/**
 * Arena-allocated HTML trees.
 * Nodes are allocated in {@link com.machinezoo.arenahtml.HtmlArena} and referenced by {@link com.machinezoo.arenahtml.NodeHandle}.
 * Trees are built with {@link com.machinezoo.arenahtml.HtmlBuilder}, rewritten by {@link com.machinezoo.arenahtml.HtmlTransform},
 * and rendered by {@link com.machinezoo.arenahtml.HtmlSerializer}.
 * Arenas are recycled via {@link com.machinezoo.arenahtml.ArenaPool}.
 */
package com.machinezoo.arenahtml;
