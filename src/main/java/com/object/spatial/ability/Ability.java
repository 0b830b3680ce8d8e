package com.object.spatial.ability;

import com.object.spatial.walker.WalkerContext;

/**
 * Handler bound to an element archetype (or any element) and a phase.
 *
 * <p>The body runs on the thread driving the walker, with {@code ctx.here()} bound to
 * the element being entered or exited. Any exception aborts the walker.</p>
 */
@FunctionalInterface
public interface Ability {

    void execute(WalkerContext ctx) throws Exception;
}
