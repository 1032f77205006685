package io.github.eutro.gotoj.api.bits;

import io.github.eutro.gotoj.api.GotoCompiler;

/**
 * A reusable piece of behaviour that hooks into a {@link GotoCompiler}'s events.
 *
 * @param <R> The handle returned once attached, or {@link Void}.
 * @see GotoCompiler#add(Bit)
 */
@FunctionalInterface
public interface Bit<R> {
    R addTo(GotoCompiler cc);
}
