package io.github.eutro.gotoj.api.events;

import io.github.eutro.gotoj.api.GotoCompiler;

/**
 * An event fired on the {@link GotoCompiler compiler} itself.
 */
public interface CompilerEvent {
}
