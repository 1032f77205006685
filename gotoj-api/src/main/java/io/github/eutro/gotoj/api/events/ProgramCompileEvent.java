package io.github.eutro.gotoj.api.events;

import io.github.eutro.gotoj.api.ProgramCompilation;

/**
 * An event fired during the compilation of a single program.
 *
 * @see ProgramCompilation
 */
public interface ProgramCompileEvent {
}
