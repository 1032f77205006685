/**
 * A configurable API over the lower-level core Gotoj API.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.gotoj.api.GotoCompiler},
 * to which symbol tables can be submitted for compilation.
 * <p>
 * The compiler can be configured using the {@link io.github.eutro.gotoj.api.events
 * events API}.
 */
package io.github.eutro.gotoj.api;
