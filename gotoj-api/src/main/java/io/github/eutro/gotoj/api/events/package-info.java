/**
 * Events that occur during a compilation.
 * <p>
 * These can be used to configure the pipeline, to inspect the program between
 * passes, to redirect the output, and the like.
 * <p>
 * The API revolves around {@link io.github.eutro.gotoj.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.gotoj.api.events;
