/**
 * Passes that convert symbol tables between the typed model and ireps.
 * <p>
 * Unlike most passes, these only read their input.
 */
package io.github.eutro.gotoj.core.passes.convert;
