/**
 * {@link io.github.eutro.gotoj.core.passes.IRPass Passes} over symbol tables, and the
 * {@link io.github.eutro.gotoj.core.passes.PassRegistry registry} that names them
 * for use in a {@link io.github.eutro.gotoj.core.passes.Pipeline pipeline}.
 */
package io.github.eutro.gotoj.core.passes;
