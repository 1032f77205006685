/**
 * The untyped tree representation of goto programs, as the verifier reads them.
 * <p>
 * Typed programs are converted to and from this representation by
 * {@link io.github.eutro.gotoj.core.passes.convert the conversion passes},
 * and it is serialized by {@link io.github.eutro.gotoj.core.codec the codecs}.
 */
package io.github.eutro.gotoj.core.irep;
