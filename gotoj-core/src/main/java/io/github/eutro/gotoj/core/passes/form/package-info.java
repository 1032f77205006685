/**
 * Passes that lower a program towards the form the verifier accepts.
 * <p>
 * Some depend on others having run first, which they check by the
 * {@link io.github.eutro.gotoj.core.ext.CommonExts exts} left on the table.
 */
package io.github.eutro.gotoj.core.passes.form;
