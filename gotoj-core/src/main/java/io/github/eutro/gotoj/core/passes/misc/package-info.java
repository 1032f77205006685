/**
 * Passes that don't fit anywhere else.
 */
package io.github.eutro.gotoj.core.passes.misc;
