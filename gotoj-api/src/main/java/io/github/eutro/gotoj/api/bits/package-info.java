/**
 * {@link io.github.eutro.gotoj.api.bits.Bit Bits} that can be added to a compiler.
 */
package io.github.eutro.gotoj.api.bits;
