/**
 * Reading and writing serialized {@link io.github.eutro.gotoj.core.irep.IrepSymbolTable symbol tables},
 * in the binary and JSON {@link io.github.eutro.gotoj.core.codec.GotoFormat formats}.
 */
package io.github.eutro.gotoj.core.codec;
