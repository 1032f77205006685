/**
 * Facts that passes record on a {@link io.github.eutro.gotoj.core.model.SymbolTable} for
 * the passes after them, such as {@link io.github.eutro.gotoj.core.ext.CommonExts#LOWERED}.
 * They are carried from a pass's input table to its output and are never serialized.
 */
package io.github.eutro.gotoj.core.ext;
