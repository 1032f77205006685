/**
 * The typed model of goto programs: {@link io.github.eutro.gotoj.core.model.Type types},
 * {@link io.github.eutro.gotoj.core.model.Expr expressions}, {@link io.github.eutro.gotoj.core.model.Stmt statements},
 * {@link io.github.eutro.gotoj.core.model.Location locations} and {@link io.github.eutro.gotoj.core.model.Symbol symbols},
 * collected in a {@link io.github.eutro.gotoj.core.model.SymbolTable}.
 * <p>
 * Every part of the model is immutable and compares structurally. Each kind of node is a
 * closed set of variants with a visitor interface, so that code which must handle every
 * variant fails to compile when a variant is added.
 */
package io.github.eutro.gotoj.core.model;
