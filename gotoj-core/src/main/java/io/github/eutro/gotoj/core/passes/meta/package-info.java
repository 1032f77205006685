/**
 * Passes that check a program without changing it.
 */
package io.github.eutro.gotoj.core.passes.meta;
