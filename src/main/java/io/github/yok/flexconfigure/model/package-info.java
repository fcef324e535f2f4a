/**
 * Immutable model of configuration sources and the mutable run statistics.
 *
 * <p>
 * Model instances are produced by {@code parser} with all defaults applied and are not modified
 * afterwards.
 * </p>
 */
package io.github.yok.flexconfigure.model;
