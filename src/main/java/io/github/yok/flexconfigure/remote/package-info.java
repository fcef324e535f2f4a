/**
 * Capabilities of the remote tenant consumed by the configure engine.
 *
 * <p>
 * The engine in {@code core} depends on these interfaces only. {@code remote.http} provides the
 * HTTP implementation used by the CLI.
 * </p>
 */
package io.github.yok.flexconfigure.remote;
