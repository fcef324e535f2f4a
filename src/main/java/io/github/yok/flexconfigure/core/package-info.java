/**
 * Configure-and-deploy workflow package.
 *
 * <p>
 * Loads and merges configuration sources, filters packages and artifacts, updates artifact
 * parameters (batched or individually, with fallback), and deploys configured artifacts with
 * per-package bounded parallelism and status polling.
 * </p>
 *
 * <p>
 * Remote access is delegated to the capability interfaces in {@code remote}.
 * </p>
 */
package io.github.yok.flexconfigure.core;
