/**
 * Configuration model package for FlexConfigure.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: run options of the
 * configure command and the tenant connection.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}.
 * </p>
 */
package io.github.yok.flexconfigure.config;
