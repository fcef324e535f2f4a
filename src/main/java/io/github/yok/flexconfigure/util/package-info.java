/**
 * Shared utilities.
 */
package io.github.yok.flexconfigure.util;
