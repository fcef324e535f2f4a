/**
 * Command-line tool that applies declared configuration parameters to integration artifacts and
 * deploys them.
 */
package io.github.yok.flexconfigure;
