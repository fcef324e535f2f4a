/**
 * Parsing of declarative configuration sources.
 *
 * <p>
 * Parsers read YAML or JSON files into {@link io.github.yok.flexconfigure.parser.RawConfigureFile};
 * {@link io.github.yok.flexconfigure.parser.ConfigDefaults} then produces the immutable model.
 * </p>
 */
package io.github.yok.flexconfigure.parser;
