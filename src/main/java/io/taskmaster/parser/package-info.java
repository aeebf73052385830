/**
 * Format parsers behind the {@link io.taskmaster.parser.Parser} contract and their ordered registry.
 */
package io.taskmaster.parser;
