/**
 * Filesystem discovery: filters, scan budget and the lazy walk that yields candidate files.
 */
package io.taskmaster.scan;
