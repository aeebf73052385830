/**
 * Event bus: bounded in-memory hand-off from stages to a single batching writer.
 */
package io.taskmaster.events;
