/**
 * Content identity: hashing with the manifest fast path, stale-record refresh and exact duplicate grouping.
 */
package io.taskmaster.identity;
