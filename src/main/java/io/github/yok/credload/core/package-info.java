/**
 * Import pipeline: line parsing, batching, run context, and the driver that ties them to the store.
 */
package io.github.yok.credload.core;
