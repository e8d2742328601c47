/**
 * Utility package for CredLoad.
 *
 * <p>
 * Provides stateless helpers: fatal error reporting, the ASCII85 codec, logical date parsing, and
 * connection string normalization.
 * </p>
 */
package io.github.yok.credload.util;
