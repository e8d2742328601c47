/**
 * Root package of CredLoad.
 *
 * <p>
 * Provides a CLI that bulk-loads breached-credential corpora ({@code sha1:count} and
 * {@code sha1:plaintext} files) into PostgreSQL with multi-row upserts and records every import in
 * a ledger table.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.credload.config}: configuration models</li>
 * <li>{@code io.github.yok.credload.core}: streaming import pipeline</li>
 * <li>{@code io.github.yok.credload.codec}: identifier encodings</li>
 * <li>{@code io.github.yok.credload.db}: upsert, ledger, and schema access over JDBC</li>
 * </ul>
 */
package io.github.yok.credload;
