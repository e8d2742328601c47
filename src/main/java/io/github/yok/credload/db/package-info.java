/**
 * JDBC access to the destination: connection pool, schema bootstrap, batch upserts, and the import
 * ledger. PostgreSQL syntax ({@code ON CONFLICT}) is assumed.
 */
package io.github.yok.credload.db;
