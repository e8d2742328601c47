/**
 * Configuration model package for CredLoad.
 *
 * <p>
 * Defines classes bound from {@code application.yml} and the environment: the destination
 * connection and the per-mode import profiles.
 * </p>
 */
package io.github.yok.credload.config;
