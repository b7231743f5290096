/**
 * Layered settings resolution: environment variables, then a legacy INI file or a YAML file.
 * <p><strong>Role:</strong> Callers declare {@link org.flyte.flytekit.config.ConfigEntry} constants once and
 * resolve them against the file found by {@link org.flyte.flytekit.config.ConfigFileLocator}.
 * <p><strong>Concurrency:</strong> Entries and loaded files are immutable; safe to share.
 * <p><strong>Errors:</strong> Missing or malformed user data resolves to empty; only a reserved section
 * or an unsupported descriptor fails hard.
 *
 * @since 0.1.0
 */
package org.flyte.flytekit.config;
