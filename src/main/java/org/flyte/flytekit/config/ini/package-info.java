/**
 * Legacy INI config file model and parser.
 * <p><strong>Concurrency:</strong> Parsed documents are immutable and safe to share.
 * <p><strong>Observability:</strong> Malformed lines are logged at WARN through SLF4J and skipped.
 *
 * @since 0.1.0
 */
package org.flyte.flytekit.config.ini;
