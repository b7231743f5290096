/**
 * <strong>Purpose:</strong> Logging utilities that bound config document dumps before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J; no custom metrics.
 *
 * @since 0.1.0
 */
package org.flyte.flytekit.logging;
