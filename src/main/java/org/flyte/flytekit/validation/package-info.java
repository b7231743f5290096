/**
 * Argument validation helpers shared by the configuration layer.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> No logging; failures surface as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package org.flyte.flytekit.validation;
