/**
 * Executor factories for pipeline worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the bounded analysis pool.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return managed executors.</p>
 */
package ca.nrc.ami3.infrastructure.exec;
