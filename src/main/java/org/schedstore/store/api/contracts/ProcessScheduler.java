package org.schedstore.store.api.contracts;

/**
 * Binding of a process to the scheduler that owns it. Written once, never updated.
 *
 * @param rowId surrogate id, {@code null} before the binding is saved
 * @param processId unique process id
 * @param schedulerRowId surrogate id of the owning {@link Scheduler}
 */
public record ProcessScheduler(Long rowId, String processId, long schedulerRowId) {
}
