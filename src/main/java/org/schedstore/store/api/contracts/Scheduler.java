package org.schedstore.store.api.contracts;

/**
 * A remote scheduler that owns processes.
 *
 * @param rowId surrogate id, {@code null} before the scheduler is saved
 * @param url unique scheduler url
 * @param processCount number of processes currently assigned to it
 */
public record Scheduler(Long rowId, String url, int processCount) {

    public Scheduler withProcessCount(int newCount) {
        return new Scheduler(rowId, url, newCount);
    }
}
