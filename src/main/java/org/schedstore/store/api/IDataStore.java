package org.schedstore.store.api;

import java.util.List;
import java.util.Optional;

import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.contracts.PaginatedMessages;
import org.schedstore.store.api.contracts.Process;
import org.schedstore.store.api.contracts.ProcessScheduler;
import org.schedstore.store.api.contracts.Scheduler;

/**
 * Persistence operations of the scheduler.
 * <p>
 * Every operation reports failures through the {@link StoreException} taxonomy only.
 */
public interface IDataStore extends AutoCloseable {

    /**
     * Saves a process if no process with the same id exists. Saving an existing id is a no-op.
     */
    void saveProcess(Process process, byte[] bundle) throws StoreException;

    /**
     * @throws NotFoundException if no process has this id
     */
    Process getProcess(String processId) throws StoreException;

    /**
     * Duplicate-payload guard run by {@link #saveMessage}.
     *
     * @throws MessageExistsException if {@code message} carries a payload and a stored row with
     *         the same message id already carries one
     * @throws DatabaseException if the lookup fails for any other reason
     */
    void checkExistingMessage(Message message) throws StoreException;

    /**
     * Saves a message row and, when the blob tier is enabled, its payload bytes.
     * <p>
     * Both writes complete before this method returns. If the blob write fails the relational row
     * stays committed and the failure is reported; the blob copy is restored by the backfill.
     */
    void saveMessage(Message message, byte[] bundle) throws StoreException;

    /**
     * @return the earliest-timestamp message whose message id or assignment id equals {@code id}
     * @throws NotFoundException if none matches
     */
    Message getMessage(String id) throws StoreException;

    /**
     * Returns the most recently inserted message of a process, read from the primary.
     *
     * @return the message, or empty if the process has none
     */
    Optional<Message> getLatestMessage(String processId) throws StoreException;

    /**
     * Returns one page of a process's messages ordered by timestamp ascending.
     *
     * @param processId the process
     * @param from exclusive lower timestamp bound, or {@code null}
     * @param to inclusive upper timestamp bound, or {@code null}
     * @param limit page size, or {@code null} for the default
     * @throws IntParseException if a bound is not an integer
     */
    PaginatedMessages getMessages(String processId, String from, String to, Integer limit) throws StoreException;

    void saveProcessScheduler(ProcessScheduler processScheduler) throws StoreException;

    ProcessScheduler getProcessScheduler(String processId) throws StoreException;

    void saveScheduler(Scheduler scheduler) throws StoreException;

    /**
     * Updates url and process count of a saved scheduler.
     *
     * @throws NotFoundException if the scheduler has no surrogate id or the id is unknown
     */
    void updateScheduler(Scheduler scheduler) throws StoreException;

    Scheduler getScheduler(long rowId) throws StoreException;

    Scheduler getSchedulerByUrl(String url) throws StoreException;

    List<Scheduler> getAllSchedulers() throws StoreException;

    @Override
    void close();
}
