package org.schedstore.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.api.IDataStore;
import org.schedstore.store.api.IMessageDecoder;
import org.schedstore.store.api.IntParseException;
import org.schedstore.store.api.MessageExistsException;
import org.schedstore.store.api.NotFoundException;
import org.schedstore.store.api.StoreException;
import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.contracts.PaginatedMessages;
import org.schedstore.store.api.contracts.Process;
import org.schedstore.store.api.contracts.ProcessScheduler;
import org.schedstore.store.api.contracts.Scheduler;
import org.schedstore.store.api.dto.MessageHeader;
import org.schedstore.store.api.dto.StoredMessage;
import org.schedstore.store.api.storage.IBlobStore;
import org.schedstore.store.api.storage.MessageKey;
import org.schedstore.store.codec.JsonDocumentDecoder;
import org.schedstore.store.config.StoreConfig;
import org.schedstore.store.resources.database.ConnectionPools;
import org.schedstore.store.resources.database.RelationalMetadataStore;
import org.schedstore.store.resources.storage.RocksDbBlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store orchestrator: the single entry point over the relational tier and the optional blob tier.
 * <p>
 * <strong>Writes</strong> are write-through: {@link #saveMessage} commits the relational row and,
 * when the blob tier is enabled, stores the payload bytes before returning. There is no
 * transaction spanning both tiers. If the blob write fails the relational row stays committed,
 * the failure is reported to the caller, and the missing blob is restored later by
 * {@link org.schedstore.store.migration.BackfillMigrator}.
 * <p>
 * <strong>Paginated reads</strong> with the blob tier enabled fetch only the lightweight columns
 * from the relational tier, bulk-read the payloads from the blob tier and fall back to a full
 * relational row for every key the blob tier does not have.
 */
public class HybridDataStore implements IDataStore {

    private static final Logger log = LoggerFactory.getLogger(HybridDataStore.class);

    private final RelationalMetadataStore relational;
    private final IBlobStore blobStore;
    private final IMessageDecoder decoder;
    private final int defaultPageLimit;

    /**
     * @param relational relational tier
     * @param blobStore blob tier, or {@code null} when the disk tier is disabled
     * @param decoder rebuilds messages from blob-tier bytes
     * @param defaultPageLimit page size used when a caller passes no limit
     */
    public HybridDataStore(RelationalMetadataStore relational, IBlobStore blobStore,
                           IMessageDecoder decoder, int defaultPageLimit) {
        this.relational = Objects.requireNonNull(relational, "relational");
        this.blobStore = blobStore;
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.defaultPageLimit = defaultPageLimit;
    }

    /**
     * Opens both tiers as configured. The blob tier is only opened when {@code useDisk} is set.
     */
    public static HybridDataStore open(StoreConfig config) throws StoreException {
        return open(config, new JsonDocumentDecoder());
    }

    public static HybridDataStore open(StoreConfig config, IMessageDecoder decoder) throws StoreException {
        ConnectionPools pools = new ConnectionPools(config);
        RelationalMetadataStore relational = new RelationalMetadataStore(pools);
        IBlobStore blobs = null;
        if (config.useDisk()) {
            try {
                blobs = RocksDbBlobStore.fromConfig(config);
            } catch (DatabaseException e) {
                relational.close();
                throw e;
            }
        }
        log.info("Data store opened (primary={}, replica={}, blobTier={})",
            config.databaseUrl(), config.databaseReadUrl(), blobs != null ? config.dataDirectory() : "disabled");
        return new HybridDataStore(relational, blobs, decoder, config.defaultPageLimit());
    }

    /**
     * @return the blob tier, or empty if the disk tier is disabled
     */
    public Optional<IBlobStore> blobTier() {
        return Optional.ofNullable(blobStore);
    }

    /**
     * Creates missing tables and indexes. Meant to run once at startup.
     */
    public String runMigrations() throws StoreException {
        return relational.runMigrations();
    }

    // ========================================================================
    // Processes
    // ========================================================================

    @Override
    public void saveProcess(Process process, byte[] bundle) throws StoreException {
        relational.insertProcessIfAbsent(process, bundle);
    }

    @Override
    public Process getProcess(String processId) throws StoreException {
        return relational.findProcess(processId)
            .orElseThrow(() -> new NotFoundException("Process not found"));
    }

    // ========================================================================
    // Messages
    // ========================================================================

    @Override
    public void checkExistingMessage(Message message) throws StoreException {
        if (!message.hasPayload()) {
            return;
        }
        Message existing;
        try {
            existing = getMessage(message.getMessageId());
        } catch (NotFoundException e) {
            return;
        } catch (StoreException e) {
            throw new DatabaseException("Error checking message", e);
        }
        if (existing.hasPayload()) {
            throw new MessageExistsException("Message already exists");
        }
    }

    @Override
    public void saveMessage(Message message, byte[] bundle) throws StoreException {
        checkExistingMessage(message);

        byte[] bytes = bundle != null ? bundle : new byte[0];
        int rows = relational.insertMessage(message, bytes);
        if (rows == 0) {
            throw new DatabaseException("Error saving message");
        }

        if (blobStore != null) {
            MessageKey key = keyOf(message);
            try {
                blobStore.saveBinary(key, bytes);
            } catch (DatabaseException e) {
                log.warn("Message {} committed to the relational tier but the blob write failed; "
                    + "the blob copy will be restored by the next sync: {}", message.getMessageId(), e.getMessage());
                throw e;
            }
        }
    }

    static MessageKey keyOf(Message message) {
        return new MessageKey(message.getMessageId(), message.getAssignmentId(),
            message.getProcessId(), message.getTimestamp());
    }

    @Override
    public Message getMessage(String id) throws StoreException {
        return relational.findEarliestMessage(id)
            .orElseThrow(() -> new NotFoundException("Message not found"));
    }

    @Override
    public Optional<Message> getLatestMessage(String processId) throws StoreException {
        return relational.findLatestMessage(processId);
    }

    @Override
    public PaginatedMessages getMessages(String processId, String from, String to, Integer limit)
            throws StoreException {
        Long fromTimestamp = parseCursor(from);
        Long toTimestamp = parseCursor(to);
        int pageSize = limit != null ? Math.max(limit, 0) : defaultPageLimit;
        // One extra row tells whether another page follows; long so MAX_VALUE does not wrap
        long fetchLimit = (long) pageSize + 1;

        if (blobStore == null) {
            List<Message> rows = relational.findMessages(processId, fromTimestamp, toTimestamp, fetchLimit);
            boolean hasNextPage = rows.size() > pageSize;
            List<Message> page = hasNextPage ? rows.subList(0, pageSize) : rows;
            return PaginatedMessages.fromMessages(page, hasNextPage);
        }

        List<MessageHeader> headers = relational.findMessageHeaders(processId, fromTimestamp, toTimestamp, fetchLimit);
        boolean hasNextPage = headers.size() > pageSize;
        List<MessageHeader> page = hasNextPage ? headers.subList(0, pageSize) : headers;

        List<MessageKey> keys = new ArrayList<>(page.size());
        for (MessageHeader header : page) {
            keys.add(header.key());
        }
        Map<MessageKey, byte[]> binaries = blobStore.readBinaries(keys);

        List<Message> messages = new ArrayList<>(page.size());
        for (MessageHeader header : page) {
            byte[] bytes = binaries.get(header.key());
            if (bytes != null) {
                Message decoded = decoder.decode(bytes);
                if (header.describes(decoded)) {
                    messages.add(decoded);
                    continue;
                }
                log.warn("Stale blob for row {} ({}), falling back to relational row", header.rowId(), header.key());
            } else {
                log.debug("Blob tier miss for {}, falling back to relational row", header.key());
            }
            messages.add(relational.findEarliestMessage(header.messageId(), header.assignmentId())
                .orElseThrow(() -> new NotFoundException("Message not found")));
        }
        return PaginatedMessages.fromMessages(messages, hasNextPage);
    }

    private static Long parseCursor(String cursor) throws IntParseException {
        if (cursor == null) {
            return null;
        }
        try {
            return Long.parseLong(cursor.trim());
        } catch (NumberFormatException e) {
            throw new IntParseException("data store int error: " + e.getMessage(), e);
        }
    }

    /**
     * @return total number of message rows
     */
    public long getMessageCount() throws StoreException {
        return relational.countMessages();
    }

    /**
     * Rows {@code [from, to)} of the whole messages table in timestamp order.
     *
     * @param to exclusive end offset, or {@code null} for the end of the table
     */
    public List<StoredMessage> getAllMessages(long from, Long to) throws StoreException {
        Long limit = to != null ? Math.max(to - from, 0L) : null;
        return relational.findAllMessages(from, limit);
    }

    /**
     * @param offset 0 for the newest row, 1 for the one before it, ...
     */
    public Optional<StoredMessage> getMessageByOffsetFromEnd(long offset) throws StoreException {
        return relational.findMessageByOffsetFromEnd(offset);
    }

    // ========================================================================
    // Schedulers
    // ========================================================================

    @Override
    public void saveProcessScheduler(ProcessScheduler processScheduler) throws StoreException {
        relational.insertProcessSchedulerIfAbsent(processScheduler);
    }

    @Override
    public ProcessScheduler getProcessScheduler(String processId) throws StoreException {
        return relational.findProcessScheduler(processId)
            .orElseThrow(() -> new NotFoundException("Process scheduler not found"));
    }

    @Override
    public void saveScheduler(Scheduler scheduler) throws StoreException {
        relational.insertSchedulerIfAbsent(scheduler);
    }

    @Override
    public void updateScheduler(Scheduler scheduler) throws StoreException {
        if (scheduler.rowId() == null) {
            throw new NotFoundException("Scheduler not found: no row id");
        }
        int rows = relational.updateScheduler(scheduler.rowId(), scheduler.url(), scheduler.processCount());
        if (rows == 0) {
            throw new NotFoundException("Scheduler not found");
        }
    }

    @Override
    public Scheduler getScheduler(long rowId) throws StoreException {
        return relational.findScheduler(rowId)
            .orElseThrow(() -> new NotFoundException("Scheduler not found"));
    }

    @Override
    public Scheduler getSchedulerByUrl(String url) throws StoreException {
        return relational.findSchedulerByUrl(url)
            .orElseThrow(() -> new NotFoundException("Scheduler not found"));
    }

    @Override
    public List<Scheduler> getAllSchedulers() throws StoreException {
        return relational.findAllSchedulers();
    }

    @Override
    public void close() {
        if (blobStore != null) {
            blobStore.close();
        }
        relational.close();
    }
}
