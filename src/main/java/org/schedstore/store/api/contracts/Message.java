package org.schedstore.store.api.contracts;

import java.util.Arrays;
import java.util.Objects;

import org.schedstore.store.api.JsonException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A message of a process: either a data item carrying a payload or an assignment that only
 * references one.
 * <p>
 * The indexed scalar fields are first-class; {@code data} is the opaque payload document and
 * is {@code null} for assignments. {@code bundle} holds the raw bytes the message was stored
 * with and is only populated on reads.
 */
public final class Message {

    static final String FIELD_PROCESS_ID = "process_id";
    static final String FIELD_MESSAGE_ID = "message_id";
    static final String FIELD_ASSIGNMENT_ID = "assignment_id";
    static final String FIELD_EPOCH = "epoch";
    static final String FIELD_NONCE = "nonce";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_HASH_CHAIN = "hash_chain";
    static final String FIELD_DATA = "data";

    private final String processId;
    private final String messageId;
    private final String assignmentId;
    private final int epoch;
    private final int nonce;
    private final long timestamp;
    private final String hashChain;
    private final JsonElement data;
    private final byte[] bundle;

    private Message(Builder b) {
        this.processId = Objects.requireNonNull(b.processId, "processId");
        this.messageId = Objects.requireNonNull(b.messageId, "messageId");
        this.assignmentId = b.assignmentId;
        this.epoch = b.epoch;
        this.nonce = b.nonce;
        this.timestamp = b.timestamp;
        this.hashChain = Objects.requireNonNull(b.hashChain, "hashChain");
        this.data = b.data != null ? b.data.deepCopy() : null;
        this.bundle = b.bundle != null ? b.bundle.clone() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuilds a message from its stored document plus the raw bytes it was stored with.
     *
     * @param document the stored {@code message_data}
     * @param bundle the stored payload bytes, may be {@code null}
     * @return the message
     * @throws JsonException if an indexed field is missing or has the wrong type
     */
    public static Message fromDocument(JsonObject document, byte[] bundle) throws JsonException {
        try {
            Builder b = builder()
                .processId(requireString(document, FIELD_PROCESS_ID))
                .messageId(requireString(document, FIELD_MESSAGE_ID))
                .epoch(requireField(document, FIELD_EPOCH).getAsInt())
                .nonce(requireField(document, FIELD_NONCE).getAsInt())
                .timestamp(requireField(document, FIELD_TIMESTAMP).getAsLong())
                .hashChain(requireString(document, FIELD_HASH_CHAIN))
                .bundle(bundle);
            JsonElement assignment = document.get(FIELD_ASSIGNMENT_ID);
            if (assignment != null && !assignment.isJsonNull()) {
                b.assignmentId(assignment.getAsString());
            }
            JsonElement body = document.get(FIELD_DATA);
            if (body != null && !body.isJsonNull()) {
                b.data(body);
            }
            return b.build();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new JsonException("data store json error: " + e.getMessage(), e);
        }
    }

    private static JsonElement requireField(JsonObject document, String name) throws JsonException {
        JsonElement value = document.get(name);
        if (value == null || value.isJsonNull()) {
            throw new JsonException("data store json error: message document has no " + name);
        }
        return value;
    }

    private static String requireString(JsonObject document, String name) throws JsonException {
        return requireField(document, name).getAsString();
    }

    /**
     * Serializes the message into the opaque document stored in {@code message_data}.
     *
     * @return a fresh document
     */
    public JsonObject toDocument() {
        JsonObject doc = new JsonObject();
        doc.addProperty(FIELD_PROCESS_ID, processId);
        doc.addProperty(FIELD_MESSAGE_ID, messageId);
        if (assignmentId != null) {
            doc.addProperty(FIELD_ASSIGNMENT_ID, assignmentId);
        }
        doc.addProperty(FIELD_EPOCH, epoch);
        doc.addProperty(FIELD_NONCE, nonce);
        doc.addProperty(FIELD_TIMESTAMP, timestamp);
        doc.addProperty(FIELD_HASH_CHAIN, hashChain);
        if (data != null) {
            doc.add(FIELD_DATA, data.deepCopy());
        }
        return doc;
    }

    /**
     * @return {@code true} if this is a data item, {@code false} for an assignment
     */
    public boolean hasPayload() {
        return data != null;
    }

    public String getProcessId() {
        return processId;
    }

    public String getMessageId() {
        return messageId;
    }

    /**
     * @return the assignment id, or {@code null} if this row is itself canonical
     */
    public String getAssignmentId() {
        return assignmentId;
    }

    public int getEpoch() {
        return epoch;
    }

    public int getNonce() {
        return nonce;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getHashChain() {
        return hashChain;
    }

    public JsonElement getData() {
        return data != null ? data.deepCopy() : null;
    }

    public byte[] getBundle() {
        return bundle != null ? bundle.clone() : null;
    }

    /**
     * @return a copy of this message carrying the given bytes
     */
    public Message withBundle(byte[] newBundle) {
        return toBuilder().bundle(newBundle).build();
    }

    public Builder toBuilder() {
        return builder()
            .processId(processId)
            .messageId(messageId)
            .assignmentId(assignmentId)
            .epoch(epoch)
            .nonce(nonce)
            .timestamp(timestamp)
            .hashChain(hashChain)
            .data(data)
            .bundle(bundle);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message other = (Message) o;
        return epoch == other.epoch
            && nonce == other.nonce
            && timestamp == other.timestamp
            && processId.equals(other.processId)
            && messageId.equals(other.messageId)
            && Objects.equals(assignmentId, other.assignmentId)
            && hashChain.equals(other.hashChain)
            && Objects.equals(data, other.data)
            && Arrays.equals(bundle, other.bundle);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(processId, messageId, assignmentId, epoch, nonce, timestamp, hashChain, data);
        return 31 * result + Arrays.hashCode(bundle);
    }

    @Override
    public String toString() {
        return "Message{process=" + processId + ", id=" + messageId
            + (assignmentId != null ? ", assignment=" + assignmentId : "")
            + ", ts=" + timestamp + ", payload=" + hasPayload() + "}";
    }

    public static final class Builder {
        private String processId;
        private String messageId;
        private String assignmentId;
        private int epoch;
        private int nonce;
        private long timestamp;
        private String hashChain;
        private JsonElement data;
        private byte[] bundle;

        private Builder() {
        }

        public Builder processId(String processId) {
            this.processId = processId;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder assignmentId(String assignmentId) {
            this.assignmentId = assignmentId;
            return this;
        }

        public Builder epoch(int epoch) {
            this.epoch = epoch;
            return this;
        }

        public Builder nonce(int nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder hashChain(String hashChain) {
            this.hashChain = hashChain;
            return this;
        }

        public Builder data(JsonElement data) {
            this.data = data;
            return this;
        }

        public Builder bundle(byte[] bundle) {
            this.bundle = bundle;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
