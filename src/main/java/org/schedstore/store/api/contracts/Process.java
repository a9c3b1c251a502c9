package org.schedstore.store.api.contracts;

import java.util.Objects;

import org.schedstore.store.api.JsonException;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A long-lived process as seen by the store.
 * <p>
 * The store only reads {@code process_id}; the rest of the document is opaque and is written
 * to and read back from {@code processes.process_data} verbatim.
 */
public final class Process {

    static final String FIELD_PROCESS_ID = "process_id";

    private final String processId;
    private final JsonObject document;

    private Process(String processId, JsonObject document) {
        this.processId = processId;
        this.document = document;
    }

    /**
     * Creates a process whose document is {@code body} with {@code process_id} set.
     *
     * @param processId unique process id
     * @param body opaque process fields, may be {@code null}
     * @return the process
     */
    public static Process of(String processId, JsonObject body) {
        Objects.requireNonNull(processId, "processId");
        JsonObject doc = body != null ? body.deepCopy() : new JsonObject();
        doc.addProperty(FIELD_PROCESS_ID, processId);
        return new Process(processId, doc);
    }

    /**
     * Rebuilds a process from its stored document.
     *
     * @param document the stored {@code process_data}
     * @return the process
     * @throws JsonException if the document has no string {@code process_id}
     */
    public static Process fromDocument(JsonObject document) throws JsonException {
        JsonElement id = document.get(FIELD_PROCESS_ID);
        if (id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isString()) {
            throw new JsonException("data store json error: process document has no process_id");
        }
        return new Process(id.getAsString(), document.deepCopy());
    }

    public String getProcessId() {
        return processId;
    }

    /**
     * @return a copy of the opaque document
     */
    public JsonObject toDocument() {
        return document.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Process)) {
            return false;
        }
        Process other = (Process) o;
        return processId.equals(other.processId) && document.equals(other.document);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processId, document);
    }

    @Override
    public String toString() {
        return "Process{" + processId + "}";
    }
}
