package org.schedstore.store.api.contracts;

import java.util.List;

/**
 * One page of a process's messages, ordered by timestamp ascending.
 *
 * @param messages the page content
 * @param hasNextPage whether more messages follow the last one in this page
 */
public record PaginatedMessages(List<Message> messages, boolean hasNextPage) {

    public PaginatedMessages {
        messages = List.copyOf(messages);
    }

    public static PaginatedMessages fromMessages(List<Message> messages, boolean hasNextPage) {
        return new PaginatedMessages(messages, hasNextPage);
    }

    /**
     * @return the timestamp of the last message as a cursor for the next call, or {@code null} if empty
     */
    public String lastCursor() {
        if (messages.isEmpty()) {
            return null;
        }
        return Long.toString(messages.get(messages.size() - 1).getTimestamp());
    }
}
