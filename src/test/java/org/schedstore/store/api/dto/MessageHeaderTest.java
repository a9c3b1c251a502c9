package org.schedstore.store.api.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.schedstore.store.StoreTestSupport.assignment;
import static org.schedstore.store.StoreTestSupport.dataItem;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.schedstore.store.api.contracts.Message;

@Tag("unit")
class MessageHeaderTest {

    private static MessageHeader headerOf(Message m) {
        return new MessageHeader(7L, m.getProcessId(), m.getMessageId(), m.getAssignmentId(),
            m.getEpoch(), m.getNonce(), m.getTimestamp(), m.getHashChain());
    }

    @Test
    void describes_matchingMessage() {
        Message message = dataItem("p", "m-1", 100);

        assertThat(headerOf(message).describes(message)).isTrue();
    }

    @Test
    void describes_assignmentWithSameAssignmentId() {
        Message assigned = assignment("p", "m-1", "a-1", 200);

        assertThat(headerOf(assigned).describes(assigned)).isTrue();
        assertThat(headerOf(assigned).describes(dataItem("p", "m-1", 200))).isFalse();
    }

    @Test
    void describes_rejectsDifferingRowColumns() {
        Message message = dataItem("p", "m-1", 100);
        MessageHeader header = headerOf(message);

        assertThat(header.describes(message.toBuilder().nonce(message.getNonce() + 1).build())).isFalse();
        assertThat(header.describes(message.toBuilder().epoch(3).build())).isFalse();
        assertThat(header.describes(message.toBuilder().hashChain("hc-other").build())).isFalse();
        assertThat(header.describes(message.toBuilder().processId("q").build())).isFalse();
    }

    @Test
    void key_ignoresRowId() {
        Message message = dataItem("p", "m-1", 100);
        MessageHeader header = headerOf(message);

        assertThat(header.key().messageId()).isEqualTo("m-1");
        assertThat(header.key().timestamp()).isEqualTo(100L);
        assertThat(header.rowId()).isEqualTo(7L);
    }
}
