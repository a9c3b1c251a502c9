package org.schedstore.store.codec;

import java.nio.charset.StandardCharsets;

import org.schedstore.store.api.IMessageDecoder;
import org.schedstore.store.api.JsonException;
import org.schedstore.store.api.contracts.Message;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Default {@link IMessageDecoder}: the bundle is the message document serialized as UTF-8 JSON,
 * i.e. the bytes of {@code message.toDocument().toString()}.
 */
public class JsonDocumentDecoder implements IMessageDecoder {

    @Override
    public Message decode(byte[] bundle) throws JsonException {
        if (bundle == null || bundle.length == 0) {
            throw new JsonException("data store json error: empty bundle");
        }
        JsonElement element;
        try {
            element = JsonParser.parseString(new String(bundle, StandardCharsets.UTF_8));
        } catch (JsonParseException e) {
            throw new JsonException("data store json error: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new JsonException("data store json error: bundle is not a JSON object");
        }
        return Message.fromDocument(element.getAsJsonObject(), bundle);
    }

    /**
     * Encodes a message the way {@link #decode(byte[])} expects it.
     */
    public static byte[] encode(Message message) {
        return message.toDocument().toString().getBytes(StandardCharsets.UTF_8);
    }
}
