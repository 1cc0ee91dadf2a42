package com.hyperhook.backend.exchange.hyperliquid;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * MessagePack encoding of exchange actions. Map iteration order is significant:
 * callers build actions with {@link java.util.LinkedHashMap} in the exchange's field order.
 */
final class ActionPacker {

    private ActionPacker() {
    }

    static byte[] pack(Object action) {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            write(packer, action);
            return packer.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to msgpack action", e);
        }
    }

    private static void write(MessagePacker packer, Object value) throws IOException {
        if (value == null) {
            packer.packNil();
        } else if (value instanceof Map<?, ?> map) {
            packer.packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                packer.packString(String.valueOf(entry.getKey()));
                write(packer, entry.getValue());
            }
        } else if (value instanceof List<?> list) {
            packer.packArrayHeader(list.size());
            for (Object item : list) {
                write(packer, item);
            }
        } else if (value instanceof String text) {
            packer.packString(text);
        } else if (value instanceof Boolean flag) {
            packer.packBoolean(flag);
        } else if (value instanceof Integer || value instanceof Long) {
            packer.packLong(((Number) value).longValue());
        } else {
            throw new IllegalArgumentException("Unsupported action value type: " + value.getClass().getName());
        }
    }
}
