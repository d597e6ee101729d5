package com.deerbot.util;

import com.deerbot.server.ai.snapshot.ChainSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip-compressed JSON form of a {@link ChainSnapshot}.
 */
public class SnapshotCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static byte[] toBytes(ChainSnapshot snapshot) throws IOException {
        if (snapshot == null) {
            return null;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = new GZIPOutputStream(buffer)) {
            MAPPER.writeValue(out, snapshot);
        }
        return buffer.toByteArray();
    }

    public static ChainSnapshot fromBytes(byte[] bytes) throws IOException {
        if (bytes == null) {
            return null;
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return MAPPER.readValue(in, ChainSnapshot.class);
        }
    }
}
