package com.deerbot.util;

import com.deerbot.server.ai.ChainModel;
import com.deerbot.server.ai.snapshot.ChainSnapshot;
import com.deerbot.server.ai.snapshot.NodeRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPInputStream;

public class SnapshotCodecTest {

    @Test
    public void testRoundTrip() throws Exception {
        ChainModel model = new ChainModel(2);
        model.analyze(List.of("the", "cat", "sat"));
        model.analyze(List.of("The", "dog", "sat"));
        ChainSnapshot input = model.toSnapshot();

        byte[] bytes = SnapshotCodec.toBytes(input);
        ChainSnapshot output = SnapshotCodec.fromBytes(bytes);

        Assertions.assertEquals(input, output);
        NodeRecord exit = output.graph.get("catsat");
        Assertions.assertTrue(exit.isExit);
        Assertions.assertEquals(1, exit.weight);
        Assertions.assertEquals(List.of("cat", "dog"), output.graph.get("the").links);
    }

    @Test
    public void testJsonPropertyNames() throws Exception {
        ChainModel model = new ChainModel(1);
        model.analyze(List.of("a", "b"));

        byte[] bytes = SnapshotCodec.toBytes(model.toSnapshot());
        String json;
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        JsonNode root = new ObjectMapper().readTree(json);
        Assertions.assertEquals(1, root.get("order").asInt());
        JsonNode exit = root.get("graph").get("b");
        Assertions.assertTrue(exit.get("links").isArray());
        Assertions.assertTrue(exit.get("freqs").isArray());
        Assertions.assertEquals(1, exit.get("weight").asInt());
        Assertions.assertTrue(exit.get("isExit").asBoolean());
        Assertions.assertFalse(exit.has("exit"));
        Assertions.assertEquals("b", root.get("graph").get("a").get("links").get(0).asText());
    }

    @Test
    public void testNull() throws Exception {
        Assertions.assertNull(SnapshotCodec.toBytes(null));
        Assertions.assertNull(SnapshotCodec.fromBytes(null));
    }
}
