/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Converts message content and response envelopes to and from the JSON payload of an RPC frame.
 */
public class MessageCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    public static byte[] encode(final Map<String, ?> content) throws IOException {
        return MAPPER.writeValueAsBytes(content == null ? new HashMap<>() : content);
    }

    public static Map<String, Object> decode(final byte[] payload) throws IOException {
        if (payload.length == 0) {
            return new HashMap<>();
        }
        final Map<String, Object> ret = MAPPER.readValue(payload, MAP_TYPE);
        return ret == null ? new HashMap<>() : ret;
    }

    /// Decode a payload without assuming its shape
    public static Object decodeValue(final byte[] payload) throws IOException {
        return MAPPER.readValue(payload, Object.class);
    }

    /**
     * Build the message of the given kind around decoded content.
     *
     * @param id      the wire type
     * @param content the decoded content
     * @return the message, ready to be processed
     */
    public static Message toMessage(final RPCID id, final Map<String, Object> content) {
        switch (id) {
            case ECHO:
                return new EchoMessage(content);
            case INQUIRY:
                return new MessageInquiry(content);
            case NOTIFY:
                return new MessageNotify(content);
            case STATS:
                return new MessageStats(content);
            case TARGET_ALLOCATION:
                return new MessageTargetAllocation(content);
            case UPDATE_RESOURCE_DIFF:
                return new MessageUpdateResourceDiff(content);
            case UPDATE_APPLICATION_TARGET:
                return new MessageUpdateApplicationTarget(content);
            default:
                throw new IllegalArgumentException("Unknown message type: " + id);
        }
    }

    /// JSON, deflated and base64 encoded so it travels as one string value
    public static String compress(final Map<String, ?> data) throws IOException {
        final Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try {
            deflater.setInput(encode(data));
            deflater.finish();
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final byte[] buff = new byte[4096];
            while (!deflater.finished()) {
                final int len = deflater.deflate(buff);
                out.write(buff, 0, len);
            }
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } finally {
            deflater.end();
        }
    }

    public static Map<String, Object> decompress(final String data) throws IOException {
        final Inflater inflater = new Inflater();
        try {
            inflater.setInput(Base64.getDecoder().decode(data));
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            final byte[] buff = new byte[4096];
            while (!inflater.finished()) {
                final int len = inflater.inflate(buff);
                if (len == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IOException("Truncated compressed data");
                }
                out.write(buff, 0, len);
            }
            return decode(out.toByteArray());
        } catch (final DataFormatException | IllegalArgumentException e) {
            throw new IOException("Invalid compressed data", e);
        } finally {
            inflater.end();
        }
    }
}
