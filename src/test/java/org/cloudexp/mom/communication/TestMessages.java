/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import org.cloudexp.mom.guest.FunctionOfTime;
import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.rpc.RPCHeader;
import org.cloudexp.mom.rpc.RPCMessage;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;

public class TestMessages {

    private static GuestServer newServer(final GuestPolicy policy) {
        final MomConfig config = new MomConfig().set("monitor", "sample-history-length", 5);
        final Monitor monitor = new Monitor(config, "vm1", "vm1", Map.of(), List.of(), new Terminable());
        monitor.setReady();
        return new GuestServer(monitor, policy, "vm1");
    }

    private static GuestPolicy constantPolicy(final double memory) {
        return new GuestPolicy(Map.of("memory", FunctionOfTime.constant(memory)));
    }

    @Test
    public void testInquiry() {
        final GuestPolicy policy = constantPolicy(2048);
        final GuestServer server = newServer(policy);

        MessageResponse response = server.processMessage(new MessageInquiry(Map.of("memory", 1024.0), 2.0, 1.0));
        assertTrue(response.isAck());
        assertEquals(2048.0, response.getResponse().get("memory"));

        // The guest application reports it needs more than it asks for
        server.processMessage(new MessageUpdateResourceDiff("memory", 100));
        response = server.processMessage(new MessageInquiry(null, null, 1.0));
        assertEquals(2148.0, response.getResponse().get("memory"));

        final Map<String, Object> inquiry = DictUtils.getMap(server.interrogate(), MessageInquiry.KEY);
        assertNotNull(inquiry.get("update-time"));
        assertEquals(1.0, inquiry.get("timeout"));
    }

    @Test
    public void testNotifyAndTargetAllocation() {
        final GuestServer server = newServer(constantPolicy(2048));

        final Map<String, Double> alloc = new HashMap<>();
        alloc.put("memory", 1536.0);
        assertTrue(server.processMessage(new MessageNotify(alloc, 5.0)).isAck());

        Map<String, Object> target = server.processMessage(new MessageTargetAllocation(0.1)).getResponse();
        assertEquals(true, target.get(MessageTargetAllocation.NEW_NOTIFICATION));
        assertEquals(1536.0, DictUtils.getMap(target, "alloc").get("memory"));
        assertEquals(5.0, target.get("grace-period"));
        assertNotNull(target.get("update-time"));

        // Nothing new since the previous request
        target = server.processMessage(new MessageTargetAllocation(0.1)).getResponse();
        assertEquals(false, target.get(MessageTargetAllocation.NEW_NOTIFICATION));
        assertEquals(1536.0, DictUtils.getMap(target, "alloc").get("memory"));

        // The final notification of a cycle has no grace period
        server.processMessage(new MessageNotify(alloc, null));
        target = server.processMessage(new MessageTargetAllocation(0.1)).getResponse();
        assertEquals(true, target.get(MessageTargetAllocation.NEW_NOTIFICATION));
        assertNull(target.get("grace-period"));
    }

    @Test
    public void testRepeatedNotifyKeepsState() {
        final GuestServer server = newServer(constantPolicy(2048));
        final Map<String, Double> alloc = new HashMap<>();
        alloc.put("memory", 1536.0);

        server.processMessage(new MessageNotify(alloc, 3.0));
        server.processMessage(new MessageNotify(alloc, null));
        final Map<String, Object> first = DictUtils.getMap(server.interrogate(), MessageNotify.KEY);
        server.processMessage(new MessageNotify(alloc, null));
        final Map<String, Object> second = DictUtils.getMap(server.interrogate(), MessageNotify.KEY);

        assertTrue((Double) second.remove("update-time") >= (Double) first.remove("update-time"));
        assertEquals(first, second);
        assertTrue(first.containsKey("grace-period"));
        assertNull(first.get("grace-period"));
    }

    @Test
    public void testTargetAllocationBeforeNotify() {
        final GuestServer server = newServer(constantPolicy(2048));
        final Map<String, Object> target = server.processMessage(new MessageTargetAllocation(0.05)).getResponse();
        assertEquals(false, target.get(MessageTargetAllocation.NEW_NOTIFICATION));
        assertNull(target.get("alloc"));
    }

    @Test
    public void testStatsCarryServerState() throws MessageError {
        final GuestServer server = newServer(constantPolicy(2048));
        server.processMessage(new MessageUpdateApplicationTarget("memory", 900));

        final MessageResponse response = server.processMessage(new MessageStats());
        assertTrue(response.isAck());
        final Map<String, Object> stats = MessageStats.unpack(response.getResponse());
        assertEquals(900.0, ((Number) DictUtils.getMap(stats, MessageUpdateApplicationTarget.KEY).get("memory"))
                .doubleValue());

        assertThrows(MessageError.class, () -> MessageStats.unpack(Map.of()));
        assertThrows(MessageError.class, () -> MessageStats.unpack(Map.of(MessageStats.KEY, "not base64!")));
    }

    @Test
    public void testFailureEnvelope() {
        final GuestPolicy failing = new GuestPolicy(Map.of()) {
            @Override
            public Map<String, Double> inquiry(final Map<String, Object> inquiryData) {
                throw new IllegalStateException("no script");
            }
        };
        final MessageResponse response = newServer(failing).processMessage(new MessageInquiry(null, null, 1.0));
        assertFalse(response.isAck());
        assertEquals("no script", response.getError());

        final MessageError e = assertThrows(MessageError.class, () -> MessageResponse.fromMap(response.toMap()));
        assertTrue(e.getMessage().contains("no script"));
    }

    @Test
    public void testEnvelopeValidation() throws MessageError {
        assertThrows(MessageError.class, () -> MessageResponse.fromMap("text"));
        assertThrows(MessageError.class, () -> MessageResponse.fromMap(Map.of("ack", true, "response", 1)));

        final Map<String, Object> envelope = new HashMap<>();
        envelope.put("ack", true);
        envelope.put("response", Map.of("a", 1));
        envelope.put("process-time", 0.25);
        final MessageResponse response = MessageResponse.fromMap(envelope);
        assertEquals(1, response.getResponse().get("a"));
        assertEquals(0.25, response.getProcessTime());
    }

    @Test
    public void testHandlerMalformedPayload() throws IOException {
        final GuestServer server = newServer(constantPolicy(2048));
        final byte[] payload = "{not json".getBytes(StandardCharsets.UTF_8);
        final RPCMessage request = new RPCMessage(new RPCHeader((byte) 9, RPCID.INQUIRY.id(), payload.length),
                payload);

        final RPCMessage reply = new MessageHandler().handleRPC(request, server);
        assertEquals(9, reply.hdr().getId());
        assertEquals(RPCID.INQUIRY.id(), reply.hdr().getType());
        final Map<String, Object> envelope = MessageCodec.decode(reply.payload());
        assertEquals(false, envelope.get("ack"));
        assertNotNull(envelope.get("error"));
    }

    @Test
    public void testMessageKinds() {
        for (final RPCID id : RPCID.values()) {
            final Message msg = MessageCodec.toMessage(id, new HashMap<>());
            assertEquals(id, msg.id());
            assertEquals(id, RPCID.fromId(id.id()));
        }
        assertNull(RPCID.fromId((byte) 100));
    }

    @Test
    public void testCompressRejectsGarbage() throws IOException {
        final Map<String, Object> data = Map.of("memory", Map.of("available", 1024));
        assertEquals(data, MessageCodec.decompress(MessageCodec.compress(data)));
        assertThrows(IOException.class, () -> MessageCodec.decompress("AAAA"));
    }
}
