/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import java.util.HashMap;
import java.util.Map;

/// The envelope around every answer of the guest server
public class MessageResponse {
    private final boolean ack;
    private final Map<String, Object> response;
    private final String error;
    private double processTime = 0;

    private MessageResponse(final boolean ack, final Map<String, Object> response, final String error) {
        this.ack = ack;
        this.response = response;
        this.error = error;
    }

    public static MessageResponse success(final Map<String, Object> response) {
        return new MessageResponse(true, response, null);
    }

    public static MessageResponse failure(final String error) {
        return new MessageResponse(false, null, error);
    }

    public boolean isAck() {
        return this.ack;
    }

    public Map<String, Object> getResponse() {
        return this.response;
    }

    public String getError() {
        return this.error;
    }

    public double getProcessTime() {
        return this.processTime;
    }

    public void setProcessTime(final double processTime) {
        this.processTime = processTime;
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> ret = new HashMap<>();
        ret.put("ack", this.ack);
        ret.put("response", this.response);
        ret.put("process-time", this.processTime);
        if (this.error != null) {
            ret.put("error", this.error);
        }
        return ret;
    }

    /**
     * Validate a decoded envelope.
     *
     * @param value the decoded payload
     * @return the envelope of a successfully processed message
     * @throws MessageError if the envelope is malformed, not acknowledged or has no map response
     */
    @SuppressWarnings("unchecked")
    public static MessageResponse fromMap(final Object value) throws MessageError {
        if (!(value instanceof Map)) {
            throw new MessageError("Response must be a map. Got " + value + " instead.");
        }
        final Map<String, Object> map = (Map<String, Object>) value;
        if (!Boolean.TRUE.equals(map.get("ack"))) {
            final Object err = map.getOrDefault("error", "<no error message>");
            throw new MessageError("Other side failed to process message: " + err);
        }
        final Object data = map.get("response");
        if (!(data instanceof Map)) {
            throw new MessageError("Response data must be a map. Got " + data + " instead.");
        }
        final MessageResponse ret = success((Map<String, Object>) data);
        if (map.get("process-time") instanceof Number) {
            ret.setProcessTime(((Number) map.get("process-time")).doubleValue());
        }
        return ret;
    }
}
