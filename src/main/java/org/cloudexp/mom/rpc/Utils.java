/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

public class Utils {
    // Little-endian, least significant byte first
    public static void intToBytes(int l, final byte[] b, final int offset) {
        for (int i = 0; i < Integer.BYTES; i++) {
            b[offset + i] = (byte) (l & 0xFF);
            l >>= Byte.SIZE;
        }
    }

    public static int bytesToInt(final byte[] b, final int offset) {
        int result = 0;
        for (int i = Integer.BYTES - 1; i >= 0; i--) {
            result <<= Byte.SIZE;
            result |= (b[offset + i] & 0xFF);
        }
        return result;
    }

    /**
     * Fill the whole buffer from the stream.
     *
     * @param in   the stream to read from
     * @param buff the buffer to fill
     * @throws EOFException if the stream ends before the buffer is full
     * @throws IOException  on read errors or socket timeouts
     */
    public static void readFully(final InputStream in, final byte[] buff) throws IOException {
        int bytesRead = 0;
        while (bytesRead < buff.length) {
            final int ret = in.read(buff, bytesRead, buff.length - bytesRead);
            if (ret < 0) {
                throw new EOFException("Connection closed after " + bytesRead + " of " + buff.length + " bytes");
            }
            bytesRead += ret;
        }
    }
}
