/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage.io.format;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-size header at the start of every per-task record file.
 *
 * <h3>Layout (little-endian)</h3>
 * <pre>
 *     magic        4   'SFTR'
 *     version      2
 *     timestamp    8   epoch millis of the write
 *     taskId       4
 *     payloadLen   4
 *     checksum     8   xxHash64 of the payload
 *     padding      2   aligns the header to 32 bytes
 * </pre>
 */
public record RecordHeader(int version, long timestamp, int taskId, int payloadLength, long checksum) {

    public static final int MAGIC = 0x53465452; // ASCII: 'SFTR'
    public static final int CURRENT_VERSION = 1;
    public static final int SIZE = 32;

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(MAGIC);
        buf.putShort((short) version);
        buf.putLong(timestamp);
        buf.putInt(taskId);
        buf.putInt(payloadLength);
        buf.putLong(checksum);
        while (buf.hasRemaining()) buf.put((byte) 0);
        return buf.array();
    }

    public static RecordHeader from(ByteBuffer buf) {
        buf.order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < SIZE) {
            throw new IllegalArgumentException("Truncated record header: " + buf.remaining() + " bytes");
        }
        int start = buf.position();
        int magic = buf.getInt();
        if (magic != MAGIC)
            throw new IllegalArgumentException("Invalid magic: " + Integer.toHexString(magic));

        int version = buf.getShort() & 0xFFFF;
        if (version > CURRENT_VERSION)
            throw new IllegalArgumentException("Unsupported record version: " + version);
        long timestamp = buf.getLong();
        int taskId = buf.getInt();
        int payloadLength = buf.getInt();
        long checksum = buf.getLong();
        buf.position(start + SIZE);
        return new RecordHeader(version, timestamp, taskId, payloadLength, checksum);
    }
}
