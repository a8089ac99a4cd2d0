/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;

public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private HashingUtil() {}

    public static long checksum(byte[] bytes) {
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static long checksum(ByteBuffer buf) {
        ByteBuffer copy = buf.duplicate();
        return XX_HASH.hash64().hash(copy, copy.position(), copy.remaining(), SEED);
    }
}
