/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage.io.codec;

import ai.evacortex.spectrafit.core.FitResult;
import ai.evacortex.spectrafit.core.ParameterGuessTable;
import ai.evacortex.spectrafit.core.PixelCoordinate;
import ai.evacortex.spectrafit.core.RunMetadata;
import ai.evacortex.spectrafit.core.storage.JsonSupport;
import ai.evacortex.spectrafit.core.storage.TaskRecord;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary payload of a per-task record.
 *
 * <h3>Layout</h3>
 * <ul>
 *   <li>coordinate: row, col</li>
 *   <li>spectrum: nFreq, components, then {@code nFreq × components} doubles, frequency-major</li>
 *   <li>parameters: count, values, then the same count of uncertainties</li>
 *   <li>guess table: {@code 15 × 3} doubles, row-major</li>
 *   <li>run metadata: byte length followed by its UTF-8 JSON form</li>
 * </ul>
 * Doubles are stored bit-exact, so decoding reproduces the routine output unchanged.
 */
public final class TaskRecordCodec {

    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final int MAX_SUPPORTED_LENGTH = 65_536; // sanity limit for any vector

    private static final ObjectMapper MAPPER = JsonSupport.newMapper();

    private TaskRecordCodec() {}

    public static byte[] encode(FitResult result, ParameterGuessTable table) {
        byte[] meta = metadataBytes(result.runMetadata());
        double[][] spectrum = result.fittedSpectrum();
        int nFreq = spectrum.length;
        int comps = result.spectrumComponents();
        int nParams = result.fittedParameters().length;
        if (result.parameterUncertainties().length != nParams) {
            throw new IllegalArgumentException("Parameter/uncertainty length mismatch in task " + result.taskId());
        }
        checkLength(nFreq * comps, "spectrum");
        checkLength(nParams, "parameters");

        int size = 4 * 2
                + 4 * 2 + 8 * nFreq * comps
                + 4 + 8 * nParams * 2
                + 8 * ParameterGuessTable.ROW_COUNT * ParameterGuessTable.COLUMNS
                + 4 + meta.length;
        ByteBuffer buf = ByteBuffer.allocate(size).order(ORDER);

        buf.putInt(result.coordinate().row());
        buf.putInt(result.coordinate().col());

        buf.putInt(nFreq);
        buf.putInt(comps);
        for (double[] row : spectrum) {
            if (row.length != comps) throw new IllegalArgumentException("Ragged fitted spectrum in task " + result.taskId());
            for (double v : row) buf.putDouble(v);
        }

        buf.putInt(nParams);
        for (double v : result.fittedParameters()) buf.putDouble(v);
        for (double v : result.parameterUncertainties()) buf.putDouble(v);

        for (double[] row : table.rows()) {
            for (double v : row) buf.putDouble(v);
        }

        buf.putInt(meta.length);
        buf.put(meta);
        return buf.array();
    }

    public static TaskRecord decode(int taskId, ByteBuffer buf) {
        buf.order(ORDER);
        int row = buf.getInt();
        int col = buf.getInt();

        int nFreq = buf.getInt();
        int comps = buf.getInt();
        checkLength(nFreq * comps, "spectrum");
        double[][] spectrum = new double[nFreq][comps];
        for (int f = 0; f < nFreq; f++) {
            for (int k = 0; k < comps; k++) spectrum[f][k] = buf.getDouble();
        }

        int nParams = buf.getInt();
        checkLength(nParams, "parameters");
        double[] params = new double[nParams];
        double[] errors = new double[nParams];
        for (int i = 0; i < nParams; i++) params[i] = buf.getDouble();
        for (int i = 0; i < nParams; i++) errors[i] = buf.getDouble();

        double[][] table = new double[ParameterGuessTable.ROW_COUNT][ParameterGuessTable.COLUMNS];
        for (double[] r : table) {
            for (int c = 0; c < r.length; c++) r[c] = buf.getDouble();
        }

        int metaLength = buf.getInt();
        if (metaLength < 0 || metaLength > buf.remaining()) {
            throw new IllegalArgumentException("Corrupt metadata length: " + metaLength);
        }
        byte[] meta = new byte[metaLength];
        buf.get(meta);

        FitResult result = new FitResult(taskId, new PixelCoordinate(row, col), spectrum, params, errors,
                metadataFrom(meta));
        return new TaskRecord(result, ParameterGuessTable.of(table));
    }

    private static void checkLength(int length, String what) {
        if (length < 0 || length > MAX_SUPPORTED_LENGTH) {
            throw new IllegalArgumentException("Unsupported " + what + " length: " + length);
        }
    }

    private static byte[] metadataBytes(RunMetadata metadata) {
        try {
            return MAPPER.writeValueAsBytes(metadata);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode run metadata", e);
        }
    }

    private static RunMetadata metadataFrom(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, RunMetadata.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode run metadata", e);
        }
    }
}
