package com.acme.deeptree.ledger.orchestration;

import com.acme.deeptree.ledger.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Map;
import java.util.Objects;

/**
 * Estimates a payload's footprint as two bytes per character of its JSON rendering.
 *
 * <p>Only state Jackson can see is counted: public fields, getters and record components.
 * A non-map object that renders as {@code {}} exposes none of it and is rejected rather
 * than charged a few bytes.
 */
public final class JsonPayloadSizeEstimator {
    private static final long BYTES_PER_CHAR = 2L;
    private static final String EMPTY_OBJECT = "{}";

    /**
     * @throws IllegalArgumentException if the payload cannot be rendered as JSON, or renders
     *                                  as an empty object without being a map
     */
    public long estimateBytes(Object payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            String json = JsonCodec.writeString(payload);
            if (EMPTY_OBJECT.equals(json) && !(payload instanceof Map)) {
                throw new IllegalArgumentException(
                    "Cannot estimate size of " + payload.getClass().getName() + ": no serializable state");
            }
            return Math.max(1L, json.length() * BYTES_PER_CHAR);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Cannot estimate size of " + payload.getClass().getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /** Eight bytes per value across inputs and targets. */
    public long estimateTrainingBatchBytes(double[][] inputs, double[][] targets) {
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(targets, "targets");
        return Math.max(1L, (cellCount(inputs) + cellCount(targets)) * Double.BYTES);
    }

    private static long cellCount(double[][] matrix) {
        long cells = 0L;
        for (double[] row : matrix) {
            cells += row == null ? 0 : row.length;
        }
        return cells;
    }
}
