package com.metapharm.phi.infrastructure.crypto;

import com.metapharm.phi.infrastructure.crypto.exception.PhiCryptoException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a batch encrypt/decrypt: every field that succeeded, and the
 * failure of every field that did not. Null input values appear in neither.
 *
 * @param <T> value type of successfully processed fields
 */
public final class FieldBatchResult<T> {

    private final Map<String, T> values = new LinkedHashMap<>();
    private final Map<String, PhiCryptoException> failures = new LinkedHashMap<>();

    void succeeded(String field, T value) {
        values.put(field, value);
    }

    void failed(String field, PhiCryptoException failure) {
        failures.put(field, failure);
    }

    public Map<String, T> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public Map<String, PhiCryptoException> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public T get(String field) {
        return values.get(field);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return the successful values
     * @throws PhiCryptoException the first failure, with the others attached as suppressed
     */
    public Map<String, T> getValuesOrThrow() {
        if (failures.isEmpty()) {
            return getValues();
        }
        PhiCryptoException first = null;
        for (Map.Entry<String, PhiCryptoException> failure : failures.entrySet()) {
            if (first == null) {
                first = new PhiCryptoException(
                    "Batch failed for field '" + failure.getKey() + "'", failure.getValue());
            } else {
                first.addSuppressed(failure.getValue());
            }
        }
        throw first;
    }

    @Override
    public String toString() {
        return "FieldBatchResult[succeeded=" + values.keySet() + ", failed=" + failures.keySet() + "]";
    }
}
