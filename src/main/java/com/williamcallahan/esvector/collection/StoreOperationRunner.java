package com.williamcallahan.esvector.collection;

import com.williamcallahan.esvector.client.DocumentStoreException;
import com.williamcallahan.esvector.domain.errors.StorageOperationException;
import com.williamcallahan.esvector.domain.errors.VectorStoreException;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs backing-store calls for one collection, translating failures into {@link StorageOperationException}.
 *
 * <p>Thread interruption is the cancellation signal: a call on an interrupted thread fails with
 * {@link CancellationException} before any I/O is attempted.</p>
 */
final class StoreOperationRunner {

    private static final Logger log = LoggerFactory.getLogger(StoreOperationRunner.class);

    private final String collectionName;

    StoreOperationRunner(String collectionName) {
        this.collectionName = collectionName;
    }

    <T> T run(String operationName, Supplier<T> storeCall) {
        checkCancelled(operationName);
        try {
            return storeCall.get();
        } catch (VectorStoreException | CancellationException alreadyTranslated) {
            throw alreadyTranslated;
        } catch (RuntimeException storeFailure) {
            throw new StorageOperationException(collectionName, operationName, storeFailure);
        }
    }

    void execute(String operationName, Runnable storeCall) {
        run(operationName, () -> {
            storeCall.run();
            return null;
        });
    }

    /**
     * Runs a delete-style call for which a missing target already is the desired outcome.
     *
     * @param operationName operation name
     * @param storeCall call to run
     */
    void runIgnoringNotFound(String operationName, Runnable storeCall) {
        checkCancelled(operationName);
        try {
            storeCall.run();
        } catch (DocumentStoreException storeFailure) {
            if (!storeFailure.isNotFound()) {
                throw new StorageOperationException(collectionName, operationName, storeFailure);
            }
            log.warn("[ES] {} on {} found nothing to delete; treating as success", operationName, collectionName);
        } catch (VectorStoreException | CancellationException alreadyTranslated) {
            throw alreadyTranslated;
        } catch (RuntimeException storeFailure) {
            throw new StorageOperationException(collectionName, operationName, storeFailure);
        }
    }

    void checkCancelled(String operationName) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(
                    "Operation " + operationName + " on " + collectionName + " was cancelled by interruption");
        }
    }
}
