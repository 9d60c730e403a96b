package ru.kfl.leasingsync.gateway.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.TransactionException;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.error.StoreUnavailableException;
import ru.kfl.leasingsync.shared.error.ValidationFailedException;

import java.util.function.Supplier;

/**
 * Translates Spring persistence failures into the sync error taxonomy.
 */
final class StoreCalls {

    private static final Logger log = LoggerFactory.getLogger(StoreCalls.class);

    private StoreCalls() {
    }

    static <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("{} lost its row to a concurrent delete", operation);
            throw new NotFoundException(operation + ": entity no longer exists");
        } catch (DataIntegrityViolationException e) {
            log.warn("{} rejected by the database: {}", operation, e.getMostSpecificCause().getMessage());
            throw new ValidationFailedException(operation + " violates a store constraint");
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed", operation, e);
            throw new StoreUnavailableException(operation + " failed: store unavailable", e);
        }
    }
}
