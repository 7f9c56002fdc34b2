package com.example.rentalchat.persistence;

import com.example.rentalchat.service.exception.TransientStoreException;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Maps retryable data access failures onto {@link TransientStoreException}. Anything else propagates unchanged.
 */
final class StoreFailures {

    private StoreFailures() {}

    static <T> T guard(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException
                | RecoverableDataAccessException
                | DataAccessResourceFailureException ex) {
            throw new TransientStoreException("Store operation '%s' failed".formatted(operation), ex);
        }
    }
}
