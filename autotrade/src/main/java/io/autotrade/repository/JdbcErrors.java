package io.autotrade.repository;

import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.common.PriceBaseException;
import io.autotrade.domain.common.StorageUnavailableException;

import java.sql.SQLException;

/**
 * Maps {@link SQLException} onto the domain error taxonomy.
 *
 * SQLState class 23 (integrity constraint violation) is a terminal
 * {@link InvalidBarException}; 42P01 (undefined table) is a missing partition;
 * everything else is treated as transient.
 */
public final class JdbcErrors {
    static final String UNDEFINED_TABLE = "42P01";

    public static PriceBaseException translate(String operation, SQLException e) {
        String state = e.getSQLState();
        if (state != null && state.startsWith("23")) {
            return new InvalidBarException("Constraint violated during " + operation + ": " + e.getMessage(), e);
        }
        if (UNDEFINED_TABLE.equals(state)) {
            return new NotFoundException("Partition", operation);
        }
        return new StorageUnavailableException(operation, e);
    }

    private JdbcErrors() {}
}
