package com.invdash.config;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Keeps pooled snapshot-store connections alive on statement-level errors.
 *
 * A unique-key race between two concurrent first inserts (SQLSTATE 23xxx) or a malformed payload
 * does not break the connection.
 */
public class PersistenceSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLIntegrityConstraintViolationException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("23") || sqlState.startsWith("22"))) {
            // 22xxx: data exception, 23xxx: integrity constraint violation
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
