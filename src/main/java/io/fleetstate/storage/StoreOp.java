package io.fleetstate.storage;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One write against an open connection. Ops are collected by callers and committed together
 * through {@link Database#transact(StoreOp...)}.
 */
@FunctionalInterface
public interface StoreOp {
    void apply(Connection conn) throws SQLException;
}
