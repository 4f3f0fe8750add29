package io.sqltx.command;

import io.sqltx.CardinalityViolationException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * What a command returns: the affected-row count, at most one row, or a lazy sequence of rows.
 *
 * @param <R> the result type
 */
public abstract sealed class ResultShape<R>
        permits ResultShape.AffectedRows, ResultShape.OptionalRow, ResultShape.RowSet {

    private ResultShape() {}

    /**
     * Row count of an INSERT, UPDATE, DELETE or MERGE.
     */
    public static ResultShape<Integer> affectedRows() {
        return AffectedRows.INSTANCE;
    }

    /**
     * Zero or one row; more fails with {@link CardinalityViolationException}.
     */
    public static <T> ResultShape<SingleRow<T>> singleRow(RowMapper<T> mapper) {
        return new OptionalRow<>(mapper);
    }

    /**
     * Every row, mapped lazily as the returned {@link RowSequence} is iterated.
     */
    public static <T> ResultShape<RowSequence<T>> rows(RowMapper<T> mapper) {
        return new RowSet<>(mapper);
    }

    /**
     * Executes the prepared statement and produces the result. Eager shapes close the
     * statement before returning and never call {@code release}; lazy shapes hand both to
     * the result.
     */
    abstract R read(PreparedStatement statement, Runnable release) throws SQLException;

    /**
     * Returns {@code true} if the result keeps the connection busy after {@link #read} returns.
     */
    boolean isLazy() {
        return false;
    }

    static final class AffectedRows extends ResultShape<Integer> {
        static final AffectedRows INSTANCE = new AffectedRows();

        @Override
        Integer read(PreparedStatement statement, Runnable release) throws SQLException {
            try (statement) {
                return statement.executeUpdate();
            }
        }
    }

    static final class OptionalRow<T> extends ResultShape<SingleRow<T>> {
        private final RowMapper<T> mapper;

        OptionalRow(RowMapper<T> mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
        }

        @Override
        SingleRow<T> read(PreparedStatement statement, Runnable release) throws SQLException {
            try (statement) {
                statement.setMaxRows(2);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        return SingleRow.absent();
                    }
                    T row = mapper.map(rs);
                    if (rs.next()) {
                        throw new CardinalityViolationException("Single-row command returned more than one row");
                    }
                    return SingleRow.of(row);
                }
            }
        }
    }

    static final class RowSet<T> extends ResultShape<RowSequence<T>> {
        private final RowMapper<T> mapper;

        RowSet(RowMapper<T> mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
        }

        @Override
        RowSequence<T> read(PreparedStatement statement, Runnable release) throws SQLException {
            ResultSet rs;
            try {
                rs = statement.executeQuery();
            } catch (SQLException e) {
                try {
                    statement.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
            return new RowSequence<>(statement, rs, mapper, release);
        }

        @Override
        boolean isLazy() {
            return true;
        }
    }
}
