package io.sqltx.command;

import io.sqltx.InvalidStateException;
import io.sqltx.SqlCommandException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily mapped rows of a query, read from an open cursor.
 *
 * <p>The sequence is finite and can be iterated exactly once; a second call to
 * {@link #iterator()} fails with {@link InvalidStateException}. The cursor and the
 * statement are closed when iteration runs past the last row or on {@link #close()}.
 * Close it with try-with-resources when the rows may not all be consumed.
 *
 * @param <T> the row type
 */
public final class RowSequence<T> implements Iterable<T>, AutoCloseable {
    private final PreparedStatement statement;
    private final ResultSet resultSet;
    private final RowMapper<T> mapper;
    private final Runnable release;
    private boolean iterated;
    private boolean closed;

    RowSequence(PreparedStatement statement, ResultSet resultSet, RowMapper<T> mapper, Runnable release) {
        this.statement = statement;
        this.resultSet = resultSet;
        this.mapper = mapper;
        this.release = release;
    }

    @Override
    public synchronized Iterator<T> iterator() {
        if (iterated) {
            throw new InvalidStateException("Row sequence can only be iterated once");
        }
        iterated = true;
        return new Iterator<>() {
            private boolean fetched;
            private boolean available;

            @Override
            public boolean hasNext() {
                if (!fetched) {
                    available = advance();
                    fetched = true;
                }
                return available;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                fetched = false;
                try {
                    return mapper.map(resultSet);
                } catch (SQLException e) {
                    close();
                    throw new SqlCommandException("Failed to map row", e);
                }
            }
        };
    }

    /**
     * Consumes the remaining rows into a list and closes the sequence.
     */
    public List<T> toList() {
        try {
            List<T> rows = new ArrayList<>();
            for (T row : this) {
                rows.add(row);
            }
            return rows;
        } finally {
            close();
        }
    }

    /**
     * Returns a sequential stream over the rows; closing the stream closes the sequence.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false).onClose(this::close);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        SqlCommandException failure = null;
        try {
            resultSet.close();
        } catch (SQLException e) {
            failure = new SqlCommandException("Failed to close row sequence", e);
        }
        try {
            statement.close();
        } catch (SQLException e) {
            if (failure != null) failure.addSuppressed(e);
            else failure = new SqlCommandException("Failed to close row sequence", e);
        }
        try {
            release.run();
        } catch (RuntimeException e) {
            if (failure != null) failure.addSuppressed(e);
            else throw e;
        }
        if (failure != null) {
            throw failure;
        }
    }

    private synchronized boolean advance() {
        if (closed) {
            return false;
        }
        try {
            if (resultSet.next()) {
                return true;
            }
        } catch (SQLException e) {
            close();
            throw new SqlCommandException("Failed to read next row", e);
        }
        close();
        return false;
    }
}
