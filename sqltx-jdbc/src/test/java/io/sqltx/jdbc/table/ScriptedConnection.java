package io.sqltx.jdbc.table;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;

/**
 * Wraps a real connection to imitate driver behaviour H2 does not have.
 */
final class ScriptedConnection implements InvocationHandler {
    private final Connection target;
    private final boolean batchWithoutCounts;
    private final boolean failAutoCommitRestore;

    private ScriptedConnection(Connection target, boolean batchWithoutCounts, boolean failAutoCommitRestore) {
        this.target = target;
        this.batchWithoutCounts = batchWithoutCounts;
        this.failAutoCommitRestore = failAutoCommitRestore;
    }

    /**
     * Batches report {@link Statement#SUCCESS_NO_INFO} for every entry, like MySQL with
     * {@code rewriteBatchedStatements} or Oracle.
     */
    static Connection withoutBatchCounts(Connection target) {
        return wrap(new ScriptedConnection(target, true, false));
    }

    /**
     * {@code setAutoCommit(true)} fails after the work ran.
     */
    static Connection failingAutoCommitRestore(Connection target) {
        return wrap(new ScriptedConnection(target, false, true));
    }

    private static Connection wrap(ScriptedConnection handler) {
        return (Connection) Proxy.newProxyInstance(ScriptedConnection.class.getClassLoader(),
                new Class<?>[]{Connection.class}, handler);
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (failAutoCommitRestore && method.getName().equals("setAutoCommit") && Boolean.TRUE.equals(args[0])) {
            throw new SQLException("connection reset while restoring auto-commit");
        }
        Object result = call(target, method, args);
        if (batchWithoutCounts && result instanceof PreparedStatement statement) {
            return Proxy.newProxyInstance(ScriptedConnection.class.getClassLoader(),
                    new Class<?>[]{PreparedStatement.class}, (p, m, a) -> {
                        Object value = call(statement, m, a);
                        if (m.getName().equals("executeBatch")) {
                            int[] counts = new int[((int[]) value).length];
                            Arrays.fill(counts, Statement.SUCCESS_NO_INFO);
                            return counts;
                        }
                        return value;
                    });
        }
        return result;
    }

    private static Object call(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }
}
