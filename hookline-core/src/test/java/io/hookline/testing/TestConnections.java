package io.hookline.testing;

import io.hookline.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;

public final class TestConnections {

    private TestConnections() {}

    /** Connection provider whose connections ignore every call. */
    public static ConnectionProvider stubCp() {
        return () -> (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> null);
    }
}
