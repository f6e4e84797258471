package com.playfactory.provisioning;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Reports whether the host can currently bind a port.
 */
@FunctionalInterface
public interface PortProbe {

    boolean isFree(int port);

    /**
     * Binds a server socket on the port and releases it immediately.
     */
    static PortProbe socketBind() {
        return port -> {
            try (ServerSocket socket = new ServerSocket()) {
                // must be set before bind, or a port lingering in TIME_WAIT reads as taken
                socket.setReuseAddress(true);
                socket.bind(new InetSocketAddress(port));
                return true;
            } catch (IOException e) {
                return false;
            }
        };
    }
}
