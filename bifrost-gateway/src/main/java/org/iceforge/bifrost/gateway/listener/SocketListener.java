package org.iceforge.bifrost.gateway.listener;

import org.iceforge.bifrost.gateway.config.GatewayProperties;
import org.iceforge.bifrost.pipeline.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Blocking TCP listener: one acceptor thread, one pooled thread per client connection.
 *
 * <p>Accepted sockets start with the handshake timeout as their read timeout; sessions
 * switch to the idle timeout once the client is logged in.
 */
public abstract class SocketListener implements ProtocolListener {
    private static final Logger log = LoggerFactory.getLogger(SocketListener.class);

    private final Protocol protocol;
    private final GatewayProperties.Listener config;
    private final Duration handshakeTimeout;
    private final Set<Socket> open = ConcurrentHashMap.newKeySet();

    private volatile ExecutorService acceptor;
    private volatile ExecutorService sessions;
    private volatile boolean running;
    private volatile ServerSocket serverSocket;
    private volatile int localPort;

    protected SocketListener(Protocol protocol, GatewayProperties props) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.config = props.listener(protocol);
        this.handshakeTimeout = props.timeouts().handshake();
    }

    /** Builds the per-connection handler. It owns the socket until it returns. */
    protected abstract Runnable newSession(Socket socket);

    @Override
    public Protocol protocol() {
        return protocol;
    }

    @Override
    public synchronized void start() throws IOException {
        if (running) return;

        String name = protocol.id();
        InetAddress bind = InetAddress.getByName(config.host());
        ServerSocket ss = new ServerSocket(config.port(), 128, bind);
        ss.setSoTimeout((int) Duration.ofSeconds(1).toMillis());

        acceptor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-acceptor");
            t.setDaemon(true);
            return t;
        });
        sessions = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-session");
            t.setDaemon(true);
            return t;
        });

        this.serverSocket = ss;
        this.localPort = ss.getLocalPort();
        this.running = true;

        log.info("{} listener on {}:{}", name, config.host(), localPort);

        acceptor.submit(() -> {
            while (running) {
                try {
                    Socket s = ss.accept();
                    s.setTcpNoDelay(true);
                    s.setSoTimeout((int) handshakeTimeout.toMillis());
                    open.add(s);
                    sessions.submit(() -> serve(s));
                } catch (SocketTimeoutException expected) {
                    // SO_TIMEOUT lets the loop notice `running` going false.
                } catch (IOException e) {
                    if (running) {
                        log.warn("{} accept failed", name, e);
                    }
                }
            }
        });
    }

    private void serve(Socket s) {
        try {
            newSession(s).run();
        } catch (RuntimeException e) {
            log.debug("{} session from {} failed: {}", protocol.id(), s.getRemoteSocketAddress(), e.toString());
        } finally {
            open.remove(s);
            closeSocket(s);
        }
    }

    @Override
    public synchronized void stop(Duration grace) {
        if (!running) return;
        running = false;
        closeServerSocket();
        acceptor.shutdownNow();
        sessions.shutdown();
        try {
            if (!sessions.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("{} listener closing {} connection(s) still open after {}", protocol.id(), open.size(), grace);
                open.forEach(SocketListener::closeSocket);
                sessions.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            open.forEach(SocketListener::closeSocket);
            sessions.shutdownNow();
        }
        localPort = 0;
        log.info("{} listener stopped", protocol.id());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int localPort() {
        return localPort;
    }

    @Override
    public int activeSessions() {
        return open.size();
    }

    private void closeServerSocket() {
        ServerSocket ss = serverSocket;
        if (ss == null) return;
        try {
            ss.close();
        } catch (IOException e) {
            log.debug("{} server socket close failed: {}", protocol.id(), e.toString());
        }
    }

    private static void closeSocket(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            log.debug("socket close failed: {}", e.toString());
        }
    }
}
