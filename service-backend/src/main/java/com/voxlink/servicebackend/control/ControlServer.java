package com.voxlink.servicebackend.control;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voxlink.servicebackend.common.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP control server: one accept thread hands each connection to a worker, which reads
 * exactly one request, writes one response and closes the connection.
 */
public class ControlServer implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ControlServer.class);

    private final ControlServerProperties properties;
    private final ControlRequestDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    private final AtomicLong requestsHandled = new AtomicLong();

    private volatile boolean running = false;
    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;

    public ControlServer(ControlServerProperties properties,
                         ControlRequestDispatcher dispatcher,
                         ObjectMapper objectMapper) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    public synchronized void start() throws IOException {
        if (running) return;
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(properties.host(), properties.port()), properties.backlog());

        AtomicInteger workerIds = new AtomicInteger();
        workers = Executors.newFixedThreadPool(Math.max(2, properties.workerThreads()), r -> {
            Thread t = new Thread(r, "control-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        running = true;
        acceptThread = new Thread(this, "control-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Control server started on {}:{}", properties.host(), getLocalPort());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.debug("Error closing control socket: {}", e.getMessage());
        }
        try {
            acceptThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Control server stopped after {} request(s)", requestsHandled.get());
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public boolean isRunning() {
        return running;
    }

    public long getRequestsHandled() {
        return requestsHandled.get();
    }

    @Override
    public void run() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    log.warn("Accept failed: {}", e.getMessage());
                }
                continue;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            try {
                workers.execute(() -> handleConnection(socket));
            } catch (RejectedExecutionException e) {
                log.warn("Dropping connection from {}: server is shutting down", socket.getRemoteSocketAddress());
                closeQuietly(socket);
            }
        }
    }

    private void handleConnection(Socket socket) {
        try (socket) {
            socket.setSoTimeout((int) properties.readTimeout().toMillis());
            InputStream in = socket.getInputStream();
            OutputStream out = socket.getOutputStream();

            Optional<byte[]> body = FrameCodec.readRequest(
                    in,
                    properties.maxFrameBytes(),
                    properties.legacyRawJson(),
                    () -> socket.setSoTimeout((int) properties.legacyIdleTimeout().toMillis()));

            Map<String, Object> response = body
                    .map(this::process)
                    .orElseGet(() -> ControlResponses.error(ErrorKind.MALFORMED, "Empty request"));
            FrameCodec.writeFrame(out, objectMapper.writeValueAsBytes(response));
            requestsHandled.incrementAndGet();
        } catch (IOException e) {
            log.debug("Control connection {} failed: {}", socket.getRemoteSocketAddress(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error on control connection {}", socket.getRemoteSocketAddress(), e);
        }
    }

    private Map<String, Object> process(byte[] body) {
        JsonNode request;
        try {
            request = objectMapper.readTree(body);
        } catch (IOException e) {
            return ControlResponses.error(ErrorKind.MALFORMED, "Malformed request");
        }
        if (request == null || !request.isObject()) {
            return ControlResponses.error(ErrorKind.MALFORMED, "Malformed request");
        }
        return dispatcher.dispatch(request);
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
