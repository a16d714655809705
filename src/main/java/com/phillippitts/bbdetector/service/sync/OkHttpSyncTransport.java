package com.phillippitts.bbdetector.service.sync;

import com.phillippitts.bbdetector.config.properties.SyncProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link SyncTransport} backed by OkHttp WebSockets.
 *
 * <p>The write timeout bounds every outbound frame: a send that cannot be flushed in time
 * fails the socket, which surfaces as {@link SyncTransportListener#onFailure}. Sends
 * themselves only enqueue, so the engine tick never waits on the network.
 */
@Component
public class OkHttpSyncTransport implements SyncTransport {

    private static final Logger LOG = LogManager.getLogger(OkHttpSyncTransport.class);

    private final OkHttpClient httpClient;

    public OkHttpSyncTransport(SyncProperties props) {
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .writeTimeout(props.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .pingInterval(props.getPingInterval().toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public SyncConnection open(URI target, SyncTransportListener listener) {
        Request request = new Request.Builder().url(target.toString()).build();
        LOG.debug("Opening WebSocket to {}", target.getHost());
        WebSocket socket = httpClient.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                listener.onOpen(new OkHttpConnection(webSocket));
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                listener.onMessage(new OkHttpConnection(webSocket), text);
            }

            @Override
            public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(1000, null);
            }

            @Override
            public void onClosed(WebSocket webSocket, int code, String reason) {
                listener.onClosed(new OkHttpConnection(webSocket), code, reason);
            }

            @Override
            public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                listener.onFailure(new OkHttpConnection(webSocket), t);
            }
        });
        return new OkHttpConnection(socket);
    }

    @PreDestroy
    void shutdown() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private record OkHttpConnection(WebSocket socket) implements SyncConnection {

        @Override
        public boolean send(String text) {
            return socket.send(text);
        }

        @Override
        public void close(int code, String reason) {
            socket.close(code, reason);
        }
    }
}
