package ai.attackframework.tools.searchengine.net;

import java.io.Closeable;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Future;

import org.apache.hc.client5.http.async.methods.SimpleHttpRequest;
import org.apache.hc.client5.http.async.methods.SimpleHttpResponse;
import org.apache.hc.client5.http.async.methods.SimpleRequestBuilder;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.impl.async.HttpAsyncClients;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.concurrent.FutureCallback;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;

import ai.attackframework.tools.searchengine.utils.Logger;
import ai.attackframework.tools.searchengine.utils.Version;

/**
 * {@link Transport} backed by the Apache HttpClient 5 async client.
 *
 * <p>Ownership:
 * The transport owns its client and starts it on construction. Share one instance between
 * engines and close it when the host shuts down.</p>
 */
public final class HttpClient5Transport implements Transport, Closeable {

    private final CloseableHttpAsyncClient client;

    public HttpClient5Transport() {
        this(TransportSettings.defaults());
    }

    public HttpClient5Transport(TransportSettings settings) {
        Objects.requireNonNull(settings, "settings");
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(settings.connectTimeout().toMillis()))
                .build();
        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(settings.responseTimeout().toMillis()))
                .build();

        this.client = HttpAsyncClients.custom()
                .setConnectionManager(PoolingAsyncClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent(settings.userAgent().isEmpty() ? defaultUserAgent() : settings.userAgent())
                .build();
        this.client.start();
    }

    @Override
    public Cancellable get(URI uri, FutureCallback<byte[]> callback) {
        return execute(SimpleRequestBuilder.get(uri).build(), callback);
    }

    @Override
    public Cancellable post(URI uri, byte[] body, FutureCallback<byte[]> callback) {
        SimpleHttpRequest request = SimpleRequestBuilder.post(uri)
                .setBody(body == null ? new byte[0] : body, ContentType.APPLICATION_FORM_URLENCODED)
                .build();
        return execute(request, callback);
    }

    private Cancellable execute(SimpleHttpRequest request, FutureCallback<byte[]> callback) {
        Objects.requireNonNull(callback, "callback");
        Logger.internalDebug("[Transport] " + request.getMethod() + " " + request.getRequestUri());

        Future<SimpleHttpResponse> future = client.execute(request, new FutureCallback<>() {
            @Override
            public void completed(SimpleHttpResponse response) {
                int code = response.getCode();
                if (code >= 400) {
                    callback.failed(new TransportException(
                            "HTTP " + code + " for " + request.getRequestUri(), code));
                    return;
                }
                byte[] bytes = response.getBodyBytes();
                callback.completed(bytes == null ? new byte[0] : bytes);
            }

            @Override
            public void failed(Exception ex) {
                callback.failed(ex);
            }

            @Override
            public void cancelled() {
                callback.cancelled();
            }
        });
        return () -> future.cancel(true);
    }

    /** Stops the I/O reactor and drops pending exchanges. */
    @Override
    public void close() {
        client.close(CloseMode.GRACEFUL);
    }

    private static String defaultUserAgent() {
        try {
            return "searchengine/" + Version.get();
        } catch (IllegalStateException e) {
            Logger.internalDebug("[Transport] " + e.getMessage());
            return "searchengine";
        }
    }
}
