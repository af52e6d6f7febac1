package ai.attackframework.tools.searchengine.net;

import java.net.URI;

import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.concurrent.FutureCallback;

/**
 * Asynchronous byte transport used for suggestion and image fetches.
 *
 * <p>Both calls return immediately. The callback fires later, on a thread chosen by the
 * implementation, with the response body, a failure, or a cancellation. The returned
 * handle aborts the exchange on a best-effort basis.</p>
 */
public interface Transport {

    /** Issues a GET request for {@code uri}. */
    Cancellable get(URI uri, FutureCallback<byte[]> callback);

    /** Issues a POST request for {@code uri} with a form-encoded {@code body}. */
    Cancellable post(URI uri, byte[] body, FutureCallback<byte[]> callback);
}
