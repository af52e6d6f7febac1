package ai.attackframework.tools.searchengine.suggest;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import javax.swing.SwingUtilities;

import org.apache.hc.core5.concurrent.Cancellable;
import org.apache.hc.core5.concurrent.FutureCallback;

import ai.attackframework.tools.searchengine.OpenSearchEngine;
import ai.attackframework.tools.searchengine.RequestMethod;
import ai.attackframework.tools.searchengine.SearchRequest;
import ai.attackframework.tools.searchengine.net.Transport;
import ai.attackframework.tools.searchengine.utils.Logger;

/**
 * Fetches search suggestions for one engine.
 *
 * <p>State: idle or requesting. At most one request is in flight; a new
 * {@link #requestSuggestions(String)} cancels the previous one first, and a response of a
 * cancelled request is never delivered. Responses that fail, are empty or do not have the
 * suggestion shape are dropped without an event.</p>
 *
 * <p>Threading:
 * The manager belongs to the thread behind {@code eventLoop}. Transport callbacks are
 * re-posted to {@code eventLoop}, so state changes and listener calls happen there and never
 * inside the call that started the request. {@code eventLoop} must queue tasks rather than
 * run them inline. No timeout is applied here; callers with a deadline call {@link #cancel()}
 * when it expires.</p>
 */
public final class SuggestionRequestManager {

    private final OpenSearchEngine engine;
    private final Transport transport;
    private final Executor eventLoop;

    private final List<SuggestionListener> listeners = new CopyOnWriteArrayList<>();

    private PendingRequest pending;

    /** Manager that delivers events on the Swing event dispatch thread. */
    public SuggestionRequestManager(OpenSearchEngine engine, Transport transport) {
        this(engine, transport, SwingUtilities::invokeLater);
    }

    public SuggestionRequestManager(OpenSearchEngine engine, Transport transport, Executor eventLoop) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    }

    public OpenSearchEngine engine() {
        return engine;
    }

    /** Registers a listener for suggestion lists (nullable ignored). */
    public void onSuggestions(SuggestionListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeSuggestionListener(SuggestionListener listener) {
        listeners.remove(listener);
    }

    /** True while a request is in flight. */
    public boolean isRequesting() {
        return pending != null;
    }

    /**
     * Requests suggestions for {@code term}.
     *
     * <p>No-op for an empty term or an engine without a suggestions template. A request
     * already in flight is cancelled and its response discarded.</p>
     */
    public void requestSuggestions(String term) {
        if (term == null || term.isEmpty() || !engine.providesSuggestions()) return;

        cancel();

        Optional<SearchRequest> built = engine.suggestionsRequest(term);
        if (built.isEmpty()) {
            Logger.logDebug("[Suggestions] No usable suggestions URL for engine '" + engine.getName() + "'");
            return;
        }

        SearchRequest request = built.get();
        PendingRequest p = new PendingRequest(term);
        pending = p;
        try {
            p.handle = request.method() == RequestMethod.POST
                    ? transport.post(request.uri(), request.body(), p)
                    : transport.get(request.uri(), p);
        } catch (RuntimeException e) {
            p.detached = true;
            pending = null;
            Logger.logDebug("[Suggestions] Could not start request for '" + term + "': " + e);
        }
    }

    /** Aborts the in-flight request, if any. Safe to call when idle. */
    public void cancel() {
        PendingRequest p = pending;
        if (p == null) return;
        pending = null;
        p.detached = true;
        Cancellable handle = p.handle;
        if (handle != null) {
            handle.cancel();
        }
        Logger.internalDebug("[Suggestions] Cancelled request for '" + p.term + "'");
    }

    // -------- completion (event loop) --------

    private void finished(PendingRequest p, byte[] body) {
        if (pending != p) return;
        pending = null;

        Optional<List<String>> suggestions = SuggestionResponseParser.parse(body);
        if (suggestions.isEmpty()) {
            Logger.internalDebug("[Suggestions] Discarding malformed response for '" + p.term + "'");
            return;
        }
        notifyListeners(suggestions.get());
    }

    private void failed(PendingRequest p, Exception ex) {
        if (pending != p) return;
        pending = null;
        Logger.internalDebug("[Suggestions] Request for '" + p.term + "' failed: "
                + (ex == null ? "cancelled" : ex.toString()));
    }

    private void notifyListeners(List<String> suggestions) {
        for (SuggestionListener l : listeners) {
            try { l.onSuggestions(suggestions); }
            catch (RuntimeException ex) {
                Logger.logError("[Suggestions] Listener threw", ex);
            }
        }
    }

    /**
     * One outstanding request. Detaching flips a flag checked on the transport thread
     * before anything is posted to the event loop.
     */
    private final class PendingRequest implements FutureCallback<byte[]> {
        private final String term;
        private volatile boolean detached;
        private Cancellable handle;

        PendingRequest(String term) {
            this.term = term;
        }

        @Override
        public void completed(byte[] result) {
            if (!detached) eventLoop.execute(() -> finished(this, result));
        }

        @Override
        public void failed(Exception ex) {
            if (!detached) eventLoop.execute(() -> SuggestionRequestManager.this.failed(this, ex));
        }

        @Override
        public void cancelled() {
            if (!detached) eventLoop.execute(() -> SuggestionRequestManager.this.failed(this, null));
        }
    }
}
