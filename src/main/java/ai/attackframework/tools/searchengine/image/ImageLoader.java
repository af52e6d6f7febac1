package ai.attackframework.tools.searchengine.image;

import java.awt.image.BufferedImage;
import java.net.URI;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import javax.swing.SwingUtilities;

import org.apache.hc.core5.concurrent.FutureCallback;

import ai.attackframework.tools.searchengine.OpenSearchEngine;
import ai.attackframework.tools.searchengine.net.Transport;
import ai.attackframework.tools.searchengine.utils.Logger;

/**
 * Lazily loads the image of one engine.
 *
 * <p>{@link #image()} never blocks: without a cached image it starts a fetch of
 * {@link OpenSearchEngine#getImageUrl()} and returns empty. When the bytes arrive and decode
 * to a non-empty image, it is cached on the engine and listeners are told through
 * {@code eventLoop}. Fetch failures are logged at debug level only.</p>
 */
public final class ImageLoader {

    private final OpenSearchEngine engine;
    private final Transport transport;
    private final ImageDecoder decoder;
    private final Executor eventLoop;

    private final List<ImageListener> listeners = new CopyOnWriteArrayList<>();

    private String pendingUrl;
    private String undecodableUrl;

    /** Loader that decodes with ImageIO and notifies on the Swing event dispatch thread. */
    public ImageLoader(OpenSearchEngine engine, Transport transport) {
        this(engine, transport, new ImageIoDecoder(), SwingUtilities::invokeLater);
    }

    public ImageLoader(OpenSearchEngine engine, Transport transport, ImageDecoder decoder, Executor eventLoop) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
    }

    /** Registers an image-changed listener (nullable ignored). */
    public void onImageChanged(ImageListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeImageListener(ImageListener listener) {
        listeners.remove(listener);
    }

    /** True while a fetch is outstanding. */
    public boolean isLoading() {
        return pendingUrl != null;
    }

    /**
     * Returns the cached image, or empty while (or instead of) loading it.
     * An empty image URL never triggers a fetch, and neither does a URL whose bytes
     * already failed to decode.
     */
    public Optional<BufferedImage> image() {
        BufferedImage cached = engine.getImage();
        if (cached != null) return Optional.of(cached);

        String url = engine.getImageUrl();
        if (!url.isEmpty() && !url.equals(pendingUrl) && !url.equals(undecodableUrl)) {
            load(url);
        }
        return Optional.empty();
    }

    /**
     * Sets the image explicitly. When the engine has no image URL yet, a PNG {@code data:}
     * URI of the image becomes its URL.
     */
    public void setImage(BufferedImage image) {
        if (engine.getImageUrl().isEmpty()) {
            ImageIoDecoder.toPngDataUri(image).ifPresent(engine::setImageUrl);
        }
        pendingUrl = null;
        engine.setImage(image);
        eventLoop.execute(this::notifyListeners);
    }

    private void load(String url) {
        if (url.startsWith("data:")) {
            loadDataUri(url);
            return;
        }

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            Logger.logDebug("[Image] Invalid image URL '" + url + "': " + e.getMessage());
            return;
        }

        pendingUrl = url;
        try {
            transport.get(uri, new FutureCallback<>() {
                @Override
                public void completed(byte[] result) {
                    eventLoop.execute(() -> obtained(url, result));
                }

                @Override
                public void failed(Exception ex) {
                    eventLoop.execute(() -> dropped(url, String.valueOf(ex)));
                }

                @Override
                public void cancelled() {
                    eventLoop.execute(() -> dropped(url, "cancelled"));
                }
            });
        } catch (RuntimeException e) {
            pendingUrl = null;
            Logger.logDebug("[Image] Could not start fetch of " + url + ": " + e);
        }
    }

    /** Inline base64 images are decoded without the transport, still off the calling stack. */
    private void loadDataUri(String url) {
        int comma = url.indexOf(',');
        if (comma < 0 || !url.substring(0, comma).endsWith(";base64")) {
            Logger.logDebug("[Image] Unsupported data URI: " + url.substring(0, Math.min(url.length(), 40)));
            return;
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(url.substring(comma + 1).trim());
        } catch (IllegalArgumentException e) {
            Logger.logDebug("[Image] Malformed base64 in data URI: " + e.getMessage());
            return;
        }
        pendingUrl = url;
        eventLoop.execute(() -> obtained(url, bytes));
    }

    private void obtained(String url, byte[] bytes) {
        if (!url.equals(pendingUrl)) return;
        pendingUrl = null;
        if (!url.equals(engine.getImageUrl())) return;

        Optional<BufferedImage> decoded = decoder.decode(bytes);
        if (decoded.isEmpty()) {
            // not fetched again until the engine points at another URL
            undecodableUrl = url;
            Logger.internalDebug("[Image] No image decoded from " + url);
            return;
        }
        engine.setImage(decoded.get());
        notifyListeners();
    }

    private void dropped(String url, String reason) {
        if (!url.equals(pendingUrl)) return;
        pendingUrl = null;
        Logger.internalDebug("[Image] Fetch of " + url + " failed: " + reason);
    }

    private void notifyListeners() {
        for (ImageListener l : listeners) {
            try { l.onImageChanged(); }
            catch (RuntimeException ex) {
                Logger.logError("[Image] Listener threw", ex);
            }
        }
    }
}
