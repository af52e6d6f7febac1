package ai.attackframework.tools.searchengine.image;

/** Notified when the engine image has been loaded or replaced. */
@FunctionalInterface
public interface ImageListener {
    void onImageChanged();
}
