package ai.attackframework.tools.searchengine.image;

import java.awt.image.BufferedImage;
import java.util.Optional;

/** Turns fetched bytes into an image. */
@FunctionalInterface
public interface ImageDecoder {

    /**
     * @param bytes raw image data
     * @return the decoded image, or empty when the data is not a supported, non-empty image
     */
    Optional<BufferedImage> decode(byte[] bytes);
}
