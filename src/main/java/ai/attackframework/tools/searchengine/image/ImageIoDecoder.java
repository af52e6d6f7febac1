package ai.attackframework.tools.searchengine.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Optional;

import javax.imageio.ImageIO;

import ai.attackframework.tools.searchengine.utils.Logger;

/**
 * {@link ImageDecoder} using {@link ImageIO}. Formats are whatever the installed ImageIO
 * readers support: PNG, GIF, JPEG and BMP from the JDK, ICO and CUR from the TwelveMonkeys
 * {@code imageio-bmp} plugin, which ImageIO picks up from the class path.
 */
public final class ImageIoDecoder implements ImageDecoder {

    static final String PNG_DATA_URI_PREFIX = "data:image/png;base64,";

    @Override
    public Optional<BufferedImage> decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return Optional.empty();
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
                return Optional.empty();
            }
            return Optional.of(image);
        } catch (IOException e) {
            Logger.internalDebug("[Image] Decoding failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Encodes {@code image} as a PNG {@code data:} URI.
     *
     * @return the URI, or empty when no PNG writer accepts the image
     */
    public static Optional<String> toPngDataUri(BufferedImage image) {
        if (image == null) return Optional.empty();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, "png", out)) return Optional.empty();
        } catch (IOException e) {
            Logger.internalDebug("[Image] PNG encoding failed: " + e.getMessage());
            return Optional.empty();
        }
        return Optional.of(PNG_DATA_URI_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray()));
    }
}
