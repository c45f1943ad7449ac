package im.arun.scenebridge.image;

public class ImageUnavailableException extends RuntimeException {
    public ImageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
