package bouncer.spi;

/**
 * Exception thrown when a storage provider cannot be found or fails to initialize.
 */
public class StorageProviderException extends RuntimeException {

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
