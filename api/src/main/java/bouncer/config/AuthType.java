package bouncer.config;

/**
 * Where the HTTP adapter takes the subject of a request from.
 */
public enum AuthType {
    /**
     * The user name of an {@code Authorization: Basic} header.
     */
    BASIC,

    /**
     * A claim of an {@code Authorization: Bearer} JWT.
     */
    JWT
}
