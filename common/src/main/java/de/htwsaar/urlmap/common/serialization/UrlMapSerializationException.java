package de.htwsaar.urlmap.common.serialization;

public class UrlMapSerializationException extends RuntimeException {

    public UrlMapSerializationException(String message) {

        super(message);
    }

    public UrlMapSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
