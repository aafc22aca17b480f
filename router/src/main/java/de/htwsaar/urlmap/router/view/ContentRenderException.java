package de.htwsaar.urlmap.router.view;

/**
 * Eine eingebaute View kann ihren Inhalt nicht erzeugen (z. B. fehlendes Template).
 */
public class ContentRenderException extends RuntimeException {

    public ContentRenderException(String message) {
        super(message);
    }

    public ContentRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
