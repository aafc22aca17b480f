package de.htwsaar.urlmap.mapping.model;

/**
 * HTTP-Statuscodes, die eine Zuordnung steuern.
 */
public final class StatusCodes {

    public static final int OK = 200;
    public static final int NO_CONTENT = 204;
    public static final int MOVED_PERMANENTLY = 301;
    public static final int FOUND = 302;
    public static final int NOT_FOUND = 404;
    public static final int GONE = 410;

    private StatusCodes() {}

    public static boolean isRedirect(int statusCode) {
        return statusCode == MOVED_PERMANENTLY || statusCode == FOUND;
    }

    /** 2xx: Inhalt wird ausgeliefert (ggf. über einen Content-Handler). */
    public static boolean isContent(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
