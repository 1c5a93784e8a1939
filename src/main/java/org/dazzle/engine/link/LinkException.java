package org.dazzle.engine.link;

/**
 * Fatal linking error: a symbol defined twice, a duplicate module, or a
 * {@code use} of a module that does not exist.
 */
public class LinkException extends RuntimeException {

    public LinkException(String message) {
        super(message);
    }
}
