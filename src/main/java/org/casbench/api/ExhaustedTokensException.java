package org.casbench.api;

/**
 * Thrown when a consumer of the token stream asks for another token after the
 * end-of-stream marker has been reached.
 */
public final class ExhaustedTokensException extends CasBenchException {

    private final int position;

    /**
     * @param message The detail message supplied by the consumer.
     * @param position The index of the end-of-stream token in the token list.
     */
    public ExhaustedTokensException(String message, int position) {
        super(String.format("%s: token stream exhausted at token %d", message, position));
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
