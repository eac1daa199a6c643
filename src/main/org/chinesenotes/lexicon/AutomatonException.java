package org.chinesenotes.lexicon;

/**
 * A RuntimeException that indicates a finite state machine was built or walked in a way it does not support.
 */
public class AutomatonException extends RuntimeException {

    public AutomatonException(String msg) {
        super(msg);
    }

}
