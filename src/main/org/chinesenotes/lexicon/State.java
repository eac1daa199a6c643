package org.chinesenotes.lexicon;

/**
 * Represents a state in a finite state machine. A state is identified by an id that is unique within the machine
 * that created it, and is accepting if reaching it with the input exhausted means the input was recognized.
 */
public final class State {

    private final int id;

    // Flipped by the owning machine as terms are added, never reset.
    private volatile boolean accepting;

    State(int id, boolean accepting) {
        this.id = id;
        this.accepting = accepting;
    }

    public int getId() {
        return id;
    }

    public boolean isAccepting() {
        return accepting;
    }

    void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id == ((State) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return accepting ? "S" + id + "*" : "S" + id;
    }
}
