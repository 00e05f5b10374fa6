package semisup.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, in-memory {@link IterationTrace}.
 */
public class ListIterationTrace implements IterationTrace {

    private final List<IterationEvent> events = new ArrayList<>();

    @Override
    public synchronized void record(IterationEvent event) {
        this.events.add(event);
    }

    public synchronized List<IterationEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(this.events));
    }

    public synchronized List<IterationEvent> getEvents(IterationEvent.Kind kind) {
        List<IterationEvent> selected = new ArrayList<>();
        for (IterationEvent event : this.events) {
            if (event.getKind() == kind) {
                selected.add(event);
            }
        }
        return selected;
    }
}
