package com.masterplan.components.eventbus;

import com.masterplan.components.Component;
import com.masterplan.components.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

/**
 * Shared listener registration across all components. A component that produces notifications (the job store, the
 * HTTP API) sends events here without knowing who consumes them.
 *
 * By default handlers run asynchronously on the light pool of the TaskScheduler. Handlers that declare themselves
 * synchronous run in the sending thread. Event handlers should never themselves trigger more events.
 */
public class EventBus implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final TaskScheduler taskScheduler;

    // Linear scan through handlers is simpler than a class hierarchy lookup table, and fine for a few handlers.
    private final List<EventHandler> handlers = new ArrayList<>();

    public EventBus (TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /** This class is not synchronized, so you should add all handlers at once before any events are fired. */
    public void addHandlers (EventHandler... handlers) {
        checkState(this.handlers.isEmpty());
        for (EventHandler handler : handlers) {
            LOG.info("An instance of {} will receive events.", handler.getClass().getSimpleName());
            this.handlers.add(handler);
        }
    }

    public <T extends Event> void send (final T event) {
        LOG.debug("Bus received event: {}", event);
        for (EventHandler handler : handlers) {
            if (!handler.acceptEvent(event)) continue;
            if (handler.synchronous()) {
                try {
                    handler.handleEvent(event);
                } catch (Throwable t) {
                    // Do not recursively fire events on errors, there is some programming mistake.
                    LOG.error("Event handler {} failed.", handler, t);
                }
            } else {
                taskScheduler.enqueueLightTask(() -> handler.handleEvent(event));
            }
        }
    }

}
