package com.phillippitts.mindscribe.service.delivery;

import com.phillippitts.mindscribe.domain.SessionCommand;
import com.phillippitts.mindscribe.service.session.SessionController;
import com.phillippitts.mindscribe.service.session.event.SessionCancelledEvent;
import com.phillippitts.mindscribe.service.session.event.SessionCompletedEvent;
import com.phillippitts.mindscribe.service.session.event.SessionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Terminal-event observer: delivers completed transcripts and acknowledges every terminal state
 * so the controller returns to Idle. Acknowledgement is enqueued, never applied inline.
 */
@Component
public class TranscriptDeliveryListener {
    private static final Logger LOG = LogManager.getLogger(TranscriptDeliveryListener.class);

    private final TextInserter inserter;
    private final SessionController controller;

    public TranscriptDeliveryListener(TextInserter inserter, SessionController controller) {
        this.inserter = Objects.requireNonNull(inserter, "inserter must not be null");
        this.controller = Objects.requireNonNull(controller, "controller must not be null");
    }

    @EventListener
    public void onCompleted(SessionCompletedEvent evt) {
        try {
            boolean delivered = inserter.insert(evt.result().text());
            if (!delivered) {
                LOG.warn("Transcript of session {} not delivered by {}", evt.sessionId(), inserter.name());
            }
        } catch (RuntimeException e) {
            LOG.warn("Delivery via {} failed: {}", inserter.name(), e.toString());
        } finally {
            acknowledge();
        }
    }

    @EventListener
    public void onFailed(SessionFailedEvent evt) {
        acknowledge();
    }

    @EventListener
    public void onCancelled(SessionCancelledEvent evt) {
        acknowledge();
    }

    private void acknowledge() {
        controller.submit(SessionCommand.ACKNOWLEDGE);
    }
}
