package com.jreinhal.compass.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns document changes into schema regeneration requests. Deleting the last document of
 * a namespace clears it instead.
 */
@Component
public class DocumentEventListener {
    private static final Logger log = LoggerFactory.getLogger(DocumentEventListener.class);
    private final SchemaCacheCoordinator coordinator;

    public DocumentEventListener(SchemaCacheCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @EventListener
    public void onDocumentChanged(DocumentChangedEvent event) {
        if (event.namespace() == null || event.namespace().isBlank()) {
            log.warn("Ignoring document event without namespace (type: {})", event.type());
            return;
        }
        if (event.type() == DocumentChangedEvent.ChangeType.DELETE && event.remainingDocuments() == 0L) {
            log.info("Last document removed from {}, clearing namespace", event.namespace());
            this.coordinator.clearNamespace(event.namespace());
            return;
        }
        UpdateReason reason = event.type() == DocumentChangedEvent.ChangeType.UPLOAD
                ? UpdateReason.DOCUMENT_UPLOAD : UpdateReason.DOCUMENT_DELETE;
        this.coordinator.requestUpdate(event.namespace(), reason, event.documentId())
                .thenAccept(success -> log.debug("Regeneration for {} after {} finished (success: {})",
                        event.namespace(), reason.id(), success));
    }
}
