package io.statuswire.application.service;

import io.statuswire.application.port.output.StatusRepository;
import io.statuswire.domain.model.StatusChange;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.domain.model.StatusUri;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Local write path for statuses the user set or removed through this service.
 *
 * The record has already been written to the user's remote repository by the caller. This service
 * mirrors it into the local view and announces it to webhooks without waiting for delivery.
 */
public final class StatusWriteService {
    private static final Logger log = LoggerFactory.getLogger(StatusWriteService.class);

    private final StatusRepository statusRepo;
    private final EventDispatcher dispatcher;

    public StatusWriteService(StatusRepository statusRepo, EventDispatcher dispatcher) {
        this.statusRepo = statusRepo;
        this.dispatcher = dispatcher;
    }

    public void statusCreated(StatusRecord record) {
        statusCreated(record, null);
    }

    public void statusCreated(StatusRecord record, String handle) {
        statusRepo.upsert(record);
        log.info("[STATUS] {} set {} ({})", record.authorDid(), record.emoji(), record.uri());
        dispatcher.dispatch(record.authorDid(), StatusChange.created(record, handle));
    }

    /**
     * @throws IllegalArgumentException if {@code uri} is not one of the owner's records
     */
    public void statusDeleted(String ownerDid, String uri) {
        StatusUri parsed = StatusUri.parse(uri);
        if (!parsed.authorDid().equals(ownerDid)) {
            throw new IllegalArgumentException("Status " + uri + " does not belong to " + ownerDid);
        }
        statusRepo.deleteByUri(uri);
        log.info("[STATUS] {} deleted {}", ownerDid, uri);
        dispatcher.dispatch(ownerDid, StatusChange.deleted(ownerDid, uri));
    }

    /**
     * Removes the owner's current status, if any.
     *
     * @return the status that was cleared
     */
    public Optional<StatusRecord> clearStatus(String ownerDid) {
        Optional<StatusRecord> current = statusRepo.findCurrentByAuthor(ownerDid);
        if (current.isEmpty()) {
            log.debug("[STATUS] {} has no status to clear", ownerDid);
            return Optional.empty();
        }
        StatusRecord previous = current.get();
        statusRepo.deleteByUri(previous.uri());
        log.info("[STATUS] {} cleared {}", ownerDid, previous.uri());
        dispatcher.dispatch(ownerDid, StatusChange.cleared(previous));
        return current;
    }
}
