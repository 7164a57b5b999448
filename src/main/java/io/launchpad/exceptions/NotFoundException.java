package io.launchpad.exceptions;

/**
 * Lookup of a firework, workflow or launch by id found nothing.
 */
public class NotFoundException extends LaunchPadException {

    private final String entityType;
    private final long entityId;

    public NotFoundException(String entityType, long entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public static NotFoundException firework(long fwId) {
        return new NotFoundException("firework", fwId);
    }

    public static NotFoundException workflow(long wfId) {
        return new NotFoundException("workflow", wfId);
    }

    public static NotFoundException launch(long launchId) {
        return new NotFoundException("launch", launchId);
    }

    public String getEntityType() {
        return entityType;
    }

    public long getEntityId() {
        return entityId;
    }
}
