package com.klubtool.backend.modules.access.domain;

import java.util.UUID;

/**
 * What an action is aimed at: the resource type plus the aggregates that own the object, where known.
 * A target without owners stands for the resource as a whole (listing, creating).
 */
public record AccessTarget(
        ResourceType resource,
        UUID groupId,
        UUID localId,
        UUID councilId,
        UUID committeeId,
        UUID committeeMeetingId
) {

    public static AccessTarget of(ResourceType resource) {
        return new AccessTarget(resource, null, null, null, null, null);
    }

    public AccessTarget withGroup(UUID groupId) {
        return new AccessTarget(resource, groupId, localId, councilId, committeeId, committeeMeetingId);
    }

    public AccessTarget withLocal(UUID localId) {
        return new AccessTarget(resource, groupId, localId, councilId, committeeId, committeeMeetingId);
    }

    public AccessTarget withCouncil(UUID councilId) {
        return new AccessTarget(resource, groupId, localId, councilId, committeeId, committeeMeetingId);
    }

    public AccessTarget withCommittee(UUID committeeId) {
        return new AccessTarget(resource, groupId, localId, councilId, committeeId, committeeMeetingId);
    }

    public AccessTarget withCommitteeMeeting(UUID committeeMeetingId) {
        return new AccessTarget(resource, groupId, localId, councilId, committeeId, committeeMeetingId);
    }
}
