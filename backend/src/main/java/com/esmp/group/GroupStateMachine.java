package com.esmp.group;

import com.esmp.envelope.Address;
import com.esmp.envelope.SystemEnvelope;
import com.esmp.envelope.SystemEvent;
import com.esmp.error.ErrorKind;
import com.esmp.error.EsmpException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * The group transition function. Given the current state (or {@code null} for a group that
 * does not exist yet) and a validated system envelope, returns the next state or throws.
 * Holds no state and performs no I/O; callers serialise per group.
 *
 * <p>Checks run in this order: existence, timestamp ordering, actor key binding,
 * authorization, membership precondition.
 */
@Component
public class GroupStateMachine {

    public GroupMetadata apply(GroupMetadata current, SystemEnvelope envelope) {
        String groupId = envelope.groupId()
                .orElseThrow(() -> EsmpException.schema("group_id", "is required"));
        SystemEvent event = envelope.event();
        Address actor = envelope.actor();
        Instant timestamp = envelope.timestamp();

        if (event instanceof SystemEvent.GroupCreated created) {
            if (current != null) {
                throw new EsmpException(ErrorKind.DUPLICATE_GROUP, "Group " + groupId + " already exists");
            }
            return GroupMetadata.create(groupId, actor, envelope.senderPubkey(), timestamp,
                    created.name(), created.description(), created.dpUrl());
        }
        if (current == null) {
            throw new EsmpException(ErrorKind.UNKNOWN_GROUP, "Group " + groupId + " does not exist");
        }
        if (!timestamp.isAfter(current.updatedAt())) {
            throw new EsmpException(ErrorKind.STALE_MUTATION,
                    "timestamp " + timestamp + " is not after " + current.updatedAt() + " for group " + groupId);
        }
        current.boundKey(actor).ifPresent(bound -> {
            if (!bound.equals(envelope.senderPubkey())) {
                throw new EsmpException(ErrorKind.FORBIDDEN, actor + " is bound to a different key in " + groupId);
            }
        });

        return transition(current, event, actor, envelope.senderPubkey()).withUpdatedAt(timestamp);
    }

    private GroupMetadata transition(GroupMetadata group, SystemEvent event, Address actor, String actorKey) {
        if (event instanceof SystemEvent.Joined) {
            if (group.isMember(actor)) {
                throw invalid(actor + " is already a member");
            }
            return group.withMember(actor, actorKey);
        }
        if (event instanceof SystemEvent.Left) {
            if (!group.isMember(actor)) {
                throw invalid(actor + " is not a member");
            }
            return group.withoutMember(actor);
        }
        if (event instanceof SystemEvent.Removed removed) {
            requireAdmin(group, actor);
            if (!group.isMember(removed.target())) {
                throw invalid(removed.target() + " is not a member");
            }
            return group.withoutMember(removed.target());
        }
        if (event instanceof SystemEvent.AdminAssigned assigned) {
            requireAdmin(group, actor);
            if (!group.isMember(assigned.target())) {
                throw invalid(assigned.target() + " is not a member");
            }
            return group.withAdmin(assigned.target());
        }
        if (event instanceof SystemEvent.AdminRevoked revoked) {
            requireAdmin(group, actor);
            if (!group.isAdmin(revoked.target())) {
                throw invalid(revoked.target() + " is not an admin");
            }
            return group.withoutAdmin(revoked.target());
        }
        if (event instanceof SystemEvent.GroupRenamed renamed) {
            requireAdmin(group, actor);
            return group.withName(renamed.newName());
        }
        if (event instanceof SystemEvent.DescriptionUpdated updated) {
            requireAdmin(group, actor);
            return group.withDescription(updated.newDescription());
        }
        if (event instanceof SystemEvent.DpUpdated updated) {
            requireAdmin(group, actor);
            return group.withDpUrl(updated.newDpUrl());
        }
        throw EsmpException.schema("subtype", event.subtype().wireName() + " does not apply to groups");
    }

    private static void requireAdmin(GroupMetadata group, Address actor) {
        if (!group.isAdmin(actor)) {
            throw new EsmpException(ErrorKind.FORBIDDEN, actor + " is not an admin of " + group.groupId());
        }
    }

    private static EsmpException invalid(String message) {
        return new EsmpException(ErrorKind.INVALID_TRANSITION, message);
    }
}
