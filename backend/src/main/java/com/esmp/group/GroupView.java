package com.esmp.group;

import com.esmp.envelope.Address;

import java.time.Instant;
import java.util.Set;

/**
 * Group metadata as returned by {@code GET /groups/{groupId}}. Key bindings stay internal.
 */
public record GroupView(
        String groupId,
        String groupName,
        String groupDescription,
        String groupDpUrl,
        Set<Address> admins,
        Set<Address> members,
        Instant createdAt,
        Instant updatedAt
) {

    public static GroupView of(GroupMetadata group) {
        return new GroupView(group.groupId(), group.name(), group.description(), group.dpUrl(),
                group.admins(), group.members(), group.createdAt(), group.updatedAt());
    }
}
