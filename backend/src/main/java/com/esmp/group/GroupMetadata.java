package com.esmp.group;

import com.esmp.envelope.Address;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable state of one group. Every transition returns a new instance.
 *
 * @param memberKeys public key each member was admitted with
 * @param lastSeq    thread-log sequence number of the last transition folded into this state
 */
public record GroupMetadata(
        String groupId,
        String name,
        String description,
        String dpUrl,
        SortedSet<Address> admins,
        SortedSet<Address> members,
        SortedMap<Address, String> memberKeys,
        Instant createdAt,
        Instant updatedAt,
        long lastSeq
) {

    public GroupMetadata {
        admins = Collections.unmodifiableSortedSet(new TreeSet<>(admins));
        members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
        memberKeys = Collections.unmodifiableSortedMap(new TreeMap<>(memberKeys));
        if (!members.containsAll(admins)) {
            throw new IllegalStateException("Admins of " + groupId + " must all be members");
        }
    }

    public static GroupMetadata create(String groupId, Address creator, String creatorKey, Instant createdAt,
                                       String name, String description, String dpUrl) {
        TreeSet<Address> founders = new TreeSet<>();
        founders.add(creator);
        TreeMap<Address, String> keys = new TreeMap<>();
        keys.put(creator, creatorKey);
        return new GroupMetadata(groupId, name, description, dpUrl, founders, founders, keys,
                createdAt, createdAt, 0L);
    }

    public boolean isMember(Address address) {
        return members.contains(address);
    }

    public boolean isAdmin(Address address) {
        return admins.contains(address);
    }

    public Optional<String> boundKey(Address member) {
        return Optional.ofNullable(memberKeys.get(member));
    }

    public GroupMetadata withMember(Address member, String key) {
        TreeSet<Address> nextMembers = new TreeSet<>(members);
        nextMembers.add(member);
        TreeMap<Address, String> nextKeys = new TreeMap<>(memberKeys);
        nextKeys.put(member, key);
        return new GroupMetadata(groupId, name, description, dpUrl, admins, nextMembers, nextKeys,
                createdAt, updatedAt, lastSeq);
    }

    /** Drops the member, any admin role it held, and its key binding. */
    public GroupMetadata withoutMember(Address member) {
        TreeSet<Address> nextMembers = new TreeSet<>(members);
        nextMembers.remove(member);
        TreeSet<Address> nextAdmins = new TreeSet<>(admins);
        nextAdmins.remove(member);
        TreeMap<Address, String> nextKeys = new TreeMap<>(memberKeys);
        nextKeys.remove(member);
        return new GroupMetadata(groupId, name, description, dpUrl, nextAdmins, nextMembers, nextKeys,
                createdAt, updatedAt, lastSeq);
    }

    public GroupMetadata withAdmin(Address member) {
        TreeSet<Address> nextAdmins = new TreeSet<>(admins);
        nextAdmins.add(member);
        return new GroupMetadata(groupId, name, description, dpUrl, nextAdmins, members, memberKeys,
                createdAt, updatedAt, lastSeq);
    }

    public GroupMetadata withoutAdmin(Address member) {
        TreeSet<Address> nextAdmins = new TreeSet<>(admins);
        nextAdmins.remove(member);
        return new GroupMetadata(groupId, name, description, dpUrl, nextAdmins, members, memberKeys,
                createdAt, updatedAt, lastSeq);
    }

    public GroupMetadata withName(String newName) {
        return new GroupMetadata(groupId, newName, description, dpUrl, admins, members, memberKeys,
                createdAt, updatedAt, lastSeq);
    }

    public GroupMetadata withDescription(String newDescription) {
        return new GroupMetadata(groupId, name, newDescription, dpUrl, admins, members, memberKeys,
                createdAt, updatedAt, lastSeq);
    }

    public GroupMetadata withDpUrl(String newDpUrl) {
        return new GroupMetadata(groupId, name, description, newDpUrl, admins, members, memberKeys,
                createdAt, updatedAt, lastSeq);
    }

    public GroupMetadata withUpdatedAt(Instant timestamp) {
        return new GroupMetadata(groupId, name, description, dpUrl, admins, members, memberKeys,
                createdAt, timestamp, lastSeq);
    }

    public GroupMetadata withLastSeq(long seq) {
        return new GroupMetadata(groupId, name, description, dpUrl, admins, members, memberKeys,
                createdAt, updatedAt, seq);
    }

    /** Members keyed by their string form, for storage. */
    public Map<String, String> memberKeysByAddress() {
        TreeMap<String, String> byAddress = new TreeMap<>();
        memberKeys.forEach((member, key) -> byAddress.put(member.toString(), key));
        return byAddress;
    }
}
