package com.esmp.group;

import com.esmp.envelope.Address;
import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Snapshot of a group's state after the transition at {@code lastSeq}. The group's thread log
 * stays authoritative: entries after {@code lastSeq} are replayed on load.
 */
@Table("groups")
public class GroupEntity {

    @PrimaryKey("group_id")
    private String groupId;

    @Column("group_name")
    private String name;

    @Column("group_description")
    private String description;

    @Column("group_dp_url")
    private String dpUrl;

    @Column("admins")
    private Set<String> admins;

    @Column("members")
    private Set<String> members;

    @Column("member_keys")
    private Map<String, String> memberKeys;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    @Column("last_seq")
    private long lastSeq;

    public GroupEntity() {}

    public static GroupEntity from(GroupMetadata group) {
        GroupEntity entity = new GroupEntity();
        entity.groupId = group.groupId();
        entity.name = group.name();
        entity.description = group.description();
        entity.dpUrl = group.dpUrl();
        entity.admins = toStrings(group.admins());
        entity.members = toStrings(group.members());
        entity.memberKeys = new HashMap<>(group.memberKeysByAddress());
        entity.createdAt = group.createdAt();
        entity.updatedAt = group.updatedAt();
        entity.lastSeq = group.lastSeq();
        return entity;
    }

    public GroupMetadata toMetadata() {
        TreeMap<Address, String> keys = new TreeMap<>();
        if (memberKeys != null) {
            memberKeys.forEach((member, key) -> keys.put(Address.parse(member), key));
        }
        return new GroupMetadata(groupId, name, description, dpUrl,
                toAddresses(admins), toAddresses(members), keys, createdAt, updatedAt, lastSeq);
    }

    private static Set<String> toStrings(Set<Address> addresses) {
        Set<String> result = new HashSet<>();
        addresses.forEach(address -> result.add(address.toString()));
        return result;
    }

    private static TreeSet<Address> toAddresses(Set<String> values) {
        TreeSet<Address> result = new TreeSet<>();
        if (values != null) {
            values.forEach(value -> result.add(Address.parse(value)));
        }
        return result;
    }

    public String getGroupId() { return groupId; }
    public void setGroupId(String groupId) { this.groupId = groupId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getDpUrl() { return dpUrl; }
    public void setDpUrl(String dpUrl) { this.dpUrl = dpUrl; }
    public Set<String> getAdmins() { return admins; }
    public void setAdmins(Set<String> admins) { this.admins = admins; }
    public Set<String> getMembers() { return members; }
    public void setMembers(Set<String> members) { this.members = members; }
    public Map<String, String> getMemberKeys() { return memberKeys; }
    public void setMemberKeys(Map<String, String> memberKeys) { this.memberKeys = memberKeys; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public long getLastSeq() { return lastSeq; }
    public void setLastSeq(long lastSeq) { this.lastSeq = lastSeq; }
}
