package com.esmp.profile;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

@Table("profiles")
public class ProfileEntity {

    @PrimaryKey("pubkey")
    private String pubkey;

    /** Field wire name to value. The address value is ciphertext. */
    @Column("field_values")
    private Map<String, String> values;

    @Column("field_visibility")
    private Map<String, String> visibility;

    @Column("updated_at")
    private Instant updatedAt;

    public ProfileEntity() {}

    public static ProfileEntity from(UserProfile profile) {
        ProfileEntity entity = new ProfileEntity();
        entity.pubkey = profile.pubkey();
        entity.values = new HashMap<>();
        entity.visibility = new HashMap<>();
        profile.fields().forEach((name, field) -> {
            if (field.isSet()) {
                entity.values.put(name.wireName(), field.value());
                entity.visibility.put(name.wireName(), field.visibility().wireName());
            }
        });
        entity.updatedAt = profile.updatedAt();
        return entity;
    }

    public UserProfile toProfile() {
        EnumMap<ProfileFieldName, ProfileField> fields = new EnumMap<>(ProfileFieldName.class);
        if (values != null) {
            values.forEach((wireName, value) -> ProfileFieldName.fromWire(wireName).ifPresent(name -> {
                String stored = visibility == null ? null : visibility.get(wireName);
                Visibility vis = Visibility.fromWire(stored).orElse(Visibility.PRIVATE);
                fields.put(name, new ProfileField(value, vis));
            }));
        }
        return new UserProfile(pubkey, fields, updatedAt);
    }

    public String getPubkey() { return pubkey; }
    public void setPubkey(String pubkey) { this.pubkey = pubkey; }
    public Map<String, String> getValues() { return values; }
    public void setValues(Map<String, String> values) { this.values = values; }
    public Map<String, String> getVisibility() { return visibility; }
    public void setVisibility(Map<String, String> visibility) { this.visibility = visibility; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
