package com.esmp.profile;

/**
 * Headers an owner sends to read their own full profile: a timestamp and a signature by the
 * profile key over the canonical form of {@code {"as", "pubkey", "timestamp"}}.
 */
public record OwnerProof(String timestamp, String signature) {

    public static final String TIMESTAMP_HEADER = "X-ESMP-Timestamp";
    public static final String SIGNATURE_HEADER = "X-ESMP-Signature";

    public boolean isPresent() {
        return timestamp != null && !timestamp.isBlank() && signature != null && !signature.isBlank();
    }
}
