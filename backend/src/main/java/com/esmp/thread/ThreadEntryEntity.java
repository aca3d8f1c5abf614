package com.esmp.thread;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

@Table("thread_log")
public class ThreadEntryEntity {

    @PrimaryKey
    private ThreadEntryKey key;

    /** The accepted envelope, signature fields included, as compact JSON. */
    @Column("envelope")
    private String envelope;

    @Column("sender_pubkey")
    private String senderPubkey;

    @Column("appended_at")
    private Instant appendedAt;

    public ThreadEntryEntity() {}

    public ThreadEntryEntity(ThreadEntryKey key, String envelope, String senderPubkey, Instant appendedAt) {
        this.key = key;
        this.envelope = envelope;
        this.senderPubkey = senderPubkey;
        this.appendedAt = appendedAt;
    }

    public ThreadEntryKey getKey() { return key; }
    public void setKey(ThreadEntryKey key) { this.key = key; }
    public String getEnvelope() { return envelope; }
    public void setEnvelope(String envelope) { this.envelope = envelope; }
    public String getSenderPubkey() { return senderPubkey; }
    public void setSenderPubkey(String senderPubkey) { this.senderPubkey = senderPubkey; }
    public Instant getAppendedAt() { return appendedAt; }
    public void setAppendedAt(Instant appendedAt) { this.appendedAt = appendedAt; }
}
