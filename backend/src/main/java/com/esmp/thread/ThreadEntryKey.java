package com.esmp.thread;

import org.springframework.data.cassandra.core.cql.Ordering;
import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

import java.io.Serializable;

@PrimaryKeyClass
public record ThreadEntryKey(
    @PrimaryKeyColumn(name = "thread_key", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    String threadKey,

    @PrimaryKeyColumn(name = "seq", ordinal = 1, type = PrimaryKeyType.CLUSTERED, ordering = Ordering.ASCENDING)
    long seq
) implements Serializable {}
