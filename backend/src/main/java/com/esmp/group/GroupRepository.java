package com.esmp.group;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GroupRepository extends ReactiveCassandraRepository<GroupEntity, String> {
    // Inherits: findById(groupId), save(snapshot)
}
