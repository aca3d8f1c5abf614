package com.esmp.profile;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProfileRepository extends ReactiveCassandraRepository<ProfileEntity, String> {
}
