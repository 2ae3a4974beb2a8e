package org.gc.socialpublisher.repository;

import org.gc.socialpublisher.domain.ScheduleConfig;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduleConfigRepository extends ElasticsearchRepository<ScheduleConfig, String> {
}
