package org.gc.socialpublisher.repository;

import org.gc.socialpublisher.domain.PostRecord;
import org.gc.socialpublisher.domain.PostStatus;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PostRecordRepository extends ElasticsearchRepository<PostRecord, Long> {

    Optional<PostRecord> findByIgMediaId(String igMediaId);

    List<PostRecord> findByStatus(PostStatus status);

    List<PostRecord> findByStatusIn(Collection<PostStatus> statuses);

    List<PostRecord> findByPublishedAtUtcAfter(Instant since);

    Optional<PostRecord> findFirstByOrderByIdDesc();
}
