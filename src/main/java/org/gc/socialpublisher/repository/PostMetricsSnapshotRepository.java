package org.gc.socialpublisher.repository;

import org.gc.socialpublisher.domain.PostMetricsSnapshot;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PostMetricsSnapshotRepository extends ElasticsearchRepository<PostMetricsSnapshot, String> {

    List<PostMetricsSnapshot> findByPostIdOrderByCollectedAtUtcDesc(Long postId);
}
