package com.autoposter.repository;

import com.autoposter.model.PostRecord;
import com.autoposter.service.PostHistoryFilter;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

public final class PostRecordSpecifications {

    private PostRecordSpecifications() {
    }

    public static Specification<PostRecord> matching(PostHistoryFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.status() != null) {
                predicates.add(cb.equal(root.get("status"), filter.status()));
            }
            if (filter.topicId() != null) {
                predicates.add(cb.equal(root.get("topicId"), filter.topicId()));
            }
            if (filter.createdFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<OffsetDateTime>get("createdAt"), filter.createdFrom()));
            }
            if (filter.createdTo() != null) {
                predicates.add(cb.lessThan(root.<OffsetDateTime>get("createdAt"), filter.createdTo()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
