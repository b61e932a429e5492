package com.autoposter.service;

import com.autoposter.model.PostRecord;
import com.autoposter.repository.PostRecordRepository;
import com.autoposter.repository.PostRecordSpecifications;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Append-only store of cycle outcomes. Records are never updated; {@link #clear()} is the
 * only way anything is removed.
 */
@Service
@RequiredArgsConstructor
public class PostHistoryService {

    static final int PAGE_SIZE = 100;
    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private static final Logger log = LoggerFactory.getLogger(PostHistoryService.class);

    private final PostRecordRepository postRecordRepository;

    @Transactional
    public PostRecord append(PostRecord record) {
        if (record.getId() != null) {
            throw new IllegalArgumentException("Post records are append-only; id must be unassigned");
        }
        PostRecord saved = postRecordRepository.save(record);
        log.debug("Appended post record id={} status={} topic={}", saved.getId(), saved.getStatus(), saved.getTopicName());
        return saved;
    }

    /**
     * Lazily pages through matching records, newest first. Each call to {@code iterator()}
     * starts a fresh pass.
     */
    public Iterable<PostRecord> list(PostHistoryFilter filter) {
        PostHistoryFilter effective = filter == null ? PostHistoryFilter.all() : filter;
        return () -> new PagingIterator(effective);
    }

    @Transactional(readOnly = true)
    public List<PostRecord> recent(PostHistoryFilter filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be greater than zero");
        }
        PostHistoryFilter effective = filter == null ? PostHistoryFilter.all() : filter;
        return postRecordRepository
                .findAll(PostRecordSpecifications.matching(effective), PageRequest.of(0, limit, NEWEST_FIRST))
                .getContent();
    }

    @Transactional(readOnly = true)
    public Optional<PostRecord> latest() {
        return postRecordRepository.findFirstByOrderByCreatedAtDescIdDesc();
    }

    /**
     * All records as CSV, newest first.
     */
    public String exportAll() {
        return PostRecordCsvCodec.toCsv(list(PostHistoryFilter.all()));
    }

    /**
     * Deletes every record. Callers are responsible for obtaining confirmation first.
     */
    @Transactional
    public long clear() {
        long count = postRecordRepository.count();
        postRecordRepository.deleteAllInBatch();
        log.warn("Post history cleared: {} record(s) deleted", count);
        return count;
    }

    private final class PagingIterator implements Iterator<PostRecord> {

        private final PostHistoryFilter filter;
        private int pageNumber = 0;
        private Iterator<PostRecord> current = null;
        private boolean lastPage = false;

        private PagingIterator(PostHistoryFilter filter) {
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                if (lastPage) {
                    return false;
                }
                Page<PostRecord> page = postRecordRepository.findAll(
                        PostRecordSpecifications.matching(filter),
                        PageRequest.of(pageNumber++, PAGE_SIZE, NEWEST_FIRST));
                current = page.getContent().iterator();
                lastPage = !page.hasNext();
            }
            return true;
        }

        @Override
        public PostRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
