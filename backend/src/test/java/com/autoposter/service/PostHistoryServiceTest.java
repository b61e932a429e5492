package com.autoposter.service;

import com.autoposter.model.CycleTrigger;
import com.autoposter.model.PostRecord;
import com.autoposter.model.PostStatus;
import com.autoposter.repository.PostRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostHistoryServiceTest {

    private static final OffsetDateTime BASE = OffsetDateTime.parse("2026-01-01T00:00:00Z");

    @Mock
    private PostRecordRepository postRecordRepository;

    @InjectMocks
    private PostHistoryService postHistoryService;

    @Test
    void appendRejectsRecordsThatAlreadyHaveAnId() {
        PostRecord existing = record(5L, BASE);

        assertThrows(IllegalArgumentException.class, () -> postHistoryService.append(existing));
        verify(postRecordRepository, never()).save(any(PostRecord.class));
    }

    @Test
    void appendStoresNewRecord() {
        PostRecord fresh = record(null, BASE);
        when(postRecordRepository.save(fresh)).thenReturn(record(1L, BASE));

        PostRecord saved = postHistoryService.append(fresh);

        assertEquals(1L, saved.getId());
    }

    @Test
    @SuppressWarnings("unchecked")
    void listPagesLazilyNewestFirstAndCanBeIteratedAgain() {
        List<PostRecord> newestFirst = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            newestFirst.add(record((long) (150 - i), BASE.minusMinutes(i)));
        }
        when(postRecordRepository.findAll(any(Specification.class), any(Pageable.class))).thenAnswer(invocation -> {
            Pageable pageable = invocation.getArgument(1);
            int from = (int) pageable.getOffset();
            int to = Math.min(from + pageable.getPageSize(), newestFirst.size());
            return new PageImpl<>(newestFirst.subList(from, to), pageable, newestFirst.size());
        });

        Iterable<PostRecord> history = postHistoryService.list(PostHistoryFilter.all());
        verify(postRecordRepository, never()).findAll(any(Specification.class), any(Pageable.class));

        List<Long> firstPass = ids(history);
        List<Long> secondPass = ids(history);

        assertEquals(150, firstPass.size());
        assertEquals(150L, firstPass.get(0));
        assertEquals(1L, firstPass.get(149));
        assertEquals(firstPass, secondPass);

        ArgumentCaptor<Pageable> pageables = ArgumentCaptor.forClass(Pageable.class);
        verify(postRecordRepository, times(4)).findAll(any(Specification.class), pageables.capture());
        assertEquals(PostHistoryService.NEWEST_FIRST, pageables.getValue().getSort());
    }

    @Test
    @SuppressWarnings("unchecked")
    void recentRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> postHistoryService.recent(PostHistoryFilter.all(), 0));
        verify(postRecordRepository, never()).findAll(any(Specification.class), any(Pageable.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void exportAllWritesHeaderAndOneRowPerRecord() {
        Page<PostRecord> page = new PageImpl<>(List.of(record(2L, BASE), record(1L, BASE.minusHours(1))));
        when(postRecordRepository.findAll(any(Specification.class), any(Pageable.class))).thenReturn(page);

        String csv = postHistoryService.exportAll();

        String[] lines = csv.split("\r\n");
        assertEquals(3, lines.length);
        assertTrue(lines[1].startsWith("2,"));
        assertTrue(lines[2].startsWith("1,"));
    }

    @Test
    void clearDeletesEverythingAndReportsCount() {
        when(postRecordRepository.count()).thenReturn(7L);

        assertEquals(7L, postHistoryService.clear());
        verify(postRecordRepository).deleteAllInBatch();
    }

    private static List<Long> ids(Iterable<PostRecord> records) {
        List<Long> ids = new ArrayList<>();
        records.forEach(record -> ids.add(record.getId()));
        return ids;
    }

    private static PostRecord record(Long id, OffsetDateTime createdAt) {
        return PostRecord.builder()
                .id(id)
                .topicId(1L)
                .topicName("Bitcoin basics")
                .bodyText("body")
                .status(PostStatus.SUCCEEDED)
                .platformPostId("post-" + id)
                .trigger(CycleTrigger.TIMED)
                .attemptCount(1)
                .createdAt(createdAt)
                .build();
    }
}
