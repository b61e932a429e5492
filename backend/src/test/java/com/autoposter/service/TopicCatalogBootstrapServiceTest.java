package com.autoposter.service;

import com.autoposter.model.Topic;
import com.autoposter.model.TopicCategory;
import com.autoposter.repository.TopicRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TopicCatalogBootstrapServiceTest {

    @Mock
    private TopicRepository topicRepository;

    @InjectMocks
    private TopicCatalogBootstrapService bootstrapService;

    @Test
    void seedsEveryTopicIntoEmptyCatalog() {
        when(topicRepository.existsByNameIgnoreCase(anyString())).thenReturn(false);

        bootstrapService.run(null);

        ArgumentCaptor<Topic> saved = ArgumentCaptor.forClass(Topic.class);
        verify(topicRepository, times(50)).save(saved.capture());
        List<Topic> topics = saved.getAllValues();
        assertEquals(10, topics.stream().filter(topic -> topic.getCategory() == TopicCategory.PRIVACY).count());
        assertTrue(topics.stream().allMatch(Topic::isEnabled));
        assertTrue(topics.stream().allMatch(topic -> topic.getPriority() == 0));
    }

    @Test
    void leavesExistingTopicsUntouched() {
        when(topicRepository.existsByNameIgnoreCase(anyString())).thenReturn(true);
        when(topicRepository.existsByNameIgnoreCase(eq("Nostr relays"))).thenReturn(false);

        bootstrapService.run(null);

        ArgumentCaptor<Topic> saved = ArgumentCaptor.forClass(Topic.class);
        verify(topicRepository).save(saved.capture());
        assertEquals("Nostr relays", saved.getValue().getName());
    }

    @Test
    void rerunOnSeededCatalogSavesNothing() {
        when(topicRepository.existsByNameIgnoreCase(anyString())).thenReturn(true);

        bootstrapService.run(null);

        verify(topicRepository, never()).save(any(Topic.class));
    }
}
