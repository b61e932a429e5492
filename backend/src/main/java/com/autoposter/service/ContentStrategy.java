package com.autoposter.service;

import com.autoposter.model.GenerationMethod;
import com.autoposter.model.Topic;

/**
 * One way of writing a post body for a topic.
 */
public interface ContentStrategy {

    GenerationMethod method();

    /**
     * @param variationSeed differs between calls so repeated generation for a topic varies
     */
    String writeBody(Topic topic, long variationSeed);
}
