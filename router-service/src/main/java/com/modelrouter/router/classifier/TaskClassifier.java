package com.modelrouter.router.classifier;

import com.modelrouter.common.model.Classification;
import com.modelrouter.common.model.ConversationTurn;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Labels a request with a (domain, action) pair.
 *
 * <p>Implementations make one bounded call and signal
 * {@link com.modelrouter.common.exception.ClassificationTimeoutException} or
 * {@link com.modelrouter.common.exception.MalformedClassificationException}; substituting the
 * fallback classification is the router's job.
 */
public interface TaskClassifier {

    Mono<Classification> classify(String prompt, List<ConversationTurn> context);
}
