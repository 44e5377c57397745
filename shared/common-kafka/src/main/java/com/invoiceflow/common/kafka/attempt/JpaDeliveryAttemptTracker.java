package com.invoiceflow.common.kafka.attempt;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.invoiceflow.common.model.ErrorText;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDeliveryAttemptTracker implements DeliveryAttemptTracker {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final DeliveryAttemptRepository repository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int recordFailure(String messageId, String topic, String error) {
        DeliveryAttempt attempt = repository.findById(messageId)
                .orElseGet(() -> DeliveryAttempt.builder()
                        .messageId(messageId)
                        .topic(topic)
                        .attempts(0)
                        .build());

        attempt.setAttempts(attempt.getAttempts() + 1);
        attempt.setLastError(ErrorText.bounded(error, MAX_ERROR_LENGTH));
        repository.save(attempt);

        log.debug("Recorded failed delivery {} for message {}", attempt.getAttempts(), messageId);
        return attempt.getAttempts();
    }

    @Override
    @Transactional(readOnly = true)
    public int attempts(String messageId) {
        return repository.findById(messageId)
                .map(DeliveryAttempt::getAttempts)
                .orElse(0);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void clear(String messageId) {
        repository.deleteByMessageId(messageId);
    }
}
