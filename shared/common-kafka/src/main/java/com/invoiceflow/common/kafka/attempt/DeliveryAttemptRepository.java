package com.invoiceflow.common.kafka.attempt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface DeliveryAttemptRepository extends JpaRepository<DeliveryAttempt, String> {

    @Modifying
    @Query("DELETE FROM DeliveryAttempt d WHERE d.messageId = :messageId")
    int deleteByMessageId(@Param("messageId") String messageId);
}
