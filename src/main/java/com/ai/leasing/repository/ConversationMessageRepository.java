package com.ai.leasing.repository;

import com.ai.leasing.entity.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    boolean existsByLead_IdAndMessageId(Long leadId, String messageId);
}
