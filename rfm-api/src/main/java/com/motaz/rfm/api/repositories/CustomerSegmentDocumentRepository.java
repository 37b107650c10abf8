package com.motaz.rfm.api.repositories;

import com.motaz.rfm.api.model.documents.CustomerSegmentDocument;
import com.redis.om.spring.repository.RedisDocumentRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CustomerSegmentDocumentRepository extends RedisDocumentRepository<CustomerSegmentDocument, String> {
}
