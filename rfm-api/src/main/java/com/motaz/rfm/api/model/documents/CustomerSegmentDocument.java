package com.motaz.rfm.api.model.documents;

import com.redis.om.spring.annotations.Document;
import com.redis.om.spring.annotations.Indexed;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;

@Data
@Builder
@Document(value = "customer:segment", indexName = "CustomerSegmentIdx")
@NoArgsConstructor
@AllArgsConstructor
public class CustomerSegmentDocument {

    @Id
    private String id;                 // "cust:C001"

    @Indexed
    private String customerId;
    @Indexed
    private String segmentName;
    private Integer clusterId;
    // ISO-8601, the calc date of the run that produced this row
    private String calcDate;

    private Integer recencyDays;
    private Integer frequency;
    private Double monetary;
}
