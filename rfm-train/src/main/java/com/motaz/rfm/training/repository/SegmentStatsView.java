package com.motaz.rfm.training.repository;

public interface SegmentStatsView {

    String getSegmentName();

    Integer getClusterId();

    Long getCustomerCount();

    Double getAvgRecencyDays();

    Double getAvgFrequency();

    Double getAvgMonetary();
}
