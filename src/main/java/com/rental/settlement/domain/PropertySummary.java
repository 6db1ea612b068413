package com.rental.settlement.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PropertySummary {

    String id;
    String title;
    String city;
    String locality;
    Integer rentAmount;
}
