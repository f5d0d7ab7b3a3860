package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RateCodeDimRow {
    long   rateCodeId;
    int    rateCode;
    String rateCodeName;
}
