package com.di.tripstar.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PaymentTypeDimRow {
    long   paymentTypeId;
    int    paymentType;
    String paymentTypeName;
}
