package com.bulut.api.dto;

import com.bulut.subscription.Subscription;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionListResponse {
    private String address;
    private int count;
    private List<Subscription> subscriptions;
}
