package com.ewsmon.service.core.repo;

import com.ewsmon.model.WebhookSubscription;
import java.util.List;

public interface WebhookSubscriptionRepository {

    List<WebhookSubscription> findActive();
}
