package com.vcc.router.entity;

import com.vcc.router.model.Subscription;
import com.vcc.router.model.SubscriptionScope;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

@Table("subscription")
public class SubscriptionEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("scope")
    private String scope;

    @Column("target_id")
    private String targetId;

    @Column("models")
    private String models;

    @Column("enabled")
    private boolean enabled;

    @Column("created_at")
    private Instant createdAt;

    @Column("updated_at")
    private Instant updatedAt;

    public SubscriptionEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public String getModels() {
        return models;
    }

    public void setModels(String models) {
        this.models = models;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Subscription toSubscription() {
        return new Subscription(SubscriptionScope.parse(scope), targetId, CsvColumns.split(models), enabled);
    }

    public static SubscriptionEntity fromSubscription(Subscription subscription) {
        SubscriptionEntity entity = new SubscriptionEntity();
        entity.setScope(subscription.scope().name());
        entity.setTargetId(subscription.targetId());
        entity.setModels(CsvColumns.join(subscription.models()));
        entity.setEnabled(subscription.enabled());
        return entity;
    }
}
