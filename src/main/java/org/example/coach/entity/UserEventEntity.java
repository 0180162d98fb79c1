package org.example.coach.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "user_events",
        indexes = {
                @Index(name = "idx_user_events_type_time", columnList = "event_type, occurred_at"),
                @Index(name = "idx_user_events_user", columnList = "user_id")
        }
)
public class UserEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "event_type", nullable = false, length = 40)
    private String eventType;

    @Lob
    @Column(name = "event_data")
    private String eventData;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    public UserEventEntity() {
    }

    public UserEventEntity(Long userId, String eventType, String eventData, LocalDateTime occurredAt) {
        this.userId = userId;
        this.eventType = eventType;
        this.eventData = eventData;
        this.occurredAt = occurredAt;
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEventData() {
        return eventData;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
