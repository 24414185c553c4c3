package com.seatwatch.monitor.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NotificationMessage {
    Long routeId;
    String recipient;
    String subject;
    String body;
}
