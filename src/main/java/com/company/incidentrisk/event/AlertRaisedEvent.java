package com.company.incidentrisk.event;

import com.company.incidentrisk.domain.Alert;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertRaisedEvent {
    private final Alert alert;
}
